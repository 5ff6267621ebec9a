package com.sharesgate.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for the share ledger. Balance mutations go through {@link ShareBalanceRepositoryCustom}.
 */
public interface ShareBalanceRepository extends MongoRepository<ShareBalance, String>, ShareBalanceRepositoryCustom {

    Optional<ShareBalance> findByTraderAndSubjectAndChainType(String trader, String subject, String chainType);

    List<ShareBalance> findByTraderAndChainTypeOrderBySubjectAsc(String trader, String chainType);
}
