package com.sharesgate.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for telegram_bots (gated communities).
 */
public interface CommunityRepository extends MongoRepository<Community, String> {

    Optional<Community> findFirstBySubjectAddressAndChainType(String subjectAddress, String chainType);

    Optional<Community> findFirstByChatGroupIdAndChainType(String chatGroupId, String chainType);
}
