package com.sharesgate.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for user_mappings keyed by (address, chainType).
 */
public interface UserMappingRepository extends MongoRepository<UserMapping, String>, UserMappingRepositoryCustom {

    Optional<UserMapping> findByAddressAndChainType(String address, String chainType);
}
