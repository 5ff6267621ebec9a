package com.sharesgate.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for sync_status, one row per chain.
 */
public interface SyncStatusRepository extends MongoRepository<SyncStatus, String> {

    Optional<SyncStatus> findByChainType(String chainType);
}
