package com.sharesgate.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for applied_trade_events (ledger idempotency markers).
 */
public interface AppliedTradeEventRepository extends MongoRepository<AppliedTradeEvent, String> {
}
