package com.sharesgate.domain;

import java.math.BigInteger;

/**
 * A decoded buy or sell of subject shares. Addresses are normalized.
 *
 * @param txId     transaction hash (EVM) or digest (Sui)
 * @param sequence log index (EVM) or event sequence (Sui) within the transaction
 * @param position block number for block-height chains, otherwise the cursor surrogate
 */
public record TradeEvent(
        String chainType,
        String trader,
        String subject,
        boolean buy,
        BigInteger amount,
        String txId,
        long sequence,
        long position
) {

    /** Chain-unique identity used for idempotent application. */
    public String eventKey() {
        return chainType + ":" + txId + ":" + sequence;
    }
}
