package com.sharesgate.domain;

import java.math.BigDecimal;

/**
 * Published by the ledger after a committed trade changed a mapped user's access:
 * a sell that left the balance at zero ({@link Kind#GATE}) or a buy by a gated user ({@link Kind#UNGATE}).
 */
public record ShareBalanceTransitionEvent(
        Kind kind,
        String chainType,
        String trader,
        String subject,
        String externalIdentity,
        BigDecimal balance
) {

    public enum Kind {
        GATE,
        UNGATE
    }
}
