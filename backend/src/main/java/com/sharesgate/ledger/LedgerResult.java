package com.sharesgate.ledger;

import com.sharesgate.domain.ShareBalanceTransitionEvent;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Outcome of applying one trade event.
 *
 * @param balance    balance after the event; null unless {@link Outcome#APPLIED}
 * @param transition access change published for the event, if any
 */
public record LedgerResult(Outcome outcome, BigDecimal balance, ShareBalanceTransitionEvent transition) {

    public enum Outcome {
        APPLIED,
        /** Event key already recorded; nothing changed. */
        DUPLICATE,
        /** Sell with no ledger entry; recorded as applied, balance untouched. */
        NO_POSITION
    }

    public static LedgerResult applied(BigDecimal balance, ShareBalanceTransitionEvent transition) {
        return new LedgerResult(Outcome.APPLIED, balance, transition);
    }

    public static LedgerResult duplicate() {
        return new LedgerResult(Outcome.DUPLICATE, null, null);
    }

    public static LedgerResult noPosition() {
        return new LedgerResult(Outcome.NO_POSITION, null, null);
    }

    public Optional<ShareBalanceTransitionEvent> transitionIfAny() {
        return Optional.ofNullable(transition);
    }
}
