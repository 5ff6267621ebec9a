package com.sharesgate.access;

/**
 * Outcome of a synchronous gate check.
 */
public record GateCheckResult(Status status, String message) {

    public enum Status {
        /** Holder; full permissions pushed. */
        GRANTED,
        /** Verified, but holds no shares of the community subject. */
        NO_SHARES,
        UNSUPPORTED_CHAIN,
        COMMUNITY_NOT_FOUND,
        VERIFICATION_FAILED,
        ADDRESS_MISMATCH,
        BALANCE_UNAVAILABLE,
        NOTIFIER_FAILED
    }

    public static GateCheckResult of(Status status, String message) {
        return new GateCheckResult(status, message);
    }

    /** True when the check ran to a decision (granted or implicitly denied). */
    public boolean isSuccess() {
        return status == Status.GRANTED || status == Status.NO_SHARES;
    }
}
