package com.sharesgate.ingestion.adapter;

import lombok.Getter;

/**
 * Signature could not be decoded or no signer could be recovered from it.
 */
@Getter
public class SignatureVerificationException extends Exception {

    public enum Reason {
        MALFORMED_SIGNATURE,
        RECOVERY_FAILED
    }

    private final Reason reason;

    public SignatureVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SignatureVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
