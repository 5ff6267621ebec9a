package com.sharesgate.api.dto;

import java.time.Instant;

/**
 * Error envelope: {@code success} is always false; error (code), message, timestamp (ISO 8601).
 */
public record ErrorBody(boolean success, String error, String message, Instant timestamp) {

    /**
     * Creates an error body with timestamp set to now (UTC).
     */
    public static ErrorBody of(String error, String message) {
        return new ErrorBody(false, error, message, Instant.now());
    }
}
