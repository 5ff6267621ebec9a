package com.sharesgate.access;

/**
 * Thrown when a permission change could not be delivered to the community.
 */
public class AccessNotifierException extends RuntimeException {

    public AccessNotifierException(String message) {
        super(message);
    }

    public AccessNotifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
