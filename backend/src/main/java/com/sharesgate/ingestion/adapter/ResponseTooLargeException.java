package com.sharesgate.ingestion.adapter;

/**
 * The RPC result exceeded the client's buffer limit or the provider refused the query as too large.
 * Repeating the same call cannot succeed; callers narrow the query instead.
 */
public class ResponseTooLargeException extends RpcException {

    public ResponseTooLargeException(String message) {
        super(message);
    }

    public ResponseTooLargeException(String message, Throwable cause) {
        super(message, cause);
    }
}
