package com.sharesgate.ingestion.adapter;

/**
 * Thrown when an RPC call fails (transport, timeout, JSON-RPC error or unparseable result).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
