package com.sharesgate.ingestion.adapter;

import reactor.core.publisher.Mono;

/**
 * Transport for JSON-RPC 2.0 calls. Returns the raw response body; callers parse result/error.
 */
public interface JsonRpcClient {

    /**
     * @param params positional list or named map; null sends an empty array
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
