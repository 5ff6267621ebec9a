package com.sharesgate.ingestion.adapter;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC client using WebClient. Shared by the EVM and Sui adapters.
 * Responses are buffered whole, up to {@code maxResponseBytes}.
 */
public class WebClientJsonRpcClient implements JsonRpcClient {

    private final WebClient webClient;
    private final int maxResponseBytes;
    private final AtomicLong requestIds = new AtomicLong();

    public WebClientJsonRpcClient(WebClient.Builder builder, int maxResponseBytes) {
        if (maxResponseBytes < 1) {
            throw new IllegalStateException("maxResponseBytes must be positive, got " + maxResponseBytes);
        }
        this.maxResponseBytes = maxResponseBytes;
        this.webClient = builder.clone()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxResponseBytes))
                .build();
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.incrementAndGet());
        body.put("method", method);
        body.put("params", params != null ? params : List.of());
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientJsonRpcClient::isBufferLimit, e -> new ResponseTooLargeException(
                        method + " via " + endpointUrl + " exceeded " + maxResponseBytes + " bytes", e))
                .onErrorMap(WebClientException.class, e -> new RpcException(method + " via " + endpointUrl + ": " + e.getMessage(), e));
    }

    private static boolean isBufferLimit(Throwable e) {
        return e instanceof DataBufferLimitException
                || NestedExceptionUtils.getMostSpecificCause(e) instanceof DataBufferLimitException;
    }
}
