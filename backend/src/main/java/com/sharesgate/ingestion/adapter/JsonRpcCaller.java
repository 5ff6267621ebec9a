package com.sharesgate.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sharesgate.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blocking JSON-RPC calls for one chain: round-robin over endpoints, local rate limit, per-call timeout
 * and retries on {@link RpcException}. Returns the {@code result} node or throws after the last attempt.
 * {@link ResponseTooLargeException} is thrown at once since repeating the same query cannot help.
 */
@Slf4j
public class JsonRpcCaller {

    private final String chainName;
    private final JsonRpcClient client;
    private final List<String> endpoints;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final AtomicInteger nextEndpoint = new AtomicInteger();

    public JsonRpcCaller(String chainName, JsonRpcClient client, List<String> endpoints, RetryPolicy retryPolicy,
                         RateLimiter rateLimiter, Duration timeout, ObjectMapper objectMapper) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalStateException("No RPC endpoints configured for " + chainName);
        }
        this.chainName = chainName;
        this.client = client;
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
    }

    public JsonNode call(String method, Object params) {
        RpcException last = null;
        int maxAttempts = retryPolicy.getMaxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                sleep(retryPolicy.delay(attempt - 1));
            }
            String endpoint = nextEndpoint();
            try {
                return callOnce(endpoint, method, params);
            } catch (ResponseTooLargeException e) {
                log.warn("{} {} response too large on {}: {}", chainName, method, endpoint, e.getMessage());
                throw e;
            } catch (RpcException e) {
                last = e;
                log.debug("{} {} attempt {}/{} failed on {}: {}", chainName, method, attempt + 1, maxAttempts, endpoint, e.getMessage());
            }
        }
        throw new RpcException(chainName + " " + method + " failed after " + maxAttempts + " attempt(s): " + last.getMessage(), last);
    }

    private JsonNode callOnce(String endpoint, String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local RPC rate limit exceeded for " + chainName);
        }
        String body;
        try {
            body = client.call(endpoint, method, params).block(timeout);
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException(method + " failed: " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new RpcException(method + " returned an empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RpcException(method + " returned invalid JSON", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = error.path("message").asText(error.toString());
            if (isQueryTooLarge(message)) {
                throw new ResponseTooLargeException(method + " rejected by provider: " + message);
            }
            throw new RpcException(method + " error: " + message);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode()) {
            throw new RpcException(method + " response has no result");
        }
        return result;
    }

    /** Provider wording for log queries over its result or range cap, e.g. "query returned more than 10000 results". */
    static boolean isQueryTooLarge(String message) {
        String m = message.toLowerCase(Locale.ROOT);
        return (m.contains("more than") && m.contains("results"))
                || m.contains("too many results")
                || m.contains("response size")
                || m.contains("block range");
    }

    private String nextEndpoint() {
        int i = Math.floorMod(nextEndpoint.getAndIncrement(), endpoints.size());
        return endpoints.get(i);
    }

    private static void sleep(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during RPC retry", e);
        }
    }
}
