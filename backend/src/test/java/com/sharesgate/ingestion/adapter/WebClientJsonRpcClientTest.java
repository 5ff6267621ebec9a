package com.sharesgate.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sharesgate.common.RetryPolicy;
import com.sun.net.httpserver.HttpServer;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Real WebClient against a local HTTP server returning an eth_getLogs body well over the 256 KiB codec default.
 */
class WebClientJsonRpcClientTest {

    private static final int LOG_COUNT = 500;

    private HttpServer server;
    private String url;
    private final AtomicInteger requests = new AtomicInteger();
    private byte[] body;

    @BeforeEach
    void startServer() throws IOException {
        body = largeLogsResponse().getBytes(StandardCharsets.UTF_8);
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            requests.incrementAndGet();
            exchange.getRequestBody().readAllBytes();
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        url = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    @DisplayName("response above 256 KiB is read whole with the configured limit")
    void call_largeResponse_withinLimit_returnsAllLogs() {
        assertThat(body.length).isGreaterThan(256 * 1024);
        JsonRpcCaller caller = caller(new WebClientJsonRpcClient(WebClient.builder(), 16 * 1024 * 1024));

        JsonNode logs = caller.call("eth_getLogs", List.of());

        assertThat(logs.isArray()).isTrue();
        assertThat(logs.size()).isEqualTo(LOG_COUNT);
        assertThat(requests.get()).isEqualTo(1);
    }

    @Test
    void call_responseOverLimit_throwsTooLargeOnce() {
        JsonRpcCaller caller = caller(new WebClientJsonRpcClient(WebClient.builder(), 256 * 1024));

        assertThatThrownBy(() -> caller.call("eth_getLogs", List.of()))
                .isInstanceOf(ResponseTooLargeException.class)
                .hasMessageContaining("eth_getLogs");
        assertThat(requests.get()).isEqualTo(1);
    }

    @Test
    void constructor_nonPositiveLimit_failsStartup() {
        assertThatThrownBy(() -> new WebClientJsonRpcClient(WebClient.builder(), 0))
                .isInstanceOf(IllegalStateException.class);
    }

    private JsonRpcCaller caller(JsonRpcClient client) {
        RateLimiter limiter = RateLimiter.of("local-rpc", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000)
                .timeoutDuration(Duration.ZERO)
                .build());
        return new JsonRpcCaller("monad", client, List.of(url), RetryPolicy.exponential(Duration.ZERO, 0, 3),
                limiter, Duration.ofSeconds(10), new ObjectMapper());
    }

    private static String largeLogsResponse() {
        String data = "0x" + "0".repeat(512);
        StringJoiner logs = new StringJoiner(",", "[", "]");
        for (int i = 0; i < LOG_COUNT; i++) {
            logs.add("""
                    {"address":"0x%s","topics":["0x%s"],"data":"%s","blockNumber":"0x%x","transactionHash":"0x%064x","logIndex":"0x0","removed":false}
                    """.formatted("c".repeat(40), "d".repeat(64), data, 1000 + i, i).trim());
        }
        return "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + logs + "}";
    }
}
