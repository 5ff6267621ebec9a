package com.sharesgate.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-call RPC retry (exponential backoff ± jitter) applied inside one fetch.
 * The sync worker's own retry interval applies on top once these attempts are exhausted.
 */
@ConfigurationProperties(prefix = "sharesgate.rpc.retry")
@NoArgsConstructor
@Getter
@Setter
public class RpcRetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. Default 500. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1. Default 0.2. */
    private double jitterFactor = 0.2;

    /** Total attempts per call, including the first. Default 3. */
    private int maxAttempts = 3;
}
