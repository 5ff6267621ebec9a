package com.sharesgate.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Sync worker pacing (sharesgate.sync). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "sharesgate.sync")
@NoArgsConstructor
@Getter
@Setter
public class SyncProperties {

    /** Start one worker per enabled chain on application ready. Default true. */
    private boolean enabled = true;

    /** Max blocks per eth_getLogs window. Default 100. */
    private int batchBlockSize = 100;

    /** Max events per cursor page. Default 100. */
    private int eventPageLimit = 100;

    /** Wait after the chain head is reached. Default 60s. */
    private Duration idleInterval = Duration.ofSeconds(60);

    /** Wait after a failed fetch. Default 10s. */
    private Duration retryInterval = Duration.ofSeconds(10);

    /** Growth factor for consecutive failed fetches; 1 keeps the retry interval fixed. Default 1. */
    private double retryBackoffMultiplier = 1.0;

    /** Upper bound for the grown retry interval. Default 10m. */
    private Duration maxRetryInterval = Duration.ofMinutes(10);

    /** Wait between batches while catching up. Default 1s. */
    private Duration pacingInterval = Duration.ofSeconds(1);

    /** How long shutdown waits for workers to finish their current step. Default 30s. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);
}
