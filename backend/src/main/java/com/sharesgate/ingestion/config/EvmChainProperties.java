package com.sharesgate.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * EVM chain with the shares contract (sharesgate.chains.evm).
 */
@ConfigurationProperties(prefix = "sharesgate.chains.evm")
@NoArgsConstructor
@Getter
@Setter
public class EvmChainProperties {

    private boolean enabled = true;

    /** Chain identifier stored with every ledger row. */
    private String name = "monad";

    /** JSON-RPC endpoints, used round-robin. */
    private List<String> urls = new ArrayList<>();

    /** Shares contract address (0x-prefixed or bare hex). Required when enabled. */
    private String sharesContract;

    /** First block to scan when no checkpoint is stored. */
    private long startBlock = 0L;

    private Duration requestTimeout = Duration.ofSeconds(30);

    /** Local limiter permits per second. */
    private int maxRequestsPerSecond = 20;
}
