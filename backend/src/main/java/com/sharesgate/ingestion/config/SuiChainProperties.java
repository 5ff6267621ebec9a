package com.sharesgate.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sui chain with the shares_trading Move module (sharesgate.chains.sui).
 */
@ConfigurationProperties(prefix = "sharesgate.chains.sui")
@NoArgsConstructor
@Getter
@Setter
public class SuiChainProperties {

    private boolean enabled = false;

    private String name = "sui";

    private List<String> urls = new ArrayList<>(List.of("https://fullnode.mainnet.sui.io:443"));

    /** Package id that publishes {@code shares_trading}. Required when enabled. */
    private String packageId;

    /** Shared SharesTrading object passed to the balance view call. Required when enabled. */
    private String sharesTradingObjectId;

    /** Optional cursor JSON to start from when no checkpoint is stored; null scans from the first event. */
    private String startCursor;

    private Duration requestTimeout = Duration.ofSeconds(30);

    private int maxRequestsPerSecond = 20;
}
