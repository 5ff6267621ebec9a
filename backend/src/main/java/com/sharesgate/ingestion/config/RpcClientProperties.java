package com.sharesgate.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * JSON-RPC transport settings shared by all chains (sharesgate.rpc).
 */
@ConfigurationProperties(prefix = "sharesgate.rpc")
@NoArgsConstructor
@Getter
@Setter
public class RpcClientProperties {

    /** Largest response body buffered per call. Default 16 MiB. */
    private int maxResponseBytes = 16 * 1024 * 1024;
}
