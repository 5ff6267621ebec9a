package com.sharesgate.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sharesgate.common.RetryPolicy;
import com.sharesgate.ingestion.adapter.ChainAdapter;
import com.sharesgate.ingestion.adapter.JsonRpcCaller;
import com.sharesgate.ingestion.adapter.JsonRpcClient;
import com.sharesgate.ingestion.adapter.WebClientJsonRpcClient;
import com.sharesgate.ingestion.adapter.evm.EvmChainAdapter;
import com.sharesgate.ingestion.adapter.evm.EvmSignatureVerifier;
import com.sharesgate.ingestion.adapter.sui.SuiChainAdapter;
import com.sharesgate.ingestion.adapter.sui.SuiSignatureVerifier;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Builds one {@link ChainAdapter} per enabled chain. Each adapter gets its own endpoint rotation and rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ SyncProperties.class, EvmChainProperties.class, SuiChainProperties.class, RpcRetryProperties.class,
        RpcClientProperties.class })
public class ChainAdapterConfig {

    /** Wait for a local limiter permit before counting the call as failed. */
    private static final Duration LIMITER_TIMEOUT = Duration.ofSeconds(5);

    @Bean
    public JsonRpcClient jsonRpcClient(WebClient.Builder webClientBuilder, RpcClientProperties rpc) {
        return new WebClientJsonRpcClient(webClientBuilder, rpc.getMaxResponseBytes());
    }

    @Bean
    @ConditionalOnProperty(prefix = "sharesgate.chains.evm", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ChainAdapter evmChainAdapter(JsonRpcClient jsonRpcClient, EvmChainProperties evm, SyncProperties sync,
                                        RpcRetryProperties retry, ObjectMapper objectMapper) {
        JsonRpcCaller caller = new JsonRpcCaller(evm.getName(), jsonRpcClient, evm.getUrls(), retryPolicy(retry),
                rateLimiter(evm.getName(), evm.getMaxRequestsPerSecond()), evm.getRequestTimeout(), objectMapper);
        return new EvmChainAdapter(evm.getName(), evm.getSharesContract(), evm.getStartBlock(),
                sync.getBatchBlockSize(), caller, new EvmSignatureVerifier());
    }

    @Bean
    @ConditionalOnProperty(prefix = "sharesgate.chains.sui", name = "enabled", havingValue = "true")
    public ChainAdapter suiChainAdapter(JsonRpcClient jsonRpcClient, SuiChainProperties sui, SyncProperties sync,
                                        RpcRetryProperties retry, ObjectMapper objectMapper) {
        JsonRpcCaller caller = new JsonRpcCaller(sui.getName(), jsonRpcClient, sui.getUrls(), retryPolicy(retry),
                rateLimiter(sui.getName(), sui.getMaxRequestsPerSecond()), sui.getRequestTimeout(), objectMapper);
        return new SuiChainAdapter(sui.getName(), sui.getPackageId(), sui.getSharesTradingObjectId(),
                sui.getStartCursor(), sync.getEventPageLimit(), caller, new SuiSignatureVerifier());
    }

    private static RetryPolicy retryPolicy(RpcRetryProperties retry) {
        return RetryPolicy.exponential(Duration.ofMillis(retry.getBaseDelayMs()), retry.getJitterFactor(), retry.getMaxAttempts());
    }

    private static RateLimiter rateLimiter(String chainName, int maxRequestsPerSecond) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, maxRequestsPerSecond))
                .timeoutDuration(LIMITER_TIMEOUT)
                .build();
        return RateLimiter.of(chainName + "-rpc", config);
    }
}
