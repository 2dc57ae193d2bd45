package com.feetrail.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.feetrail.common.RetryPolicy;
import com.feetrail.ingestion.adapter.RpcEndpointFailover;
import com.feetrail.ingestion.adapter.evm.EvmJsonRpc;
import com.feetrail.ingestion.adapter.evm.EvmRpcClient;
import com.feetrail.ingestion.adapter.evm.WebClientEvmRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Wires the chain RPC stack: endpoint failover, WebClient transport, process-wide rate limiter, JSON-RPC layer.
 */
@Configuration
@EnableConfigurationProperties({ ChainRpcProperties.class, ContractProperties.class, IndexerProperties.class })
public class IngestionAdapterConfig {

    /** Used when no chain RPC URL is configured so the adapter does not fail at startup. */
    private static final String DEFAULT_RPC_URL = "https://mainnet.base.org";

    @Bean
    public RpcEndpointFailover chainRpcEndpoints(ChainRpcProperties properties) {
        ChainRpcProperties.Retry retry = properties.getRetry();
        RetryPolicy retryPolicy = new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts());
        String primary = properties.getUrl();
        List<String> fallbacks = properties.getFallbackUrls();
        boolean noneConfigured = (primary == null || primary.isBlank())
                && fallbacks.stream().allMatch(u -> u == null || u.isBlank());
        return new RpcEndpointFailover(noneConfigured ? DEFAULT_RPC_URL : primary, fallbacks, retryPolicy);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(ChainRpcProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public EvmJsonRpc evmJsonRpc(EvmRpcClient evmRpcClient,
                                 RpcEndpointFailover chainRpcEndpoints,
                                 @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
                                 ObjectMapper objectMapper,
                                 ChainRpcProperties properties) {
        return new EvmJsonRpc(evmRpcClient, chainRpcEndpoints, evmRpcRateLimiter, objectMapper,
                properties.getLocalLimiterLogThresholdMs());
    }
}
