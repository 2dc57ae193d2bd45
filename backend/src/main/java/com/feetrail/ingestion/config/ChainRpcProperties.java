package com.feetrail.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain JSON-RPC endpoints, local throttling and read retry settings.
 */
@ConfigurationProperties(prefix = "feetrail.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainRpcProperties {

    /** Primary chain RPC endpoint. */
    private String url = "https://mainnet.base.org";

    /** Tried in order once the active endpoint fails. */
    private List<String> fallbackUrls = new ArrayList<>();

    /** Local RPC budget (requests per second) for this service instance. */
    private int maxRequestsPerSecond = 50;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long localLimiterTimeoutMs = 5_000;

    /** Log local limiter waits longer than this threshold. */
    private long localLimiterLogThresholdMs = 100;

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {
        private long baseDelayMs = 1_000;
        private double jitterFactor = 0.2;
        private int maxAttempts = 3;
    }
}
