package com.feetrail.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Fee indexer polling settings.
 */
@ConfigurationProperties(prefix = "feetrail.indexer")
@NoArgsConstructor
@Getter
@Setter
public class IndexerProperties {

    /** Start polling on application ready. */
    private boolean enabled = true;

    /**
     * Block to start from when no cursor exists yet. 0 means start at the current head.
     */
    private long startBlock = 0;

    /** Fixed delay between poll cycles. */
    private long pollIntervalMs = 12_000;

    /** Blocks per eth_getLogs sub-batch; the cursor is persisted after each one. */
    private long batchBlocks = 1_000;

    private long initialRetryDelayMs = 1_000;

    private long maxRetryDelayMs = 60_000;
}
