package com.feetrail.ingestion.job;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time view of the fee indexer. blockLag is null until both heights are known.
 */
public record IndexerStatus(
        @JsonProperty("isRunning") boolean isRunning,
        Long lastProcessedBlock,
        Long currentBlock,
        Long blockLag,
        String lastError,
        long eventsIndexed,
        Instant startedAt,
        long retryDelayMs
) {
}
