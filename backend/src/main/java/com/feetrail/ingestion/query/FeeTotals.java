package com.feetrail.ingestion.query;

import java.time.Instant;

/**
 * Aggregates over the whole audit trail. Amounts are base-unit decimal strings summed across tokens.
 */
public record FeeTotals(
        String totalDistributedWei,
        String totalDevClaimedWei,
        String totalProtocolClaimedWei,
        String totalEscrowedWei,
        long distributionCount,
        long uniqueDevs,
        long uniquePools,
        Long lastIndexedBlock,
        Instant lastIndexedAt
) {
}
