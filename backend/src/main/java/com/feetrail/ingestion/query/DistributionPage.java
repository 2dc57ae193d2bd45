package com.feetrail.ingestion.query;

import com.feetrail.domain.FeeDistribution;

import java.util.List;

/**
 * Offset-paginated slice of distribution records, newest block first.
 */
public record DistributionPage(
        List<FeeDistribution> items,
        int limit,
        int offset,
        boolean hasMore
) {
}
