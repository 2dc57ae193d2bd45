package com.feetrail.ingestion.query;

import com.feetrail.domain.FeeEventType;

/**
 * Optional equality filters for distribution listings; null means "any". Addresses and ids are matched lower-cased.
 */
public record DistributionFilter(
        FeeEventType eventType,
        String poolId,
        String devAddress,
        String tokenAddress,
        String projectId
) {

    public static DistributionFilter none() {
        return new DistributionFilter(null, null, null, null, null);
    }

    public static DistributionFilter byPool(String poolId) {
        return new DistributionFilter(null, poolId, null, null, null);
    }

    public static DistributionFilter byDev(String devAddress) {
        return new DistributionFilter(null, null, devAddress, null, null);
    }

    public static DistributionFilter byProject(String projectId) {
        return new DistributionFilter(null, null, null, null, projectId);
    }
}
