package com.feetrail.routing;

/**
 * A newly verified developer for a pool.
 *
 * @param poolTokenAddress launched token; optional, needed only for locker routing
 */
public record RoutingRequest(
        String poolId,
        String devAddress,
        String projectId,
        String poolTokenAddress
) {
}
