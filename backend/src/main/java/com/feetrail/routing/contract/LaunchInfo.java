package com.feetrail.routing.contract;

import java.math.BigInteger;
import java.util.List;

/**
 * Subset of the factory's launch record needed for locker routing.
 */
public record LaunchInfo(
        String token,
        String dev,
        String projectId,
        String poolId,
        String pool,
        List<BigInteger> lpTokenIds
) {

    public List<BigInteger> nonZeroLpTokenIds() {
        return lpTokenIds.stream().filter(id -> id.signum() > 0).toList();
    }
}
