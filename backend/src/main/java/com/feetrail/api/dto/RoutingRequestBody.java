package com.feetrail.api.dto;

import com.feetrail.api.validation.EvmAddress;
import com.feetrail.api.validation.PoolId;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/fees/routing body. poolTokenAddress is optional and only enables locker routing.
 */
public record RoutingRequestBody(
        @PoolId(message = "INVALID_ROUTING_INPUT") String poolId,
        @EvmAddress(message = "INVALID_ROUTING_INPUT") String walletAddress,
        @NotBlank(message = "INVALID_ROUTING_INPUT") String projectId,
        @EvmAddress(optional = true, message = "INVALID_ROUTING_INPUT") String poolTokenAddress
) {
}
