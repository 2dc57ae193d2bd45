package com.feetrail.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record BackfillRequest(
        @NotNull(message = "INVALID_BLOCK") @PositiveOrZero(message = "INVALID_BLOCK") Long fromBlock
) {
}
