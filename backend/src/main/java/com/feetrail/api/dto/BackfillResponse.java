package com.feetrail.api.dto;

public record BackfillResponse(long fromBlock, String message) {
}
