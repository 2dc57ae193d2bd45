package com.feetrail.api.dto;

/**
 * status: "ok" when running without error, "degraded" when running with a last error, "stopped" otherwise.
 */
public record IndexerHealthResponse(boolean configured, String status) {
}
