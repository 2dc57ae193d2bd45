package com.feetrail.api.dto;

import com.feetrail.domain.FeeDistribution;
import com.feetrail.domain.FeeEventType;

import java.time.Instant;

public record FeeDistributionResponse(
        String txHash,
        int logIndex,
        long blockNumber,
        Instant blockTimestamp,
        FeeEventType eventType,
        String poolId,
        String projectId,
        String devAddress,
        String tokenAddress,
        String recipientAddress,
        String amount,
        String devAmount,
        String protocolAmount,
        String vaultAddress,
        Instant indexedAt
) {

    public static FeeDistributionResponse from(FeeDistribution d) {
        return new FeeDistributionResponse(
                d.getTxHash(),
                d.getLogIndex(),
                d.getBlockNumber(),
                d.getBlockTimestamp(),
                d.getEventType(),
                d.getPoolId(),
                d.getProjectId(),
                d.getDevAddress(),
                d.getTokenAddress(),
                d.getRecipientAddress(),
                d.getAmount(),
                d.getDevAmount(),
                d.getProtocolAmount(),
                d.getVaultAddress(),
                d.getIndexedAt());
    }
}
