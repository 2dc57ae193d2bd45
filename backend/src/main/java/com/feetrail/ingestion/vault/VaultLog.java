package com.feetrail.ingestion.vault;

import java.util.List;

/**
 * Raw eth_getLogs entry emitted by a fee vault.
 */
public record VaultLog(
        String address,
        List<String> topics,
        String data,
        long blockNumber,
        String transactionHash,
        int logIndex
) {

    public String topic0() {
        return topics.isEmpty() ? null : topics.get(0);
    }
}
