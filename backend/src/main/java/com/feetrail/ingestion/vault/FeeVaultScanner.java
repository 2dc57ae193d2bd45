package com.feetrail.ingestion.vault;

import com.feetrail.domain.FeeDistribution;
import com.feetrail.ingestion.adapter.evm.EvmBlockTimestampResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fetch + timestamp + decode for one block range. Timestamps are resolved once per distinct block.
 */
@Component
@RequiredArgsConstructor
public class FeeVaultScanner {

    private final FeeVaultLogFetcher logFetcher;
    private final FeeVaultLogParser logParser;
    private final EvmBlockTimestampResolver timestampResolver;

    /**
     * @return decoded records in chain order (blockNumber, logIndex); undecodable logs are omitted
     */
    public List<FeeDistribution> scan(List<String> vaultAddresses, long fromBlock, long toBlock) {
        List<VaultLog> logs = logFetcher.fetchLogs(vaultAddresses, fromBlock, toBlock);
        if (logs.isEmpty()) {
            return List.of();
        }
        Map<Long, Instant> timestamps = timestampResolver.getBlockTimestamps(
                logs.stream().map(VaultLog::blockNumber).toList());
        List<FeeDistribution> records = new ArrayList<>(logs.size());
        for (VaultLog log : logs) {
            logParser.parse(log, timestamps.get(log.blockNumber())).ifPresent(records::add);
        }
        return records;
    }
}
