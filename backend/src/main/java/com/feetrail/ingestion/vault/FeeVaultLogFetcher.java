package com.feetrail.ingestion.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.feetrail.common.EvmHex;
import com.feetrail.ingestion.adapter.RpcException;
import com.feetrail.ingestion.adapter.evm.EvmJsonRpc;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches fee-vault logs for an inclusive block range with one eth_getLogs per range
 * (address array, topic0 OR-filter). Ranges the node rejects as too wide are split in halves.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeeVaultLogFetcher {

    static final Comparator<VaultLog> CHAIN_ORDER = Comparator
            .comparingLong(VaultLog::blockNumber)
            .thenComparingInt(VaultLog::logIndex);

    private final EvmJsonRpc jsonRpc;

    /**
     * @return logs sorted ascending by (blockNumber, logIndex); removed (reorged) entries are dropped
     */
    public List<VaultLog> fetchLogs(List<String> vaultAddresses, long fromBlock, long toBlock) {
        if (vaultAddresses.isEmpty() || fromBlock > toBlock) {
            return List.of();
        }
        List<VaultLog> logs = new ArrayList<>();
        fetchRange(vaultAddresses, fromBlock, toBlock, logs);
        logs.sort(CHAIN_ORDER);
        return logs;
    }

    private void fetchRange(List<String> vaultAddresses, long fromBlock, long toBlock, List<VaultLog> out) {
        JsonNode result;
        try {
            result = jsonRpc.call("eth_getLogs", List.of(filter(vaultAddresses, fromBlock, toBlock)));
        } catch (RpcException e) {
            if (!EvmJsonRpc.isRangeTooWideError(e) || fromBlock >= toBlock) {
                throw e;
            }
            long mid = fromBlock + (toBlock - fromBlock) / 2;
            log.info("eth_getLogs range {}-{} too wide, splitting at {}", fromBlock, toBlock, mid);
            fetchRange(vaultAddresses, fromBlock, mid, out);
            fetchRange(vaultAddresses, mid + 1, toBlock, out);
            return;
        }
        if (!result.isArray()) {
            throw new RpcException("eth_getLogs: expected array for " + fromBlock + "-" + toBlock);
        }
        for (JsonNode node : result) {
            if (node.path("removed").asBoolean(false)) {
                continue;
            }
            try {
                out.add(toVaultLog(node));
            } catch (RuntimeException e) {
                log.warn("Skipping malformed log in {}-{} (tx {}): {}", fromBlock, toBlock,
                        node.path("transactionHash").asText("?"), e.getMessage());
            }
        }
    }

    private static Map<String, Object> filter(List<String> vaultAddresses, long fromBlock, long toBlock) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("fromBlock", EvmHex.toQuantity(fromBlock));
        filter.put("toBlock", EvmHex.toQuantity(toBlock));
        filter.put("address", vaultAddresses);
        filter.put("topics", List.of(FeeVaultEvents.allTopics()));
        return filter;
    }

    private static VaultLog toVaultLog(JsonNode node) {
        List<String> topics = new ArrayList<>();
        node.path("topics").forEach(t -> topics.add(t.asText()));
        String txHash = node.path("transactionHash").asText("");
        if (txHash.isBlank()) {
            throw new IllegalArgumentException("missing transactionHash");
        }
        long logIndex = EvmHex.parseQuantity(node.path("logIndex").asText(null));
        if (logIndex > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("logIndex out of range: " + logIndex);
        }
        return new VaultLog(
                node.path("address").asText(null),
                topics,
                node.path("data").asText("0x"),
                EvmHex.parseQuantity(node.path("blockNumber").asText(null)),
                txHash,
                (int) logIndex);
    }
}
