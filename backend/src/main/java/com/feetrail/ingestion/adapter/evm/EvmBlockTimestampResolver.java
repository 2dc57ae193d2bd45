package com.feetrail.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.feetrail.common.EvmHex;
import com.feetrail.ingestion.adapter.RpcException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Resolves block timestamps via eth_getBlockByNumber, one request per distinct block.
 * Uses a JSON-RPC batch when the endpoint accepts it and falls back to sequential calls otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvmBlockTimestampResolver {

    static final int MAX_BATCH_SIZE = 50;

    private final EvmJsonRpc jsonRpc;

    /**
     * Timestamps for the given block numbers. Duplicates are collapsed; blocks that cannot be
     * resolved are absent from the returned map.
     */
    public Map<Long, Instant> getBlockTimestamps(Collection<Long> blockNumbers) {
        List<Long> distinct = new ArrayList<>(new TreeSet<>(blockNumbers));
        Map<Long, Instant> result = new HashMap<>();
        for (int i = 0; i < distinct.size(); i += MAX_BATCH_SIZE) {
            List<Long> chunk = distinct.subList(i, Math.min(i + MAX_BATCH_SIZE, distinct.size()));
            if (chunk.size() == 1) {
                resolveSequential(chunk, result);
                continue;
            }
            try {
                resolveBatch(chunk, result);
            } catch (RpcException e) {
                log.info("Batch eth_getBlockByNumber unavailable ({} blocks), falling back to sequential: {}",
                        chunk.size(), e.getMessage());
                resolveSequential(chunk, result);
            }
        }
        return result;
    }

    public Instant getBlockTimestamp(long blockNumber) {
        JsonNode block = jsonRpc.call("eth_getBlockByNumber", List.of(EvmHex.toQuantity(blockNumber), false));
        return toInstant(block, blockNumber);
    }

    private void resolveBatch(List<Long> blocks, Map<Long, Instant> out) {
        List<RpcRequest> requests = blocks.stream()
                .map(b -> new RpcRequest("eth_getBlockByNumber", List.of(EvmHex.toQuantity(b), false)))
                .toList();
        List<JsonNode> results = jsonRpc.batch(requests);
        for (int i = 0; i < blocks.size(); i++) {
            out.put(blocks.get(i), toInstant(results.get(i), blocks.get(i)));
        }
    }

    private void resolveSequential(List<Long> blocks, Map<Long, Instant> out) {
        for (Long block : blocks) {
            try {
                out.put(block, getBlockTimestamp(block));
            } catch (RpcException e) {
                log.warn("Could not resolve timestamp for block {}: {}", block, e.getMessage());
            }
        }
    }

    private static Instant toInstant(JsonNode block, long blockNumber) {
        if (block == null || block.isMissingNode() || block.isNull()) {
            throw new RpcException("eth_getBlockByNumber no result for block " + blockNumber);
        }
        String timestampHex = block.path("timestamp").asText(null);
        if (timestampHex == null || !timestampHex.startsWith("0x")) {
            throw new RpcException("eth_getBlockByNumber invalid timestamp: " + timestampHex);
        }
        return Instant.ofEpochSecond(EvmHex.parseQuantity(timestampHex));
    }
}
