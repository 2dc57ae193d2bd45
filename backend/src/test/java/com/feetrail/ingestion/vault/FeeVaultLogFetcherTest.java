package com.feetrail.ingestion.vault;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.feetrail.common.EvmHex;
import com.feetrail.ingestion.adapter.JsonRpcErrorException;
import com.feetrail.ingestion.adapter.RpcException;
import com.feetrail.ingestion.adapter.evm.EvmJsonRpc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.feetrail.ingestion.vault.VaultLogFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeeVaultLogFetcherTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private EvmJsonRpc jsonRpc;

    private FeeVaultLogFetcher fetcher;

    @BeforeEach
    void setUp() {
        fetcher = new FeeVaultLogFetcher(jsonRpc);
    }

    @Test
    @DisplayName("one eth_getLogs per range, filtered by vault address array and every fee topic")
    @SuppressWarnings("unchecked")
    void fetchLogs_buildsSingleFilter() {
        when(jsonRpc.call(eq("eth_getLogs"), any())).thenReturn(MAPPER.createArrayNode());

        fetcher.fetchLogs(List.of(VAULT), 100, 200);

        ArgumentCaptor<Object> params = ArgumentCaptor.forClass(Object.class);
        verify(jsonRpc, times(1)).call(eq("eth_getLogs"), params.capture());
        Map<String, Object> filter = (Map<String, Object>) ((List<Object>) params.getValue()).get(0);
        assertThat(filter.get("fromBlock")).isEqualTo("0x64");
        assertThat(filter.get("toBlock")).isEqualTo("0xc8");
        assertThat(filter.get("address")).isEqualTo(List.of(VAULT));
        assertThat(filter.get("topics")).isEqualTo(List.of(FeeVaultEvents.allTopics()));
    }

    @Test
    void fetchLogs_sortsByBlockThenLogIndex_andDropsRemoved() {
        ArrayNode result = MAPPER.createArrayNode();
        result.add(logNode(deposit(12, 0, txHash(3), 1, 1), false));
        result.add(logNode(deposit(10, 5, txHash(2), 1, 1), false));
        result.add(logNode(deposit(10, 1, txHash(1), 1, 1), false));
        result.add(logNode(deposit(11, 0, txHash(4), 1, 1), true));
        when(jsonRpc.call(eq("eth_getLogs"), any())).thenReturn(result);

        List<VaultLog> logs = fetcher.fetchLogs(List.of(VAULT), 10, 12);

        assertThat(logs).extracting(VaultLog::transactionHash)
                .containsExactly(txHash(1), txHash(2), txHash(3));
        assertThat(logs.get(0).topics()).hasSize(4);
        assertThat(logs.get(0).logIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("a log with a missing or out-of-range envelope field is skipped; the rest of the range is kept")
    void fetchLogs_malformedLog_skippedWithoutLosingBatch() {
        ArrayNode result = MAPPER.createArrayNode();
        result.add(logNode(deposit(10, 0, txHash(1), 1, 1), false));
        ObjectNode nullLogIndex = (ObjectNode) logNode(deposit(10, 1, txHash(2), 1, 1), false);
        nullLogIndex.putNull("logIndex");
        result.add(nullLogIndex);
        ObjectNode hugeLogIndex = (ObjectNode) logNode(deposit(10, 2, txHash(3), 1, 1), false);
        hugeLogIndex.put("logIndex", "0x100000000");
        result.add(hugeLogIndex);
        ObjectNode badBlock = (ObjectNode) logNode(deposit(11, 0, txHash(4), 1, 1), false);
        badBlock.put("blockNumber", "pending");
        result.add(badBlock);
        ObjectNode noTxHash = (ObjectNode) logNode(deposit(11, 1, txHash(5), 1, 1), false);
        noTxHash.remove("transactionHash");
        result.add(noTxHash);
        result.add(logNode(deposit(12, 0, txHash(6), 1, 1), false));
        when(jsonRpc.call(eq("eth_getLogs"), any())).thenReturn(result);

        List<VaultLog> logs = fetcher.fetchLogs(List.of(VAULT), 10, 12);

        assertThat(logs).extracting(VaultLog::transactionHash).containsExactly(txHash(1), txHash(6));
    }

    @Test
    @DisplayName("a range rejected as too wide is split in halves until the node accepts it")
    @SuppressWarnings("unchecked")
    void fetchLogs_rangeTooWide_splits() {
        List<Long> requestedFrom = new ArrayList<>();
        when(jsonRpc.call(eq("eth_getLogs"), any())).thenAnswer(invocation -> {
            Map<String, Object> filter = (Map<String, Object>) ((List<Object>) invocation.getArgument(1)).get(0);
            long from = EvmHex.parseQuantity((String) filter.get("fromBlock"));
            long to = EvmHex.parseQuantity((String) filter.get("toBlock"));
            requestedFrom.add(from);
            if (to - from >= 50) {
                throw new JsonRpcErrorException("eth_getLogs", -32005, "query returned more than 10000 results", null);
            }
            ArrayNode arr = MAPPER.createArrayNode();
            arr.add(logNode(deposit(from, 0, txHash((int) from), 1, 1), false));
            return arr;
        });

        List<VaultLog> logs = fetcher.fetchLogs(List.of(VAULT), 0, 99);

        assertThat(logs).extracting(VaultLog::blockNumber).containsExactly(0L, 50L);
        assertThat(requestedFrom).containsExactly(0L, 0L, 50L);
    }

    @Test
    void fetchLogs_otherErrorsPropagate() {
        when(jsonRpc.call(eq("eth_getLogs"), any())).thenThrow(new RpcException("all endpoints failed"));

        assertThatThrownBy(() -> fetcher.fetchLogs(List.of(VAULT), 0, 10))
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("all endpoints failed");
    }

    @Test
    void fetchLogs_emptyRangeOrNoVaults_noCall() {
        assertThat(fetcher.fetchLogs(List.of(VAULT), 10, 9)).isEmpty();
        assertThat(fetcher.fetchLogs(List.of(), 0, 10)).isEmpty();

        verify(jsonRpc, never()).call(any(), any());
    }

    static JsonNode logNode(VaultLog log, boolean removed) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("address", log.address());
        ArrayNode topics = node.putArray("topics");
        log.topics().forEach(topics::add);
        node.put("data", log.data());
        node.put("blockNumber", EvmHex.toQuantity(log.blockNumber()));
        node.put("transactionHash", log.transactionHash());
        node.put("logIndex", EvmHex.toQuantity(log.logIndex()));
        node.put("removed", removed);
        return node;
    }
}
