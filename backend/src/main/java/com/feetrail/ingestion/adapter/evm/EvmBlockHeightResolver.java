package com.feetrail.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.feetrail.common.EvmHex;
import com.feetrail.ingestion.adapter.RpcException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resolves the current chain head via eth_blockNumber.
 */
@Component
@RequiredArgsConstructor
public class EvmBlockHeightResolver {

    private final EvmJsonRpc jsonRpc;

    public long getCurrentBlock() {
        JsonNode result = jsonRpc.call("eth_blockNumber", List.of());
        String hex = result.asText(null);
        if (hex == null || !hex.startsWith("0x")) {
            throw new RpcException("eth_blockNumber invalid result: " + hex);
        }
        return EvmHex.parseQuantity(hex);
    }
}
