package com.feetrail.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.feetrail.ingestion.adapter.RpcException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only contract access: eth_call against latest state and eth_getCode.
 */
@Component
@RequiredArgsConstructor
public class EvmContractReader {

    private final EvmJsonRpc jsonRpc;

    /**
     * @return ABI-encoded return data ("0x..."); reverts surface as JsonRpcErrorException
     */
    public String call(String to, String data) {
        Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("to", to);
        tx.put("data", data);
        JsonNode result = jsonRpc.call("eth_call", List.of(tx, "latest"));
        String hex = result.asText(null);
        if (hex == null || !hex.startsWith("0x")) {
            throw new RpcException("eth_call invalid result: " + hex);
        }
        return hex;
    }

    /**
     * Deployed runtime bytecode; "0x" when no contract lives at the address.
     */
    public String getCode(String address) {
        JsonNode result = jsonRpc.call("eth_getCode", List.of(address, "latest"));
        String hex = result.asText(null);
        if (hex == null || !hex.startsWith("0x")) {
            throw new RpcException("eth_getCode invalid result: " + hex);
        }
        return hex;
    }
}
