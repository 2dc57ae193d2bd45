package com.feetrail.ingestion.adapter.evm;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * EVM JSON-RPC transport. Endpoint failover, rate limiting and error decoding live in {@link EvmJsonRpc}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getLogs"
     * @param params      method params
     * @return raw response body (JSON object)
     */
    Mono<String> call(String endpointUrl, String method, Object params);

    /**
     * JSON-RPC batch: several requests in one HTTP round trip. Request ids are 1-based positions.
     *
     * @return raw response body (JSON array)
     */
    Mono<String> batchCall(String endpointUrl, List<RpcRequest> requests);
}
