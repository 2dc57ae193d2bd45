package com.feetrail.ingestion.adapter.evm;

/**
 * A single JSON-RPC request inside a batch.
 */
public record RpcRequest(String method, Object params) {}
