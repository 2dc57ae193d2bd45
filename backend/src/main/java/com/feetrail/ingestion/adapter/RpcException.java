package com.feetrail.ingestion.adapter;

/**
 * Thrown when a JSON-RPC call fails at the transport level or returns an unusable payload.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
