package com.feetrail.ingestion.adapter;

import lombok.Getter;

/**
 * JSON-RPC response carried an {@code error} object. For contract execution errors
 * {@code data} holds the ABI-encoded revert payload (custom error selector + args) when the node returns it.
 */
@Getter
public class JsonRpcErrorException extends RpcException {

    private final String method;
    private final int code;
    private final String rpcMessage;
    private final String data;

    public JsonRpcErrorException(String method, int code, String rpcMessage, String data) {
        super(method + " error " + code + ": " + rpcMessage + (data != null ? " data=" + data : ""));
        this.method = method;
        this.code = code;
        this.rpcMessage = rpcMessage;
        this.data = data;
    }
}
