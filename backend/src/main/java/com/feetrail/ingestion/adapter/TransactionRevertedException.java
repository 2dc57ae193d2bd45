package com.feetrail.ingestion.adapter;

import lombok.Getter;

/**
 * A sent transaction was mined with status 0, or was not mined before the confirmation timeout.
 */
@Getter
public class TransactionRevertedException extends RpcException {

    private final String txHash;

    public TransactionRevertedException(String txHash, String message) {
        super(message + " (tx " + txHash + ")");
        this.txHash = txHash;
    }
}
