package com.feetrail.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.feetrail.common.EvmHex;
import com.feetrail.ingestion.adapter.RpcException;
import com.feetrail.ingestion.adapter.TransactionRevertedException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Signs and sends state-changing contract calls from the administrative key, then waits for one confirmation.
 * Reverts detected during gas estimation surface as {@link com.feetrail.ingestion.adapter.JsonRpcErrorException}
 * carrying the revert data; a mined receipt with status 0 surfaces as {@link TransactionRevertedException}.
 * Sends are serialized so pending nonces never collide.
 */
@Slf4j
public class EvmTransactionSender {

    private static final BigInteger GAS_LIMIT_NUMERATOR = BigInteger.valueOf(12);
    private static final BigInteger GAS_LIMIT_DENOMINATOR = BigInteger.TEN;

    private final EvmJsonRpc jsonRpc;
    private final Credentials credentials;
    private final long confirmationPollMs;
    private final long confirmationTimeoutMs;
    private final Object signerLock = new Object();
    private volatile Long chainId;

    public EvmTransactionSender(EvmJsonRpc jsonRpc, Credentials credentials,
                                long confirmationPollMs, long confirmationTimeoutMs) {
        this.jsonRpc = jsonRpc;
        this.credentials = credentials;
        this.confirmationPollMs = Math.max(1L, confirmationPollMs);
        this.confirmationTimeoutMs = Math.max(this.confirmationPollMs, confirmationTimeoutMs);
    }

    public String getSenderAddress() {
        return credentials.getAddress();
    }

    /**
     * Sends {@code data} to {@code to} and blocks until the transaction is mined successfully.
     *
     * @return transaction hash
     */
    public String sendAndConfirm(String to, String data) {
        String txHash;
        synchronized (signerLock) {
            String from = credentials.getAddress();
            BigInteger gasLimit = estimateGas(from, to, data)
                    .multiply(GAS_LIMIT_NUMERATOR).divide(GAS_LIMIT_DENOMINATOR);
            BigInteger nonce = quantity(jsonRpc.call("eth_getTransactionCount", List.of(from, "pending")),
                    "eth_getTransactionCount");
            BigInteger gasPrice = quantity(jsonRpc.call("eth_gasPrice", List.of()), "eth_gasPrice");
            RawTransaction rawTx = RawTransaction.createTransaction(nonce, gasPrice, gasLimit, to, BigInteger.ZERO, data);
            byte[] signed = TransactionEncoder.signMessage(rawTx, chainId(), credentials);
            JsonNode result = jsonRpc.callWithoutRetry("eth_sendRawTransaction", List.of(Numeric.toHexString(signed)));
            txHash = result.asText(null);
            if (txHash == null || !txHash.startsWith("0x")) {
                throw new RpcException("eth_sendRawTransaction invalid result: " + txHash);
            }
            log.debug("Sent tx {} to {} nonce {}", txHash, to, nonce);
        }
        waitForReceipt(txHash);
        return txHash;
    }

    private BigInteger estimateGas(String from, String to, String data) {
        Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("from", from);
        tx.put("to", to);
        tx.put("data", data);
        return quantity(jsonRpc.call("eth_estimateGas", List.of(tx)), "eth_estimateGas");
    }

    private long chainId() {
        Long cached = chainId;
        if (cached == null) {
            cached = quantity(jsonRpc.call("eth_chainId", List.of()), "eth_chainId").longValueExact();
            chainId = cached;
        }
        return cached;
    }

    private void waitForReceipt(String txHash) {
        long deadline = System.currentTimeMillis() + confirmationTimeoutMs;
        while (true) {
            JsonNode receipt = jsonRpc.call("eth_getTransactionReceipt", List.of(txHash));
            if (receipt != null && receipt.isObject()) {
                String status = receipt.path("status").asText("0x1");
                if (EvmHex.parseQuantity(status) == 0L) {
                    throw new TransactionRevertedException(txHash, "transaction reverted");
                }
                return;
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new TransactionRevertedException(txHash,
                        "transaction not mined within " + confirmationTimeoutMs + " ms");
            }
            try {
                Thread.sleep(confirmationPollMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RpcException("Interrupted waiting for receipt of " + txHash, e);
            }
        }
    }

    private static BigInteger quantity(JsonNode node, String method) {
        String hex = node != null ? node.asText(null) : null;
        if (hex == null || !hex.startsWith("0x")) {
            throw new RpcException(method + " invalid result: " + hex);
        }
        return EvmHex.parseBigQuantity(hex);
    }
}
