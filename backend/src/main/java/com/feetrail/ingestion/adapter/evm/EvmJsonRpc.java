package com.feetrail.ingestion.adapter.evm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.feetrail.ingestion.adapter.JsonRpcErrorException;
import com.feetrail.ingestion.adapter.RpcEndpointFailover;
import com.feetrail.ingestion.adapter.RpcException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON-RPC call layer shared by the indexer and the routing contracts: local rate limiting,
 * failover to the next endpoint with retry on transient failures, and response/error decoding.
 * Execution errors (reverts, invalid params) are never retried and surface as {@link JsonRpcErrorException}.
 */
@Slf4j
public class EvmJsonRpc {

    private final EvmRpcClient rpcClient;
    private final RpcEndpointFailover endpoints;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final long limiterLogThresholdMs;

    public EvmJsonRpc(EvmRpcClient rpcClient, RpcEndpointFailover endpoints, RateLimiter rateLimiter,
                      ObjectMapper objectMapper, long limiterLogThresholdMs) {
        this.rpcClient = rpcClient;
        this.endpoints = endpoints;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.limiterLogThresholdMs = limiterLogThresholdMs;
    }

    /**
     * Calls {@code method} with retries on transient failures; returns the {@code result} node (may be JSON null).
     */
    public JsonNode call(String method, Object params) {
        Exception lastException = null;
        for (int attempt = 0; attempt < endpoints.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepBeforeRetry(attempt - 1);
            }
            String endpoint = endpoints.current();
            try {
                return callOnce(endpoint, method, params);
            } catch (JsonRpcErrorException e) {
                if (isRangeTooWideError(e) || !isRateLimitOrTransient(e)) {
                    throw e;
                }
                lastException = e;
                endpoints.markFailed(endpoint);
                log.warn("{} transient error on {} (attempt {}): {}", method, endpoint, attempt + 1, e.getMessage());
            } catch (RpcException e) {
                lastException = e;
                endpoints.markFailed(endpoint);
                log.warn("{} failed on {} (attempt {}): {}", method, endpoint, attempt + 1, e.getMessage());
            }
        }
        throw exhausted(method, lastException);
    }

    /**
     * Single attempt on the active endpoint. Used for non-idempotent sends where a blind retry is not wanted.
     */
    public JsonNode callWithoutRetry(String method, Object params) {
        return callOnce(endpoints.current(), method, params);
    }

    /**
     * JSON-RPC batch; results returned in request order. Any per-request error fails the whole batch
     * so callers can fall back to sequential calls.
     */
    public List<JsonNode> batch(List<RpcRequest> requests) {
        if (requests.isEmpty()) {
            return List.of();
        }
        Exception lastException = null;
        String method = requests.get(0).method();
        for (int attempt = 0; attempt < endpoints.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepBeforeRetry(attempt - 1);
            }
            String endpoint = endpoints.current();
            try {
                return batchOnce(endpoint, requests);
            } catch (JsonRpcErrorException e) {
                if (!isRateLimitOrTransient(e)) {
                    throw e;
                }
                lastException = e;
                endpoints.markFailed(endpoint);
            } catch (RpcException e) {
                lastException = e;
                endpoints.markFailed(endpoint);
                log.warn("Batch {} ({} req) failed on {} (attempt {}): {}",
                        method, requests.size(), endpoint, attempt + 1, e.getMessage());
            }
        }
        throw exhausted("batch " + method, lastException);
    }

    private JsonNode callOnce(String endpoint, String method, Object params) {
        acquirePermit(method, endpoint);
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException(method + " returned empty body from " + endpoint);
        }
        JsonNode root = readTree(json, method);
        return unwrap(root, method);
    }

    private List<JsonNode> batchOnce(String endpoint, List<RpcRequest> requests) {
        String method = requests.get(0).method();
        acquirePermit("batch " + method, endpoint);
        String json = rpcClient.batchCall(endpoint, requests).block();
        if (json == null) {
            throw new RpcException("Batch " + method + " returned empty body from " + endpoint);
        }
        JsonNode root = readTree(json, "batch " + method);
        if (!root.isArray()) {
            throw new RpcException("Batch " + method + ": expected JSON array, got " + root.getNodeType());
        }
        Map<Integer, JsonNode> byId = new HashMap<>();
        for (JsonNode resp : root) {
            byId.put(resp.path("id").asInt(), resp);
        }
        List<JsonNode> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            JsonNode resp = byId.get(i + 1);
            if (resp == null) {
                throw new RpcException("Batch " + method + ": missing response for id " + (i + 1));
            }
            results.add(unwrap(resp, requests.get(i).method()));
        }
        return results;
    }

    private JsonNode readTree(String json, String what) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + what + " response", e);
        }
    }

    private static JsonNode unwrap(JsonNode response, String method) {
        JsonNode error = response.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new JsonRpcErrorException(method, error.path("code").asInt(),
                    error.path("message").asText(""), errorData(error.path("data")));
        }
        return response.path("result");
    }

    private static String errorData(JsonNode data) {
        if (data.isMissingNode() || data.isNull()) {
            return null;
        }
        if (data.isTextual()) {
            return data.asText();
        }
        JsonNode nested = data.path("data");
        if (nested.isTextual()) {
            return nested.asText();
        }
        return data.toString();
    }

    private void acquirePermit(String method, String endpoint) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, limiterLogThresholdMs)) {
            log.info("Local RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
    }

    private void sleepBeforeRetry(int attempt) {
        try {
            Thread.sleep(endpoints.retryDelayMs(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry", e);
        }
    }

    private RpcException exhausted(String what, Exception lastException) {
        String msg = what + " failed after " + endpoints.getMaxAttempts() + " attempts";
        if (lastException != null && lastException.getMessage() != null && !lastException.getMessage().isBlank()) {
            msg += ": " + lastException.getMessage();
        }
        return new RpcException(msg, lastException);
    }

    /**
     * True if the error is transient or rate-limit related and a retry (possibly on another endpoint) may succeed.
     */
    public static boolean isRateLimitOrTransient(Exception e) {
        if (e == null) return false;
        if (e instanceof JsonRpcErrorException rpcError) {
            // revert data is arbitrary hex and must not be matched against status codes
            return rpcError.getCode() == -32005 || rpcError.getCode() == 429
                    || isTransientText(rpcError.getRpcMessage());
        }
        return isTransientText(e.getMessage());
    }

    private static boolean isTransientText(String message) {
        String msg = message != null ? message.toLowerCase(Locale.ROOT) : "";
        return msg.contains("429") || msg.contains("too many requests")
                || msg.contains("rate limit") || msg.contains("limit exceeded")
                || msg.contains("request limit") || msg.contains("quota")
                || msg.contains("503") || msg.contains("502") || msg.contains("504")
                || msg.contains("timeout") || msg.contains("timed out")
                || msg.contains("connection refused") || msg.contains("temporary")
                || msg.contains("header not found");
    }

    /**
     * True if eth_getLogs was rejected because the block range or result set is too large.
     */
    public static boolean isRangeTooWideError(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase(Locale.ROOT);
        return msg.contains("-32701") || msg.contains("query returned more than")
                || msg.contains("too many results") || msg.contains("block range is too wide")
                || msg.contains("exceed maximum block range") || msg.contains("log response size exceeded")
                || msg.contains("range too large");
    }
}
