package com.feetrail.ingestion.adapter;

import com.feetrail.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chain RPC endpoint with ordered fallbacks. Calls stay on the active endpoint until it fails;
 * a failure moves every caller to the next configured URL, wrapping back to the primary after the last fallback.
 */
@Slf4j
public class RpcEndpointFailover {

    private final List<String> endpoints;
    private final AtomicInteger active = new AtomicInteger(0);
    private final RetryPolicy retryPolicy;

    public RpcEndpointFailover(String primaryUrl, List<String> fallbackUrls, RetryPolicy retryPolicy) {
        List<String> urls = new ArrayList<>();
        addIfPresent(urls, primaryUrl);
        if (fallbackUrls != null) {
            fallbackUrls.forEach(url -> addIfPresent(urls, url));
        }
        if (urls.isEmpty()) {
            throw new IllegalArgumentException("Chain RPC URL is required");
        }
        this.endpoints = List.copyOf(urls);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    private static void addIfPresent(List<String> urls, String url) {
        if (url == null || url.isBlank()) {
            return;
        }
        String trimmed = url.trim();
        if (!urls.contains(trimmed)) {
            urls.add(trimmed);
        }
    }

    public String current() {
        return endpoints.get(active.get());
    }

    /**
     * Switches to the next endpoint if {@code endpoint} is still the active one. Concurrent failures
     * reported against the same endpoint advance only once.
     */
    public void markFailed(String endpoint) {
        int index = active.get();
        if (endpoints.size() == 1 || !endpoints.get(index).equals(endpoint)) {
            return;
        }
        int next = (index + 1) % endpoints.size();
        if (active.compareAndSet(index, next)) {
            log.warn("RPC endpoint {} failed, switching to {}", endpoint, endpoints.get(next));
        }
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return retryPolicy.getMaxAttempts();
    }
}
