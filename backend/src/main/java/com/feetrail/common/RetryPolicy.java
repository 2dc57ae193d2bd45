package com.feetrail.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for JSON-RPC retries across failover endpoints.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before the retry that follows the given zero-based attempt.
     * baseDelay * 2^attempt, then jitter.
     */
    public long delayMs(int attempt) {
        long exponential = attempt <= 0 ? baseDelayMs : baseDelayMs * (1L << Math.min(attempt, 20));
        if (jitterFactor == 0.0) {
            return exponential;
        }
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0L, (long) (exponential * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 3);
    }

    /** No waiting between attempts; used by tests and single-shot callers. */
    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(0L, 0.0, maxAttempts);
    }
}
