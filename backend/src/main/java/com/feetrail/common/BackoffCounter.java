package com.feetrail.common;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Doubling delay counter with a ceiling. Doubles on each failure, resets on success.
 * Thread-safe; readers may observe it while the owning worker updates it.
 */
public class BackoffCounter {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final AtomicLong currentDelayMs;

    public BackoffCounter(long initialDelayMs, long maxDelayMs) {
        if (initialDelayMs <= 0) {
            throw new IllegalArgumentException("initialDelayMs must be positive");
        }
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = Math.max(initialDelayMs, maxDelayMs);
        this.currentDelayMs = new AtomicLong(initialDelayMs);
    }

    /**
     * Records a failure and returns the delay that was current before doubling.
     */
    public long onFailure() {
        return currentDelayMs.getAndUpdate(d -> Math.min(d * 2, maxDelayMs));
    }

    public void onSuccess() {
        currentDelayMs.set(initialDelayMs);
    }

    public long currentDelayMs() {
        return currentDelayMs.get();
    }
}
