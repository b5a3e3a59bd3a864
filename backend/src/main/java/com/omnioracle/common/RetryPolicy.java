package com.omnioracle.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter for JSON-RPC reads against feed and pool contracts.
 */
public final class RetryPolicy {

    private static final int MAX_SHIFT = 16;

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.jitterFactor = Math.max(0, Math.min(1, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before retry number {@code attempt} (0-based): base * 2^attempt, then jittered.
     */
    public long delayMs(int attempt) {
        long raw = baseDelayMs << Math.min(Math.max(attempt, 0), MAX_SHIFT);
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, Math.round(raw * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Default: 250ms base, ±20% jitter, 3 attempts. */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(250L, 0.2, 3);
    }
}
