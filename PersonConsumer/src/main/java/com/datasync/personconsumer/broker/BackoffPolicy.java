package com.datasync.personconsumer.broker;

import lombok.Getter;

/**
 * Bounded exponential backoff: the delay after failed attempt n (1-based)
 * is min(initialDelay * 2^(n-1), maxDelay).
 */
@Getter
public class BackoffPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 10;
    public static final long DEFAULT_INITIAL_DELAY_MS = 1000;
    public static final long DEFAULT_MAX_DELAY_MS = 30000;

    private final int maxAttempts;
    private final long initialDelayMs;
    private final long maxDelayMs;

    public BackoffPolicy(int maxAttempts, long initialDelayMs, long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (initialDelayMs < 0 || maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException(
                    "Invalid delays: initial=" + initialDelayMs + "ms, max=" + maxDelayMs + "ms");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public static BackoffPolicy standard() {
        return new BackoffPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS);
    }

    public long delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based, was " + attempt);
        }
        // shifting past 62 bits overflows; anything that large is capped anyway
        if (attempt > 32) {
            return maxDelayMs;
        }
        long delay = initialDelayMs << (attempt - 1);
        return Math.min(delay, maxDelayMs);
    }
}
