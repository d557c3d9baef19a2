package com.ledgerimport.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter for outbound calls (aggregator pages, classifier chunks).
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before retry number {@code attempt} (zero-based): baseDelay * 2^attempt with jitter applied.
     */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), 20));
        return jitter(exponential);
    }

    public Duration delay(int attempt) {
        return Duration.ofMillis(delayMs(attempt));
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 500ms base, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 3);
    }
}
