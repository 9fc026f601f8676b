package com.copyradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with ±jitter between bounded retries (lock acquisition on aggregate keys).
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must not be negative");
        }
        if (jitterFactor < 0 || jitterFactor > 1) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1]");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the attempt following the given zero-based attempt: baseDelay * 2^attempt, then jitter.
     */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), 20));
        if (jitterFactor == 0) {
            return exponential;
        }
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (exponential * jitter));
    }

    /**
     * Sleeps for {@link #delayMs(int)}. Restores the interrupt flag and rethrows when interrupted.
     */
    public void backoff(int attempt) throws InterruptedException {
        long delay = delayMs(attempt);
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            }
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Default: 10ms base, ±20% jitter, 3 attempts. */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(10L, 0.2, 3);
    }
}
