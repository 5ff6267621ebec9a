package com.sharesgate.common;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Delay schedule for retried work: {@code base * multiplier^attempt}, capped at {@code maxDelay}, then ±jitter.
 * A multiplier of 1 gives a fixed interval.
 */
public final class RetryPolicy {

    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(Duration baseDelay, double multiplier, Duration maxDelay, double jitterFactor, int maxAttempts) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got " + multiplier);
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be within [0, 1], got " + jitterFactor);
        }
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay.compareTo(baseDelay) < 0 ? baseDelay : maxDelay;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Delay before the given zero-based retry.
     */
    public Duration delay(int attempt) {
        double raw = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, Math.min(attempt, 30)));
        long capped = (long) Math.min(raw, (double) maxDelay.toMillis());
        return Duration.ofMillis(jitter(capped));
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    /** Total calls allowed, including the first one. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Constant interval, no jitter, unbounded attempts. */
    public static RetryPolicy fixed(Duration interval) {
        return new RetryPolicy(interval, 1.0, interval, 0.0, Integer.MAX_VALUE);
    }

    /** Doubling delay from {@code baseDelay} with the given jitter. */
    public static RetryPolicy exponential(Duration baseDelay, double jitterFactor, int maxAttempts) {
        return new RetryPolicy(baseDelay, 2.0, baseDelay.multipliedBy(1L << 10), jitterFactor, maxAttempts);
    }
}
