package com.tracker.sync.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff for transient tracker failures.
 *
 * @param maxAttempts  total attempts including the first one
 * @param initialDelay delay before the second attempt
 * @param multiplier   growth factor between consecutive delays
 * @param maxDelay     upper bound for any single delay
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(initialDelay, "initialDelay is required");
        Objects.requireNonNull(maxDelay, "maxDelay is required");
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * Default policy: 4 attempts, 500ms initial delay, doubling, 10s cap.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(4, Duration.ofMillis(500), 2.0, Duration.ofSeconds(10));
    }

    /**
     * Single attempt, no retry.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Delay to wait after failed attempt number {@code attempt} (1-based).
     */
    public Duration delayAfter(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
