package com.drugbox.recognition.ocr;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * @param maxAttempts       total attempts including the first, at least 1
 * @param initialBackoff    wait before the second attempt
 * @param backoffMultiplier growth factor per further attempt, at least 1.0
 */
public record RetryConfig(int maxAttempts, Duration initialBackoff, double backoffMultiplier) {

    public RetryConfig {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    /**
     * Three attempts, 200 ms then 400 ms apart.
     */
    public static RetryConfig defaults() {
        return new RetryConfig(3, Duration.ofMillis(200), 2.0);
    }

    public static RetryConfig noRetry() {
        return new RetryConfig(1, Duration.ZERO, 1.0);
    }

    /**
     * Wait before attempt number {@code attempt} (1-based; attempt 1 never waits).
     */
    public Duration backoffBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(Math.round(initialBackoff.toMillis() * Math.pow(backoffMultiplier, attempt - 2)));
    }
}
