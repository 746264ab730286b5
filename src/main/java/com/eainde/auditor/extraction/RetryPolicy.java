package com.eainde.auditor.extraction;

import java.time.Duration;

/**
 * Attempt budget and backoff curve for calls to an unreliable generator.
 *
 * @param maxAttempts    total attempts, including the first one
 * @param initialBackoff wait after the first rate-limited attempt
 * @param multiplier     growth factor applied per further rate-limited attempt
 * @param maxBackoff     upper bound for any single wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public static final RetryPolicy DEFAULT =
            new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 (current: " + maxAttempts + ")");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0 (current: " + multiplier + ")");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
    }

    /**
     * Wait before the next attempt, after {@code failedAttempt} attempts failed.
     * {@code initialBackoff * multiplier^(failedAttempt-1)}, capped at {@code maxBackoff}.
     */
    public Duration backoffAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be positive (current: " + failedAttempt + ")");
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
