package io.autotrade.infrastructure.retry;

import java.time.Duration;
import java.time.Instant;

/**
 * Retry policy with exponential backoff for transient storage failures.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Maximum attempt limit, after which the policy is exhausted
 * - Maximum backoff duration (cap)
 * - Reset after a successful call
 *
 * Instances are stateful: use one per retried operation.
 *
 * Usage:
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .initialDelay(Duration.ofMillis(200))
 *     .maxDelay(Duration.ofSeconds(10))
 *     .multiplier(2.0)
 *     .maxAttempts(5)
 *     .build();
 * </pre>
 */
public class RetryPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastFailureTime;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true while fewer than maxAttempts failures have been recorded
     */
    public synchronized boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Record a failed attempt and grow the delay, capped at maxDelay.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastFailureTime = Instant.now();

        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));
    }

    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastFailureTime = null;
    }

    public synchronized boolean isExhausted() {
        return attemptCount >= maxAttempts;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default policy for database writes: 200ms doubling to 10s, 5 attempts.
     */
    public static RetryPolicy forStorage() {
        return builder()
            .initialDelay(Duration.ofMillis(200))
            .maxDelay(Duration.ofSeconds(10))
            .multiplier(2.0)
            .maxAttempts(5)
            .build();
    }

    /**
     * Builder for RetryPolicy.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(10);
        private double multiplier = 2.0;
        private int maxAttempts = 5;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
