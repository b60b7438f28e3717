package com.genflow.core.model;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for retrying an unreliable generation call.
 * Immutable and reusable across steps.
 *
 * Invariants:
 * - maxRetries >= 0 (total attempts = maxRetries + 1)
 * - baseDelay >= 0
 * - maxDelay >= 0
 * - delaySequence, when non-empty, overrides the strategy
 */
public record RetryConfig(
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    DelayStrategy strategy,
    List<Duration> delaySequence
) {
    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must be >= 0");
        }
        if (strategy == null) {
            strategy = DelayStrategy.EXPONENTIAL;
        }
        delaySequence = delaySequence == null ? List.of() : List.copyOf(delaySequence);
    }

    /**
     * Default: 3 retries, 10s/30s/60s delay sequence, exponential from 10s capped at 60s.
     */
    public static RetryConfig defaultConfig() {
        return new RetryConfig(
            3,
            Duration.ofSeconds(10),
            Duration.ofSeconds(60),
            DelayStrategy.EXPONENTIAL,
            List.of(Duration.ofSeconds(10), Duration.ofSeconds(30), Duration.ofSeconds(60))
        );
    }

    /**
     * Single attempt, no retries.
     */
    public static RetryConfig noRetry() {
        return new RetryConfig(0, Duration.ZERO, Duration.ZERO, DelayStrategy.FIXED, List.of());
    }

    /**
     * Total attempts including the initial try.
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    public boolean hasDelaySequence() {
        return !delaySequence.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxRetries(maxRetries)
            .baseDelay(baseDelay)
            .maxDelay(maxDelay)
            .strategy(strategy)
            .delaySequence(delaySequence);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(10);
        private Duration maxDelay = Duration.ofSeconds(60);
        private DelayStrategy strategy = DelayStrategy.EXPONENTIAL;
        private List<Duration> delaySequence = List.of();

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder strategy(DelayStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder delaySequence(List<Duration> delaySequence) {
            this.delaySequence = delaySequence;
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(maxRetries, baseDelay, maxDelay, strategy, delaySequence);
        }
    }
}
