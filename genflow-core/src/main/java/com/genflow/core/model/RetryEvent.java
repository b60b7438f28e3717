package com.genflow.core.model;

import java.time.Duration;

/**
 * @param attempt     1-based attempt number the event refers to
 * @param maxAttempts total attempts the policy allows
 * @param delay       wait before the next attempt, RETRY only
 * @param error       failure cause, RETRY/FAILURE/EXHAUSTED only
 */
public record RetryEvent(
    RetryEventType type,
    int attempt,
    int maxAttempts,
    Duration delay,
    Throwable error
) {
    public static RetryEvent attempt(int attempt, int maxAttempts) {
        return new RetryEvent(RetryEventType.ATTEMPT, attempt, maxAttempts, null, null);
    }

    public static RetryEvent retry(int attempt, int maxAttempts, Duration delay, Throwable error) {
        return new RetryEvent(RetryEventType.RETRY, attempt, maxAttempts, delay, error);
    }

    public static RetryEvent success(int attempt, int maxAttempts) {
        return new RetryEvent(RetryEventType.SUCCESS, attempt, maxAttempts, null, null);
    }

    public static RetryEvent failure(int attempt, int maxAttempts, Throwable error) {
        return new RetryEvent(RetryEventType.FAILURE, attempt, maxAttempts, null, error);
    }

    public static RetryEvent exhausted(int attempt, int maxAttempts, Throwable error) {
        return new RetryEvent(RetryEventType.EXHAUSTED, attempt, maxAttempts, null, error);
    }
}
