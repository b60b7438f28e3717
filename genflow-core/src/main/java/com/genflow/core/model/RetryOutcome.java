package com.genflow.core.model;

import java.time.Duration;

/**
 * Result of running an operation under a retry policy.
 *
 * @param attempts initial try plus retries
 */
public record RetryOutcome<T>(
    boolean success,
    T result,
    Throwable error,
    int attempts,
    Duration totalElapsed
) {
    public static <T> RetryOutcome<T> succeeded(T result, int attempts, Duration elapsed) {
        return new RetryOutcome<>(true, result, null, attempts, elapsed);
    }

    public static <T> RetryOutcome<T> failed(Throwable error, int attempts, Duration elapsed) {
        return new RetryOutcome<>(false, null, error, attempts, elapsed);
    }
}
