package com.genflow.core.model;

/**
 * Notifications emitted while an operation runs under a retry policy.
 */
public enum RetryEventType {
    /** An attempt is about to run. */
    ATTEMPT,
    /** A retryable failure; the next attempt follows after the event's delay. */
    RETRY,
    /** The operation succeeded. */
    SUCCESS,
    /** A fatal failure; no retry. */
    FAILURE,
    /** Every attempt failed with a retryable error. */
    EXHAUSTED;

    public boolean isTerminal() {
        return switch (this) {
            case SUCCESS, FAILURE, EXHAUSTED -> true;
            case ATTEMPT, RETRY -> false;
        };
    }
}
