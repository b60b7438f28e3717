package com.genflow.engine.retry;

/**
 * A fallible operation run under a {@link RetryPolicy}.
 */
@FunctionalInterface
public interface RetryableOperation<T> {
    
    /**
     * @param attempt 1-based attempt number
     */
    T execute(int attempt) throws Exception;
}
