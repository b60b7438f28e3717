package com.genflow.core.model;

/**
 * How the retry delay grows with the attempt number.
 */
public enum DelayStrategy {
    /** Always the base delay. */
    FIXED,
    /** base * attempt. */
    LINEAR,
    /** base * 2^(attempt - 1). */
    EXPONENTIAL
}
