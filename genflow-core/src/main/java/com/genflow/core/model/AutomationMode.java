package com.genflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-step execution policy.
 */
public enum AutomationMode {
    /** Run the step through the generation backend. */
    AUTO,
    /** Prefer a user-authored output; fall back to generation when none exists. */
    MANUAL,
    /** Do not run the step. */
    SKIP;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AutomationMode fromWireValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
