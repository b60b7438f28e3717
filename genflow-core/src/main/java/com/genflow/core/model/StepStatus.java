package com.genflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states for a workflow step.
 */
public enum StepStatus {
    /**
     * Step has not started yet.
     * Transitions: -> IN_PROGRESS, SKIPPED
     */
    PENDING("pending"),

    /**
     * Step generation is running.
     * Transitions: -> COMPLETED, SKIPPED
     */
    IN_PROGRESS("in-progress"),

    /**
     * Step produced its artifact. Terminal unless rewound.
     * Transitions: -> PENDING (rewind)
     */
    COMPLETED("completed"),

    /**
     * Step was skipped. Terminal unless rewound.
     * Transitions: -> PENDING (rewind)
     */
    SKIPPED("skipped");

    private final String wireValue;

    StepStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static StepStatus fromWireValue(String value) {
        for (StepStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown step status: " + value);
    }

    /**
     * Check if this state is terminal (counts towards workflow completion).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED;
    }
}
