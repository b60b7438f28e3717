package com.genflow.core.model;

/**
 * One unit of work in a workflow's fixed step sequence.
 *
 * @param stepId      opaque identifier, unique within the workflow
 * @param ordinal     zero-based position in the sequence
 * @param displayName human-readable name, used in logs only
 */
public record WorkflowStep(String stepId, int ordinal, String displayName) {

    public WorkflowStep {
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("stepId must not be blank");
        }
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be >= 0");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = stepId;
        }
    }

    public static WorkflowStep of(String stepId, int ordinal) {
        return new WorkflowStep(stepId, ordinal, stepId);
    }
}
