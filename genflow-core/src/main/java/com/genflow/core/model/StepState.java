package com.genflow.core.model;

import java.time.Instant;

/**
 * Snapshot of one step's lifecycle state.
 * Owned by the workflow state machine; callers only ever see copies.
 */
public record StepState(
    String stepId,
    StepStatus status,
    AutomationMode automationMode,
    Instant startedAt,
    Instant completedAt
) {
    public static StepState pending(String stepId, AutomationMode mode) {
        return new StepState(stepId, StepStatus.PENDING, mode, null, null);
    }

    public StepState withStarted(Instant at) {
        return new StepState(stepId, StepStatus.IN_PROGRESS, automationMode, at, null);
    }

    public StepState withCompleted(Instant at) {
        return new StepState(stepId, StepStatus.COMPLETED, automationMode, startedAt, at);
    }

    public StepState withSkipped(Instant at) {
        return new StepState(stepId, StepStatus.SKIPPED, automationMode, startedAt, at);
    }

    /**
     * Back to PENDING with both timestamps cleared.
     */
    public StepState withReset() {
        return new StepState(stepId, StepStatus.PENDING, automationMode, null, null);
    }

    public StepState withAutomationMode(AutomationMode mode) {
        return new StepState(stepId, status, mode, startedAt, completedAt);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
