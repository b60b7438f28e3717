package com.genflow.core.model;

/**
 * Lifecycle notifications emitted by the workflow state machine.
 */
public enum WorkflowEventType {
    STEP_STARTED,
    STEP_COMPLETED,
    STEP_SKIPPED,
    STEP_RESET,
    MODE_CHANGED,
    WORKFLOW_STARTED,
    WORKFLOW_COMPLETED
}
