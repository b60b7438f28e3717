package com.genflow.core.model;

import java.time.Instant;

/**
 * Immutable record of a state machine transition.
 *
 * @param stepId        null for workflow-level events and global mode changes
 * @param previousValue set for MODE_CHANGED only
 * @param newValue      set for MODE_CHANGED only
 */
public record WorkflowEvent(
    WorkflowEventType type,
    String stepId,
    String previousValue,
    String newValue,
    Instant timestamp
) {
    public static WorkflowEvent of(WorkflowEventType type, Instant timestamp) {
        return new WorkflowEvent(type, null, null, null, timestamp);
    }

    public static WorkflowEvent forStep(WorkflowEventType type, String stepId, Instant timestamp) {
        return new WorkflowEvent(type, stepId, null, null, timestamp);
    }

    public static WorkflowEvent modeChanged(String stepId, AutomationMode from, AutomationMode to, Instant timestamp) {
        return new WorkflowEvent(WorkflowEventType.MODE_CHANGED, stepId,
            from.wireValue(), to.wireValue(), timestamp);
    }

    public boolean isWorkflowEvent() {
        return type.name().startsWith("WORKFLOW_");
    }
}
