package com.genflow.engine.statemachine;

import com.genflow.core.model.WorkflowEvent;

/**
 * Observer of state machine transitions.
 * A listener that throws is logged and skipped; the transition still happens.
 */
@FunctionalInterface
public interface WorkflowEventListener {
    
    void onEvent(WorkflowEvent event);
}
