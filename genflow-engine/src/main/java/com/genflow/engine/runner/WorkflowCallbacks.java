package com.genflow.engine.runner;

import com.genflow.core.model.StepOutput;
import com.genflow.core.model.WorkflowProgress;

import java.nio.file.Path;

/**
 * Caller hooks invoked by the runner. All methods default to no-ops.
 * A hook that throws is logged and does not affect the run.
 */
public interface WorkflowCallbacks {
    
    WorkflowCallbacks NONE = new WorkflowCallbacks() { };
    
    default void onStepStart(String stepId) {
    }
    
    default void onStepComplete(String stepId, StepOutput output) {
    }
    
    default void onStepSkip(String stepId) {
    }
    
    default void onManualStepDetected(String stepId, Path file) {
    }
    
    default void onStepFailed(String stepId, Throwable error) {
    }
    
    default void onProgress(WorkflowProgress progress) {
    }
}
