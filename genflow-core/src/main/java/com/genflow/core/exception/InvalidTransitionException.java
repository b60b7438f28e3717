package com.genflow.core.exception;

import com.genflow.core.model.StepStatus;

/**
 * Thrown when a step transition is not allowed from the step's current status.
 */
public class InvalidTransitionException extends GenflowException {
    
    public static final String ERROR_CODE = "INVALID_TRANSITION";
    
    private final String stepId;
    private final StepStatus currentStatus;
    
    public InvalidTransitionException(String stepId, StepStatus currentStatus, String trigger) {
        super(ERROR_CODE, String.format(
            "Cannot %s step %s: step is %s",
            trigger, stepId, currentStatus.wireValue()
        ));
        this.stepId = stepId;
        this.currentStatus = currentStatus;
    }
    
    public InvalidTransitionException(String message) {
        super(ERROR_CODE, message);
        this.stepId = null;
        this.currentStatus = null;
    }
    
    public String getStepId() {
        return stepId;
    }
    
    public StepStatus getCurrentStatus() {
        return currentStatus;
    }
}
