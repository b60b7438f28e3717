package com.genflow.core.exception;

/**
 * Thrown when a step's generation failed after the retry policy gave up.
 */
public class StepExecutionException extends GenflowException {
    
    public static final String ERROR_CODE = "STEP_EXECUTION_FAILED";
    
    private final String stepId;
    private final int attempts;
    
    public StepExecutionException(String stepId, int attempts, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Step %s failed after %d attempt(s): %s",
            stepId, attempts, cause == null ? "unknown error" : cause.getMessage()
        ), cause);
        this.stepId = stepId;
        this.attempts = attempts;
    }
    
    public String getStepId() {
        return stepId;
    }
    
    public int getAttempts() {
        return attempts;
    }
}
