package com.genflow.core.exception;

/**
 * Thrown when a workflow definition fails validation.
 */
public class WorkflowValidationException extends GenflowException {
    
    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";
    
    public WorkflowValidationException(String field, String message) {
        super(ERROR_CODE, String.format(
            "Invalid workflow definition (%s): %s", field, message
        ));
    }
}
