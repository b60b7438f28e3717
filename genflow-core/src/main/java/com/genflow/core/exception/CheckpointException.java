package com.genflow.core.exception;

/**
 * Thrown when a checkpoint cannot be written or deleted.
 * Read failures are not errors: an unreadable checkpoint counts as absent.
 */
public class CheckpointException extends GenflowException {
    
    public static final String ERROR_CODE = "CHECKPOINT_IO";
    
    public CheckpointException(String stepId, String operation, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Failed to %s checkpoint for step %s", operation, stepId
        ), cause);
    }
    
    public CheckpointException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
