package com.genflow.core.exception;

/**
 * Thrown when a run or resume is requested while another workflow is active.
 */
public class WorkflowAlreadyRunningException extends GenflowException {
    
    public static final String ERROR_CODE = "WORKFLOW_ALREADY_RUNNING";
    
    public WorkflowAlreadyRunningException(String workflowName) {
        super(ERROR_CODE, String.format(
            "Workflow %s is already running", workflowName
        ));
    }
}
