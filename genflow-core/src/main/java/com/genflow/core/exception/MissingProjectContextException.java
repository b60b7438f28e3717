package com.genflow.core.exception;

/**
 * Thrown when a run is requested without the project context it needs.
 */
public class MissingProjectContextException extends GenflowException {
    
    public static final String ERROR_CODE = "MISSING_PROJECT_CONTEXT";
    
    private final String field;
    
    public MissingProjectContextException(String field) {
        super(ERROR_CODE, String.format(
            "Missing required project context: %s", field
        ));
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
