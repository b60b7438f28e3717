package com.genflow.core.exception;

/**
 * Base exception for all genflow engine errors.
 */
public class GenflowException extends RuntimeException {
    
    private final String errorCode;
    
    public GenflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public GenflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
