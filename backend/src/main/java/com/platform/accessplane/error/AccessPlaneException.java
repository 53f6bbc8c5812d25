package com.platform.accessplane.error;

/**
 * Base exception for all access plane exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class AccessPlaneException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected AccessPlaneException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected AccessPlaneException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
