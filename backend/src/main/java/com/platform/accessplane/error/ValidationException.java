package com.platform.accessplane.error;

/**
 * Exception for configuration and declaration validation errors.
 * Always fatal: raised before reconciliation begins.
 */
public class ValidationException extends AccessPlaneException {
    
    private final String field;
    
    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
    }
    
    public ValidationException(ErrorCode errorCode, String field, String message) {
        super(errorCode, message);
        this.field = field;
    }
    
    public ValidationException(ErrorCode errorCode, String field, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.field = field;
    }
    
    public static ValidationException missing(String field) {
        return new ValidationException(
            ErrorCode.MISSING_REQUIRED_FIELD,
            field,
            field + " is a mandatory attribute. Please populate to ensure correct functionality."
        );
    }
    
    public static ValidationException incompletePair(String first, String second) {
        return new ValidationException(
            ErrorCode.INCOMPLETE_FIELD_PAIR,
            first,
            String.format("Both %s & %s must be present in the configuration.", first, second)
        );
    }
    
    public String getField() {
        return field;
    }
}
