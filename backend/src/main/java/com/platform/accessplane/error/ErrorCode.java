package com.platform.accessplane.error;

/**
 * Standardized error codes for the access plane.
 * 
 * Format: AP-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Configuration and declaration errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: External system errors (Confluent Cloud, secret store)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("AP-100", "Validation error", ErrorCategory.FATAL),
    MISSING_REQUIRED_FIELD("AP-101", "Missing required field", ErrorCategory.FATAL),
    INCOMPLETE_FIELD_PAIR("AP-102", "Paired fields must both be present", ErrorCategory.FATAL),
    MISSING_ENVIRONMENT_VARIABLE("AP-103", "Environment variable not set", ErrorCategory.FATAL),
    INVALID_DEFINITIONS_FILE("AP-104", "Definitions file could not be read", ErrorCategory.FATAL),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("AP-300", "Resource not found", ErrorCategory.RECOVERABLE),
    SERVICE_ACCOUNT_NOT_FOUND("AP-301", "Service account not found", ErrorCategory.RECOVERABLE),
    CLUSTER_NOT_FOUND("AP-302", "Cluster not found", ErrorCategory.RECOVERABLE),
    API_KEY_SECRET_UNAVAILABLE("AP-303", "API key secret is no longer retrievable", ErrorCategory.RECOVERABLE),
    SECRET_NOT_FOUND("AP-304", "Secret not found", ErrorCategory.RECOVERABLE),
    RUN_NOT_FOUND("AP-305", "No reconciliation run recorded", ErrorCategory.RECOVERABLE),
    
    // ==================== External System Errors (4xx) ====================
    
    CCLOUD_ERROR("AP-400", "Confluent Cloud request failed", ErrorCategory.RECOVERABLE),
    CCLOUD_UNAVAILABLE("AP-401", "Confluent Cloud unavailable", ErrorCategory.RECOVERABLE),
    SECRET_STORE_ERROR("AP-410", "Secret store request failed", ErrorCategory.RECOVERABLE),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("AP-900", "Internal error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - the affected unit of work is skipped and the run continues.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the run is aborted before any change is made.
         */
        FATAL
    }
}
