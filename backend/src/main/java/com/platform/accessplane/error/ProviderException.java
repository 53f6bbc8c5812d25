package com.platform.accessplane.error;

/**
 * Exception for external system errors (Confluent Cloud, secret store).
 */
public class ProviderException extends AccessPlaneException {
    
    private final String systemName;
    private final int statusCode;
    
    public ProviderException(ErrorCode errorCode, String systemName, int statusCode, String message) {
        super(errorCode, message);
        this.systemName = systemName;
        this.statusCode = statusCode;
    }
    
    public ProviderException(ErrorCode errorCode, String systemName, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.systemName = systemName;
        this.statusCode = -1;
    }
    
    public static ProviderException ccloud(int statusCode, String body) {
        return new ProviderException(
            ErrorCode.CCLOUD_ERROR,
            "ccloud",
            statusCode,
            String.format("Confluent Cloud returned HTTP %d: %s", statusCode, body)
        );
    }
    
    public static ProviderException ccloudUnavailable(String message, Throwable cause) {
        return new ProviderException(
            ErrorCode.CCLOUD_UNAVAILABLE,
            "ccloud",
            "Could not connect to Confluent Cloud. Please check your settings. " + message,
            cause
        );
    }
    
    public String getSystemName() {
        return systemName;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    /**
     * Whether the failed call is worth repeating (throttling or server-side failure).
     */
    public boolean isRetryable() {
        return getErrorCode() == ErrorCode.CCLOUD_UNAVAILABLE || statusCode == 429 || statusCode >= 500;
    }
}
