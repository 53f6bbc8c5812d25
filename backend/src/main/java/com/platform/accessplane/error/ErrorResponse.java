package com.platform.accessplane.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Standardized error response model.
 * All API errors return this structure for consistency.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Unique error code (e.g., AP-300).
     */
    private String code;
    
    /**
     * Human-readable error message.
     */
    private String message;
    
    /**
     * Additional detail (optional).
     */
    private String detail;
    
    /**
     * Whether this error is fatal (requires intervention) or recoverable.
     */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    /**
     * Request path that caused the error.
     */
    private String path;
    
    /**
     * Correlation id for log lookup.
     */
    private String traceId;
}
