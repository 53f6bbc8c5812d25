package com.platform.accessplane.error;

import com.platform.accessplane.observability.ReconciliationMetrics;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 * 
 * Converts exceptions to standardized ErrorResponse.
 * Logs all errors with appropriate severity.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final ReconciliationMetrics metrics;
    
    public GlobalExceptionHandler(ReconciliationMetrics metrics) {
        this.metrics = metrics;
    }
    
    @ExceptionHandler(AccessPlaneException.class)
    public ResponseEntity<ErrorResponse> handleAccessPlaneException(
            AccessPlaneException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
        metrics.recordError(errorCode);
        
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(ex.getMessage())
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build());
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Type mismatch: {} = {}", traceId, ex.getName(), ex.getValue());
        metrics.recordError(ErrorCode.VALIDATION_ERROR);
        
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
            .code(ErrorCode.VALIDATION_ERROR.getCode())
            .message(String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()))
            .fatal(false)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build());
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        metrics.recordError(ErrorCode.INTERNAL_ERROR);
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.builder()
            .code(ErrorCode.INTERNAL_ERROR.getCode())
            .message("An unexpected error occurred")
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .fatal(true)
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build());
    }
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("traceId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put("traceId", traceId);
        }
        return traceId;
    }
    
    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, SERVICE_ACCOUNT_NOT_FOUND, CLUSTER_NOT_FOUND, SECRET_NOT_FOUND, RUN_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case VALIDATION_ERROR, MISSING_REQUIRED_FIELD, INCOMPLETE_FIELD_PAIR, MISSING_ENVIRONMENT_VARIABLE,
                 INVALID_DEFINITIONS_FILE ->
                HttpStatus.BAD_REQUEST;
            case CCLOUD_ERROR, SECRET_STORE_ERROR, API_KEY_SECRET_UNAVAILABLE ->
                HttpStatus.BAD_GATEWAY;
            case CCLOUD_UNAVAILABLE ->
                HttpStatus.SERVICE_UNAVAILABLE;
            default ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
