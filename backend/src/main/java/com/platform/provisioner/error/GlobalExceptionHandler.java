package com.platform.provisioner.error;

import com.platform.provisioner.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 * 
 * Converts exceptions to standardized ErrorResponse and records an error metric per code.
 * 
 * RULES:
 * - Never swallow exceptions (always log)
 * - Never return HTTP 200 on failure
 * - Always include error code for client action
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final MetricsRegistry metricsRegistry;
    
    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }
    
    // ==================== Provisioner Exceptions ====================
    
    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<ErrorResponse> handleServiceException(
            ServiceException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Request failed: {}", traceId, ex.toString());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ex.toRecord();
        if (ex.getCause() instanceof RemoteServiceException remote) {
            response.setErrors(remote.getErrors());
        }
        return respond(response, request, traceId);
    }
    
    @ExceptionHandler(RemoteServiceException.class)
    public ResponseEntity<ErrorResponse> handleRemoteService(
            RemoteServiceException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Management API rejected request: {}", traceId, ex.toString());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ex.toRecord();
        response.setErrors(ex.getErrors());
        return respond(response, request, traceId);
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Resource not found: {} ({})", 
            traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = ex.toRecord();
        response.setMetadata(Map.of(
            "resourceType", ex.getResourceType(),
            "resourceId", ex.getResourceId()
        ));
        return respond(response, request, traceId);
    }
    
    @ExceptionHandler(ProvisionerException.class)
    public ResponseEntity<ErrorResponse> handleProvisionerException(
            ProvisionerException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] {}", traceId, ex.toString());
        recordMetric(ex.getErrorCode());
        
        return respond(ex.toRecord(), request, traceId);
    }
    
    // ==================== Spring MVC ====================
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Malformed request body: {}", traceId, ex.getMostSpecificCause().getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.INVALID_REQUEST,
            "Malformed request body", HttpStatus.BAD_REQUEST.value(), request.getRequestURI(), traceId);
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(
            MissingRequestHeaderException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Missing header: {}", traceId, ex.getHeaderName());
        recordMetric(ErrorCode.UNAUTHORIZED);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.UNAUTHORIZED,
            ex.getHeaderName() + " header is required", HttpStatus.UNAUTHORIZED.value(),
            request.getRequestURI(), traceId);
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(response);
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.UNEXPECTED_ERROR);
        
        ErrorResponse response = ErrorResponse.of(ErrorCode.UNEXPECTED_ERROR,
            ErrorCode.UNEXPECTED_ERROR.getDefaultMessage(), HttpStatus.INTERNAL_SERVER_ERROR.value(),
            request.getRequestURI(), traceId);
        return ResponseEntity.internalServerError().body(response);
    }
    
    // ==================== Helpers ====================
    
    private ResponseEntity<ErrorResponse> respond(ErrorResponse response, HttpServletRequest request, String traceId) {
        response.setPath(request.getRequestURI());
        response.setTraceId(traceId);
        HttpStatus status = HttpStatus.resolve(response.getStatus());
        return ResponseEntity.status(status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("correlationId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId;
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metricsRegistry.recordError(errorCode.getCode(), errorCode.getCategory().name());
    }
}
