package com.platform.provisioner.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Standardized error response model.
 * All API errors return this structure, and {@link ProvisionerException#toRecord()} produces it for logs.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Unique error code (e.g., PV-300).
     */
    private String code;
    
    /**
     * Status-qualified code, e.g. {@code 429-PV-400}.
     */
    private String internalCode;
    
    /**
     * Human-readable error message.
     */
    private String message;
    
    private boolean fatal;
    
    /**
     * HTTP status code.
     */
    private int status;
    
    private Instant timestamp;
    
    /**
     * Call site that raised the error.
     */
    private String failFunction;
    
    /**
     * Call-site markers accumulated across service-boundary wrapping.
     */
    private List<String> causes;
    
    /**
     * Request path that caused the error.
     */
    private String path;
    
    /**
     * Trace ID for correlating with logs.
     */
    private String traceId;
    
    /**
     * Structured sub-errors reported by the Management API.
     */
    private List<RemoteServiceException.ErrorDetail> errors;
    
    /**
     * Additional error metadata.
     */
    private Map<String, Object> metadata;
    
    /**
     * Create from ErrorCode with custom message.
     */
    public static ErrorResponse of(ErrorCode errorCode, String message, int status, String path, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .internalCode(status + "-" + errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status)
            .timestamp(Instant.now())
            .path(path)
            .traceId(traceId)
            .build();
    }
}
