package com.platform.provisioner.error;

/**
 * Standardized error codes for the provisioner.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: PV-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 2xx: Authentication errors
 * - 3xx: Resource errors (not found)
 * - 4xx: Remote Management API errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("PV-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("PV-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("PV-102", "Missing required field", ErrorCategory.RECOVERABLE),
    
    // ==================== Auth Errors (2xx) ====================
    
    UNAUTHORIZED("PV-200", "Authentication required", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("PV-300", "Resource not found", ErrorCategory.RECOVERABLE),
    
    // ==================== Remote Errors (4xx) ====================
    
    REMOTE_SERVICE_ERROR("PV-400", "Management API error", ErrorCategory.RECOVERABLE),
    REMOTE_UNAVAILABLE("PV-401", "Management API unreachable", ErrorCategory.RECOVERABLE),
    INVALID_REMOTE_RESPONSE("PV-402", "Unreadable Management API response", ErrorCategory.FATAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("PV-900", "Internal server error", ErrorCategory.FATAL),
    UNEXPECTED_ERROR("PV-901", "Unexpected error occurred", ErrorCategory.FATAL),
    SERIALIZATION_ERROR("PV-903", "Serialization error", ErrorCategory.RECOVERABLE);
    
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
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - something outside the request is broken.
         */
        FATAL
    }
}
