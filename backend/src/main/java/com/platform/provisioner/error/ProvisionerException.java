package com.platform.provisioner.error;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Base exception for all provisioner exceptions.
 * Carries an ErrorCode, a numeric status and the internal code derived from both.
 */
public abstract class ProvisionerException extends RuntimeException {
    
    private final ErrorCode errorCode;
    private final int statusCode;
    private final String internalCode;
    private final Instant timestamp;
    
    protected ProvisionerException(ErrorCode errorCode, int statusCode, String message) {
        this(errorCode, statusCode, null, message, null);
    }
    
    protected ProvisionerException(ErrorCode errorCode, int statusCode, String message, Throwable cause) {
        this(errorCode, statusCode, null, message, cause);
    }
    
    /**
     * @param internalCode inherited internal code, or null to derive one from status and error code
     */
    protected ProvisionerException(ErrorCode errorCode, int statusCode, String internalCode,
            String message, Throwable cause) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
        this.internalCode = internalCode != null ? internalCode : statusCode + "-" + errorCode.getCode();
        this.timestamp = Instant.now();
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    public String getInternalCode() {
        return internalCode;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
    
    /**
     * The first frame outside the constructors and factories of this exception's own class hierarchy,
     * rendered as {@code at Class.method(File:line)}.
     */
    public String getFailFunction() {
        Set<String> ownClasses = new HashSet<>();
        for (Class<?> type = getClass(); type != Throwable.class; type = type.getSuperclass()) {
            ownClasses.add(type.getName());
        }
        return Arrays.stream(getStackTrace())
            .filter(frame -> !ownClasses.contains(frame.getClassName()))
            .findFirst()
            .map(frame -> "at " + frame)
            .orElse("at <unknown>");
    }
    
    /**
     * Structured rendering for logs and API responses.
     */
    public ErrorResponse toRecord() {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .internalCode(internalCode)
            .message(getMessage())
            .fatal(isFatal())
            .status(statusCode)
            .timestamp(timestamp)
            .failFunction(getFailFunction())
            .build();
    }
    
    /**
     * Compact single-line rendering.
     */
    @Override
    public String toString() {
        return String.format("[%d]{%s} %s: %s", statusCode, internalCode, getMessage(), getFailFunction());
    }
}
