package com.platform.provisioner.error;

import java.util.List;

/**
 * A rejection from the Management API, reduced to a uniform shape:
 * HTTP status, status text plus message, the vendor error type and the structured sub-errors.
 */
public class RemoteServiceException extends ProvisionerException {
    
    private final String statusText;
    private final String type;
    private final List<ErrorDetail> errors;
    
    public RemoteServiceException(int statusCode, String statusText, String message,
            String type, List<ErrorDetail> errors) {
        this(ErrorCode.REMOTE_SERVICE_ERROR, statusCode, statusText, message, type, errors, null);
    }
    
    public RemoteServiceException(ErrorCode errorCode, int statusCode, String statusText, String message,
            String type, List<ErrorDetail> errors, Throwable cause) {
        super(errorCode, statusCode, join(statusText, message), cause);
        this.statusText = statusText;
        this.type = type;
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }
    
    /**
     * The request never produced a response.
     */
    public static RemoteServiceException unreachable(Throwable cause) {
        return new RemoteServiceException(ErrorCode.REMOTE_UNAVAILABLE, 503, "Service Unavailable",
            cause.getMessage(), "transport", List.of(), cause);
    }
    
    /**
     * The response body could not be read.
     */
    public static RemoteServiceException unreadable(int statusCode, Throwable cause) {
        return new RemoteServiceException(ErrorCode.INVALID_REMOTE_RESPONSE, statusCode, "Bad Gateway",
            cause.getMessage(), "invalid_response", List.of(), cause);
    }
    
    public String getStatusText() {
        return statusText;
    }
    
    public String getType() {
        return type;
    }
    
    public List<ErrorDetail> getErrors() {
        return errors;
    }
    
    /**
     * Reason of the first sub-error, or null when the rejection carries none.
     */
    public String getFirstReason() {
        return errors.isEmpty() ? null : errors.get(0).reason();
    }
    
    private static String join(String statusText, String message) {
        String text = statusText != null ? statusText : "";
        String detail = message != null ? message : "";
        return (text + " " + detail).trim();
    }
    
    /**
     * One entry of the {@code error.errors} array.
     */
    public record ErrorDetail(String domain, String reason, String message) {}
}
