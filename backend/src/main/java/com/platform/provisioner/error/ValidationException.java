package com.platform.provisioner.error;

/**
 * Exception for local precondition violations. Never retried.
 */
public class ValidationException extends ProvisionerException {
    
    public static final int PRECONDITION_FAILED = 412;
    
    private final String field;
    
    public ValidationException(String message) {
        this(PRECONDITION_FAILED, message);
    }
    
    public ValidationException(int statusCode, String message) {
        super(ErrorCode.VALIDATION_ERROR, statusCode, message);
        this.field = null;
    }
    
    public ValidationException(ErrorCode errorCode, int statusCode, String message) {
        super(errorCode, statusCode, message);
        this.field = null;
    }
    
    /**
     * A required field is absent from the input.
     */
    public static ValidationException missingField(String field) {
        return new ValidationException(field, String.format("%s should be defined", field));
    }
    
    private ValidationException(String field, String message) {
        super(ErrorCode.MISSING_REQUIRED_FIELD, PRECONDITION_FAILED, message);
        this.field = field;
    }
    
    public String getField() {
        return field;
    }
}
