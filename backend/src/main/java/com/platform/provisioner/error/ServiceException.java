package com.platform.provisioner.error;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Wraps any failure at the service boundary.
 * 
 * A ServiceException keeps the status and internal code of the provisioner error it wraps,
 * and wrapping another ServiceException extends its chain of call-site markers.
 */
public class ServiceException extends ProvisionerException {
    
    public static final int DEFAULT_STATUS = 500;
    
    private final List<String> stacks;
    
    public ServiceException(int statusCode, String message) {
        super(ErrorCode.INTERNAL_ERROR, statusCode, message);
        this.stacks = List.of();
    }
    
    public ServiceException(int statusCode, Throwable cause) {
        super(errorCodeOf(cause), statusOf(cause, statusCode), internalCodeOf(cause), cause.getMessage(), cause);
        List<String> chain = new ArrayList<>();
        if (cause instanceof ServiceException previous) {
            chain.addAll(previous.getStacks());
        }
        chain.add("- " + getFailFunction());
        this.stacks = List.copyOf(chain);
    }
    
    public static ServiceException wrap(Throwable cause) {
        return new ServiceException(DEFAULT_STATUS, cause);
    }
    
    public List<String> getStacks() {
        return stacks;
    }
    
    @Override
    public ErrorResponse toRecord() {
        ErrorResponse record = super.toRecord();
        record.setCauses(stacks);
        return record;
    }
    
    /**
     * Verbose multi-line rendering including the full causal chain.
     */
    public String toDebug() {
        StringBuilder debug = new StringBuilder()
            .append(DateTimeFormatter.ISO_INSTANT.format(getTimestamp())).append('\n')
            .append(String.format("[%d]{%s} %s", getStatusCode(), getInternalCode(), getMessage())).append('\n')
            .append("- ").append(getFailFunction());
        for (String marker : stacks) {
            debug.append('\n').append(marker);
        }
        return debug.toString();
    }
    
    private static ErrorCode errorCodeOf(Throwable cause) {
        return cause instanceof ProvisionerException p ? p.getErrorCode() : ErrorCode.UNEXPECTED_ERROR;
    }
    
    private static int statusOf(Throwable cause, int fallback) {
        return cause instanceof ProvisionerException p ? p.getStatusCode() : fallback;
    }
    
    private static String internalCodeOf(Throwable cause) {
        return cause instanceof ProvisionerException p ? p.getInternalCode() : null;
    }
}
