package com.platform.provisioner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for retrying transient Management API errors.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "provisioner.retry")
public class RetryProperties {
    
    /**
     * Retries after the first attempt. 10 retries means at most 11 calls: the initial one plus
     * one per backoff delay (100 ms up to 51.2 s). The error of the 11th call is the one reported.
     */
    private int maxRetries = 10;
    
    /**
     * Delay before the first retry.
     */
    private long initialDelayMs = 100;
    
    private double multiplier = 2.0;
    
    /**
     * Reasons of the first sub-error that mark a rejection as transient.
     */
    private List<String> transientReasons = new ArrayList<>(List.of(
        "rateLimitExceeded",
        "quotaExceeded",
        "userRateLimitExceeded",
        "backendError"
    ));
}
