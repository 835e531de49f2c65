package com.platform.provisioner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the Management API transport.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "provisioner.api")
public class ApiProperties {
    
    /**
     * Base URL of the Management API, without trailing slash.
     */
    private String baseUrl = "https://www.googleapis.com/analytics/v3/management";
    
    /**
     * Connection timeout in milliseconds.
     */
    private int connectTimeoutMs = 5000;
    
    /**
     * Per-request timeout in milliseconds.
     */
    private int readTimeoutMs = 30000;
}
