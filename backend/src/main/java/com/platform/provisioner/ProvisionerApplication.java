package com.platform.provisioner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Analytics Provisioner Application
 * 
 * Converges a Google Analytics account toward a declarative description of:
 * - one web property
 * - its custom dimensions and custom metrics
 * - its views, with their goals
 * 
 * Features:
 * - Identity resolution by id or by an alternate unique key
 * - Create-or-patch only what differs
 * - Exponential backoff on rate-limit and backend errors
 */
@SpringBootApplication
public class ProvisionerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProvisionerApplication.class, args);
    }
}
