package com.platform.provisioner.config;

import com.platform.provisioner.core.RetryEngine;
import com.platform.provisioner.model.ResourcePayloads;
import com.platform.provisioner.remote.HttpManagementApi;
import com.platform.provisioner.remote.ManagementApi;
import com.platform.provisioner.remote.RetryingManagementApi;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the Management API client: JDK HTTP transport wrapped by the retry engine.
 */
@Slf4j
@Configuration
public class ManagementApiConfig {
    
    /**
     * Schedules backoff delays between attempts.
     */
    @Bean(name = "retryScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService retryScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "retry-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
    
    @Bean
    public HttpClient managementHttpClient(ApiProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .build();
    }
    
    @Bean
    public ManagementApi managementApi(
            ApiProperties properties,
            HttpClient managementHttpClient,
            ResourcePayloads payloads,
            RetryEngine retryEngine) {
        log.info("Management API client targeting {}", properties.getBaseUrl());
        return new RetryingManagementApi(
            new HttpManagementApi(properties, managementHttpClient, payloads),
            retryEngine);
    }
}
