package com.platform.provisioner.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for provisioner metrics.
 * Records reconciliation actions, remote call retries, run latencies and API errors.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        
        log.info("Metrics registry initialized");
    }
    
    /**
     * Record the outcome of reconciling one resource, e.g. ("customMetric", "INSERT").
     */
    public void recordReconciliationAction(String kind, String action) {
        incrementCounter("provisioner.reconciliation.action", "kind", kind, "action", action);
    }
    
    /**
     * Record a full reconciliation run.
     */
    public void recordReconciliation(boolean success, long durationMs) {
        String outcome = success ? "success" : "failure";
        incrementCounter("provisioner.reconciliation.run", "outcome", outcome);
        timers.computeIfAbsent("reconciliation." + outcome, k ->
            Timer.builder("provisioner.reconciliation.latency")
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry))
            .record(Duration.ofMillis(durationMs));
    }
    
    /**
     * Record retry attempt.
     */
    public void recordRetryAttempt(String operation, int attemptNumber) {
        incrementCounter("provisioner.retry.attempt", "operation", operation);
        log.debug("Recorded retry attempt {} for {}", attemptNumber, operation);
    }
    
    /**
     * Record an operation that gave up after exhausting its retries.
     */
    public void recordRetryExhausted(String operation) {
        incrementCounter("provisioner.retry.exhausted", "operation", operation);
    }
    
    /**
     * Record an error rendered by the REST layer.
     */
    public void recordError(String code, String category) {
        incrementCounter("provisioner.errors", "code", code, "category", category);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
    
    /**
     * Current count of a tagged counter, 0 if never incremented.
     */
    public double getCount(String name, String... tags) {
        Counter counter = counters.get(name + String.join(".", tags));
        return counter != null ? counter.count() : 0;
    }
}
