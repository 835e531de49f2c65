package com.platform.provisioner.core;

import com.platform.provisioner.config.RetryProperties;
import com.platform.provisioner.observability.MetricsRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Retry engine with exponential backoff for asynchronous Management API calls.
 * 
 * Delays start at the configured initial delay and grow by the multiplier on every retry
 * (100, 200, 400 ms by default). Retries are scheduled, never slept. Once the retry budget
 * is spent, or the error is not transient, the last error propagates as it was raised.
 */
@Slf4j
@Component
public class RetryEngine {
    
    private final RetryRegistry retryRegistry;
    private final ScheduledExecutorService scheduler;
    private final MetricsRegistry metricsRegistry;
    
    public RetryEngine(
            RetryProperties properties,
            TransientErrorClassifier classifier,
            MetricsRegistry metricsRegistry,
            @Qualifier("retryScheduler") ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
        this.metricsRegistry = metricsRegistry;
        
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(properties.getMaxRetries() + 1)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                Duration.ofMillis(properties.getInitialDelayMs()), properties.getMultiplier()))
            .retryOnException(classifier::isTransient)
            .build();
        
        this.retryRegistry = RetryRegistry.of(config);
        this.retryRegistry.getEventPublisher()
            .onEntryAdded(event -> registerEventListeners(event.getAddedEntry()));
        
        log.info("RetryEngine initialized (maxRetries={}, initialDelay={}ms, multiplier={})",
            properties.getMaxRetries(), properties.getInitialDelayMs(), properties.getMultiplier());
    }
    
    /**
     * Execute an asynchronous operation with retry logic.
     * The supplier is invoked again for every attempt.
     */
    public <T> CompletableFuture<T> executeWithRetry(String operationName, Supplier<? extends CompletionStage<T>> operation) {
        Retry retry = retryRegistry.retry(operationName);
        Supplier<CompletionStage<T>> attempt = operation::get;
        return Retry.decorateCompletionStage(retry, scheduler, attempt).get().toCompletableFuture();
    }
    
    /**
     * Wrap an asynchronous operation so that every call of the result retries with the same argument.
     */
    public <A, T> Function<A, CompletableFuture<T>> decorate(String operationName,
                                                             Function<A, ? extends CompletionStage<T>> operation) {
        return argument -> executeWithRetry(operationName, () -> operation.apply(argument));
    }
    
    private void registerEventListeners(Retry retry) {
        String operation = retry.getName();
        retry.getEventPublisher()
            .onRetry(event -> {
                log.warn("{} failed (retry {}), retrying in {}ms: {}",
                    operation, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-");
                metricsRegistry.recordRetryAttempt(operation, event.getNumberOfRetryAttempts());
            })
            .onError(event -> {
                log.error("{} failed after {} attempts", operation, event.getNumberOfRetryAttempts());
                metricsRegistry.recordRetryExhausted(operation);
            })
            .onIgnoredError(event -> log.debug("{} failed with non-transient error: {}",
                operation, event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"))
            .onSuccess(event -> log.info("{} succeeded after {} retries",
                operation, event.getNumberOfRetryAttempts()));
    }
}
