package com.platform.provisioner.core;

import com.platform.provisioner.config.RetryProperties;
import com.platform.provisioner.error.RemoteServiceException;
import com.platform.provisioner.error.ValidationException;
import com.platform.provisioner.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetryEngineTest {
    
    private final List<Long> delays = new ArrayList<>();
    private MetricsRegistry metrics;
    private RetryEngine retryEngine;
    
    @BeforeEach
    void setUp() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(invocation -> {
            Runnable task = invocation.getArgument(0);
            TimeUnit unit = invocation.getArgument(2);
            delays.add(unit.toMillis(invocation.getArgument(1)));
            task.run();
            return mock(ScheduledFuture.class);
        });
        
        RetryProperties properties = new RetryProperties();
        metrics = new MetricsRegistry(new SimpleMeterRegistry());
        retryEngine = new RetryEngine(properties, new TransientErrorClassifier(properties), metrics, scheduler);
    }
    
    private static RemoteServiceException rejection(int status, String reason) {
        return new RemoteServiceException(status, "Forbidden", "Quota hit", "usageLimits",
            List.of(new RemoteServiceException.ErrorDetail("usageLimits", reason, "Quota hit")));
    }
    
    @Test
    void success_on_first_attempt_schedules_nothing() {
        // given
        AtomicInteger attempts = new AtomicInteger();
        
        // when
        String result = retryEngine.executeWithRetry("accounts.list", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture("ok");
        }).join();
        
        // then
        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(1);
        assertThat(delays).isEmpty();
    }
    
    @Test
    void transient_failures_back_off_exponentially() {
        // given
        AtomicInteger attempts = new AtomicInteger();
        RemoteServiceException rateLimited = rejection(403, "rateLimitExceeded");
        
        // when
        String result = retryEngine.executeWithRetry("webproperties.list", () -> attempts.incrementAndGet() <= 3
            ? CompletableFuture.<String>failedFuture(rateLimited)
            : CompletableFuture.completedFuture("ok")).join();
        
        // then
        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(4);
        assertThat(delays).containsExactly(100L, 200L, 400L);
    }
    
    @Test
    void gives_up_after_ten_retries_with_the_last_error() {
        // given
        AtomicInteger attempts = new AtomicInteger();
        RemoteServiceException backendError = rejection(500, "backendError");
        
        // when
        CompletableFuture<String> result = retryEngine.executeWithRetry("profiles.insert", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(backendError);
        });
        
        // then
        assertThatThrownBy(result::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseReference(backendError);
        assertThat(attempts).hasValue(11);
        assertThat(delays).containsExactly(100L, 200L, 400L, 800L, 1600L, 3200L, 6400L, 12800L, 25600L, 51200L);
        assertThat(metrics.getCount("provisioner.retry.attempt", "operation", "profiles.insert")).isEqualTo(10);
        assertThat(metrics.getCount("provisioner.retry.exhausted", "operation", "profiles.insert")).isEqualTo(1);
    }
    
    @Test
    void non_transient_reason_is_not_retried() {
        // given
        AtomicInteger attempts = new AtomicInteger();
        RemoteServiceException forbidden = rejection(403, "insufficientPermissions");
        
        // when
        CompletableFuture<String> result = retryEngine.executeWithRetry("webproperties.insert", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(forbidden);
        });
        
        // then
        assertThatThrownBy(result::join).hasCauseReference(forbidden);
        assertThat(attempts).hasValue(1);
        assertThat(delays).isEmpty();
    }
    
    @Test
    void rejection_without_sub_errors_is_not_retried() {
        // given
        AtomicInteger attempts = new AtomicInteger();
        RemoteServiceException unreachable = RemoteServiceException.unreachable(new ConnectException("refused"));
        
        // when
        CompletableFuture<String> result = retryEngine.executeWithRetry("accounts.list", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(unreachable);
        });
        
        // then
        assertThatThrownBy(result::join).hasCauseReference(unreachable);
        assertThat(attempts).hasValue(1);
    }
    
    @Test
    void local_errors_are_not_retried() {
        // given
        AtomicInteger attempts = new AtomicInteger();
        ValidationException invalid = ValidationException.missingField("accountId");
        
        // when
        CompletableFuture<String> result = retryEngine.executeWithRetry("goals.patch", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(invalid);
        });
        
        // then
        assertThatThrownBy(result::join).hasCauseReference(invalid);
        assertThat(attempts).hasValue(1);
    }
    
    @Test
    void decorated_function_retries_with_the_same_argument() {
        // given
        List<String> seen = new ArrayList<>();
        RemoteServiceException quota = rejection(403, "userRateLimitExceeded");
        Function<String, CompletableFuture<Integer>> length = retryEngine.decorate("customMetrics.get", id -> {
            seen.add(id);
            return seen.size() < 2
                ? CompletableFuture.<Integer>failedFuture(quota)
                : CompletableFuture.completedFuture(id.length());
        });
        
        // when
        Integer result = length.apply("ga:metric1").join();
        
        // then
        assertThat(result).isEqualTo(10);
        assertThat(seen).containsExactly("ga:metric1", "ga:metric1");
        assertThat(delays).containsExactly(100L);
    }
}
