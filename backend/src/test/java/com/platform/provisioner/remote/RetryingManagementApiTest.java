package com.platform.provisioner.remote;

import com.platform.provisioner.config.RetryProperties;
import com.platform.provisioner.core.RetryEngine;
import com.platform.provisioner.core.TransientErrorClassifier;
import com.platform.provisioner.error.RemoteServiceException;
import com.platform.provisioner.model.WebProperty;
import com.platform.provisioner.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetryingManagementApiTest {
    
    private final List<Long> delays = new ArrayList<>();
    private final InMemoryManagementApi remote = new InMemoryManagementApi();
    private final ResourcePath account = ResourcePath.account(Session.bearer("token"), "317979");
    private ManagementApi api;
    
    @BeforeEach
    void setUp() {
        ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);
        when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(invocation -> {
            delays.add(invocation.<Long>getArgument(1));
            invocation.<Runnable>getArgument(0).run();
            return mock(ScheduledFuture.class);
        });
        RetryProperties properties = new RetryProperties();
        RetryEngine retryEngine = new RetryEngine(properties, new TransientErrorClassifier(properties),
            new MetricsRegistry(new SimpleMeterRegistry()), scheduler);
        api = new RetryingManagementApi(remote, retryEngine);
    }
    
    @Test
    void rate_limited_list_succeeds_on_third_attempt() {
        // given
        remote.seedWebProperty(WebProperty.builder().id("UA-317979-1").name("Shop").build())
            .failNext("webproperties.list", InMemoryManagementApi.rejection(403, "rateLimitExceeded"))
            .failNext("webproperties.list", InMemoryManagementApi.rejection(403, "rateLimitExceeded"));
        
        // when
        RemoteResult<List<WebProperty>> result = api.listWebProperties(account).join();
        
        // then
        assertThat(result.value()).extracting(WebProperty::id).containsExactly("UA-317979-1");
        assertThat(result.path()).isEqualTo(account);
        assertThat(remote.count("webproperties.list")).isEqualTo(3);
        assertThat(delays).containsExactly(100L, 200L);
    }
    
    @Test
    void permanent_rejection_reaches_the_caller_after_one_call() {
        // given
        RemoteServiceException denied = InMemoryManagementApi.rejection(403, "insufficientPermissions");
        remote.failNext("webproperties.insert", denied);
        
        // when
        CompletableFuture<RemoteResult<WebProperty>> result =
            api.insertWebProperty(account, WebProperty.builder().name("Shop").build());
        
        // then
        assertThatThrownBy(result::join).hasCauseReference(denied);
        assertThat(remote.calls()).containsExactly("webproperties.insert");
        assertThat(remote.webProperties()).isEmpty();
        assertThat(delays).isEmpty();
    }
    
    @Test
    void every_operation_is_retried_under_its_own_name() {
        // given
        remote.failNext("accounts.list", InMemoryManagementApi.rejection(500, "backendError"));
        
        // when
        api.listAccounts(ResourcePath.root(Session.bearer("token"))).join();
        
        // then
        assertThat(remote.calls()).containsExactly("accounts.list", "accounts.list");
        assertThat(delays).containsExactly(100L);
    }
}
