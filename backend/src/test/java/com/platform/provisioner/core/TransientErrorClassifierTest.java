package com.platform.provisioner.core;

import com.platform.provisioner.config.RetryProperties;
import com.platform.provisioner.error.RemoteServiceException;
import com.platform.provisioner.error.RemoteServiceException.ErrorDetail;
import com.platform.provisioner.error.ResourceNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class TransientErrorClassifierTest {
    
    private final TransientErrorClassifier classifier = new TransientErrorClassifier(new RetryProperties());
    
    private static RemoteServiceException rejection(String... reasons) {
        List<ErrorDetail> errors = Arrays.stream(reasons)
            .map(reason -> new ErrorDetail("usageLimits", reason, reason))
            .toList();
        return new RemoteServiceException(403, "Forbidden", "rejected", "usageLimits", errors);
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"rateLimitExceeded", "quotaExceeded", "userRateLimitExceeded", "backendError"})
    void known_reasons_are_transient(String reason) {
        assertThat(classifier.isTransient(rejection(reason))).isTrue();
    }
    
    @Test
    void only_the_first_sub_error_counts() {
        assertThat(classifier.isTransient(rejection("insufficientPermissions", "rateLimitExceeded"))).isFalse();
        assertThat(classifier.isTransient(rejection("quotaExceeded", "insufficientPermissions"))).isTrue();
    }
    
    @Test
    void rejection_without_sub_errors_is_permanent() {
        assertThat(classifier.isTransient(rejection())).isFalse();
    }
    
    @Test
    void other_errors_are_permanent() {
        assertThat(classifier.isTransient(new ResourceNotFoundException("WebProperty", "name=Shop"))).isFalse();
        assertThat(classifier.isTransient(new IllegalStateException("boom"))).isFalse();
    }
    
    @Test
    void wrapped_rejections_are_unwrapped() {
        RemoteServiceException rateLimited = rejection("rateLimitExceeded");
        
        assertThat(classifier.isTransient(new CompletionException(rateLimited))).isTrue();
        assertThat(classifier.isTransient(new ExecutionException(new CompletionException(rateLimited)))).isTrue();
    }
}
