package com.platform.provisioner.core;

import com.platform.provisioner.config.RetryProperties;
import com.platform.provisioner.error.RemoteServiceException;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Decides whether a failed Management API call is worth another attempt.
 * 
 * Only remote rejections whose first sub-error carries one of the configured reasons qualify.
 * Local errors, transport failures and rejections without sub-errors never do.
 */
@Component
public class TransientErrorClassifier {
    
    private final Set<String> transientReasons;
    
    public TransientErrorClassifier(RetryProperties properties) {
        this.transientReasons = Set.copyOf(properties.getTransientReasons());
    }
    
    public boolean isTransient(Throwable throwable) {
        Throwable error = unwrap(throwable);
        if (!(error instanceof RemoteServiceException remote)) {
            return false;
        }
        String reason = remote.getFirstReason();
        return reason != null && transientReasons.contains(reason);
    }
    
    static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
