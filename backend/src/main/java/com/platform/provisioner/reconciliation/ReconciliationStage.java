package com.platform.provisioner.reconciliation;

import com.platform.provisioner.model.Description;
import com.platform.provisioner.remote.Session;

import java.util.concurrent.CompletableFuture;

/**
 * One ordered phase of reconciliation. A stage receives the snapshot left by the previous stage
 * and completes with the snapshot it hands on.
 */
public interface ReconciliationStage {
    
    String name();
    
    CompletableFuture<Description> apply(Session session, Description description);
}
