package com.platform.provisioner.reconciliation;

import com.platform.provisioner.error.ValidationException;
import com.platform.provisioner.model.Description;
import com.platform.provisioner.observability.MetricsRegistry;
import com.platform.provisioner.remote.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Reconciliation engine that converges the Management API toward a {@link Description}.
 * 
 * Stages run strictly one after another: web property, custom metrics, custom dimensions, views.
 * Each stage starts only once the previous one has completed, so later stages can rely on ids
 * resolved earlier. A failure stops the pipeline; changes already applied stay applied.
 */
@Slf4j
@Component
public class ReconciliationEngine {
    
    private final List<ReconciliationStage> stages;
    private final MetricsRegistry metricsRegistry;
    
    @Autowired
    public ReconciliationEngine(
            WebPropertyStage webPropertyStage,
            CustomMetricsStage customMetricsStage,
            CustomDimensionsStage customDimensionsStage,
            ViewsStage viewsStage,
            MetricsRegistry metricsRegistry) {
        this(List.of(webPropertyStage, customMetricsStage, customDimensionsStage, viewsStage), metricsRegistry);
    }
    
    ReconciliationEngine(List<ReconciliationStage> stages, MetricsRegistry metricsRegistry) {
        this.stages = List.copyOf(stages);
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * Reconcile the remote state of one account with its description.
     * 
     * @return the description with every remote id resolved during the run
     */
    public CompletableFuture<Description> reconcile(Session session, Description description) {
        if (description == null) {
            return CompletableFuture.failedFuture(ValidationException.missingField("description"));
        }
        if (description.accountId() == null || description.accountId().isBlank()) {
            return CompletableFuture.failedFuture(ValidationException.missingField("accountId"));
        }
        if (description.webProperty() == null) {
            return CompletableFuture.failedFuture(ValidationException.missingField("webProperty"));
        }
        
        String accountId = description.accountId();
        long startTime = System.currentTimeMillis();
        log.info("Starting reconciliation of account {}", accountId);
        
        CompletableFuture<Description> pipeline = CompletableFuture.completedFuture(description);
        for (ReconciliationStage stage : stages) {
            pipeline = pipeline.thenCompose(current -> {
                log.debug("Account {}: stage {} started", accountId, stage.name());
                return stage.apply(session, current);
            });
        }
        
        return pipeline.whenComplete((result, error) -> {
            long duration = System.currentTimeMillis() - startTime;
            metricsRegistry.recordReconciliation(error == null, duration);
            if (error == null) {
                log.info("Reconciliation of account {} completed in {}ms (webProperty={})",
                    accountId, duration, result.webPropertyId());
            } else {
                log.warn("Reconciliation of account {} failed after {}ms: {}",
                    accountId, duration, error.getMessage());
            }
        });
    }
}
