package com.platform.provisioner.reconciliation;

import com.platform.provisioner.model.CustomMetric;
import com.platform.provisioner.model.Description;
import com.platform.provisioner.observability.MetricsRegistry;
import com.platform.provisioner.remote.ManagementApi;
import com.platform.provisioner.remote.ResourcePath;
import com.platform.provisioner.remote.Session;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Custom metrics, correlated by position as {@code ga:metric1}, {@code ga:metric2}, ...
 */
@Component
public class CustomMetricsStage implements ReconciliationStage {
    
    private final ManagementApi managementApi;
    private final PositionalCollectionReconciler<CustomMetric> reconciler;
    
    public CustomMetricsStage(ManagementApi managementApi, DiffEvaluator diffEvaluator, MetricsRegistry metricsRegistry) {
        this.managementApi = managementApi;
        this.reconciler = new PositionalCollectionReconciler<>(
            "customMetric",
            new PositionalCorrelation<CustomMetric>(CustomMetric::withPosition),
            diffEvaluator,
            metricsRegistry);
    }
    
    @Override
    public String name() {
        return "customMetrics";
    }
    
    @Override
    public CompletableFuture<Description> apply(Session session, Description description) {
        if (description.customMetrics().isEmpty()) {
            return CompletableFuture.completedFuture(description);
        }
        ResourcePath property = ResourcePath.account(session, description.accountId())
            .webProperty(description.webPropertyId());
        
        return reconciler.reconcile(description.customMetrics(), new CollectionOperations<>(
                () -> managementApi.listCustomMetrics(property),
                metric -> managementApi.insertCustomMetric(property, metric),
                metric -> managementApi.patchCustomMetric(property.item(metric.id()), metric)))
            .thenApply(description::withCustomMetrics);
    }
}
