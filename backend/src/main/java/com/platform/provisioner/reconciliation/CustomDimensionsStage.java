package com.platform.provisioner.reconciliation;

import com.platform.provisioner.model.CustomDimension;
import com.platform.provisioner.model.Description;
import com.platform.provisioner.observability.MetricsRegistry;
import com.platform.provisioner.remote.ManagementApi;
import com.platform.provisioner.remote.ResourcePath;
import com.platform.provisioner.remote.Session;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Custom dimensions, correlated by position as {@code ga:dimension1}, {@code ga:dimension2}, ...
 */
@Component
public class CustomDimensionsStage implements ReconciliationStage {
    
    private final ManagementApi managementApi;
    private final PositionalCollectionReconciler<CustomDimension> reconciler;
    
    public CustomDimensionsStage(ManagementApi managementApi, DiffEvaluator diffEvaluator, MetricsRegistry metricsRegistry) {
        this.managementApi = managementApi;
        this.reconciler = new PositionalCollectionReconciler<>(
            "customDimension",
            new PositionalCorrelation<CustomDimension>(CustomDimension::withPosition),
            diffEvaluator,
            metricsRegistry);
    }
    
    @Override
    public String name() {
        return "customDimensions";
    }
    
    @Override
    public CompletableFuture<Description> apply(Session session, Description description) {
        if (description.customDimensions().isEmpty()) {
            return CompletableFuture.completedFuture(description);
        }
        ResourcePath property = ResourcePath.account(session, description.accountId())
            .webProperty(description.webPropertyId());
        
        return reconciler.reconcile(description.customDimensions(), new CollectionOperations<>(
                () -> managementApi.listCustomDimensions(property),
                dimension -> managementApi.insertCustomDimension(property, dimension),
                dimension -> managementApi.patchCustomDimension(property.item(dimension.id()), dimension)))
            .thenApply(description::withCustomDimensions);
    }
}
