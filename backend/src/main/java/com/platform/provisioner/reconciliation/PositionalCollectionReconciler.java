package com.platform.provisioner.reconciliation;

import com.platform.provisioner.model.PositionalResource;
import com.platform.provisioner.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reconciles a child collection item by item, strictly in declaration order.
 * 
 * The remote collection is listed once. Each declared item is then paired with a remote item by the
 * correlation strategy: a missing counterpart is inserted, a differing one patched, an equal one left alone.
 * The returned list carries the ids the Management API reported.
 */
@Slf4j
public class PositionalCollectionReconciler<T extends PositionalResource<T>> {
    
    private final String kind;
    private final CorrelationStrategy<T> correlation;
    private final DiffEvaluator diffEvaluator;
    private final MetricsRegistry metricsRegistry;
    
    public PositionalCollectionReconciler(
            String kind,
            CorrelationStrategy<T> correlation,
            DiffEvaluator diffEvaluator,
            MetricsRegistry metricsRegistry) {
        this.kind = kind;
        this.correlation = correlation;
        this.diffEvaluator = diffEvaluator;
        this.metricsRegistry = metricsRegistry;
    }
    
    public CompletableFuture<List<T>> reconcile(List<T> declared, CollectionOperations<T> operations) {
        if (declared.isEmpty()) {
            return CompletableFuture.completedFuture(declared);
        }
        
        return operations.list().get().thenCompose(listed -> {
            List<T> remote = listed.value() != null ? listed.value() : List.of();
            log.debug("Reconciling {} declared {} against {} remote", declared.size(), kind, remote.size());
            
            CompletableFuture<List<T>> fold = CompletableFuture.completedFuture(new ArrayList<>());
            for (int i = 0; i < declared.size(); i++) {
                int position = i;
                T item = declared.get(i);
                fold = fold.thenCompose(done -> reconcileItem(remote, item, position, operations)
                    .thenApply(result -> {
                        done.add(result);
                        return done;
                    }));
            }
            return fold.thenApply(List::copyOf);
        });
    }
    
    private CompletableFuture<T> reconcileItem(List<T> remote, T item, int position,
                                               CollectionOperations<T> operations) {
        Optional<T> existing = correlation.match(remote, item, position);
        T target = correlation.assignIdentity(item, position);
        
        if (existing.isEmpty()) {
            log.info("Inserting {} {}", kind, target.id());
            record(ReconciliationAction.INSERT);
            return operations.insert().apply(target).thenApply(result -> adoptId(target, result.value()));
        }
        
        T observed = existing.get();
        if (diffEvaluator.requiresPatch(observed, item)) {
            log.info("Patching {} {}", kind, target.id());
            record(ReconciliationAction.PATCH);
            return operations.patch().apply(target).thenApply(result -> adoptId(target, result.value()));
        }
        
        log.debug("{} {} unchanged", kind, target.id());
        record(ReconciliationAction.UNCHANGED);
        return CompletableFuture.completedFuture(adoptId(target, observed));
    }
    
    private T adoptId(T target, T remote) {
        return remote != null && remote.id() != null ? target.withId(remote.id()) : target;
    }
    
    private void record(ReconciliationAction action) {
        metricsRegistry.recordReconciliationAction(kind, action.name());
    }
}
