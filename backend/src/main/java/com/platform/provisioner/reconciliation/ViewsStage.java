package com.platform.provisioner.reconciliation;

import com.platform.provisioner.model.Description;
import com.platform.provisioner.model.Goal;
import com.platform.provisioner.model.View;
import com.platform.provisioner.model.ViewDescription;
import com.platform.provisioner.observability.MetricsRegistry;
import com.platform.provisioner.remote.ManagementApi;
import com.platform.provisioner.remote.RemoteResult;
import com.platform.provisioner.remote.ResourcePath;
import com.platform.provisioner.remote.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Views of the web property, each followed by its goals.
 * 
 * The remote views are listed once for the whole stage, and only when some view has to be found.
 * A view that cannot be found is left as declared, and its goals are skipped.
 * Filters are carried through untouched.
 */
@Slf4j
@Component
public class ViewsStage implements ReconciliationStage {
    
    private static final String KIND = "view";
    
    private final ManagementApi managementApi;
    private final DiffEvaluator diffEvaluator;
    private final UniqueKeyMatcher uniqueKeyMatcher;
    private final MetricsRegistry metricsRegistry;
    private final PositionalCollectionReconciler<Goal> goalReconciler;
    
    public ViewsStage(
            ManagementApi managementApi,
            DiffEvaluator diffEvaluator,
            UniqueKeyMatcher uniqueKeyMatcher,
            MetricsRegistry metricsRegistry) {
        this.managementApi = managementApi;
        this.diffEvaluator = diffEvaluator;
        this.uniqueKeyMatcher = uniqueKeyMatcher;
        this.metricsRegistry = metricsRegistry;
        this.goalReconciler = new PositionalCollectionReconciler<>(
            "goal",
            new PositionalCorrelation<Goal>(Goal::withPosition),
            diffEvaluator,
            metricsRegistry);
    }
    
    @Override
    public String name() {
        return "views";
    }
    
    @Override
    public CompletableFuture<Description> apply(Session session, Description description) {
        List<ViewDescription> views = description.views();
        if (views.isEmpty()) {
            return CompletableFuture.completedFuture(description);
        }
        ResourcePath property = ResourcePath.account(session, description.accountId())
            .webProperty(description.webPropertyId());
        
        return listIfNeeded(property, views).thenCompose(remoteViews -> {
            CompletableFuture<List<ViewDescription>> fold = CompletableFuture.completedFuture(new ArrayList<>());
            for (ViewDescription entry : views) {
                fold = fold.thenCompose(done -> reconcileEntry(property, remoteViews, entry)
                    .thenApply(result -> {
                        done.add(result);
                        return done;
                    }));
            }
            return fold;
        }).thenApply(description::withViews);
    }
    
    private CompletableFuture<List<View>> listIfNeeded(ResourcePath property, List<ViewDescription> views) {
        boolean lookupNeeded = views.stream()
            .map(ViewDescription::view)
            .anyMatch(view -> view != null && (view.id() != null || view.uniqueKey() != null));
        if (!lookupNeeded) {
            return CompletableFuture.completedFuture(List.of());
        }
        return managementApi.listViews(property).thenApply(RemoteResult::value);
    }
    
    private CompletableFuture<ViewDescription> reconcileEntry(ResourcePath property, List<View> remoteViews,
                                                              ViewDescription entry) {
        if (entry.view() == null) {
            log.warn("Skipping view entry without view fields");
            record(ReconciliationAction.SKIPPED);
            return CompletableFuture.completedFuture(entry);
        }
        
        return resolveView(property, remoteViews, entry.view()).thenCompose(resolution -> {
            View view = resolution.view();
            if (!entry.filters().isEmpty()) {
                log.debug("{} filter(s) of view '{}' are not synchronized", entry.filters().size(), view.name());
            }
            return reconcileGoals(property, resolution, entry.goals())
                .thenApply(goals -> new ViewDescription(view, goals, entry.filters()));
        });
    }
    
    private CompletableFuture<Resolution> resolveView(ResourcePath property, List<View> remoteViews, View desired) {
        if (desired.id() != null) {
            Optional<View> found = remoteViews.stream()
                .filter(remote -> desired.id().equals(remote.id()))
                .findFirst();
            if (found.isEmpty()) {
                log.warn("View {} not found under web property {}", desired.id(), property.webPropertyId());
                record(ReconciliationAction.NOT_FOUND);
                return CompletableFuture.completedFuture(Resolution.unresolved(desired));
            }
            return patchIfChanged(property, found.get(), desired).thenApply(Resolution::resolved);
        }
        
        if (desired.uniqueKey() != null) {
            Optional<View> found = uniqueKeyMatcher.findFirst(remoteViews, desired, desired.uniqueKey());
            if (found.isEmpty()) {
                log.warn("No view under web property {} matches {}",
                    property.webPropertyId(), uniqueKeyMatcher.describe(desired, desired.uniqueKey()));
                record(ReconciliationAction.NOT_FOUND);
                return CompletableFuture.completedFuture(Resolution.unresolved(desired));
            }
            View adopted = desired.withId(found.get().id());
            log.info("Adopted view {} by {}", adopted.id(), desired.uniqueKey());
            record(ReconciliationAction.ADOPT);
            return patchIfChanged(property, found.get(), adopted).thenApply(Resolution::resolved);
        }
        
        log.info("Inserting view '{}' into web property {}", desired.name(), property.webPropertyId());
        record(ReconciliationAction.INSERT);
        return managementApi.insertView(property, desired)
            .thenApply(inserted -> Resolution.resolved(desired.withId(inserted.value().id())));
    }
    
    private CompletableFuture<View> patchIfChanged(ResourcePath property, View observed, View desired) {
        if (!diffEvaluator.requiresPatch(observed, desired)) {
            log.debug("View {} unchanged", desired.id());
            record(ReconciliationAction.UNCHANGED);
            return CompletableFuture.completedFuture(desired);
        }
        log.info("Patching view {}", desired.id());
        record(ReconciliationAction.PATCH);
        return managementApi.patchView(property.profile(desired.id()), desired)
            .thenApply(patched -> desired);
    }
    
    private CompletableFuture<List<Goal>> reconcileGoals(ResourcePath property, Resolution resolution,
                                                         List<Goal> goals) {
        if (goals.isEmpty()) {
            return CompletableFuture.completedFuture(goals);
        }
        View view = resolution.view();
        if (!resolution.found() || view.id() == null) {
            log.warn("Skipping {} goal(s) of unresolved view '{}'", goals.size(), view.name());
            return CompletableFuture.completedFuture(goals);
        }
        ResourcePath profile = property.profile(view.id());
        return goalReconciler.reconcile(goals, new CollectionOperations<>(
            () -> managementApi.listGoals(profile),
            goal -> managementApi.insertGoal(profile, goal),
            goal -> managementApi.patchGoal(profile.item(goal.id()), goal)));
    }
    
    private void record(ReconciliationAction action) {
        metricsRegistry.recordReconciliationAction(KIND, action.name());
    }
    
    /**
     * A view after identity resolution; {@code found} is false when no remote view backs it.
     */
    private record Resolution(View view, boolean found) {
        
        static Resolution resolved(View view) {
            return new Resolution(view, true);
        }
        
        static Resolution unresolved(View view) {
            return new Resolution(view, false);
        }
    }
}
