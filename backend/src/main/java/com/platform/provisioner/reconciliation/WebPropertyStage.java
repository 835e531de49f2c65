package com.platform.provisioner.reconciliation;

import com.platform.provisioner.error.ResourceNotFoundException;
import com.platform.provisioner.model.Description;
import com.platform.provisioner.model.WebProperty;
import com.platform.provisioner.observability.MetricsRegistry;
import com.platform.provisioner.remote.ManagementApi;
import com.platform.provisioner.remote.ResourcePath;
import com.platform.provisioner.remote.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves the identity of the web property, then brings it in line with the description.
 * 
 * Resolution order: a known id is fetched directly; otherwise a unique key is looked up among
 * the account's web properties; otherwise the web property is created.
 */
@Slf4j
@Component
public class WebPropertyStage implements ReconciliationStage {
    
    private static final String KIND = "webProperty";
    
    private final ManagementApi managementApi;
    private final DiffEvaluator diffEvaluator;
    private final UniqueKeyMatcher uniqueKeyMatcher;
    private final MetricsRegistry metricsRegistry;
    
    public WebPropertyStage(
            ManagementApi managementApi,
            DiffEvaluator diffEvaluator,
            UniqueKeyMatcher uniqueKeyMatcher,
            MetricsRegistry metricsRegistry) {
        this.managementApi = managementApi;
        this.diffEvaluator = diffEvaluator;
        this.uniqueKeyMatcher = uniqueKeyMatcher;
        this.metricsRegistry = metricsRegistry;
    }
    
    @Override
    public String name() {
        return KIND;
    }
    
    @Override
    public CompletableFuture<Description> apply(Session session, Description description) {
        WebProperty desired = description.webProperty();
        ResourcePath account = ResourcePath.account(session, description.accountId());
        
        CompletableFuture<WebProperty> reconciled;
        if (desired.id() != null) {
            reconciled = managementApi.getWebProperty(account.webProperty(desired.id()))
                .thenCompose(fetched -> patchIfChanged(account, fetched.value(), desired));
        } else if (desired.uniqueKey() != null) {
            reconciled = resolveByUniqueKey(account, desired);
        } else {
            reconciled = insert(account, desired);
        }
        return reconciled.thenApply(description::withWebProperty);
    }
    
    private CompletableFuture<WebProperty> resolveByUniqueKey(ResourcePath account, WebProperty desired) {
        return managementApi.listWebProperties(account).thenCompose(listed -> {
            Optional<WebProperty> found = uniqueKeyMatcher.findFirst(listed.value(), desired, desired.uniqueKey());
            if (found.isEmpty()) {
                String key = uniqueKeyMatcher.describe(desired, desired.uniqueKey());
                log.warn("No web property of account {} matches {}", account.accountId(), key);
                record(ReconciliationAction.NOT_FOUND);
                return CompletableFuture.<WebProperty>failedFuture(new ResourceNotFoundException("WebProperty", key));
            }
            WebProperty adopted = desired.withId(found.get().id());
            log.info("Adopted web property {} by {}", adopted.id(), desired.uniqueKey());
            record(ReconciliationAction.ADOPT);
            return patchIfChanged(account, found.get(), adopted);
        });
    }
    
    private CompletableFuture<WebProperty> insert(ResourcePath account, WebProperty desired) {
        log.info("Inserting web property '{}' into account {}", desired.name(), account.accountId());
        record(ReconciliationAction.INSERT);
        return managementApi.insertWebProperty(account, desired)
            .thenApply(inserted -> desired.withId(inserted.value().id()));
    }
    
    private CompletableFuture<WebProperty> patchIfChanged(ResourcePath account, WebProperty observed, WebProperty desired) {
        if (!diffEvaluator.requiresPatch(observed, desired)) {
            log.debug("Web property {} unchanged", desired.id());
            record(ReconciliationAction.UNCHANGED);
            return CompletableFuture.completedFuture(desired);
        }
        log.info("Patching web property {}", desired.id());
        record(ReconciliationAction.PATCH);
        return managementApi.patchWebProperty(account.webProperty(desired.id()), desired)
            .thenApply(patched -> desired);
    }
    
    private void record(ReconciliationAction action) {
        metricsRegistry.recordReconciliationAction(KIND, action.name());
    }
}
