package com.platform.provisioner.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.platform.provisioner.error.ServiceException;
import com.platform.provisioner.model.Account;
import com.platform.provisioner.model.AccountSummary;
import com.platform.provisioner.model.Description;
import com.platform.provisioner.model.DescriptionBuilder;
import com.platform.provisioner.model.ResourcePayloads;
import com.platform.provisioner.reconciliation.ReconciliationEngine;
import com.platform.provisioner.remote.ManagementApi;
import com.platform.provisioner.remote.RemoteResult;
import com.platform.provisioner.remote.ResourcePath;
import com.platform.provisioner.remote.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Service boundary of the provisioner.
 * 
 * Every failure leaving this class is a {@link ServiceException}; the verbose rendering is logged here.
 */
@Slf4j
@Service
public class ProvisioningService {
    
    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};
    
    private final ReconciliationEngine reconciliationEngine;
    private final ManagementApi managementApi;
    private final ResourcePayloads payloads;
    
    public ProvisioningService(
            ReconciliationEngine reconciliationEngine,
            ManagementApi managementApi,
            ResourcePayloads payloads) {
        this.reconciliationEngine = reconciliationEngine;
        this.managementApi = managementApi;
        this.payloads = payloads;
    }
    
    // ==================== Provisioning ====================
    
    public CompletableFuture<Description> provisionAsync(Session session, Description description) {
        return reconciliationEngine.reconcile(session, description)
            .exceptionallyCompose(error -> CompletableFuture.failedFuture(fail("provision", error)));
    }
    
    /**
     * Blocking variant of {@link #provisionAsync(Session, Description)}.
     */
    public Description provision(Session session, Description description) {
        return await(provisionAsync(session, description));
    }
    
    /**
     * Shapes a loose description document the way {@link DescriptionBuilder} does.
     * Expected keys: {@code account}, {@code webProperty}, {@code customDimensions},
     * {@code customMetrics} and {@code views}, each view holding {@code view}, {@code goals} and {@code filters}.
     */
    public Description shape(Map<String, Object> document) {
        DescriptionBuilder builder = new DescriptionBuilder(payloads);
        if (document.get("account") instanceof Map<?, ?> account) {
            builder.account(fields(account));
        } else if (document.get("accountId") != null) {
            builder.account(String.valueOf(document.get("accountId")));
        }
        if (document.get("webProperty") instanceof Map<?, ?> webProperty) {
            builder.webProperty(fields(webProperty));
        }
        builder.customDimensionFields(fieldList(document.get("customDimensions")));
        builder.customMetricFields(fieldList(document.get("customMetrics")));
        for (Map<String, Object> view : fieldList(document.get("views"))) {
            Map<String, Object> viewFields = view.get("view") instanceof Map<?, ?> raw ? fields(raw) : Map.of();
            builder.view(
                viewFields,
                fieldList(view.get("goals")),
                fieldList(view.get("filters")));
        }
        return builder.build();
    }
    
    // ==================== Read-only ====================
    
    public List<Account> listAccounts(Session session) {
        return await(managementApi.listAccounts(ResourcePath.root(session))
            .thenApply(RemoteResult::value)
            .exceptionallyCompose(error -> CompletableFuture.failedFuture(fail("listAccounts", error))));
    }
    
    public List<AccountSummary> listAccountSummaries(Session session) {
        return await(managementApi.listAccountSummaries(ResourcePath.root(session))
            .thenApply(RemoteResult::value)
            .exceptionallyCompose(error -> CompletableFuture.failedFuture(fail("listAccountSummaries", error))));
    }
    
    // ==================== Helpers ====================
    
    private ServiceException fail(String operation, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause() : error;
        ServiceException wrapped = ServiceException.wrap(cause);
        log.error("{} failed:\n{}", operation, wrapped.toDebug());
        return wrapped;
    }
    
    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ServiceException serviceException) {
                throw serviceException;
            }
            throw ServiceException.wrap(e.getCause() != null ? e.getCause() : e);
        }
    }
    
    private Map<String, Object> fields(Map<?, ?> value) {
        return payloads.getObjectMapper().convertValue(value, FIELDS);
    }
    
    private List<Map<String, Object>> fieldList(Object value) {
        if (!(value instanceof List<?> items)) {
            return List.of();
        }
        return items.stream()
            .filter(Map.class::isInstance)
            .map(item -> fields((Map<?, ?>) item))
            .toList();
    }
}
