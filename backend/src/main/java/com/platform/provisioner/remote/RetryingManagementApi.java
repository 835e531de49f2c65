package com.platform.provisioner.remote;

import com.platform.provisioner.core.RetryEngine;
import com.platform.provisioner.model.Account;
import com.platform.provisioner.model.AccountSummary;
import com.platform.provisioner.model.CustomDimension;
import com.platform.provisioner.model.CustomMetric;
import com.platform.provisioner.model.Goal;
import com.platform.provisioner.model.View;
import com.platform.provisioner.model.WebProperty;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Routes every call of a delegate {@link ManagementApi} through the {@link RetryEngine}.
 */
public class RetryingManagementApi implements ManagementApi {
    
    private final ManagementApi delegate;
    private final RetryEngine retryEngine;
    
    public RetryingManagementApi(ManagementApi delegate, RetryEngine retryEngine) {
        this.delegate = delegate;
        this.retryEngine = retryEngine;
    }
    
    @Override
    public CompletableFuture<RemoteResult<List<AccountSummary>>> listAccountSummaries(ResourcePath path) {
        return retryEngine.executeWithRetry("accountSummaries.list", () -> delegate.listAccountSummaries(path));
    }
    
    @Override
    public CompletableFuture<RemoteResult<List<Account>>> listAccounts(ResourcePath path) {
        return retryEngine.executeWithRetry("accounts.list", () -> delegate.listAccounts(path));
    }
    
    @Override
    public CompletableFuture<RemoteResult<List<WebProperty>>> listWebProperties(ResourcePath path) {
        return retryEngine.executeWithRetry("webproperties.list", () -> delegate.listWebProperties(path));
    }
    
    @Override
    public CompletableFuture<RemoteResult<WebProperty>> getWebProperty(ResourcePath path) {
        return retryEngine.executeWithRetry("webproperties.get", () -> delegate.getWebProperty(path));
    }
    
    @Override
    public CompletableFuture<RemoteResult<WebProperty>> insertWebProperty(ResourcePath path, WebProperty webProperty) {
        return retryEngine.executeWithRetry("webproperties.insert", () -> delegate.insertWebProperty(path, webProperty));
    }
    
    @Override
    public CompletableFuture<RemoteResult<WebProperty>> patchWebProperty(ResourcePath path, WebProperty webProperty) {
        return retryEngine.executeWithRetry("webproperties.patch", () -> delegate.patchWebProperty(path, webProperty));
    }
    
    @Override
    public CompletableFuture<RemoteResult<List<CustomDimension>>> listCustomDimensions(ResourcePath path) {
        return retryEngine.executeWithRetry("customDimensions.list", () -> delegate.listCustomDimensions(path));
    }
    
    @Override
    public CompletableFuture<RemoteResult<CustomDimension>> insertCustomDimension(ResourcePath path, CustomDimension dimension) {
        return retryEngine.executeWithRetry("customDimensions.insert", () -> delegate.insertCustomDimension(path, dimension));
    }
    
    @Override
    public CompletableFuture<RemoteResult<CustomDimension>> patchCustomDimension(ResourcePath path, CustomDimension dimension) {
        return retryEngine.executeWithRetry("customDimensions.patch", () -> delegate.patchCustomDimension(path, dimension));
    }
    
    @Override
    public CompletableFuture<RemoteResult<List<CustomMetric>>> listCustomMetrics(ResourcePath path) {
        return retryEngine.executeWithRetry("customMetrics.list", () -> delegate.listCustomMetrics(path));
    }
    
    @Override
    public CompletableFuture<RemoteResult<CustomMetric>> insertCustomMetric(ResourcePath path, CustomMetric metric) {
        return retryEngine.executeWithRetry("customMetrics.insert", () -> delegate.insertCustomMetric(path, metric));
    }
    
    @Override
    public CompletableFuture<RemoteResult<CustomMetric>> patchCustomMetric(ResourcePath path, CustomMetric metric) {
        return retryEngine.executeWithRetry("customMetrics.patch", () -> delegate.patchCustomMetric(path, metric));
    }
    
    @Override
    public CompletableFuture<RemoteResult<List<View>>> listViews(ResourcePath path) {
        return retryEngine.executeWithRetry("profiles.list", () -> delegate.listViews(path));
    }
    
    @Override
    public CompletableFuture<RemoteResult<View>> getView(ResourcePath path) {
        return retryEngine.executeWithRetry("profiles.get", () -> delegate.getView(path));
    }
    
    @Override
    public CompletableFuture<RemoteResult<View>> insertView(ResourcePath path, View view) {
        return retryEngine.executeWithRetry("profiles.insert", () -> delegate.insertView(path, view));
    }
    
    @Override
    public CompletableFuture<RemoteResult<View>> patchView(ResourcePath path, View view) {
        return retryEngine.executeWithRetry("profiles.patch", () -> delegate.patchView(path, view));
    }
    
    @Override
    public CompletableFuture<RemoteResult<List<Goal>>> listGoals(ResourcePath path) {
        return retryEngine.executeWithRetry("goals.list", () -> delegate.listGoals(path));
    }
    
    @Override
    public CompletableFuture<RemoteResult<Goal>> insertGoal(ResourcePath path, Goal goal) {
        return retryEngine.executeWithRetry("goals.insert", () -> delegate.insertGoal(path, goal));
    }
    
    @Override
    public CompletableFuture<RemoteResult<Goal>> patchGoal(ResourcePath path, Goal goal) {
        return retryEngine.executeWithRetry("goals.patch", () -> delegate.patchGoal(path, goal));
    }
}
