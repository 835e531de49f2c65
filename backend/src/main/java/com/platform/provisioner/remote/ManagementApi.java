package com.platform.provisioner.remote;

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
 * Asynchronous operations of the Analytics Management API.
 * 
 * Every future completes with the path it was given and the resource or resource list returned,
 * or fails with a {@link com.platform.provisioner.error.RemoteServiceException}.
 */
public interface ManagementApi {
    
    // ==================== Read-only ====================
    
    CompletableFuture<RemoteResult<List<AccountSummary>>> listAccountSummaries(ResourcePath path);
    
    CompletableFuture<RemoteResult<List<Account>>> listAccounts(ResourcePath path);
    
    // ==================== Web Properties ====================
    
    CompletableFuture<RemoteResult<List<WebProperty>>> listWebProperties(ResourcePath path);
    
    CompletableFuture<RemoteResult<WebProperty>> getWebProperty(ResourcePath path);
    
    CompletableFuture<RemoteResult<WebProperty>> insertWebProperty(ResourcePath path, WebProperty webProperty);
    
    CompletableFuture<RemoteResult<WebProperty>> patchWebProperty(ResourcePath path, WebProperty webProperty);
    
    // ==================== Custom Dimensions ====================
    
    CompletableFuture<RemoteResult<List<CustomDimension>>> listCustomDimensions(ResourcePath path);
    
    CompletableFuture<RemoteResult<CustomDimension>> insertCustomDimension(ResourcePath path, CustomDimension dimension);
    
    CompletableFuture<RemoteResult<CustomDimension>> patchCustomDimension(ResourcePath path, CustomDimension dimension);
    
    // ==================== Custom Metrics ====================
    
    CompletableFuture<RemoteResult<List<CustomMetric>>> listCustomMetrics(ResourcePath path);
    
    CompletableFuture<RemoteResult<CustomMetric>> insertCustomMetric(ResourcePath path, CustomMetric metric);
    
    CompletableFuture<RemoteResult<CustomMetric>> patchCustomMetric(ResourcePath path, CustomMetric metric);
    
    // ==================== Views ====================
    
    CompletableFuture<RemoteResult<List<View>>> listViews(ResourcePath path);
    
    CompletableFuture<RemoteResult<View>> getView(ResourcePath path);
    
    CompletableFuture<RemoteResult<View>> insertView(ResourcePath path, View view);
    
    CompletableFuture<RemoteResult<View>> patchView(ResourcePath path, View view);
    
    // ==================== Goals ====================
    
    CompletableFuture<RemoteResult<List<Goal>>> listGoals(ResourcePath path);
    
    CompletableFuture<RemoteResult<Goal>> insertGoal(ResourcePath path, Goal goal);
    
    CompletableFuture<RemoteResult<Goal>> patchGoal(ResourcePath path, Goal goal);
}
