package com.platform.provisioner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Root of the declarative resource tree: one account, its web property and the children of that property.
 * 
 * Reconciliation never mutates a Description; it returns a new one with remote ids filled in.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Description(
        String accountId,
        WebProperty webProperty,
        List<CustomDimension> customDimensions,
        List<CustomMetric> customMetrics,
        List<ViewDescription> views) {
    
    public Description {
        customDimensions = customDimensions != null ? List.copyOf(customDimensions) : List.of();
        customMetrics = customMetrics != null ? List.copyOf(customMetrics) : List.of();
        views = views != null ? List.copyOf(views) : List.of();
    }
    
    public Description withWebProperty(WebProperty webProperty) {
        return toBuilder().webProperty(webProperty).build();
    }
    
    public Description withCustomDimensions(List<CustomDimension> customDimensions) {
        return toBuilder().customDimensions(customDimensions).build();
    }
    
    public Description withCustomMetrics(List<CustomMetric> customMetrics) {
        return toBuilder().customMetrics(customMetrics).build();
    }
    
    public Description withViews(List<ViewDescription> views) {
        return toBuilder().views(views).build();
    }
    
    /**
     * Id of the web property, once known.
     */
    public String webPropertyId() {
        return webProperty != null ? webProperty.id() : null;
    }
}
