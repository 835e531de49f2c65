package com.platform.provisioner.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Incrementally assembles a {@link Description}.
 * 
 * Every call shapes its input to the fields the resource kind accepts and applies defaults.
 * Nothing is validated and no remote call is made.
 * 
 * <pre>
 * Description description = new DescriptionBuilder()
 *     .account("1234")
 *     .webProperty(WebProperty.builder().name("Shop").websiteUrl("https://shop.example").build())
 *     .view(View.builder().name("All traffic").build(), List.of(), List.of())
 *     .build();
 * </pre>
 */
public class DescriptionBuilder {
    
    private final ResourcePayloads payloads;
    private final List<ViewDescription> views = new ArrayList<>();
    private String accountId;
    private WebProperty webProperty;
    private List<CustomDimension> customDimensions = List.of();
    private List<CustomMetric> customMetrics = List.of();
    
    public DescriptionBuilder() {
        this(ResourcePayloads.standalone());
    }
    
    public DescriptionBuilder(ResourcePayloads payloads) {
        this.payloads = payloads;
    }
    
    // ==================== Account ====================
    
    public DescriptionBuilder account(String accountId) {
        this.accountId = accountId;
        return this;
    }
    
    /**
     * Takes the account id from {@code id}, falling back to {@code accountId}.
     */
    public DescriptionBuilder account(Map<String, ?> fields) {
        Object id = fields.get("id") != null ? fields.get("id") : fields.get("accountId");
        this.accountId = id != null ? String.valueOf(id) : null;
        return this;
    }
    
    // ==================== Web Property ====================
    
    public DescriptionBuilder webProperty(WebProperty webProperty) {
        this.webProperty = webProperty.toBuilder().build();
        return this;
    }
    
    public DescriptionBuilder webProperty(Map<String, ?> fields) {
        return webProperty(payloads.shape(fields, WebProperty.class));
    }
    
    // ==================== Views ====================
    
    /**
     * Appends a view with its goals and filters.
     */
    public DescriptionBuilder view(View view, List<Goal> goals, List<Filter> filters) {
        views.add(new ViewDescription(
            view,
            safe(goals).stream().map(DescriptionBuilder::shapeGoal).toList(),
            safe(filters)));
        return this;
    }
    
    public DescriptionBuilder view(View view) {
        return view(view, List.of(), List.of());
    }
    
    public DescriptionBuilder view(Map<String, ?> viewFields,
                                   List<? extends Map<String, ?>> goalFields,
                                   List<? extends Map<String, ?>> filterFields) {
        return view(
            payloads.shape(viewFields, View.class),
            safe(goalFields).stream().map(fields -> payloads.shape(fields, Goal.class)).toList(),
            safe(filterFields).stream().map(fields -> payloads.shape(fields, Filter.class)).toList());
    }
    
    // ==================== Custom Definitions ====================
    
    public DescriptionBuilder customDimensions(List<CustomDimension> dimensions) {
        this.customDimensions = safe(dimensions).stream()
            .map(d -> new CustomDimension(null, null, d.name(), d.scope(), d.active()))
            .toList();
        return this;
    }
    
    public DescriptionBuilder customDimensionFields(List<? extends Map<String, ?>> dimensions) {
        return customDimensions(safe(dimensions).stream()
            .map(fields -> payloads.shape(fields, CustomDimension.class))
            .toList());
    }
    
    public DescriptionBuilder customMetrics(List<CustomMetric> metrics) {
        this.customMetrics = safe(metrics).stream()
            .map(m -> new CustomMetric(null, null, m.name(), m.scope(), m.active(), m.type()))
            .toList();
        return this;
    }
    
    public DescriptionBuilder customMetricFields(List<? extends Map<String, ?>> metrics) {
        return customMetrics(safe(metrics).stream()
            .map(fields -> payloads.shape(fields, CustomMetric.class))
            .toList());
    }
    
    // ==================== Snapshot ====================
    
    public Description build() {
        return new Description(accountId, webProperty, customDimensions, customMetrics, views);
    }
    
    public String toJson() {
        return payloads.toPrettyJson(build());
    }
    
    @Override
    public String toString() {
        return toJson();
    }
    
    private static Goal shapeGoal(Goal goal) {
        return goal.toBuilder().id(null).build();
    }
    
    private static <T> List<T> safe(List<T> items) {
        return items == null ? List.of() : items.stream().filter(Objects::nonNull).toList();
    }
}
