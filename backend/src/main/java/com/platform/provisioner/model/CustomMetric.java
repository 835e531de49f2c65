package com.platform.provisioner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CustomMetric(
        String id,
        Integer index,
        String name,
        String scope,
        Boolean active,
        String type) implements PositionalResource<CustomMetric> {
    
    @Override
    public CustomMetric withId(String id) {
        return toBuilder().id(id).build();
    }
    
    public CustomMetric withPosition(int position) {
        return toBuilder().id("ga:metric" + position).index(position).build();
    }
}
