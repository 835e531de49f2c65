package com.platform.provisioner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * A conversion goal of a view. Only event goals carry details here.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Goal(
        String id,
        String name,
        Boolean active,
        String type,
        Double value,
        EventDetails eventDetails) implements PositionalResource<Goal> {
    
    @Override
    public Goal withId(String id) {
        return toBuilder().id(id).build();
    }
    
    public Goal withPosition(int position) {
        return withId(String.valueOf(position));
    }
    
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EventDetails(Boolean useEventValue, List<EventCondition> eventConditions) {}
    
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EventCondition(
            String type,
            String matchType,
            String expression,
            String comparisonType,
            Long comparisonValue) {}
}
