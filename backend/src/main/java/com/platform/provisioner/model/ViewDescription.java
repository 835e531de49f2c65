package com.platform.provisioner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * A view together with its goals and filters.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ViewDescription(View view, List<Goal> goals, List<Filter> filters) {
    
    public ViewDescription {
        goals = goals != null ? List.copyOf(goals) : List.of();
        filters = filters != null ? List.copyOf(filters) : List.of();
    }
}
