package com.platform.provisioner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * A view-level filter. Carried in the description but never pushed to the Management API.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Filter(
        String name,
        String type,
        String uniqueKey,
        Details includeDetails,
        Details excludeDetails) {
    
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Details(
            String field,
            String matchType,
            String expressionValue,
            Boolean caseSensitive) {}
}
