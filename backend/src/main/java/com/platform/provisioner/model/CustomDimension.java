package com.platform.provisioner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CustomDimension(
        String id,
        Integer index,
        String name,
        String scope,
        Boolean active) implements PositionalResource<CustomDimension> {
    
    @Override
    public CustomDimension withId(String id) {
        return toBuilder().id(id).build();
    }
    
    public CustomDimension withPosition(int position) {
        return toBuilder().id("ga:dimension" + position).index(position).build();
    }
}
