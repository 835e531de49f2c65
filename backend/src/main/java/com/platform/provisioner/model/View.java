package com.platform.provisioner.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * A reporting view (profile) of a web property.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record View(
        @JsonAlias("profileId") String id,
        String name,
        String currency,
        String timezone,
        String websiteUrl,
        String type,
        @JsonProperty("eCommerceTracking") Boolean eCommerceTracking,
        String uniqueKey) {
    
    public static final String DEFAULT_TYPE = "WEB";
    
    public View {
        if (type == null) {
            type = DEFAULT_TYPE;
        }
    }
    
    public View withId(String id) {
        return toBuilder().id(id).build();
    }
}
