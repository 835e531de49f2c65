package com.platform.provisioner.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * A tracked site under an account.
 *
 * @param uniqueKey name of the field used to find an existing remote web property when no id is known
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebProperty(
        @JsonAlias("webPropertyId") String id,
        String name,
        String websiteUrl,
        String industryVertical,
        String uniqueKey) {
    
    public static final String DEFAULT_INDUSTRY_VERTICAL = "UNSPECIFIED";
    
    public WebProperty {
        if (industryVertical == null) {
            industryVertical = DEFAULT_INDUSTRY_VERTICAL;
        }
    }
    
    public WebProperty withId(String id) {
        return toBuilder().id(id).build();
    }
}
