package com.platform.provisioner.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Read-only overview of an account with its web properties and their views.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountSummary(String id, String name, List<WebPropertySummary> webProperties) {
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WebPropertySummary(String id, String name, String websiteUrl, List<ProfileSummary> profiles) {}
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProfileSummary(String id, String name, String type) {}
}
