package com.platform.provisioner.reconciliation;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.provisioner.model.ResourcePayloads;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Finds a remote resource by the value of an alternate identifying field.
 */
@Component
public class UniqueKeyMatcher {
    
    private final ResourcePayloads payloads;
    
    public UniqueKeyMatcher(ResourcePayloads payloads) {
        this.payloads = payloads;
    }
    
    /**
     * First candidate whose {@code key} field equals the desired one. A desired resource without
     * a value for {@code key} matches nothing.
     */
    public <T> Optional<T> findFirst(List<T> candidates, Object desired, String key) {
        JsonNode wanted = keyValue(desired, key);
        if (wanted.isMissingNode() || wanted.isNull()) {
            return Optional.empty();
        }
        return candidates.stream()
            .filter(candidate -> wanted.equals(keyValue(candidate, key)))
            .findFirst();
    }
    
    /**
     * Value of the key field as text, for log and error messages.
     */
    public String describe(Object desired, String key) {
        return key + "=" + keyValue(desired, key).asText("");
    }
    
    private JsonNode keyValue(Object resource, String key) {
        return payloads.toTree(resource).path(key);
    }
}
