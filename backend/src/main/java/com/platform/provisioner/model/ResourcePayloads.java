package com.platform.provisioner.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.platform.provisioner.error.ErrorCode;
import com.platform.provisioner.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Converts resource records to and from JSON trees.
 * Local-only fields are removed from every tree meant for the Management API or for comparison.
 */
@Slf4j
@Component
public class ResourcePayloads {
    
    /**
     * Fields that only steer reconciliation and never leave the process.
     */
    public static final Set<String> LOCAL_FIELDS = Set.of("uniqueKey");
    
    private final ObjectMapper objectMapper;
    
    public ResourcePayloads(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public static ResourcePayloads standalone() {
        return new ResourcePayloads(new ObjectMapper());
    }
    
    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
    
    /**
     * Tree of a resource as the Management API sees it. Null fields and local fields are absent.
     */
    public JsonNode toTree(Object resource) {
        if (resource == null) {
            return null;
        }
        JsonNode tree = objectMapper.valueToTree(resource);
        if (tree instanceof ObjectNode object) {
            object.remove(LOCAL_FIELDS);
        }
        return tree;
    }
    
    /**
     * Serialized request body for insert and patch calls.
     */
    public String toPayload(Object resource) {
        try {
            return objectMapper.writeValueAsString(toTree(resource));
        } catch (JsonProcessingException e) {
            throw new ValidationException(ErrorCode.SERIALIZATION_ERROR, 500,
                "Cannot serialize " + resource.getClass().getSimpleName() + ": " + e.getOriginalMessage());
        }
    }
    
    /**
     * Builds a resource from loose fields. Unknown fields and fields whose value does not fit are dropped.
     */
    public <T> T shape(Map<String, ?> fields, Class<T> type) {
        ObjectNode accepted = objectMapper.createObjectNode();
        if (fields != null) {
            fields.forEach((name, value) -> {
                ObjectNode candidate = objectMapper.createObjectNode();
                candidate.set(name, objectMapper.valueToTree(value));
                try {
                    objectMapper.treeToValue(candidate, type);
                    accepted.set(name, candidate.get(name));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    log.debug("Dropping field {} of {}: {}", name, type.getSimpleName(), e.getMessage());
                }
            });
        }
        return fromTree(accepted, type);
    }
    
    public <T> T fromTree(JsonNode tree, Class<T> type) {
        try {
            return objectMapper.treeToValue(tree, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException(ErrorCode.SERIALIZATION_ERROR, 500,
                "Cannot read " + type.getSimpleName() + ": " + e.getOriginalMessage());
        }
    }
    
    public String toPrettyJson(Object value) {
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException(ErrorCode.SERIALIZATION_ERROR, 500,
                "Cannot render JSON: " + e.getOriginalMessage());
        }
    }
}
