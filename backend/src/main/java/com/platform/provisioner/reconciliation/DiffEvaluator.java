package com.platform.provisioner.reconciliation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.platform.provisioner.model.ResourcePayloads;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Decides whether a remote resource must be patched to match its desired state.
 * 
 * Only the fields present in the desired state are considered:
 * - scalars are compared by value, numbers numerically;
 * - objects are compared recursively, an absent observed object counting as empty;
 * - lists are compared by length only.
 */
@Component
public class DiffEvaluator {
    
    private final ResourcePayloads payloads;
    
    public DiffEvaluator(ResourcePayloads payloads) {
        this.payloads = payloads;
    }
    
    public boolean requiresPatch(Object observed, Object desired) {
        if (desired == null) {
            return false;
        }
        JsonNode observedTree = observed != null ? payloads.toTree(observed) : MissingNode.getInstance();
        return differs(observedTree, payloads.toTree(desired));
    }
    
    /**
     * True when some field of {@code desired} disagrees with {@code observed}.
     */
    public static boolean differs(JsonNode observed, JsonNode desired) {
        if (desired == null || desired.isNull() || desired.isMissingNode()) {
            return false;
        }
        if (!desired.isObject()) {
            return !sameValue(observed, desired);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = desired.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (fieldDiffers(observed == null ? MissingNode.getInstance() : observed.path(field.getKey()),
                    field.getValue())) {
                return true;
            }
        }
        return false;
    }
    
    private static boolean fieldDiffers(JsonNode observed, JsonNode desired) {
        if (desired.isNull()) {
            return false;
        }
        if (desired.isArray()) {
            int observedSize = observed.isArray() ? observed.size() : 0;
            return observedSize != desired.size();
        }
        if (desired.isObject()) {
            return differs(observed.isObject() ? observed : MissingNode.getInstance(), desired);
        }
        return !sameValue(observed, desired);
    }
    
    private static boolean sameValue(JsonNode observed, JsonNode desired) {
        if (observed == null || observed.isMissingNode() || observed.isNull()) {
            return false;
        }
        if (desired.isNumber() && observed.isNumber()) {
            return desired.decimalValue().compareTo(observed.decimalValue()) == 0;
        }
        return desired.equals(observed);
    }
}
