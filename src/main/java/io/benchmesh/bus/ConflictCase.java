package io.benchmesh.bus;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A disputed issue and the competing proposals, in submission order.
 */
public record ConflictCase(
        String type,
        String issue,
        Map<String, JsonNode> proposals
) {
    public ConflictCase {
        if (proposals == null || proposals.isEmpty()) {
            throw new IllegalArgumentException("conflict case requires at least one proposal");
        }
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : proposals.entrySet()) {
            copy.put(entry.getKey(), entry.getValue() == null ? null : entry.getValue().deepCopy());
        }
        proposals = Collections.unmodifiableMap(copy);
        issue = issue == null ? "" : issue;
    }

    public List<String> involvedWorkers() {
        return new ArrayList<>(proposals.keySet());
    }
}
