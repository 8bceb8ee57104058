package io.benchmesh.state;

import com.fasterxml.jackson.databind.JsonNode;
import io.benchmesh.model.Decision;
import io.benchmesh.model.ValidationOutcome;
import io.benchmesh.util.DocumentPaths;
import io.benchmesh.util.Jsons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Set of writes applied by one transaction. Patches are flattened to leaf paths; a later write to
 * the same leaf replaces the earlier one.
 */
public final class StateUpdate {
    public static final String DESIGN = "design";
    public static final String CONSTRAINTS = "constraints";

    private final Map<String, JsonNode> writes = new LinkedHashMap<>();
    private final List<Decision> decisions = new ArrayList<>();
    private final Map<String, ValidationOutcome> validations = new LinkedHashMap<>();
    private String reason = "";

    public static StateUpdate create() {
        return new StateUpdate();
    }

    public StateUpdate reason(String value) {
        this.reason = value == null ? "" : value;
        return this;
    }

    public StateUpdate design(String path, JsonNode value) {
        DocumentPaths.flatten(DocumentPaths.join(DESIGN, path), value, writes);
        return this;
    }

    public StateUpdate design(String path, Object value) {
        return design(path, Jsons.tree(value));
    }

    public StateUpdate designPatch(JsonNode partial) {
        requireObject(partial);
        if (partial.size() > 0) {
            DocumentPaths.flatten(DESIGN, partial, writes);
        }
        return this;
    }

    public StateUpdate constraint(String path, JsonNode value) {
        DocumentPaths.flatten(DocumentPaths.join(CONSTRAINTS, path), value, writes);
        return this;
    }

    public StateUpdate constraintsPatch(JsonNode partial) {
        requireObject(partial);
        if (partial.size() > 0) {
            DocumentPaths.flatten(CONSTRAINTS, partial, writes);
        }
        return this;
    }

    public StateUpdate decision(Decision decision) {
        if (decision != null) {
            decisions.add(decision);
        }
        return this;
    }

    public StateUpdate validation(String worker, ValidationOutcome outcome) {
        if (worker != null && outcome != null) {
            validations.put(worker, outcome);
        }
        return this;
    }

    public Map<String, JsonNode> writes() {
        return Collections.unmodifiableMap(writes);
    }

    public List<Decision> decisions() {
        return List.copyOf(decisions);
    }

    public Map<String, ValidationOutcome> validations() {
        return Collections.unmodifiableMap(validations);
    }

    public String reason() {
        return reason;
    }

    public boolean isEmpty() {
        return writes.isEmpty() && decisions.isEmpty() && validations.isEmpty();
    }

    private static void requireObject(JsonNode partial) {
        if (partial == null || !partial.isObject()) {
            throw new IllegalArgumentException("patch must be a JSON object");
        }
    }
}
