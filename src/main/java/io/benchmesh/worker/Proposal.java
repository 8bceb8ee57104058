package io.benchmesh.worker;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.util.Jsons;

import java.util.List;

/**
 * A worker's answer to a propose or revise query. {@code data} is a partial design document;
 * {@code constraints} are constraints the worker wants to add for later workers.
 */
public record Proposal(
        boolean success,
        String decisionType,
        ObjectNode data,
        ObjectNode constraints,
        List<String> suggestions,
        List<String> issues,
        List<String> nextSteps,
        List<String> alternatives,
        String reasoning,
        double confidence,
        boolean fallback
) {
    public Proposal {
        decisionType = decisionType == null || decisionType.isBlank() ? "proposal" : decisionType;
        data = data == null ? Jsons.object() : data.deepCopy();
        constraints = constraints == null ? Jsons.object() : constraints.deepCopy();
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        issues = issues == null ? List.of() : List.copyOf(issues);
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        reasoning = reasoning == null ? "" : reasoning;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    @Override
    public ObjectNode data() {
        return data.deepCopy();
    }

    @Override
    public ObjectNode constraints() {
        return constraints.deepCopy();
    }

    public static Proposal ok(ObjectNode data, String reasoning) {
        return new Proposal(true, null, data, null, null, null, null, null, reasoning, 0.8, false);
    }

    public static Proposal fail(String error) {
        return new Proposal(false, null, null, null, null, List.of(error == null ? "unknown error" : error), null, null, error, 0.0, false);
    }

    public Proposal withConstraints(ObjectNode value) {
        return new Proposal(success, decisionType, data, value, suggestions, issues, nextSteps, alternatives, reasoning, confidence, fallback);
    }

    public Proposal asFallback(String why) {
        return new Proposal(success, decisionType, data, constraints, suggestions, issues, nextSteps, alternatives, why, Math.min(confidence, 0.5), true);
    }
}
