package io.benchmesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record Decision(
        String worker,
        String decisionType,
        JsonNode value,
        String reasoning,
        double confidence,
        List<String> alternativesConsidered,
        long decidedAtMs
) {
    public Decision {
        if (worker == null || worker.isBlank()) {
            throw new IllegalArgumentException("decision worker cannot be empty");
        }
        if (decisionType == null || decisionType.isBlank()) {
            throw new IllegalArgumentException("decision type cannot be empty");
        }
        value = value == null ? null : value.deepCopy();
        reasoning = reasoning == null ? "" : reasoning;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        alternativesConsidered = alternativesConsidered == null ? List.of() : List.copyOf(alternativesConsidered);
    }

    @Override
    public JsonNode value() {
        return value == null ? null : value.deepCopy();
    }

    public String key() {
        return key(worker, decisionType);
    }

    public static String key(String worker, String decisionType) {
        return worker + ":" + decisionType;
    }
}
