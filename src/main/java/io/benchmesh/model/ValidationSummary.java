package io.benchmesh.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ValidationSummary(
        boolean valid,
        double score,
        List<ValidationIssue> issues,
        List<String> suggestions,
        Map<String, ValidationOutcome> validators
) {
    public ValidationSummary {
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        validators = validators == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(validators));
    }
}
