package io.benchmesh.model;

import java.util.List;

public record ValidationOutcome(
        boolean valid,
        double score,
        List<ValidationIssue> issues,
        List<String> warnings,
        List<String> suggestions
) {
    public ValidationOutcome {
        score = Math.max(0.0, Math.min(1.0, score));
        issues = issues == null ? List.of() : List.copyOf(issues);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static ValidationOutcome passed(double score) {
        return new ValidationOutcome(true, score, List.of(), List.of(), List.of());
    }

    public static ValidationOutcome failure(String worker, String error) {
        String message = "Validation by " + worker + " failed: " + (error == null || error.isBlank() ? "unknown error" : error);
        return new ValidationOutcome(
                false,
                0.0,
                List.of(new ValidationIssue("validator_error", Severity.HIGH, message)),
                List.of(),
                List.of()
        );
    }
}
