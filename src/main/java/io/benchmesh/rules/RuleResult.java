package io.benchmesh.rules;

import io.benchmesh.model.DesignDocument;

import java.util.List;
import java.util.function.UnaryOperator;

public record RuleResult(
        boolean valid,
        String message,
        UnaryOperator<DesignDocument> fix,
        List<String> suggestions
) {
    public RuleResult {
        message = message == null ? "" : message;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static RuleResult pass(String message) {
        return new RuleResult(true, message, null, List.of());
    }

    public static RuleResult fail(String message, UnaryOperator<DesignDocument> fix, List<String> suggestions) {
        return new RuleResult(false, message, fix, suggestions);
    }
}
