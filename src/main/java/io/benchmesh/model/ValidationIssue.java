package io.benchmesh.model;

public record ValidationIssue(
        String rule,
        Severity severity,
        String message
) {
}
