package io.benchmesh.rules;

import io.benchmesh.model.Severity;

public enum RuleCategory {
    STRUCTURAL(Severity.HIGH),
    SAFETY(Severity.HIGH),
    COMPATIBILITY(Severity.MEDIUM),
    AESTHETIC(Severity.LOW);

    private final Severity severity;

    RuleCategory(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
