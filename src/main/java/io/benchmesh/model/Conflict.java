package io.benchmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Rule violation or write collision. Derived on every evaluation pass and never stored.
 */
public record Conflict(
        String type,
        Severity severity,
        List<String> involvedWorkers,
        String description,
        @JsonIgnore UnaryOperator<DesignDocument> autoFix
) {
    public Conflict {
        severity = severity == null ? Severity.LOW : severity;
        involvedWorkers = involvedWorkers == null ? List.of() : List.copyOf(involvedWorkers);
        description = description == null ? "" : description;
    }

    public static Conflict of(String type, Severity severity, List<String> involvedWorkers, String description) {
        return new Conflict(type, severity, involvedWorkers, description, null);
    }

    @JsonProperty("fixAvailable")
    public boolean fixAvailable() {
        return autoFix != null;
    }

    public Conflict withInvolvedWorkers(List<String> workers) {
        return new Conflict(type, severity, workers, description, autoFix);
    }
}
