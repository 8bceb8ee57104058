package io.benchmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW("low", 0),
    MEDIUM("medium", 1),
    HIGH("high", 2);

    private final String label;
    private final int rank;

    Severity(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int rank() {
        return rank;
    }

    @JsonCreator
    public static Severity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return LOW;
        }
        for (Severity value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.label.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + raw);
    }
}
