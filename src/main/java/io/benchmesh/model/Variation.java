package io.benchmesh.model;

public record Variation(
        Kind kind,
        String description,
        DesignDocument document
) {
    public enum Kind {
        ALTERNATE_MATERIAL,
        ADDED_FEATURE,
        ALTERNATE_PROPORTIONS
    }
}
