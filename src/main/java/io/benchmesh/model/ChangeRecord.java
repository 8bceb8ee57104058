package io.benchmesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record ChangeRecord(
        String worker,
        Instant timestamp,
        String path,
        JsonNode previousValue,
        JsonNode newValue,
        String reason
) {
    public ChangeRecord {
        previousValue = previousValue == null ? null : previousValue.deepCopy();
        newValue = newValue == null ? null : newValue.deepCopy();
        reason = reason == null ? "" : reason;
    }

    @Override
    public JsonNode previousValue() {
        return previousValue == null ? null : previousValue.deepCopy();
    }

    @Override
    public JsonNode newValue() {
        return newValue == null ? null : newValue.deepCopy();
    }
}
