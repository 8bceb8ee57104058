package io.benchmesh.state;

import io.benchmesh.model.Constraints;
import io.benchmesh.model.Decision;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.ValidationOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record StateSnapshot(
        DesignDocument document,
        Constraints constraints,
        long version,
        Map<String, Decision> decisions,
        Map<String, ValidationOutcome> validations
) {
    public StateSnapshot {
        decisions = decisions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(decisions));
        validations = validations == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(validations));
    }
}
