package io.benchmesh.bus;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Resolution(
        String winner,
        JsonNode proposal,
        Strategy strategy,
        Map<String, String> votes
) {
    public enum Strategy {
        PRIORITY,
        VOTE,
        FIRST_PROPOSAL
    }

    public Resolution {
        votes = votes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(votes));
    }
}
