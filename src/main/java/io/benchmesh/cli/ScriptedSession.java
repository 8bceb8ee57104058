package io.benchmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.config.BenchMeshSettings;
import io.benchmesh.coordinator.DesignSession;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Intent;
import io.benchmesh.model.TurnResult;
import io.benchmesh.observability.AuditLogger;
import io.benchmesh.rules.FurnitureKnowledge;
import io.benchmesh.util.Jsons;
import io.benchmesh.worker.ScriptedWorker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A design conversation read from a JSON file:
 *
 * <pre>
 * {"document": {"type": "bookshelf"},
 *  "constraints": {"dimensional": {"maxWidth": 40}},
 *  "workers": [{"name": "dimension", "proposals": [...]}],
 *  "turns": [{"intent": "design_initiation", "input": "a tall bookshelf"}]}
 * </pre>
 */
public record ScriptedSession(
        DesignDocument document,
        Constraints constraints,
        List<JsonNode> workers,
        List<Turn> turns
) {
    public ScriptedSession {
        document = document == null ? DesignDocument.empty() : document;
        constraints = constraints == null ? Constraints.defaults() : constraints;
        workers = workers == null ? List.of() : List.copyOf(workers);
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    public static ScriptedSession load(Path file) {
        try {
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read script: " + file, e);
        }
    }

    public static ScriptedSession parse(String json) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid script JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("script must be a JSON object");
        }
        Constraints constraints = Constraints.defaults();
        if (root.get("constraints") instanceof ObjectNode overrides) {
            ObjectNode merged = constraints.toJson();
            overrides.fields().forEachRemaining(e -> {
                if (merged.get(e.getKey()) instanceof ObjectNode section && e.getValue().isObject()) {
                    section.setAll((ObjectNode) e.getValue());
                } else {
                    merged.set(e.getKey(), e.getValue());
                }
            });
            constraints = Constraints.of(merged);
        }
        List<JsonNode> workers = new ArrayList<>();
        root.path("workers").forEach(workers::add);
        List<Turn> turns = new ArrayList<>();
        root.path("turns").forEach(turn -> turns.add(new Turn(
                Intent.fromString(turn.path("intent").asText(null)),
                turn.path("input").asText("")
        )));
        return new ScriptedSession(DesignDocument.of(root.get("document")), constraints, workers, turns);
    }

    public DesignSession open(BenchMeshSettings settings, AuditLogger auditLogger, FurnitureKnowledge knowledge) {
        DesignSession.Builder builder = DesignSession.builder()
                .settings(settings)
                .auditLogger(auditLogger)
                .knowledge(knowledge)
                .document(document)
                .constraints(constraints);
        for (JsonNode definition : workers) {
            builder.worker(ScriptedWorker.fromJson(definition));
        }
        return builder.build();
    }

    public List<TurnResult> run(DesignSession session) {
        List<TurnResult> results = new ArrayList<>();
        for (Turn turn : turns) {
            results.add(session.processTurn(turn.intent(), turn.input()));
        }
        return results;
    }

    public record Turn(Intent intent, String input) {
    }
}
