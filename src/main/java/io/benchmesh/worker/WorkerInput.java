package io.benchmesh.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Intent;
import io.benchmesh.util.Jsons;

import java.util.ArrayList;
import java.util.List;

/**
 * What a worker sees when asked to propose: the user text, the current design and constraints,
 * and the constraints implied by workers that already ran in this turn.
 */
public record WorkerInput(
        String turnId,
        Intent intent,
        String text,
        DesignDocument document,
        Constraints constraints,
        ObjectNode turnConstraints,
        List<String> issues
) {
    public static final String PROPOSE = "propose";
    public static final String REVISE = "revise";

    public WorkerInput {
        intent = intent == null ? Intent.CLARIFICATION_NEEDED : intent;
        text = text == null ? "" : text;
        document = document == null ? DesignDocument.empty() : document;
        constraints = constraints == null ? Constraints.defaults() : constraints;
        turnConstraints = turnConstraints == null ? Jsons.object() : turnConstraints.deepCopy();
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    @Override
    public ObjectNode turnConstraints() {
        return turnConstraints.deepCopy();
    }

    public boolean isRevision() {
        return !issues.isEmpty();
    }

    public ObjectNode toPayload() {
        ObjectNode payload = Jsons.object();
        payload.put("type", isRevision() ? REVISE : PROPOSE);
        payload.put("turnId", turnId);
        payload.put("intent", intent.label());
        payload.put("input", text);
        payload.set("document", document.toJson());
        payload.set("constraints", constraints.toJson());
        payload.set("turnConstraints", turnConstraints.deepCopy());
        if (isRevision()) {
            ArrayNode list = payload.putArray("issues");
            issues.forEach(list::add);
        }
        return payload;
    }

    public static WorkerInput fromPayload(JsonNode payload) {
        List<String> issues = new ArrayList<>();
        JsonNode rawIssues = payload.path("issues");
        if (rawIssues.isArray()) {
            rawIssues.forEach(item -> issues.add(item.asText()));
        }
        JsonNode turnConstraints = payload.get("turnConstraints");
        return new WorkerInput(
                payload.path("turnId").asText(null),
                Intent.fromString(payload.path("intent").asText(null)),
                payload.path("input").asText(""),
                DesignDocument.of(payload.get("document")),
                payload.hasNonNull("constraints") ? Constraints.of(payload.get("constraints")) : null,
                turnConstraints != null && turnConstraints.isObject() ? (ObjectNode) turnConstraints : null,
                issues
        );
    }
}
