package io.benchmesh.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Intent;
import io.benchmesh.model.Message;
import io.benchmesh.model.MessageKind;
import io.benchmesh.model.ValidationOutcome;
import io.benchmesh.util.Jsons;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface Worker {
    String VALIDATE = "validate";
    String VOTE = "vote";

    String name();

    boolean canHandle(Intent intent);

    Proposal propose(WorkerInput input, WorkerContext context) throws Exception;

    /**
     * Broadcast topics this worker subscribes to on registration.
     */
    default List<String> topics() {
        return List.of();
    }

    /**
     * Query type to required payload fields. Queries whose type is missing here are rejected
     * before dispatch.
     */
    default Map<String, List<String>> payloadSchema() {
        Map<String, List<String>> schema = new LinkedHashMap<>();
        schema.put(WorkerInput.PROPOSE, List.of("input", "document"));
        schema.put(WorkerInput.REVISE, List.of("input", "document", "issues"));
        schema.put(VALIDATE, List.of("document"));
        schema.put(VOTE, List.of("issue", "candidates"));
        return schema;
    }

    default ValidationOutcome validate(DesignDocument document, Constraints constraints) throws Exception {
        throw new UnsupportedOperationException("worker " + name() + " does not validate designs");
    }

    /**
     * Picks one candidate worker for a disputed issue, or abstains with an empty result.
     */
    default Optional<String> vote(String issue, Map<String, JsonNode> candidates) {
        return Optional.empty();
    }

    default void onBroadcast(String topic, JsonNode data, String fromWorker) {
    }

    default JsonNode handleMessage(Message message, WorkerContext context) throws Exception {
        JsonNode payload = message.payload();
        if (message.kind() == MessageKind.BROADCAST) {
            onBroadcast(payload.path("topic").asText(""), payload.get("data"), message.fromWorker());
            return null;
        }
        String type = message.payloadType();
        switch (type) {
            case WorkerInput.PROPOSE, WorkerInput.REVISE -> {
                return Jsons.tree(propose(WorkerInput.fromPayload(payload), context));
            }
            case VALIDATE -> {
                ValidationOutcome outcome = validate(
                        DesignDocument.of(payload.get("document")),
                        payload.hasNonNull("constraints") ? Constraints.of(payload.get("constraints")) : Constraints.defaults()
                );
                return Jsons.tree(outcome);
            }
            case VOTE -> {
                Map<String, JsonNode> candidates = new LinkedHashMap<>();
                payload.path("candidates").fields().forEachRemaining(e -> candidates.put(e.getKey(), e.getValue()));
                Optional<String> choice = vote(payload.path("issue").asText(""), candidates);
                ObjectNode out = Jsons.object();
                if (choice.isPresent() && candidates.containsKey(choice.get())) {
                    out.put("vote", choice.get());
                } else {
                    out.putNull("vote");
                }
                return out;
            }
            default -> throw new UnsupportedOperationException("worker " + name() + " cannot handle query type: " + type);
        }
    }
}
