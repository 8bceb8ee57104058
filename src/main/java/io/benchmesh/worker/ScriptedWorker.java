package io.benchmesh.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.model.Intent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker that replays proposals from a JSON script. The last scripted proposal repeats once the
 * list is exhausted.
 *
 * <pre>
 * {"name": "dimension", "intents": ["design_initiation"], "decisionType": "dimensions",
 *  "proposals": [{"dimensions": {"width": 48}}], "revisions": [...], "constraints": {...},
 *  "topics": ["conflict_resolved"], "vote": "material", "fail": "boom"}
 * </pre>
 */
public final class ScriptedWorker implements Worker {
    private final String name;
    private final Set<Intent> intents;
    private final String decisionType;
    private final List<ObjectNode> proposals;
    private final List<ObjectNode> revisions;
    private final ObjectNode constraints;
    private final List<String> topics;
    private final String vote;
    private final String failure;
    private final AtomicInteger proposeCalls = new AtomicInteger();
    private final AtomicInteger reviseCalls = new AtomicInteger();
    private final List<String> receivedTopics = Collections.synchronizedList(new ArrayList<>());

    public ScriptedWorker(
            String name,
            Set<Intent> intents,
            String decisionType,
            List<ObjectNode> proposals,
            List<ObjectNode> revisions,
            ObjectNode constraints,
            List<String> topics,
            String vote,
            String failure
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("scripted worker name cannot be empty");
        }
        this.name = name;
        this.intents = intents == null || intents.isEmpty() ? EnumSet.allOf(Intent.class) : EnumSet.copyOf(intents);
        this.decisionType = decisionType;
        this.proposals = copyAll(proposals);
        this.revisions = copyAll(revisions);
        this.constraints = constraints == null ? null : constraints.deepCopy();
        this.topics = topics == null ? List.of() : List.copyOf(topics);
        this.vote = vote == null || vote.isBlank() ? null : vote;
        this.failure = failure == null || failure.isBlank() ? null : failure;
    }

    public static ScriptedWorker fromJson(JsonNode definition) {
        if (definition == null || !definition.isObject()) {
            throw new IllegalArgumentException("scripted worker definition must be a JSON object");
        }
        Set<Intent> intents = EnumSet.noneOf(Intent.class);
        definition.path("intents").forEach(item -> intents.add(Intent.fromString(item.asText())));
        List<String> topics = new ArrayList<>();
        definition.path("topics").forEach(item -> topics.add(item.asText()));
        return new ScriptedWorker(
                definition.path("name").asText(null),
                intents,
                definition.path("decisionType").asText(null),
                objects(definition.get("proposals")),
                objects(definition.get("revisions")),
                definition.get("constraints") instanceof ObjectNode node ? node : null,
                topics,
                definition.path("vote").asText(null),
                definition.path("fail").asText(null)
        );
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean canHandle(Intent intent) {
        return intents.contains(intent);
    }

    @Override
    public List<String> topics() {
        return topics;
    }

    @Override
    public Proposal propose(WorkerInput input, WorkerContext context) {
        if (failure != null) {
            throw new IllegalStateException(failure);
        }
        ObjectNode data;
        if (input.isRevision() && !revisions.isEmpty()) {
            data = pick(revisions, reviseCalls.getAndIncrement());
        } else {
            data = pick(proposals, proposeCalls.getAndIncrement());
        }
        String reasoning = input.isRevision()
                ? name + " revised its proposal after: " + String.join("; ", input.issues())
                : name + " proposed from script";
        return new Proposal(true, decisionType, data, constraints, null, null, null, null, reasoning, 0.9, false);
    }

    @Override
    public Optional<String> vote(String issue, Map<String, JsonNode> candidates) {
        if (vote == null || !candidates.containsKey(vote)) {
            return Optional.empty();
        }
        return Optional.of(vote);
    }

    @Override
    public void onBroadcast(String topic, JsonNode data, String fromWorker) {
        receivedTopics.add(topic);
    }

    public List<String> receivedTopics() {
        synchronized (receivedTopics) {
            return List.copyOf(receivedTopics);
        }
    }

    public int proposeCalls() {
        return proposeCalls.get() + reviseCalls.get();
    }

    private static ObjectNode pick(List<ObjectNode> values, int index) {
        if (values.isEmpty()) {
            return null;
        }
        return values.get(Math.min(index, values.size() - 1)).deepCopy();
    }

    private static List<ObjectNode> copyAll(List<ObjectNode> values) {
        List<ObjectNode> out = new ArrayList<>();
        if (values != null) {
            values.forEach(v -> out.add(v.deepCopy()));
        }
        return List.copyOf(out);
    }

    private static List<ObjectNode> objects(JsonNode node) {
        List<ObjectNode> out = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> {
                if (item instanceof ObjectNode object) {
                    out.add(object);
                }
            });
        }
        return out;
    }
}
