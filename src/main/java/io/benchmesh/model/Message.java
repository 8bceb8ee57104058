package io.benchmesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record Message(
        String id,
        String fromWorker,
        String toWorker,
        MessageKind kind,
        JsonNode payload,
        boolean requiresResponse,
        long timeoutMs,
        Priority priority,
        long createdAtMs,
        List<String> callChain
) {
    public static final String ALL = "*";

    public Message {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("message id cannot be empty");
        }
        if (kind == null) {
            throw new IllegalArgumentException("message kind cannot be null");
        }
        payload = payload == null ? null : payload.deepCopy();
        priority = priority == null ? Priority.NORMAL : priority;
        timeoutMs = Math.max(0L, timeoutMs);
        callChain = callChain == null ? List.of() : List.copyOf(callChain);
    }

    @Override
    public JsonNode payload() {
        return payload == null ? null : payload.deepCopy();
    }

    public String payloadType() {
        if (payload == null || !payload.isObject()) {
            return "";
        }
        return payload.path("type").asText("");
    }

    public boolean isBroadcast() {
        return ALL.equals(toWorker);
    }
}
