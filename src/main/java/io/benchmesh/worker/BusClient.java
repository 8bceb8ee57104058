package io.benchmesh.worker;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Bus handle given to a worker while it handles a message. Queries issued through it carry the
 * caller chain of the message being handled, so re-entrant queries are rejected.
 */
public interface BusClient {
    CompletableFuture<JsonNode> query(String toWorker, JsonNode payload);

    void broadcast(String topic, JsonNode data);
}
