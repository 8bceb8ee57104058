package io.benchmesh.bus;

import com.fasterxml.jackson.databind.JsonNode;
import io.benchmesh.util.Jsons;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL cache of query results keyed by sender, target and canonical payload.
 */
final class QueryCache {
    private final long ttlMs;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    QueryCache(long ttlMs) {
        this.ttlMs = Math.max(0L, ttlMs);
    }

    static String key(String from, String to, JsonNode payload) {
        return from + "->" + to + ":" + Jsons.canonical(payload);
    }

    Optional<JsonNode> get(String key, long nowMs) {
        if (ttlMs == 0L) {
            return Optional.empty();
        }
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (nowMs >= entry.expiresAtMs()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value().deepCopy());
    }

    void put(String key, JsonNode value, long nowMs) {
        if (ttlMs == 0L || value == null) {
            return;
        }
        entries.put(key, new Entry(value.deepCopy(), nowMs + ttlMs));
    }

    int cleanup(long nowMs) {
        int before = entries.size();
        entries.values().removeIf(entry -> nowMs >= entry.expiresAtMs());
        return before - entries.size();
    }

    int size() {
        return entries.size();
    }

    private record Entry(JsonNode value, long expiresAtMs) {
    }
}
