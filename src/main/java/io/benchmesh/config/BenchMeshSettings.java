package io.benchmesh.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record BenchMeshSettings(
        long queryTimeoutMs,
        long cacheTtlMs,
        int maxRetries,
        long tickIntervalMs,
        int batchSize,
        int maxQueueSize,
        int dispatchThreads,
        long voteTimeoutMs,
        int deadLetterCapacity,
        long lockTtlMs,
        int historyCapacity,
        int snapshotInterval,
        int snapshotCapacity,
        long notifyDebounceMs,
        int maxResolutionPasses,
        int maxTransactRetries,
        long transactBackoffMs,
        int maxVariations,
        Map<String, Integer> workerPriorities,
        Map<String, JsonNode> fallbacks,
        List<String> validators
) {
    public BenchMeshSettings {
        workerPriorities = workerPriorities == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(workerPriorities));
        Map<String, JsonNode> copied = new LinkedHashMap<>();
        if (fallbacks != null) {
            for (Map.Entry<String, JsonNode> entry : fallbacks.entrySet()) {
                JsonNode data = entry.getValue();
                copied.put(entry.getKey(), data == null ? null : data.deepCopy());
            }
        }
        fallbacks = Collections.unmodifiableMap(copied);
        validators = validators == null ? List.of() : List.copyOf(validators);
    }

    public static BenchMeshSettings defaults() {
        Map<String, Integer> priorities = new LinkedHashMap<>();
        priorities.put("validation", 3);
        priorities.put("material", 2);
        priorities.put("dimension", 2);
        priorities.put("joinery", 1);
        priorities.put("style", 0);

        Map<String, JsonNode> fallbacks = new LinkedHashMap<>();
        ObjectNode material = Jsons.object();
        material.putArray("materials").add("pine");
        fallbacks.put("material", material);
        ObjectNode dimension = Jsons.object();
        ObjectNode dims = dimension.putObject("dimensions");
        dims.put("width", 24);
        dims.put("height", 30);
        dims.put("depth", 18);
        fallbacks.put("dimension", dimension);

        return new BenchMeshSettings(
                BenchMeshConfig.DEFAULT_QUERY_TIMEOUT_MS,
                BenchMeshConfig.DEFAULT_CACHE_TTL_MS,
                BenchMeshConfig.DEFAULT_MAX_RETRIES,
                BenchMeshConfig.DEFAULT_TICK_INTERVAL_MS,
                BenchMeshConfig.DEFAULT_BATCH_SIZE,
                BenchMeshConfig.DEFAULT_MAX_QUEUE_SIZE,
                BenchMeshConfig.DEFAULT_DISPATCH_THREADS,
                BenchMeshConfig.DEFAULT_VOTE_TIMEOUT_MS,
                BenchMeshConfig.DEFAULT_DEAD_LETTER_CAPACITY,
                BenchMeshConfig.DEFAULT_LOCK_TTL_MS,
                BenchMeshConfig.DEFAULT_HISTORY_CAPACITY,
                BenchMeshConfig.DEFAULT_SNAPSHOT_INTERVAL,
                BenchMeshConfig.DEFAULT_SNAPSHOT_CAPACITY,
                BenchMeshConfig.DEFAULT_NOTIFY_DEBOUNCE_MS,
                BenchMeshConfig.DEFAULT_MAX_RESOLUTION_PASSES,
                BenchMeshConfig.DEFAULT_MAX_TRANSACT_RETRIES,
                BenchMeshConfig.DEFAULT_TRANSACT_BACKOFF_MS,
                BenchMeshConfig.DEFAULT_MAX_VARIATIONS,
                priorities,
                fallbacks,
                List.of("validation")
        );
    }

    public static BenchMeshSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            return fromJson(Files.readString(file));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    public static BenchMeshSettings fromJson(String json) {
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(json, SettingsFile.class);
            return fromFile(file, defaults());
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings JSON: " + e.getMessage(), e);
        }
    }

    static BenchMeshSettings fromFile(SettingsFile file, BenchMeshSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long queryTimeout = sanitizeLong(file.queryTimeoutMs(), defaults.queryTimeoutMs(), 1L);
        long tickInterval = sanitizeLong(file.tickIntervalMs(), defaults.tickIntervalMs(), 1L);
        long voteTimeout = sanitizeLong(file.voteTimeoutMs(), defaults.voteTimeoutMs(), 1L);
        if (voteTimeout > queryTimeout) {
            voteTimeout = queryTimeout;
        }
        Map<String, Integer> priorities = new LinkedHashMap<>(defaults.workerPriorities());
        if (file.workerPriorities() != null) {
            file.workerPriorities().forEach((name, value) -> {
                if (name != null && !name.isBlank() && value != null) {
                    priorities.put(name.trim(), value);
                }
            });
        }
        Map<String, JsonNode> fallbacks = new LinkedHashMap<>(defaults.fallbacks());
        if (file.fallbacks() != null) {
            file.fallbacks().forEach((name, data) -> {
                if (name == null || name.isBlank()) {
                    return;
                }
                if (data == null || data.isNull()) {
                    fallbacks.remove(name.trim());
                } else if (data.isObject()) {
                    fallbacks.put(name.trim(), data);
                }
            });
        }
        List<String> validators = defaults.validators();
        if (file.validators() != null) {
            List<String> cleaned = new ArrayList<>();
            for (String name : file.validators()) {
                if (name != null && !name.isBlank() && !cleaned.contains(name.trim())) {
                    cleaned.add(name.trim());
                }
            }
            validators = cleaned;
        }
        return new BenchMeshSettings(
                queryTimeout,
                sanitizeLong(file.cacheTtlMs(), defaults.cacheTtlMs(), 0L),
                sanitizeInt(file.maxRetries(), defaults.maxRetries(), 0),
                tickInterval,
                sanitizeInt(file.batchSize(), defaults.batchSize(), 1),
                sanitizeInt(file.maxQueueSize(), defaults.maxQueueSize(), 1),
                sanitizeInt(file.dispatchThreads(), defaults.dispatchThreads(), 1),
                voteTimeout,
                sanitizeInt(file.deadLetterCapacity(), defaults.deadLetterCapacity(), 1),
                sanitizeLong(file.lockTtlMs(), defaults.lockTtlMs(), 1L),
                sanitizeInt(file.historyCapacity(), defaults.historyCapacity(), 1),
                sanitizeInt(file.snapshotInterval(), defaults.snapshotInterval(), 1),
                sanitizeInt(file.snapshotCapacity(), defaults.snapshotCapacity(), 1),
                sanitizeLong(file.notifyDebounceMs(), defaults.notifyDebounceMs(), 0L),
                sanitizeInt(file.maxResolutionPasses(), defaults.maxResolutionPasses(), 1),
                sanitizeInt(file.maxTransactRetries(), defaults.maxTransactRetries(), 0),
                sanitizeLong(file.transactBackoffMs(), defaults.transactBackoffMs(), 0L),
                sanitizeInt(file.maxVariations(), defaults.maxVariations(), 0),
                priorities,
                fallbacks,
                validators
        );
    }

    public int priorityOf(String worker) {
        Integer value = workerPriorities.get(worker);
        return value == null ? 0 : value;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            Long queryTimeoutMs,
            Long cacheTtlMs,
            Integer maxRetries,
            Long tickIntervalMs,
            Integer batchSize,
            Integer maxQueueSize,
            Integer dispatchThreads,
            Long voteTimeoutMs,
            Integer deadLetterCapacity,
            Long lockTtlMs,
            Integer historyCapacity,
            Integer snapshotInterval,
            Integer snapshotCapacity,
            Long notifyDebounceMs,
            Integer maxResolutionPasses,
            Integer maxTransactRetries,
            Long transactBackoffMs,
            Integer maxVariations,
            Map<String, Integer> workerPriorities,
            Map<String, JsonNode> fallbacks,
            List<String> validators
    ) {
    }
}
