package io.benchmesh.bus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record BusStatus(
        List<String> registeredWorkers,
        int queueDepth,
        int pendingQueries,
        int cacheSize,
        long deadLetterTotal,
        List<DeadLetter> recentDeadLetters,
        Map<String, WorkerStats> workerMetrics
) {
    public BusStatus {
        registeredWorkers = registeredWorkers == null ? List.of() : List.copyOf(registeredWorkers);
        recentDeadLetters = recentDeadLetters == null ? List.of() : List.copyOf(recentDeadLetters);
        workerMetrics = workerMetrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(workerMetrics));
    }

    public record WorkerStats(
            long totalQueries,
            double successRate,
            double avgResponseMs,
            long cacheHits,
            long fallbacks,
            long lastUpdatedMs
    ) {
    }
}
