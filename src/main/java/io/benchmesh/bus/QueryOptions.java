package io.benchmesh.bus;

import io.benchmesh.config.BenchMeshSettings;
import io.benchmesh.model.Priority;

public record QueryOptions(
        long timeoutMs,
        Priority priority,
        boolean allowFallback,
        boolean useCache
) {
    public QueryOptions {
        timeoutMs = Math.max(1L, timeoutMs);
        priority = priority == null ? Priority.NORMAL : priority;
    }

    public static QueryOptions defaults(BenchMeshSettings settings) {
        return new QueryOptions(settings.queryTimeoutMs(), Priority.NORMAL, true, true);
    }

    public QueryOptions withTimeoutMs(long value) {
        return new QueryOptions(value, priority, allowFallback, useCache);
    }

    public QueryOptions withPriority(Priority value) {
        return new QueryOptions(timeoutMs, value, allowFallback, useCache);
    }

    public QueryOptions withoutFallback() {
        return new QueryOptions(timeoutMs, priority, false, useCache);
    }

    public QueryOptions withoutCache() {
        return new QueryOptions(timeoutMs, priority, allowFallback, false);
    }
}
