package io.benchmesh.bus;

final class WorkerMetrics {
    private long totalQueries;
    private long successes;
    private long cacheHits;
    private long fallbacks;
    private double avgResponseMs;
    private long lastUpdatedMs;

    synchronized void record(boolean success, long latencyMs, long nowMs) {
        totalQueries++;
        if (success) {
            successes++;
        }
        avgResponseMs += (Math.max(0L, latencyMs) - avgResponseMs) / totalQueries;
        lastUpdatedMs = nowMs;
    }

    synchronized void cacheHit(long nowMs) {
        cacheHits++;
        lastUpdatedMs = nowMs;
    }

    synchronized void fallback(long nowMs) {
        fallbacks++;
        lastUpdatedMs = nowMs;
    }

    synchronized BusStatus.WorkerStats view() {
        double successRate = totalQueries == 0 ? 1.0 : (double) successes / totalQueries;
        return new BusStatus.WorkerStats(totalQueries, successRate, avgResponseMs, cacheHits, fallbacks, lastUpdatedMs);
    }
}
