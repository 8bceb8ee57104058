package io.benchmesh.observability;

import io.benchmesh.bus.BusStatus;
import io.benchmesh.bus.DeadLetter;

import java.util.LinkedHashMap;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(BusStatus status) {
        return format(status, null);
    }

    public static String format(BusStatus status, String session) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "benchmesh_registered_workers", "Registered workers", null, null, status.registeredWorkers().size());
        appendGauge(sb, "benchmesh_queue_depth", "Messages waiting for dispatch", null, null, status.queueDepth());
        appendGauge(sb, "benchmesh_pending_queries", "Queries waiting for a response", null, null, status.pendingQueries());
        appendGauge(sb, "benchmesh_cache_entries", "Live query cache entries", null, null, status.cacheSize());
        appendGauge(sb, "benchmesh_dead_letter_total", "Messages dead-lettered after exhausting retries", null, null, status.deadLetterTotal());

        Map<String, Long> deadByTarget = new LinkedHashMap<>();
        for (DeadLetter letter : status.recentDeadLetters()) {
            deadByTarget.merge(letter.toWorker(), 1L, Long::sum);
        }
        appendMapGauge(sb, "benchmesh_recent_dead_letters", "Recent dead letters grouped by target worker", "worker", deadByTarget);

        Map<String, Long> queries = new LinkedHashMap<>();
        Map<String, Long> cacheHits = new LinkedHashMap<>();
        Map<String, Long> fallbacks = new LinkedHashMap<>();
        Map<String, Long> avgResponse = new LinkedHashMap<>();
        Map<String, Long> successPermille = new LinkedHashMap<>();
        for (Map.Entry<String, BusStatus.WorkerStats> entry : status.workerMetrics().entrySet()) {
            BusStatus.WorkerStats stats = entry.getValue();
            queries.put(entry.getKey(), stats.totalQueries());
            cacheHits.put(entry.getKey(), stats.cacheHits());
            fallbacks.put(entry.getKey(), stats.fallbacks());
            avgResponse.put(entry.getKey(), Math.round(stats.avgResponseMs()));
            successPermille.put(entry.getKey(), Math.round(stats.successRate() * 1000.0));
        }
        appendMapGauge(sb, "benchmesh_worker_queries_total", "Queries dispatched per worker", "worker", queries);
        appendMapGauge(sb, "benchmesh_worker_cache_hits_total", "Queries answered from cache per worker", "worker", cacheHits);
        appendMapGauge(sb, "benchmesh_worker_fallbacks_total", "Queries answered by a default provider per worker", "worker", fallbacks);
        appendMapGauge(sb, "benchmesh_worker_avg_response_ms", "Average response time per worker in milliseconds", "worker", avgResponse);
        appendMapGauge(sb, "benchmesh_worker_success_permille", "Successful queries per thousand per worker", "worker", successPermille);

        String base = sb.toString();
        String normalized = session == null ? "" : session.trim();
        if (normalized.isBlank()) {
            return base;
        }
        return base + "# HELP benchmesh_session_info Design session marker\n"
                + "# TYPE benchmesh_session_info gauge\n"
                + "benchmesh_session_info{session=\"" + escapeLabel(normalized) + "\"} 1\n";
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Long> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Long> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
