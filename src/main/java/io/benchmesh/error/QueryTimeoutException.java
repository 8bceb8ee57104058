package io.benchmesh.error;

public final class QueryTimeoutException extends BenchMeshException {
    private final String target;
    private final long timeoutMs;

    public QueryTimeoutException(String target, long timeoutMs) {
        super("Query to " + target + " timed out after " + timeoutMs + "ms");
        this.target = target;
        this.timeoutMs = timeoutMs;
    }

    public String target() {
        return target;
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
