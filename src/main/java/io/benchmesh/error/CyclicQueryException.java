package io.benchmesh.error;

public final class CyclicQueryException extends BenchMeshException {
    public CyclicQueryException(String from, String to) {
        super("Cyclic query detected: " + from + " -> " + to);
    }
}
