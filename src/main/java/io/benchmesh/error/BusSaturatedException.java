package io.benchmesh.error;

public final class BusSaturatedException extends BenchMeshException {
    public BusSaturatedException(int capacity) {
        super("Message queue is full (capacity " + capacity + ")");
    }
}
