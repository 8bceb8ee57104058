package io.benchmesh.error;

public final class DuplicateWorkerException extends BenchMeshException {
    private final String worker;

    public DuplicateWorkerException(String worker) {
        super("Worker already registered: " + worker);
        this.worker = worker;
    }

    public String worker() {
        return worker;
    }
}
