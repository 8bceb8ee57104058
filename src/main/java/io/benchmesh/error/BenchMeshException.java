package io.benchmesh.error;

public class BenchMeshException extends RuntimeException {
    public BenchMeshException(String message) {
        super(message);
    }

    public BenchMeshException(String message, Throwable cause) {
        super(message, cause);
    }
}
