package io.benchmesh.error;

public final class PayloadValidationException extends BenchMeshException {
    public PayloadValidationException(String target, String message) {
        super("Invalid payload for " + target + ": " + message);
    }
}
