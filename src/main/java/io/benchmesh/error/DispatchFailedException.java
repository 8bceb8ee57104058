package io.benchmesh.error;

public final class DispatchFailedException extends BenchMeshException {
    private final String target;
    private final int attempts;

    public DispatchFailedException(String target, int attempts, Throwable cause) {
        super("Dispatch to " + target + " failed after " + attempts + " attempts: "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.target = target;
        this.attempts = attempts;
    }

    public String target() {
        return target;
    }

    public int attempts() {
        return attempts;
    }
}
