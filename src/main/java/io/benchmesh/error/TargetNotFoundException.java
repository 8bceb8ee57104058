package io.benchmesh.error;

public final class TargetNotFoundException extends BenchMeshException {
    private final String target;

    public TargetNotFoundException(String target) {
        super("Target worker not registered: " + target);
        this.target = target;
    }

    public String target() {
        return target;
    }
}
