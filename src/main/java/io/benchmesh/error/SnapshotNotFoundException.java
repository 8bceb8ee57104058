package io.benchmesh.error;

public final class SnapshotNotFoundException extends BenchMeshException {
    private final long version;

    public SnapshotNotFoundException(long version) {
        super("No snapshot captured at version " + version);
        this.version = version;
    }

    public long version() {
        return version;
    }
}
