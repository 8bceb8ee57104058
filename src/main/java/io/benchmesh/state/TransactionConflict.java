package io.benchmesh.state;

public record TransactionConflict(
        Kind kind,
        String path,
        String owner,
        String message
) {
    public enum Kind {
        STALE_VERSION,
        PROPERTY_LOCKED,
        UNKNOWN_WRITER
    }

    public static TransactionConflict staleVersion(long expected, long actual) {
        return new TransactionConflict(Kind.STALE_VERSION, null, null,
                "stale version: expected " + expected + " but store is at " + actual);
    }

    public static TransactionConflict propertyLocked(String path, PropertyLock lock) {
        return new TransactionConflict(Kind.PROPERTY_LOCKED, path, lock.owner(),
                "property " + path + " is locked by " + lock.owner() + " (" + lock.id() + ")");
    }

    public static TransactionConflict unknownWriter(String worker) {
        return new TransactionConflict(Kind.UNKNOWN_WRITER, null, worker,
                "writer is not registered: " + worker);
    }
}
