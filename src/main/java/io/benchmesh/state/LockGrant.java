package io.benchmesh.state;

import java.util.List;

public record LockGrant(
        boolean granted,
        String lockId,
        long expiresAtMs,
        List<TransactionConflict> conflicts
) {
    public LockGrant {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static LockGrant granted(PropertyLock lock) {
        return new LockGrant(true, lock.id(), lock.expiresAtMs(), List.of());
    }

    public static LockGrant conflict(List<TransactionConflict> conflicts) {
        return new LockGrant(false, null, 0L, conflicts);
    }
}
