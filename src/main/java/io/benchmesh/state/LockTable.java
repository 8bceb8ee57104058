package io.benchmesh.state;

import io.benchmesh.util.DocumentPaths;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Path-scoped locks with a fixed TTL. Expired entries are purged lazily on every access.
 * Callers hold the store monitor.
 */
final class LockTable {
    private final Map<String, PropertyLock> locks = new LinkedHashMap<>();

    List<PropertyLock> active(long nowMs) {
        purgeExpired(nowMs);
        return List.copyOf(locks.values());
    }

    /**
     * Conflicts for writing {@code paths}. Locks held by {@code writer} are skipped unless
     * {@code writer} is null.
     */
    List<TransactionConflict> conflictsFor(Collection<String> paths, String writer, long nowMs) {
        purgeExpired(nowMs);
        List<TransactionConflict> out = new ArrayList<>();
        for (String path : paths) {
            for (PropertyLock lock : locks.values()) {
                if (writer != null && writer.equals(lock.owner())) {
                    continue;
                }
                if (covers(lock, path)) {
                    out.add(TransactionConflict.propertyLocked(path, lock));
                    break;
                }
            }
        }
        return out;
    }

    PropertyLock add(String id, String owner, List<String> paths, long nowMs, long ttlMs) {
        PropertyLock lock = new PropertyLock(id, owner, paths, nowMs, nowMs + ttlMs);
        locks.put(id, lock);
        return lock;
    }

    boolean release(String lockId, long nowMs) {
        purgeExpired(nowMs);
        if (lockId == null) {
            return false;
        }
        return locks.remove(lockId) != null;
    }

    void clear() {
        locks.clear();
    }

    private void purgeExpired(long nowMs) {
        Iterator<PropertyLock> it = locks.values().iterator();
        while (it.hasNext()) {
            if (it.next().expiredAt(nowMs)) {
                it.remove();
            }
        }
    }

    private static boolean covers(PropertyLock lock, String path) {
        for (String locked : lock.paths()) {
            if (DocumentPaths.overlaps(locked, path)) {
                return true;
            }
        }
        return false;
    }
}
