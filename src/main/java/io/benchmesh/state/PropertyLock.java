package io.benchmesh.state;

import java.util.List;

public record PropertyLock(
        String id,
        String owner,
        List<String> paths,
        long acquiredAtMs,
        long expiresAtMs
) {
    public PropertyLock {
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    public boolean expiredAt(long nowMs) {
        return nowMs >= expiresAtMs;
    }
}
