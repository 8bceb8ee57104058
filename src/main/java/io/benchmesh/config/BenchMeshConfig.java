package io.benchmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class BenchMeshConfig {
    public static final long DEFAULT_QUERY_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_CACHE_TTL_MS = 5L * 60L * 1000L;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_TICK_INTERVAL_MS = 100L;
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int DEFAULT_MAX_QUEUE_SIZE = 1_000;
    public static final int DEFAULT_DISPATCH_THREADS = 4;
    public static final long DEFAULT_VOTE_TIMEOUT_MS = 2_000L;
    public static final int DEFAULT_DEAD_LETTER_CAPACITY = 100;
    public static final long DEFAULT_LOCK_TTL_MS = 5_000L;
    public static final int DEFAULT_HISTORY_CAPACITY = 100;
    public static final int DEFAULT_SNAPSHOT_INTERVAL = 10;
    public static final int DEFAULT_SNAPSHOT_CAPACITY = 100;
    public static final long DEFAULT_NOTIFY_DEBOUNCE_MS = 50L;
    public static final int DEFAULT_MAX_RESOLUTION_PASSES = 3;
    public static final int DEFAULT_MAX_TRANSACT_RETRIES = 3;
    public static final long DEFAULT_TRANSACT_BACKOFF_MS = 25L;
    public static final int DEFAULT_MAX_VARIATIONS = 3;

    private final Path rootDir;

    public BenchMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static BenchMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new BenchMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve("benchmesh-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path knowledgeFile() {
        return rootDir.resolve("furniture-knowledge.json");
    }
}
