package io.benchmesh.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.config.BenchMeshSettings;
import io.benchmesh.error.SnapshotNotFoundException;
import io.benchmesh.model.ChangeRecord;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.Decision;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.ValidationOutcome;
import io.benchmesh.observability.AuditLogger;
import io.benchmesh.observability.Ids;
import io.benchmesh.util.DocumentPaths;
import io.benchmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Versioned design state for one session. Every mutation goes through {@link #transact}, which
 * serializes writers on the store monitor, checks the expected version and the lock table, and
 * applies all writes or none.
 */
public final class SharedStateStore implements AutoCloseable {
    public static final String SYSTEM_WRITER = "system";
    private static final Logger log = LoggerFactory.getLogger(SharedStateStore.class);

    private final BenchMeshSettings settings;
    private final Clock clock;
    private final Predicate<String> writerCheck;
    private final AuditLogger auditLogger;
    private final LockTable locks = new LockTable();
    private final ChangeHistory history;
    private final Map<Long, Snapshot> snapshots;
    private final NotificationBatcher notifier;

    private ObjectNode root;
    private final Map<String, Decision> decisions = new LinkedHashMap<>();
    private final Map<String, ValidationOutcome> validations = new LinkedHashMap<>();
    private final Map<String, String> lastWriters = new HashMap<>();
    private long version;

    public SharedStateStore(BenchMeshSettings settings, Clock clock) {
        this(DesignDocument.empty(), Constraints.defaults(), settings, clock, writer -> true, AuditLogger.disabled());
    }

    public SharedStateStore(
            DesignDocument initialDocument,
            Constraints initialConstraints,
            BenchMeshSettings settings,
            Clock clock,
            Predicate<String> writerCheck,
            AuditLogger auditLogger
    ) {
        this.settings = settings == null ? BenchMeshSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.writerCheck = writerCheck == null ? writer -> true : writerCheck;
        this.auditLogger = auditLogger == null ? AuditLogger.disabled() : auditLogger;
        this.history = new ChangeHistory(this.settings.historyCapacity());
        int snapshotCapacity = this.settings.snapshotCapacity();
        this.snapshots = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, Snapshot> eldest) {
                return size() > snapshotCapacity;
            }
        };
        this.root = Jsons.object();
        this.root.set(StateUpdate.DESIGN, (initialDocument == null ? DesignDocument.empty() : initialDocument).toJson());
        this.root.set(StateUpdate.CONSTRAINTS, (initialConstraints == null ? Constraints.defaults() : initialConstraints).toJson());
        this.version = 0L;
        this.notifier = new NotificationBatcher(this.settings.notifyDebounceMs(), this::read);
        captureSnapshotLocked();
    }

    public synchronized StateSnapshot read() {
        return new StateSnapshot(
                DesignDocument.of(root.get(StateUpdate.DESIGN)),
                Constraints.of(root.get(StateUpdate.CONSTRAINTS)),
                version,
                decisions,
                validations
        );
    }

    public synchronized long version() {
        return version;
    }

    public TransactionResult transact(String worker, StateUpdate update) {
        return transact(worker, update, null);
    }

    public synchronized TransactionResult transact(String worker, StateUpdate update, Long expectedVersion) {
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        if (worker == null || worker.isBlank() || !writerCheck.test(worker)) {
            log.debug("Rejected transaction from unknown writer {}", worker);
            return TransactionResult.rejected(version, List.of(TransactionConflict.unknownWriter(worker)));
        }
        for (Decision decision : update.decisions()) {
            if (!decision.worker().equals(worker) && !writerCheck.test(decision.worker())) {
                log.debug("Rejected transaction from {}: decision names unknown worker {}", worker, decision.worker());
                return TransactionResult.rejected(version, List.of(TransactionConflict.unknownWriter(decision.worker())));
            }
        }
        if (expectedVersion != null && expectedVersion != version) {
            log.debug("Rejected stale transaction from {}: expected={} current={}", worker, expectedVersion, version);
            return TransactionResult.rejected(version, List.of(TransactionConflict.staleVersion(expectedVersion, version)));
        }
        long nowMs = clock.millis();
        List<TransactionConflict> lockConflicts = locks.conflictsFor(update.writes().keySet(), worker, nowMs);
        if (!lockConflicts.isEmpty()) {
            log.debug("Rejected transaction from {}: {} locked path(s)", worker, lockConflicts.size());
            return TransactionResult.rejected(version, lockConflicts);
        }

        List<ChangeRecord> changes = new ArrayList<>();
        for (Map.Entry<String, JsonNode> write : update.writes().entrySet()) {
            String path = write.getKey();
            // A write below a scalar replaces it; record the change at that ancestor.
            String replaced = DocumentPaths.replacedAncestor(root, path);
            String recorded = replaced == null ? path : replaced;
            JsonNode previous = DocumentPaths.get(root, recorded);
            JsonNode next = write.getValue();
            if (replaced == null && previous != null && previous.equals(next)) {
                continue;
            }
            DocumentPaths.set(root, path, next.deepCopy());
            lastWriters.put(recorded, worker);
            JsonNode recordedValue = replaced == null ? next : DocumentPaths.get(root, replaced).deepCopy();
            changes.add(new ChangeRecord(worker, clock.instant(), recorded, previous, recordedValue, update.reason()));
        }
        for (Decision decision : update.decisions()) {
            Decision previous = decisions.remove(decision.key());
            decisions.put(decision.key(), decision);
            changes.add(new ChangeRecord(
                    worker,
                    clock.instant(),
                    "decisions." + decision.key(),
                    previous == null ? null : previous.value(),
                    decision.value(),
                    decision.reasoning()
            ));
        }
        for (Map.Entry<String, ValidationOutcome> entry : update.validations().entrySet()) {
            ValidationOutcome previous = validations.put(entry.getKey(), entry.getValue());
            changes.add(new ChangeRecord(
                    worker,
                    clock.instant(),
                    "validations." + entry.getKey(),
                    previous == null ? null : Jsons.tree(previous),
                    Jsons.tree(entry.getValue()),
                    update.reason()
            ));
        }
        changes.forEach(history::append);
        version++;
        if (version % settings.snapshotInterval() == 0) {
            captureSnapshotLocked();
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "state.transact",
                worker,
                "state/v" + version,
                "accepted",
                null,
                Map.of(
                        "version", version,
                        "changes", changes.size(),
                        "reason", update.reason()
                )
        ));
        notifier.enqueue(changes);
        return TransactionResult.accepted(version, changes);
    }

    public synchronized LockGrant acquireLock(String worker, Collection<String> propertyPaths) {
        if (worker == null || worker.isBlank()) {
            throw new IllegalArgumentException("lock owner cannot be empty");
        }
        if (propertyPaths == null || propertyPaths.isEmpty()) {
            throw new IllegalArgumentException("lock requires at least one property path");
        }
        List<String> paths = new ArrayList<>(new LinkedHashSet<>(propertyPaths));
        paths.forEach(DocumentPaths::split);
        long nowMs = clock.millis();
        List<TransactionConflict> conflicts = locks.conflictsFor(paths, null, nowMs);
        if (!conflicts.isEmpty()) {
            return LockGrant.conflict(conflicts);
        }
        PropertyLock lock = locks.add(Ids.newLockId(), worker, paths, nowMs, settings.lockTtlMs());
        log.debug("Lock {} granted to {} on {}", lock.id(), worker, paths);
        return LockGrant.granted(lock);
    }

    public synchronized boolean releaseLock(String lockId) {
        return locks.release(lockId, clock.millis());
    }

    public synchronized List<PropertyLock> activeLocks() {
        return locks.active(clock.millis());
    }

    public synchronized StateSnapshot rollbackTo(long targetVersion) {
        Snapshot snapshot = snapshots.get(targetVersion);
        if (snapshot == null) {
            throw new SnapshotNotFoundException(targetVersion);
        }
        long from = version;
        root = snapshot.root().deepCopy();
        decisions.clear();
        decisions.putAll(snapshot.decisions());
        validations.clear();
        validations.putAll(snapshot.validations());
        lastWriters.clear();
        lastWriters.putAll(snapshot.lastWriters());
        version = snapshot.version();
        snapshots.keySet().removeIf(v -> v > targetVersion);
        locks.clear();
        ChangeRecord record = new ChangeRecord(
                SYSTEM_WRITER,
                clock.instant(),
                "*",
                Jsons.tree(from),
                Jsons.tree(targetVersion),
                "rollback to version " + targetVersion
        );
        history.append(record);
        log.info("Rolled back state from version {} to {}", from, targetVersion);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "state.rollback",
                SYSTEM_WRITER,
                "state/v" + targetVersion,
                "ok",
                null,
                Map.of("from_version", from, "to_version", targetVersion)
        ));
        notifier.enqueue(List.of(record));
        return read();
    }

    /**
     * Takes an out-of-cycle snapshot at the current version and returns that version.
     */
    public synchronized long captureSnapshot() {
        captureSnapshotLocked();
        return version;
    }

    public synchronized List<Long> snapshotVersions() {
        return List.copyOf(snapshots.keySet());
    }

    public Runnable subscribe(String id, StateListener listener) {
        return notifier.subscribe(id, listener, null);
    }

    public Runnable subscribe(String id, StateListener listener, Predicate<ChangeRecord> filter) {
        return notifier.subscribe(id, listener, filter);
    }

    public synchronized List<ChangeRecord> history() {
        return history.all();
    }

    public synchronized List<ChangeRecord> history(String worker) {
        return history.byWorker(worker);
    }

    /**
     * Workers that last wrote any of {@code paths} or a path below them, in first-seen order.
     */
    public synchronized List<String> lastWriters(Collection<String> paths) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String path : paths) {
            for (Map.Entry<String, String> entry : lastWriters.entrySet()) {
                if (DocumentPaths.overlaps(path, entry.getKey())) {
                    out.add(entry.getValue());
                }
            }
        }
        return List.copyOf(out);
    }

    public synchronized Optional<Decision> decision(String worker, String decisionType) {
        return Optional.ofNullable(decisions.get(Decision.key(worker, decisionType)));
    }

    /**
     * Most recent decision recorded by {@code worker}, whatever its type.
     */
    public synchronized Optional<Decision> lastDecisionOf(String worker) {
        Decision last = null;
        for (Decision decision : decisions.values()) {
            if (decision.worker().equals(worker)) {
                last = decision;
            }
        }
        return Optional.ofNullable(last);
    }

    @Override
    public void close() {
        notifier.close();
    }

    void flushNotifications() {
        notifier.flush();
    }

    private void captureSnapshotLocked() {
        snapshots.put(version, new Snapshot(
                version,
                root.deepCopy(),
                new LinkedHashMap<>(decisions),
                new LinkedHashMap<>(validations),
                new HashMap<>(lastWriters)
        ));
    }

    private record Snapshot(
            long version,
            ObjectNode root,
            Map<String, Decision> decisions,
            Map<String, ValidationOutcome> validations,
            Map<String, String> lastWriters
    ) {
    }
}
