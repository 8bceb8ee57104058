package io.benchmesh.state;

import io.benchmesh.model.ChangeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Coalesces change records committed within one window into a single event per subscriber.
 * Records keep commit order inside a batch.
 */
final class NotificationBatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationBatcher.class);

    private final long windowMs;
    private final Supplier<StateSnapshot> snapshotSupplier;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Subscription> subscribers = new LinkedHashMap<>();
    private final List<ChangeRecord> pending = new ArrayList<>();
    private ScheduledFuture<?> scheduled;
    private boolean closed;

    NotificationBatcher(long windowMs, Supplier<StateSnapshot> snapshotSupplier) {
        this.windowMs = Math.max(0L, windowMs);
        this.snapshotSupplier = snapshotSupplier;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "benchmesh-state-notify");
            t.setDaemon(true);
            return t;
        });
    }

    synchronized Runnable subscribe(String id, StateListener listener, Predicate<ChangeRecord> filter) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("subscriber id cannot be empty");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        Subscription subscription = new Subscription(id, listener, filter);
        subscribers.put(id, subscription);
        return () -> unsubscribe(subscription);
    }

    synchronized int subscriberCount() {
        return subscribers.size();
    }

    synchronized void enqueue(List<ChangeRecord> changes) {
        if (closed || changes.isEmpty() || subscribers.isEmpty()) {
            return;
        }
        pending.addAll(changes);
        if (scheduled == null) {
            scheduled = scheduler.schedule(this::flush, windowMs, TimeUnit.MILLISECONDS);
        }
    }

    void flush() {
        List<ChangeRecord> batch;
        List<Subscription> targets;
        synchronized (this) {
            scheduled = null;
            if (pending.isEmpty()) {
                return;
            }
            batch = List.copyOf(pending);
            pending.clear();
            targets = List.copyOf(subscribers.values());
        }
        StateSnapshot snapshot = snapshotSupplier.get();
        for (Subscription subscription : targets) {
            try {
                List<ChangeRecord> filtered = subscription.select(batch);
                if (filtered.isEmpty()) {
                    continue;
                }
                subscription.listener().onChange(snapshot, filtered);
            } catch (RuntimeException e) {
                log.warn("State subscriber {} failed: {}", subscription.id(), e.getMessage(), e);
            }
        }
    }

    private synchronized void unsubscribe(Subscription subscription) {
        subscribers.remove(subscription.id(), subscription);
    }

    @Override
    public void close() {
        synchronized (this) {
            closed = true;
            if (scheduled != null) {
                scheduled.cancel(false);
                scheduled = null;
            }
        }
        flush();
        scheduler.shutdownNow();
    }

    private record Subscription(String id, StateListener listener, Predicate<ChangeRecord> filter) {
        List<ChangeRecord> select(List<ChangeRecord> batch) {
            if (filter == null) {
                return batch;
            }
            List<ChangeRecord> out = new ArrayList<>();
            for (ChangeRecord record : batch) {
                if (filter.test(record)) {
                    out.add(record);
                }
            }
            return out;
        }
    }
}
