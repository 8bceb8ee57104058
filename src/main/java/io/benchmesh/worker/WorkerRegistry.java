package io.benchmesh.worker;

import io.benchmesh.error.DuplicateWorkerException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class WorkerRegistry {
    private final Map<String, Worker> workers = new ConcurrentHashMap<>();
    private final List<String> order = new ArrayList<>();

    public void register(Worker worker) {
        if (worker == null || worker.name() == null || worker.name().isBlank()) {
            throw new IllegalArgumentException("worker name cannot be empty");
        }
        synchronized (order) {
            if (workers.putIfAbsent(worker.name(), worker) != null) {
                throw new DuplicateWorkerException(worker.name());
            }
            order.add(worker.name());
        }
    }

    public Optional<Worker> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(workers.get(name));
    }

    public boolean isRegistered(String name) {
        return name != null && workers.containsKey(name);
    }

    /**
     * Names in registration order.
     */
    public List<String> names() {
        synchronized (order) {
            return List.copyOf(order);
        }
    }
}
