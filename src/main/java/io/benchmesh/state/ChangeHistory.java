package io.benchmesh.state;

import io.benchmesh.model.ChangeRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded ring of change records; the oldest entry is dropped once capacity is reached.
 */
final class ChangeHistory {
    private final int capacity;
    private final Deque<ChangeRecord> records;

    ChangeHistory(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.records = new ArrayDeque<>(this.capacity);
    }

    void append(ChangeRecord record) {
        if (records.size() == capacity) {
            records.removeFirst();
        }
        records.addLast(record);
    }

    List<ChangeRecord> all() {
        return List.copyOf(records);
    }

    List<ChangeRecord> byWorker(String worker) {
        List<ChangeRecord> out = new ArrayList<>();
        for (ChangeRecord record : records) {
            if (record.worker().equals(worker)) {
                out.add(record);
            }
        }
        return out;
    }

    int size() {
        return records.size();
    }

    int capacity() {
        return capacity;
    }
}
