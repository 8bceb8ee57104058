package io.benchmesh.state;

import io.benchmesh.model.ChangeRecord;

import java.util.List;

@FunctionalInterface
public interface StateListener {
    void onChange(StateSnapshot snapshot, List<ChangeRecord> changes);
}
