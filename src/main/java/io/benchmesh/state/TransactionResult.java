package io.benchmesh.state;

import io.benchmesh.model.ChangeRecord;

import java.util.List;

public record TransactionResult(
        boolean accepted,
        long newVersion,
        List<TransactionConflict> conflicts,
        List<ChangeRecord> changes
) {
    public TransactionResult {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static TransactionResult accepted(long newVersion, List<ChangeRecord> changes) {
        return new TransactionResult(true, newVersion, List.of(), changes);
    }

    public static TransactionResult rejected(long currentVersion, List<TransactionConflict> conflicts) {
        return new TransactionResult(false, currentVersion, conflicts, List.of());
    }

    public boolean hasConflict(TransactionConflict.Kind kind) {
        for (TransactionConflict conflict : conflicts) {
            if (conflict.kind() == kind) {
                return true;
            }
        }
        return false;
    }
}
