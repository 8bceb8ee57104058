package io.benchmesh.model;

import java.util.List;

public record TurnResult(
        String turnId,
        Intent intent,
        DesignDocument document,
        Constraints constraints,
        long version,
        ValidationSummary validation,
        List<Variation> variations,
        List<Conflict> conflicts,
        List<Conflict> resolved,
        List<String> plan,
        List<String> reasoning
) {
    public TurnResult {
        variations = variations == null ? List.of() : List.copyOf(variations);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        resolved = resolved == null ? List.of() : List.copyOf(resolved);
        plan = plan == null ? List.of() : List.copyOf(plan);
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
    }
}
