package io.benchmesh.rules;

import io.benchmesh.model.Conflict;
import io.benchmesh.model.Severity;

import java.util.List;

public record RuleEvaluation(
        List<Conflict> conflicts,
        List<String> passed,
        List<String> suggestions
) {
    public RuleEvaluation {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        passed = passed == null ? List.of() : List.copyOf(passed);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public boolean hasBlocking() {
        for (Conflict conflict : conflicts) {
            if (conflict.severity() == Severity.HIGH) {
                return true;
            }
        }
        return false;
    }

    public double score() {
        return score(conflicts);
    }

    /**
     * 1.0 scaled down per conflict: x0.5 per high, x0.8 per medium, x0.95 per low.
     */
    public static double score(List<Conflict> conflicts) {
        double score = 1.0;
        for (Conflict conflict : conflicts) {
            score *= switch (conflict.severity()) {
                case HIGH -> 0.5;
                case MEDIUM -> 0.8;
                case LOW -> 0.95;
            };
        }
        return score;
    }

    public long count(Severity severity) {
        return conflicts.stream().filter(c -> c.severity() == severity).count();
    }
}
