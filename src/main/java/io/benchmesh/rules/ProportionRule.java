package io.benchmesh.rules;

import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;

import java.util.List;
import java.util.Locale;

/**
 * Flags extreme aspect ratios. Suggestion only.
 */
public final class ProportionRule implements Rule {
    static final double MAX_ASPECT = 8.0;

    @Override
    public String name() {
        return "proportion_balance";
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.AESTHETIC;
    }

    @Override
    public List<String> watchedPaths() {
        return List.of(DesignDocument.WIDTH, DesignDocument.HEIGHT, DesignDocument.DEPTH);
    }

    @Override
    public boolean appliesTo(DesignDocument document) {
        return positive(document.width()) && positive(document.height()) && positive(document.depth());
    }

    @Override
    public RuleResult evaluate(DesignDocument document, Constraints constraints) {
        double max = Math.max(document.width(), Math.max(document.height(), document.depth()));
        double min = Math.min(document.width(), Math.min(document.height(), document.depth()));
        double aspect = max / min;
        if (aspect <= MAX_ASPECT) {
            return RuleResult.pass(String.format(Locale.ROOT, "Balanced proportions (%.1f:1)", aspect));
        }
        return RuleResult.fail(
                String.format(Locale.ROOT, "Proportions look extreme (%.1f:1)", aspect),
                null,
                List.of("Consider bringing the longest dimension closer to " + ShelfDeflectionRule.fmt(Math.round(min * MAX_ASPECT)) + "\"")
        );
    }

    private static boolean positive(Double value) {
        return value != null && value > 0.0;
    }
}
