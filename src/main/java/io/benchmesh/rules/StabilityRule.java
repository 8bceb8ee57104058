package io.benchmesh.rules;

import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;

import java.util.List;
import java.util.Locale;

/**
 * Tall pieces need a height to base ratio under 4, or anti-tip hardware.
 */
public final class StabilityRule implements Rule {
    static final double MIN_HEIGHT = 48.0;
    static final double MAX_RATIO = 4.0;
    static final String ANTI_TIP = "anti-tip hardware";

    @Override
    public String name() {
        return "stability";
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.SAFETY;
    }

    @Override
    public List<String> watchedPaths() {
        return List.of(DesignDocument.HEIGHT, DesignDocument.WIDTH, DesignDocument.DEPTH, DesignDocument.FEATURES);
    }

    @Override
    public boolean appliesTo(DesignDocument document) {
        Double height = document.height();
        return height != null && height > MIN_HEIGHT;
    }

    @Override
    public RuleResult evaluate(DesignDocument document, Constraints constraints) {
        double height = document.height();
        double width = document.width() == null ? 1.0 : document.width();
        double depth = document.depth() == null ? 1.0 : document.depth();
        double ratio = height / Math.max(0.001, Math.min(width, depth));
        if (ratio < MAX_RATIO) {
            return RuleResult.pass(String.format(Locale.ROOT, "Stable proportions. Ratio: %.1f", ratio));
        }
        if (hasAntiTip(document)) {
            return RuleResult.pass(String.format(Locale.ROOT, "Ratio %.1f secured by anti-tip hardware", ratio));
        }
        return RuleResult.fail(
                String.format(Locale.ROOT, "Too tall for base. Risk of tipping. Ratio: %.1f", ratio),
                doc -> doc.withAppended(DesignDocument.FEATURES, ANTI_TIP),
                List.of("Add anti-tip hardware or widen the base")
        );
    }

    static boolean hasAntiTip(DesignDocument document) {
        for (String feature : document.features()) {
            String normalized = feature.toLowerCase().replace('_', '-');
            if (normalized.startsWith("anti-tip")) {
                return true;
            }
        }
        return false;
    }
}
