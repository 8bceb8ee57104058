package io.benchmesh.rules;

import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Shelf span against the span table for the board's material and thickness. The fix narrows
 * the span to the table maximum.
 */
public final class ShelfDeflectionRule implements Rule {
    static final double DEFAULT_THICKNESS = 0.75;
    static final String DEFAULT_MATERIAL = "pine";

    private final FurnitureKnowledge knowledge;

    public ShelfDeflectionRule(FurnitureKnowledge knowledge) {
        this.knowledge = knowledge;
    }

    @Override
    public String name() {
        return "shelf_deflection";
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.STRUCTURAL;
    }

    @Override
    public List<String> watchedPaths() {
        return List.of(DesignDocument.WIDTH, DesignDocument.MATERIALS, DesignDocument.BOARD_THICKNESS);
    }

    @Override
    public boolean appliesTo(DesignDocument document) {
        return knowledge.isShelving(document.type());
    }

    @Override
    public RuleResult evaluate(DesignDocument document, Constraints constraints) {
        double span = document.width() == null ? 0.0 : document.width();
        double thickness = document.boardThickness() == null ? DEFAULT_THICKNESS : document.boardThickness();
        String material = document.primaryMaterial().orElse(DEFAULT_MATERIAL);
        double maxSpan = Math.floor(knowledge.maxSpan(material, thickness) * 4.0) / 4.0;
        if (span <= maxSpan) {
            return RuleResult.pass(String.format(Locale.ROOT, "%s\" span within %s\" limit for %s\" %s", fmt(span), fmt(maxSpan), fmt(thickness), material));
        }
        List<String> suggestions = new ArrayList<>();
        suggestions.add("Reduce span to " + fmt(maxSpan) + "\"");
        Optional<Double> thicker = knowledge.minThicknessFor(material, span);
        thicker.ifPresent(t -> suggestions.add("Use " + fmt(t) + "\" " + material + " to keep a " + fmt(span) + "\" span"));
        return RuleResult.fail(
                fmt(span) + "\" span too wide for " + fmt(thickness) + "\" " + material + ". Max: " + fmt(maxSpan) + "\"",
                doc -> doc.with(DesignDocument.WIDTH, maxSpan),
                suggestions
        );
    }

    static String fmt(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
