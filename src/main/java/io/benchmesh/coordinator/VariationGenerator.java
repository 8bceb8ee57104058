package io.benchmesh.coordinator;

import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Variation;
import io.benchmesh.rules.FurnitureKnowledge;
import io.benchmesh.rules.RuleEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds up to three alternatives of a valid design: another material, one extra feature and
 * wider-lower proportions. Candidates that fail a blocking rule are dropped.
 */
public final class VariationGenerator {
    static final double WIDTH_FACTOR = 1.25;
    static final double HEIGHT_FACTOR = 0.8;

    private final FurnitureKnowledge knowledge;
    private final RuleEngine rules;

    public VariationGenerator(FurnitureKnowledge knowledge, RuleEngine rules) {
        this.knowledge = knowledge;
        this.rules = rules;
    }

    public List<Variation> generate(DesignDocument document, Constraints constraints, int limit) {
        List<Variation> out = new ArrayList<>();
        if (limit <= 0) {
            return out;
        }
        alternateMaterial(document, constraints).ifPresent(out::add);
        addedFeature(document, constraints).ifPresent(out::add);
        alternateProportions(document, constraints).ifPresent(out::add);
        return out.size() > limit ? List.copyOf(out.subList(0, limit)) : out;
    }

    Optional<Variation> alternateMaterial(DesignDocument document, Constraints constraints) {
        Optional<String> current = document.primaryMaterial();
        if (current.isEmpty()) {
            return Optional.empty();
        }
        List<String> excluded = constraints.excludedMaterials();
        for (String alternative : knowledge.alternatives(current.get())) {
            if (excluded.contains(alternative)) {
                continue;
            }
            DesignDocument candidate = document.with(DesignDocument.MATERIALS, List.of(alternative));
            if (!document.joinery().isEmpty() && knowledge.knowsMaterial(alternative)) {
                candidate = candidate.with(DesignDocument.JOINERY, List.of(knowledge.bestJoint(alternative)));
            }
            if (valid(candidate, constraints)) {
                return Optional.of(new Variation(
                        Variation.Kind.ALTERNATE_MATERIAL,
                        "Same design in " + alternative + " instead of " + current.get(),
                        candidate
                ));
            }
        }
        return Optional.empty();
    }

    Optional<Variation> addedFeature(DesignDocument document, Constraints constraints) {
        List<String> present = new ArrayList<>();
        document.features().forEach(f -> present.add(normalize(f)));
        for (String feature : knowledge.template(document.type()).features()) {
            if (present.stream().anyMatch(p -> p.startsWith(normalize(feature)))) {
                continue;
            }
            DesignDocument candidate = document.withAppended(DesignDocument.FEATURES, feature);
            if (valid(candidate, constraints)) {
                return Optional.of(new Variation(Variation.Kind.ADDED_FEATURE, "Adds " + feature.replace('_', ' '), candidate));
            }
        }
        return Optional.empty();
    }

    Optional<Variation> alternateProportions(DesignDocument document, Constraints constraints) {
        Double width = document.width();
        Double height = document.height();
        if (width == null || height == null) {
            return Optional.empty();
        }
        double newWidth = roundHalf(width * WIDTH_FACTOR);
        double newHeight = roundHalf(height * HEIGHT_FACTOR);
        DesignDocument candidate = document
                .with(DesignDocument.WIDTH, newWidth)
                .with(DesignDocument.HEIGHT, newHeight);
        if (!valid(candidate, constraints)) {
            return Optional.empty();
        }
        return Optional.of(new Variation(
                Variation.Kind.ALTERNATE_PROPORTIONS,
                String.format(Locale.ROOT, "Wider and lower: %.1f\" wide, %.1f\" high", newWidth, newHeight),
                candidate
        ));
    }

    private boolean valid(DesignDocument candidate, Constraints constraints) {
        if (!withinDimensionalLimits(candidate, constraints)) {
            return false;
        }
        return !rules.evaluate(candidate, constraints).hasBlocking();
    }

    private static boolean withinDimensionalLimits(DesignDocument document, Constraints constraints) {
        return within(document.width(), constraints.minDimension("width"), constraints.maxDimension("width"))
                && within(document.height(), constraints.minDimension("height"), constraints.maxDimension("height"))
                && within(document.depth(), constraints.minDimension("depth"), constraints.maxDimension("depth"));
    }

    private static boolean within(Double value, Double min, Double max) {
        if (value == null) {
            return true;
        }
        return (min == null || value >= min) && (max == null || value <= max);
    }

    private static double roundHalf(double value) {
        return Math.round(value * 2.0) / 2.0;
    }

    private static String normalize(String feature) {
        return feature.toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
    }
}
