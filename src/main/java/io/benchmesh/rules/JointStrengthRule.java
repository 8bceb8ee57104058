package io.benchmesh.rules;

import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class JointStrengthRule implements Rule {
    private final FurnitureKnowledge knowledge;

    public JointStrengthRule(FurnitureKnowledge knowledge) {
        this.knowledge = knowledge;
    }

    @Override
    public String name() {
        return "joint_strength";
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.STRUCTURAL;
    }

    @Override
    public List<String> watchedPaths() {
        return List.of(DesignDocument.JOINERY, DesignDocument.MATERIALS, DesignDocument.TYPE);
    }

    @Override
    public boolean appliesTo(DesignDocument document) {
        return document.type() != null || !document.joinery().isEmpty();
    }

    @Override
    public RuleResult evaluate(DesignDocument document, Constraints constraints) {
        List<String> joinery = document.joinery();
        String joint = joinery.isEmpty() ? "screw" : joinery.get(0);
        String material = document.primaryMaterial().orElse(ShelfDeflectionRule.DEFAULT_MATERIAL);
        double load = knowledge.estimatedLoad(document.type());
        double safetyFactor = knowledge.jointStrength(joint, material) / load;
        double required = constraints.minSafetyFactor();
        if (safetyFactor >= required) {
            return RuleResult.pass(String.format(Locale.ROOT, "Joints strong enough. Safety factor: %.1f", safetyFactor));
        }
        String stronger = knowledge.strongerJoint(joint);
        List<String> suggestions = new ArrayList<>();
        if (!stronger.equals(joint)) {
            suggestions.add("Switch " + joint + " to " + stronger);
        }
        return RuleResult.fail(
                String.format(Locale.ROOT, "Joints may fail. Safety factor: %.1f (need %.1f)", safetyFactor, required),
                stronger.equals(joint) ? null : doc -> {
                    List<String> updated = new ArrayList<>(doc.joinery());
                    if (updated.isEmpty()) {
                        updated.add(stronger);
                    } else {
                        updated.set(0, stronger);
                    }
                    return doc.with(DesignDocument.JOINERY, updated);
                },
                suggestions
        );
    }
}
