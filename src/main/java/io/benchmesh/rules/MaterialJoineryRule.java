package io.benchmesh.rules;

import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;

import java.util.ArrayList;
import java.util.List;

public final class MaterialJoineryRule implements Rule {
    private final FurnitureKnowledge knowledge;

    public MaterialJoineryRule(FurnitureKnowledge knowledge) {
        this.knowledge = knowledge;
    }

    @Override
    public String name() {
        return "material_joinery_compatibility";
    }

    @Override
    public RuleCategory category() {
        return RuleCategory.COMPATIBILITY;
    }

    @Override
    public List<String> watchedPaths() {
        return List.of(DesignDocument.MATERIALS, DesignDocument.JOINERY);
    }

    @Override
    public boolean appliesTo(DesignDocument document) {
        return document.primaryMaterial().map(knowledge::knowsMaterial).orElse(false)
                && !document.joinery().isEmpty();
    }

    @Override
    public RuleResult evaluate(DesignDocument document, Constraints constraints) {
        String material = document.primaryMaterial().orElseThrow();
        String joint = document.joinery().get(0);
        if (knowledge.isCompatible(material, joint)) {
            return RuleResult.pass(joint + " suits " + material);
        }
        String best = knowledge.bestJoint(material);
        return RuleResult.fail(
                joint + " doesn't work well with " + material,
                doc -> {
                    List<String> updated = new ArrayList<>(doc.joinery());
                    updated.set(0, best);
                    return doc.with(DesignDocument.JOINERY, updated);
                },
                List.of("Use " + best + " for " + material)
        );
    }
}
