package io.benchmesh.rules;

import io.benchmesh.model.Conflict;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Severity;
import io.benchmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;

final class RuleEngineTest {
    private final FurnitureKnowledge knowledge = FurnitureKnowledge.bundled();
    private final RuleEngine engine = RuleEngine.withBuiltInRules(knowledge);

    @Test
    void wideMdfShelfIsBlockedAndFixNarrowsSpan() {
        DesignDocument document = bookshelf(48, "mdf");

        RuleEvaluation evaluation = engine.evaluate(document, Constraints.defaults());
        Conflict deflection = find(evaluation, "shelf_deflection");

        Assertions.assertTrue(evaluation.hasBlocking());
        Assertions.assertEquals(Severity.HIGH, deflection.severity());
        Assertions.assertTrue(deflection.description().contains("Max: 20\""), deflection.description());
        Assertions.assertTrue(deflection.fixAvailable());

        DesignDocument fixed = deflection.autoFix().apply(document);
        Assertions.assertEquals(20.0, fixed.width());
        Assertions.assertEquals(48.0, document.width());
        Assertions.assertTrue(engine.evaluate(fixed, Constraints.defaults()).passed().contains("shelf_deflection"));
    }

    @Test
    void hardMapleCarriesTwentyInchSpan() {
        RuleEvaluation evaluation = engine.evaluate(bookshelf(20, "maple_hard"), Constraints.defaults());

        Assertions.assertTrue(evaluation.passed().contains("shelf_deflection"));
        Assertions.assertTrue(evaluation.passed().contains("joint_strength"));
    }

    @Test
    void deflectionOnlyAppliesToShelving() {
        DesignDocument table = bookshelf(60, "mdf").with(DesignDocument.TYPE, "table");

        RuleEvaluation evaluation = engine.evaluate(table, Constraints.defaults());

        Assertions.assertFalse(evaluation.passed().contains("shelf_deflection"));
        Assertions.assertTrue(evaluation.conflicts().stream().noneMatch(c -> c.type().equals("shelf_deflection")));
    }

    @Test
    void tallNarrowPieceNeedsAntiTipHardware() {
        DesignDocument document = bookshelf(20, "maple_hard");
        Conflict stability = find(engine.evaluate(document, Constraints.defaults()), "stability");
        Assertions.assertEquals(Severity.HIGH, stability.severity());

        DesignDocument fixed = stability.autoFix().apply(document);
        Assertions.assertEquals(List.of("anti-tip hardware"), fixed.features());
        Assertions.assertTrue(engine.evaluate(fixed, Constraints.defaults()).passed().contains("stability"));

        DesignDocument kit = document.withAppended(DesignDocument.FEATURES, "anti_tip_kit");
        Assertions.assertTrue(engine.evaluate(kit, Constraints.defaults()).passed().contains("stability"));
    }

    @Test
    void weakJointIsUpgradedOneStep() {
        DesignDocument chair = DesignDocument.empty()
                .with(DesignDocument.TYPE, "chair")
                .with(DesignDocument.MATERIALS, List.of("pine"))
                .with(DesignDocument.JOINERY, List.of("screw"));

        Conflict joints = find(engine.evaluate(chair, Constraints.defaults()), "joint_strength");
        Assertions.assertTrue(joints.description().contains("Safety factor: 1.2"), joints.description());
        Assertions.assertEquals(List.of("pocket_hole"), joints.autoFix().apply(chair).joinery());

        DesignDocument strongest = chair.with(DesignDocument.JOINERY, List.of("mortise_tenon"));
        Constraints demanding = Constraints.of(Jsons.tree(Map.of("structural", Map.of("min_safety_factor", 10))));
        Conflict stillWeak = find(engine.evaluate(strongest, demanding), "joint_strength");
        Assertions.assertFalse(stillWeak.fixAvailable());
    }

    @Test
    void messagesUseDotDecimalsWhateverTheDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            DesignDocument chair = DesignDocument.empty()
                    .with(DesignDocument.TYPE, "chair")
                    .with(DesignDocument.MATERIALS, List.of("pine"))
                    .with(DesignDocument.JOINERY, List.of("screw"));

            Conflict joints = find(engine.evaluate(chair, Constraints.defaults()), "joint_strength");
            Assertions.assertTrue(joints.description().contains("Safety factor: 1.2"), joints.description());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void incompatibleJointIsMediumAndSortedAfterHigh() {
        DesignDocument document = bookshelf(48, "mdf").with(DesignDocument.JOINERY, List.of("dovetail"));

        RuleEvaluation evaluation = engine.evaluate(document, Constraints.defaults());
        Conflict mismatch = find(evaluation, "material_joinery_compatibility");

        Assertions.assertEquals(Severity.MEDIUM, mismatch.severity());
        Assertions.assertEquals(List.of("rabbet"), mismatch.autoFix().apply(document).joinery());
        Assertions.assertEquals(Severity.HIGH, evaluation.conflicts().get(0).severity());
        Assertions.assertEquals(Severity.MEDIUM, evaluation.conflicts().get(evaluation.conflicts().size() - 1).severity());
    }

    @Test
    void extremeProportionsOnlySuggest() {
        DesignDocument bench = DesignDocument.empty()
                .with(DesignDocument.TYPE, "bench")
                .with("dimensions", Jsons.tree(Map.of("width", 96, "height", 18, "depth", 10)));

        RuleEvaluation evaluation = engine.evaluate(bench, Constraints.defaults());
        Conflict proportion = find(evaluation, "proportion_balance");

        Assertions.assertEquals(Severity.LOW, proportion.severity());
        Assertions.assertFalse(proportion.fixAvailable());
        Assertions.assertFalse(evaluation.hasBlocking());
        Assertions.assertEquals(0.95, evaluation.score(), 1e-9);
        Assertions.assertFalse(evaluation.suggestions().isEmpty());
    }

    @Test
    void brokenRuleBecomesConflictInsteadOfAbortingEvaluation() {
        RuleEngine custom = RuleEngine.withBuiltInRules(knowledge);
        custom.register(new Rule() {
            @Override
            public String name() {
                return "grain_direction";
            }

            @Override
            public RuleCategory category() {
                return RuleCategory.COMPATIBILITY;
            }

            @Override
            public List<String> watchedPaths() {
                return List.of(DesignDocument.MATERIALS);
            }

            @Override
            public boolean appliesTo(DesignDocument document) {
                return true;
            }

            @Override
            public RuleResult evaluate(DesignDocument document, Constraints constraints) {
                throw new IllegalStateException("grain table missing");
            }
        });

        RuleEvaluation evaluation = custom.evaluate(bookshelf(20, "maple_hard"), Constraints.defaults());
        Conflict error = find(evaluation, RuleEngine.RULE_ERROR);

        Assertions.assertEquals(Severity.MEDIUM, error.severity());
        Assertions.assertTrue(error.description().contains("grain_direction"));
        Assertions.assertTrue(evaluation.passed().contains("shelf_deflection"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> custom.register(new ProportionRule()));
    }

    @Test
    void involvedWorkersComeFromLastWritersOfWatchedPaths() {
        RuleEvaluation evaluation = engine.evaluate(bookshelf(48, "mdf"), Constraints.defaults(), paths -> {
            if (paths.contains("design.dimensions.width")) {
                return List.of("dimension", "material");
            }
            return List.of();
        });

        Assertions.assertEquals(List.of("dimension", "material"), find(evaluation, "shelf_deflection").involvedWorkers());
    }

    @Test
    void scoreMultipliesPerSeverity() {
        List<Conflict> conflicts = List.of(
                Conflict.of("a", Severity.HIGH, List.of(), ""),
                Conflict.of("b", Severity.MEDIUM, List.of(), ""),
                Conflict.of("c", Severity.LOW, List.of(), "")
        );
        Assertions.assertEquals(0.5 * 0.8 * 0.95, RuleEvaluation.score(conflicts), 1e-9);
        Assertions.assertEquals(1.0, RuleEvaluation.score(List.of()));
    }

    static DesignDocument bookshelf(double width, String material) {
        return DesignDocument.empty()
                .with(DesignDocument.TYPE, "bookshelf")
                .with("dimensions", Jsons.tree(Map.of("width", width, "height", 72, "depth", 12)))
                .with(DesignDocument.MATERIALS, List.of(material))
                .with(DesignDocument.BOARD_THICKNESS, 0.75);
    }

    private static Conflict find(RuleEvaluation evaluation, String type) {
        return evaluation.conflicts().stream()
                .filter(c -> c.type().equals(type))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no " + type + " conflict in " + evaluation.conflicts()));
    }
}
