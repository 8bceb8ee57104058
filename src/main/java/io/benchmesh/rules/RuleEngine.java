package io.benchmesh.rules;

import io.benchmesh.error.RuleEvaluationException;
import io.benchmesh.model.Conflict;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.util.DocumentPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Runs every applicable rule against a document. A rule that throws is reported as a
 * {@code rule_error} conflict at the rule's severity and does not stop the others.
 */
public final class RuleEngine {
    public static final String RULE_ERROR = "rule_error";
    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final List<Rule> rules = new CopyOnWriteArrayList<>();

    public RuleEngine(List<Rule> rules) {
        if (rules != null) {
            rules.forEach(this::register);
        }
    }

    public static RuleEngine withBuiltInRules(FurnitureKnowledge knowledge) {
        return new RuleEngine(List.of(
                new ShelfDeflectionRule(knowledge),
                new JointStrengthRule(knowledge),
                new StabilityRule(),
                new MaterialJoineryRule(knowledge),
                new ProportionRule()
        ));
    }

    public void register(Rule rule) {
        for (Rule existing : rules) {
            if (existing.name().equals(rule.name())) {
                throw new IllegalArgumentException("Rule already registered: " + rule.name());
            }
        }
        rules.add(rule);
    }

    public List<Rule> rules() {
        return List.copyOf(rules);
    }

    public RuleEvaluation evaluate(DesignDocument document, Constraints constraints) {
        return evaluate(document, constraints, paths -> List.of());
    }

    /**
     * @param lastWriters maps store paths to the workers that last wrote them
     */
    public RuleEvaluation evaluate(DesignDocument document, Constraints constraints, Function<List<String>, List<String>> lastWriters) {
        List<Conflict> conflicts = new ArrayList<>();
        List<String> passed = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        for (Rule rule : rules) {
            try {
                if (!rule.appliesTo(document)) {
                    continue;
                }
                RuleResult result = rule.evaluate(document, constraints);
                if (result.valid()) {
                    passed.add(rule.name());
                    continue;
                }
                conflicts.add(new Conflict(
                        rule.name(),
                        rule.severity(),
                        involved(rule, lastWriters),
                        result.message(),
                        result.fix()
                ));
                suggestions.addAll(result.suggestions());
            } catch (RuntimeException e) {
                RuleEvaluationException error = new RuleEvaluationException(rule.name(), e);
                log.warn(error.getMessage(), e);
                conflicts.add(Conflict.of(RULE_ERROR, rule.severity(), List.of(), error.getMessage()));
            }
        }
        conflicts.sort(Comparator.comparingInt((Conflict c) -> -c.severity().rank()));
        return new RuleEvaluation(conflicts, passed, suggestions);
    }

    private static List<String> involved(Rule rule, Function<List<String>, List<String>> lastWriters) {
        List<String> paths = new ArrayList<>();
        for (String path : rule.watchedPaths()) {
            paths.add(DocumentPaths.join("design", path));
        }
        List<String> writers = lastWriters.apply(paths);
        return writers == null ? List.of() : writers;
    }
}
