package io.benchmesh.rules;

import io.benchmesh.model.Conflict;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Intent;
import io.benchmesh.model.Severity;
import io.benchmesh.model.ValidationIssue;
import io.benchmesh.model.ValidationOutcome;
import io.benchmesh.worker.Proposal;
import io.benchmesh.worker.Worker;
import io.benchmesh.worker.WorkerContext;
import io.benchmesh.worker.WorkerInput;

import java.util.ArrayList;
import java.util.List;

/**
 * Validator backed by the rule engine. It never proposes design changes.
 */
public final class RuleValidationWorker implements Worker {
    public static final String NAME = "validation";

    private final String name;
    private final RuleEngine engine;

    public RuleValidationWorker(RuleEngine engine) {
        this(NAME, engine);
    }

    public RuleValidationWorker(String name, RuleEngine engine) {
        this.name = name;
        this.engine = engine;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean canHandle(Intent intent) {
        return intent == Intent.VALIDATION_CHECK;
    }

    @Override
    public Proposal propose(WorkerInput input, WorkerContext context) {
        ValidationOutcome outcome = validate(input.document(), input.constraints());
        List<String> issues = new ArrayList<>();
        outcome.issues().forEach(issue -> issues.add(issue.message()));
        return new Proposal(true, "validation", null, null, outcome.suggestions(), issues, null, null,
                outcome.valid() ? "design passes all rules" : issues.size() + " rule(s) failing", 1.0, false);
    }

    @Override
    public ValidationOutcome validate(DesignDocument document, Constraints constraints) {
        RuleEvaluation evaluation = engine.evaluate(document, constraints);
        List<ValidationIssue> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Conflict conflict : evaluation.conflicts()) {
            issues.add(new ValidationIssue(conflict.type(), conflict.severity(), conflict.description()));
            if (conflict.severity() == Severity.LOW) {
                warnings.add(conflict.description());
            }
        }
        return new ValidationOutcome(
                !evaluation.hasBlocking(),
                evaluation.score(),
                issues,
                warnings,
                evaluation.suggestions()
        );
    }
}
