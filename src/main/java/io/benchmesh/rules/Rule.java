package io.benchmesh.rules;

import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Severity;

import java.util.List;

public interface Rule {
    String name();

    RuleCategory category();

    default Severity severity() {
        return category().severity();
    }

    /**
     * Document-relative paths the rule reads; their last writers are the workers involved when
     * the rule fails.
     */
    List<String> watchedPaths();

    boolean appliesTo(DesignDocument document);

    RuleResult evaluate(DesignDocument document, Constraints constraints);
}
