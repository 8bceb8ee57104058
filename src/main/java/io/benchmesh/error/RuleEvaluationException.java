package io.benchmesh.error;

public final class RuleEvaluationException extends BenchMeshException {
    private final String rule;

    public RuleEvaluationException(String rule, Throwable cause) {
        super("Rule " + rule + " failed to evaluate: " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.rule = rule;
    }

    public String rule() {
        return rule;
    }
}
