package io.benchmesh.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.bus.ConflictCase;
import io.benchmesh.bus.MessageBus;
import io.benchmesh.bus.QueryOptions;
import io.benchmesh.bus.Resolution;
import io.benchmesh.config.BenchMeshSettings;
import io.benchmesh.model.Conflict;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.Decision;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Intent;
import io.benchmesh.model.Severity;
import io.benchmesh.model.TurnResult;
import io.benchmesh.model.ValidationIssue;
import io.benchmesh.model.ValidationOutcome;
import io.benchmesh.model.ValidationSummary;
import io.benchmesh.model.Variation;
import io.benchmesh.observability.AuditLogger;
import io.benchmesh.observability.Ids;
import io.benchmesh.rules.RuleEngine;
import io.benchmesh.rules.RuleEvaluation;
import io.benchmesh.state.SharedStateStore;
import io.benchmesh.state.StateSnapshot;
import io.benchmesh.state.StateUpdate;
import io.benchmesh.state.TransactionConflict;
import io.benchmesh.state.TransactionResult;
import io.benchmesh.util.DocumentPaths;
import io.benchmesh.util.Jsons;
import io.benchmesh.worker.Proposal;
import io.benchmesh.worker.WorkerInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Runs one user turn: plan, ask each planned worker through the bus, commit its proposal, and
 * keep the design rule-valid by applying fixes or escalating after every commit. A failing
 * worker never aborts the turn.
 */
public final class Coordinator {
    public static final String CONSTRAINT_VIOLATION = "constraint_violation";
    public static final String WRITE_CONFLICT = "write_conflict";
    public static final String VALIDATION_UNAVAILABLE = "validation_unavailable";
    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final SharedStateStore store;
    private final MessageBus bus;
    private final RuleEngine rules;
    private final ExecutionPlanner planner;
    private final VariationGenerator variations;
    private final BenchMeshSettings settings;
    private final Clock clock;
    private final AuditLogger auditLogger;

    public Coordinator(
            SharedStateStore store,
            MessageBus bus,
            RuleEngine rules,
            VariationGenerator variations,
            BenchMeshSettings settings,
            Clock clock,
            AuditLogger auditLogger
    ) {
        this.store = store;
        this.bus = bus;
        this.rules = rules;
        this.variations = variations;
        this.settings = settings;
        this.clock = clock;
        this.auditLogger = auditLogger == null ? AuditLogger.disabled() : auditLogger;
        this.planner = new ExecutionPlanner(bus.registry(), settings.validators());
    }

    /**
     * @param currentVersion version the caller last saw, or {@code -1} to skip the check
     */
    public TurnResult processTurn(Intent intent, String rawInput, long currentVersion) {
        Turn turn = new Turn(Ids.newTurnId(), intent == null ? Intent.CLARIFICATION_NEEDED : intent, rawInput);
        StateSnapshot start = store.read();
        if (currentVersion >= 0 && currentVersion != start.version()) {
            turn.note("Caller saw version " + currentVersion + " but the design is at version " + start.version() + "; continuing on the current design");
        }
        List<String> plan = planner.plan(turn.intent, start.document());
        turn.note(plan.isEmpty() ? "No workers planned for " + turn.intent.label() : "Plan: " + String.join(" -> ", plan));
        log.debug("Turn {} intent={} plan={}", turn.id, turn.intent.label(), plan);

        for (String worker : plan) {
            Optional<Offer> offer = prepare(worker, turn, false);
            if (offer.isEmpty()) {
                continue;
            }
            Proposal accepted = offer.get().proposal();
            Optional<TransactionResult> committed = commit(worker, offer.get(), worker + " " + accepted.decisionType(), turn,
                    () -> prepare(worker, turn, true));
            if (committed.isPresent()) {
                resolve(turn);
            }
        }
        return finish(turn, plan);
    }

    private Optional<Offer> prepare(String worker, Turn turn, boolean fresh) {
        Optional<Offer> offer = ask(worker, turn, List.of(), fresh).map(o -> checkConstraints(worker, o, turn));
        offer.ifPresent(o -> turn.constraints.setAll(o.proposal().constraints()));
        return offer;
    }

    private Optional<Offer> ask(String worker, Turn turn, List<String> issues, boolean fresh) {
        StateSnapshot snapshot = store.read();
        WorkerInput input = new WorkerInput(
                turn.id,
                turn.intent,
                turn.text,
                snapshot.document(),
                snapshot.constraints(),
                turn.constraints,
                issues
        );
        QueryOptions options = QueryOptions.defaults(settings).withoutFallback();
        if (fresh) {
            options = options.withoutCache();
        }
        String failure;
        try {
            JsonNode response = bus.query(MessageBus.COORDINATOR, worker, input.toPayload(), options).join();
            Proposal proposal = Jsons.convert(response, Proposal.class);
            if (proposal.success()) {
                return Optional.of(new Offer(proposal, snapshot.version()));
            }
            failure = proposal.issues().isEmpty() ? proposal.reasoning() : proposal.issues().get(0);
        } catch (CompletionException | IllegalArgumentException e) {
            failure = MessageBus.unwrap(e).getMessage();
        }
        log.warn("Worker {} failed in turn {}: {}", worker, turn.id, failure);
        turn.note(worker + " failed: " + failure);
        if (!issues.isEmpty()) {
            return Optional.empty();
        }
        return substitute(worker, turn, snapshot.version());
    }

    private Optional<Offer> substitute(String worker, Turn turn, long readVersion) {
        Optional<Decision> last = store.lastDecisionOf(worker);
        if (last.isPresent() && last.get().value() instanceof ObjectNode data) {
            turn.note("Reusing the last decision of " + worker);
            return Optional.of(new Offer(Proposal.ok(data, null).asFallback("last known decision of " + worker), readVersion));
        }
        JsonNode conservative = settings.fallbacks().get(worker);
        if (conservative instanceof ObjectNode data) {
            turn.note("Using the conservative default for " + worker);
            return Optional.of(new Offer(Proposal.ok(data, null).asFallback("conservative default for " + worker), readVersion));
        }
        turn.note("Skipping " + worker + ": no previous decision or default");
        return Optional.empty();
    }

    private Offer checkConstraints(String worker, Offer offer, Turn turn) {
        Constraints constraints = store.read().constraints();
        List<String> violations = violations(merge(store.read().document(), offer.proposal().data()), constraints);
        if (violations.isEmpty()) {
            return offer;
        }
        turn.note(worker + " proposal breaks constraints; asking for a revision");
        Optional<Offer> revised = ask(worker, turn, violations, false);
        Offer chosen = revised.orElse(offer);
        List<String> remaining = violations(merge(store.read().document(), chosen.proposal().data()), constraints);
        if (!remaining.isEmpty()) {
            turn.surfaced.add(Conflict.of(CONSTRAINT_VIOLATION, Severity.MEDIUM, List.of(worker), String.join("; ", remaining)));
        }
        return chosen;
    }

    static List<String> violations(DesignDocument document, Constraints constraints) {
        List<String> out = new ArrayList<>();
        checkAxis(out, "width", document.width(), constraints);
        checkAxis(out, "height", document.height(), constraints);
        checkAxis(out, "depth", document.depth(), constraints);
        List<String> excluded = constraints.excludedMaterials();
        for (String material : document.materials()) {
            if (excluded.contains(material)) {
                out.add("material " + material + " is excluded");
            }
        }
        return out;
    }

    private static void checkAxis(List<String> out, String axis, Double value, Constraints constraints) {
        if (value == null) {
            return;
        }
        Double max = constraints.maxDimension(axis);
        Double min = constraints.minDimension(axis);
        if (max != null && value > max) {
            out.add(String.format(Locale.ROOT, "%s %.1f exceeds maximum %.1f", axis, value, max));
        }
        if (min != null && value < min) {
            out.add(String.format(Locale.ROOT, "%s %.1f is below minimum %.1f", axis, value, min));
        }
    }

    private static DesignDocument merge(DesignDocument document, ObjectNode data) {
        Map<String, JsonNode> leaves = new LinkedHashMap<>();
        DocumentPaths.flatten("", data, leaves);
        DesignDocument merged = document;
        for (Map.Entry<String, JsonNode> leaf : leaves.entrySet()) {
            merged = merged.with(leaf.getKey(), leaf.getValue());
        }
        return merged;
    }

    /**
     * Commits against the version the worker was shown. A stale-version rejection re-reads
     * through {@code refresh} and tries again, up to {@code maxTransactRetries} times.
     */
    private Optional<TransactionResult> commit(String worker, Offer offer, String reason, Turn turn, Supplier<Optional<Offer>> refresh) {
        TransactionResult last = null;
        Offer current = offer;
        for (int attempt = 0; attempt <= settings.maxTransactRetries(); attempt++) {
            Proposal proposal = current.proposal();
            StateUpdate update = StateUpdate.create()
                    .reason(reason)
                    .designPatch(proposal.data())
                    .constraintsPatch(proposal.constraints())
                    .decision(new Decision(
                            worker,
                            proposal.decisionType(),
                            proposal.data(),
                            proposal.reasoning(),
                            proposal.confidence(),
                            proposal.alternatives(),
                            clock.millis()
                    ));
            last = store.transact(worker, update, current.readVersion());
            if (last.accepted()) {
                if (proposal.fallback()) {
                    turn.note("Committed fallback for " + worker + " at version " + last.newVersion());
                }
                return Optional.of(last);
            }
            if (last.hasConflict(TransactionConflict.Kind.UNKNOWN_WRITER) || !backoff(attempt)) {
                break;
            }
            if (last.hasConflict(TransactionConflict.Kind.STALE_VERSION)) {
                turn.note("Design changed while " + worker + " was proposing; asking again");
                Optional<Offer> fresh = refresh.get();
                if (fresh.isEmpty()) {
                    break;
                }
                current = fresh.get();
            }
        }
        String detail = last == null || last.conflicts().isEmpty() ? "rejected" : last.conflicts().get(0).message();
        log.warn("Could not commit proposal of {} in turn {}: {}", worker, turn.id, detail);
        turn.surfaced.add(Conflict.of(WRITE_CONFLICT, Severity.MEDIUM, List.of(worker), "Proposal of " + worker + " not committed: " + detail));
        return Optional.empty();
    }

    private boolean backoff(int attempt) {
        if (attempt >= settings.maxTransactRetries()) {
            return false;
        }
        try {
            Thread.sleep(settings.transactBackoffMs() * (attempt + 1L));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void resolve(Turn turn) {
        for (int pass = 0; pass < settings.maxResolutionPasses(); pass++) {
            StateSnapshot snapshot = store.read();
            RuleEvaluation evaluation = rules.evaluate(snapshot.document(), snapshot.constraints(), store::lastWriters);
            boolean changed = false;
            for (Conflict conflict : evaluation.conflicts()) {
                if (conflict.fixAvailable()) {
                    changed |= applyFix(conflict, turn);
                } else if (conflict.severity() != Severity.LOW && turn.escalated.add(conflict.type())) {
                    changed |= escalate(conflict, turn);
                }
            }
            if (!changed) {
                return;
            }
        }
        turn.note("Stopped resolving after " + settings.maxResolutionPasses() + " passes");
    }

    private boolean applyFix(Conflict conflict, Turn turn) {
        DesignDocument before = store.read().document();
        DesignDocument after;
        try {
            after = conflict.autoFix().apply(before);
        } catch (RuntimeException e) {
            log.warn("Fix for {} failed: {}", conflict.type(), e.getMessage(), e);
            turn.note("Fix for " + conflict.type() + " failed: " + e.getMessage());
            return false;
        }
        Map<String, JsonNode> previous = new LinkedHashMap<>();
        Map<String, JsonNode> next = new LinkedHashMap<>();
        DocumentPaths.flatten("", before.toJson(), previous);
        DocumentPaths.flatten("", after.toJson(), next);
        StateUpdate update = StateUpdate.create().reason("auto-fix " + conflict.type());
        for (Map.Entry<String, JsonNode> leaf : next.entrySet()) {
            if (!leaf.getValue().equals(previous.get(leaf.getKey()))) {
                update.design(leaf.getKey(), leaf.getValue());
            }
        }
        for (String removed : previous.keySet()) {
            if (!next.containsKey(removed)) {
                update.design(removed, Jsons.mapper().nullNode());
            }
        }
        if (update.isEmpty()) {
            return false;
        }
        TransactionResult result = store.transact(MessageBus.COORDINATOR, update);
        if (!result.accepted()) {
            turn.note("Fix for " + conflict.type() + " rejected");
            return false;
        }
        turn.resolved.add(conflict);
        turn.note("Applied fix for " + conflict.type() + ": " + conflict.description());
        return !result.changes().isEmpty();
    }

    private boolean escalate(Conflict conflict, Turn turn) {
        List<String> involved = new ArrayList<>();
        for (String worker : conflict.involvedWorkers()) {
            if (bus.registry().isRegistered(worker) && !settings.validators().contains(worker)) {
                involved.add(worker);
            }
        }
        if (involved.isEmpty()) {
            turn.note("No worker to escalate " + conflict.type() + " to");
            return false;
        }
        if (involved.size() == 1) {
            String worker = involved.get(0);
            turn.note("Asking " + worker + " to revise for " + conflict.type());
            List<String> issues = List.of(conflict.description());
            Optional<Offer> revised = ask(worker, turn, issues, false);
            return revised.flatMap(o -> commit(worker, o, "revision for " + conflict.type(), turn, () -> ask(worker, turn, issues, true)))
                    .map(result -> !result.changes().isEmpty())
                    .orElse(false);
        }
        long readVersion = store.version();
        Map<String, JsonNode> proposals = new LinkedHashMap<>();
        for (String worker : involved) {
            proposals.put(worker, store.lastDecisionOf(worker).map(Decision::value).orElse(null));
        }
        Resolution resolution = bus.resolveConflict(new ConflictCase(conflict.type(), conflict.description(), proposals));
        turn.note(resolution.winner() + " wins " + conflict.type() + " by " + resolution.strategy().name().toLowerCase(Locale.ROOT));
        if (!(resolution.proposal() instanceof ObjectNode data)) {
            return false;
        }
        Proposal won = Proposal.ok(data, "won " + conflict.type());
        return commit(resolution.winner(), new Offer(won, readVersion), "arbitration of " + conflict.type(), turn,
                () -> Optional.of(new Offer(won, store.version())))
                .map(result -> !result.changes().isEmpty())
                .orElse(false);
    }

    private TurnResult finish(Turn turn, List<String> plan) {
        StateSnapshot end = store.read();
        RuleEvaluation evaluation = rules.evaluate(end.document(), end.constraints(), store::lastWriters);
        List<Conflict> conflicts = new ArrayList<>(evaluation.conflicts());
        conflicts.addAll(turn.surfaced);

        List<String> validatorNames = settings.validators().stream().filter(bus.registry()::isRegistered).toList();
        Map<String, ValidationOutcome> outcomes = validatorNames.isEmpty()
                ? Map.of()
                : bus.requestValidation(end.document(), end.constraints(), validatorNames);
        StateUpdate record = StateUpdate.create().reason("validation " + turn.id);
        for (Map.Entry<String, ValidationOutcome> entry : outcomes.entrySet()) {
            ValidationOutcome outcome = entry.getValue();
            record.validation(entry.getKey(), outcome);
            boolean unavailable = outcome.issues().stream().anyMatch(issue -> "validator_error".equals(issue.rule()));
            if (unavailable) {
                conflicts.add(Conflict.of(VALIDATION_UNAVAILABLE, Severity.HIGH, List.of(entry.getKey()), outcome.issues().get(0).message()));
            }
        }
        if (!record.isEmpty()) {
            store.transact(MessageBus.COORDINATOR, record);
        }

        boolean valid = conflicts.stream().noneMatch(c -> c.severity() == Severity.HIGH)
                && outcomes.values().stream().allMatch(ValidationOutcome::valid);
        double score = RuleEvaluation.score(conflicts);
        for (ValidationOutcome outcome : outcomes.values()) {
            score = Math.min(score, outcome.score());
        }
        Set<String> seen = new HashSet<>();
        List<ValidationIssue> issues = new ArrayList<>();
        for (Conflict conflict : conflicts) {
            addIssue(issues, seen, new ValidationIssue(conflict.type(), conflict.severity(), conflict.description()));
        }
        Set<String> suggestions = new LinkedHashSet<>(evaluation.suggestions());
        for (ValidationOutcome outcome : outcomes.values()) {
            outcome.issues().forEach(issue -> addIssue(issues, seen, issue));
            suggestions.addAll(outcome.suggestions());
        }
        ValidationSummary summary = new ValidationSummary(valid, score, issues, List.copyOf(suggestions), outcomes);

        StateSnapshot finalState = store.read();
        List<Variation> generated = valid
                ? variations.generate(finalState.document(), finalState.constraints(), settings.maxVariations())
                : List.of();
        if (!valid) {
            turn.note("Design not valid yet; variations skipped");
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "turn.completed",
                MessageBus.COORDINATOR,
                "turn/" + turn.id,
                valid ? "valid" : "invalid",
                turn.id,
                Map.of(
                        "intent", turn.intent.label(),
                        "plan", plan,
                        "version", finalState.version(),
                        "conflicts", conflicts.size(),
                        "resolved", turn.resolved.size(),
                        "variations", generated.size()
                )
        ));
        log.info("Turn {} finished at version {} valid={} score={}", turn.id, finalState.version(), valid, String.format(Locale.ROOT, "%.2f", score));
        return new TurnResult(
                turn.id,
                turn.intent,
                finalState.document(),
                finalState.constraints(),
                finalState.version(),
                summary,
                generated,
                conflicts,
                turn.resolved,
                plan,
                turn.reasoning
        );
    }

    private static void addIssue(List<ValidationIssue> issues, Set<String> seen, ValidationIssue issue) {
        if (seen.add(issue.rule() + "|" + issue.message())) {
            issues.add(issue);
        }
    }

    private record Offer(Proposal proposal, long readVersion) {
    }

    private static final class Turn {
        private final String id;
        private final Intent intent;
        private final String text;
        private final ObjectNode constraints = Jsons.object();
        private final List<String> reasoning = new ArrayList<>();
        private final List<Conflict> surfaced = new ArrayList<>();
        private final List<Conflict> resolved = new ArrayList<>();
        private final Set<String> escalated = new HashSet<>();

        private Turn(String id, Intent intent, String text) {
            this.id = id;
            this.intent = intent;
            this.text = text == null ? "" : text;
        }

        private void note(String line) {
            reasoning.add(line);
        }
    }
}
