package io.benchmesh.coordinator;

import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Intent;
import io.benchmesh.worker.Worker;
import io.benchmesh.worker.WorkerRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Orders the workers for one turn. Stage workers run in dependency order (dimensions and
 * materials before joinery) and are added when the intent asks for them, when they declare they
 * handle the intent, or when a planned stage depends on fields they fill that are still unset.
 * Other workers that handle the intent run after the stages. Validators never appear in a plan.
 */
public final class ExecutionPlanner {
    static final List<Stage> STAGES = List.of(
            new Stage("dimension", List.of(DesignDocument.WIDTH, DesignDocument.HEIGHT, DesignDocument.DEPTH), List.of()),
            new Stage("material", List.of(DesignDocument.MATERIALS), List.of()),
            new Stage("joinery", List.of(DesignDocument.JOINERY), List.of("dimension", "material")),
            new Stage("style", List.of(DesignDocument.STYLE), List.of())
    );

    private static final Map<Intent, List<String>> INTENT_STAGES = new EnumMap<>(Intent.class);

    static {
        INTENT_STAGES.put(Intent.DIMENSION_SPECIFICATION, List.of("dimension"));
        INTENT_STAGES.put(Intent.MATERIAL_SELECTION, List.of("material"));
        INTENT_STAGES.put(Intent.JOINERY_METHOD, List.of("joinery"));
        INTENT_STAGES.put(Intent.STYLE_AESTHETIC, List.of("style"));
    }

    private final WorkerRegistry registry;
    private final Set<String> validators;

    public ExecutionPlanner(WorkerRegistry registry, List<String> validators) {
        this.registry = registry;
        this.validators = validators == null ? Set.of() : Set.copyOf(validators);
    }

    public List<String> plan(Intent intent, DesignDocument document) {
        if (intent == Intent.VALIDATION_CHECK) {
            return List.of();
        }
        Set<String> wanted = new LinkedHashSet<>();
        for (Stage stage : STAGES) {
            if (!plannable(stage.name())) {
                continue;
            }
            boolean direct = INTENT_STAGES.getOrDefault(intent, List.of()).contains(stage.name())
                    || (intent == Intent.DESIGN_INITIATION && stage.unset(document));
            boolean declared = registry.find(stage.name()).map(w -> w.canHandle(intent)).orElse(false);
            if (direct || declared) {
                wanted.add(stage.name());
            }
        }
        for (String name : List.copyOf(wanted)) {
            addUnsetDependencies(name, document, wanted);
        }
        List<String> plan = new ArrayList<>();
        for (Stage stage : STAGES) {
            if (wanted.contains(stage.name())) {
                plan.add(stage.name());
            }
        }
        for (String name : registry.names()) {
            if (plan.contains(name) || !plannable(name) || stage(name).isPresent()) {
                continue;
            }
            Optional<Worker> worker = registry.find(name);
            if (worker.isPresent() && worker.get().canHandle(intent)) {
                plan.add(name);
            }
        }
        return plan;
    }

    private void addUnsetDependencies(String name, DesignDocument document, Set<String> wanted) {
        Optional<Stage> stage = stage(name);
        if (stage.isEmpty()) {
            return;
        }
        for (String dependency : stage.get().dependsOn()) {
            Optional<Stage> dep = stage(dependency);
            if (dep.isPresent() && plannable(dependency) && dep.get().unset(document) && wanted.add(dependency)) {
                addUnsetDependencies(dependency, document, wanted);
            }
        }
    }

    private boolean plannable(String name) {
        return registry.isRegistered(name) && !validators.contains(name);
    }

    private static Optional<Stage> stage(String name) {
        for (Stage stage : STAGES) {
            if (stage.name().equals(name)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    record Stage(String name, List<String> fills, List<String> dependsOn) {
        boolean unset(DesignDocument document) {
            for (String path : fills) {
                if (!document.has(path)) {
                    return true;
                }
            }
            return false;
        }
    }
}
