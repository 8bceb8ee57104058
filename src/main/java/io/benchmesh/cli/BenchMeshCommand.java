package io.benchmesh.cli;

import io.benchmesh.config.BenchMeshConfig;
import io.benchmesh.config.BenchMeshSettings;
import io.benchmesh.coordinator.DesignSession;
import io.benchmesh.model.TurnResult;
import io.benchmesh.observability.AuditLogger;
import io.benchmesh.observability.Ids;
import io.benchmesh.observability.PrometheusFormatter;
import io.benchmesh.rules.FurnitureKnowledge;
import io.benchmesh.rules.Rule;
import io.benchmesh.rules.RuleEngine;
import io.benchmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "benchmesh",
        mixinStandardHelpOptions = true,
        description = "BenchMesh furniture design coordination CLI",
        subcommands = {
                BenchMeshCommand.TurnCommand.class,
                BenchMeshCommand.RulesCommand.class,
                BenchMeshCommand.StatusCommand.class
        }
)
public final class BenchMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--no-audit"}, description = "Do not write the audit log")
    boolean noAudit;

    @Override
    public void run() {
        System.out.println("Use subcommands: turn | rules | status");
    }

    BenchMeshConfig config() {
        return BenchMeshConfig.fromRoot(root);
    }

    BenchMeshSettings settings() {
        return BenchMeshSettings.load(config().settingsFile());
    }

    FurnitureKnowledge knowledge() {
        Path override = config().knowledgeFile();
        return Files.exists(override) ? FurnitureKnowledge.load(override) : FurnitureKnowledge.bundled();
    }

    AuditLogger auditLogger() {
        if (noAudit) {
            return AuditLogger.disabled();
        }
        return new AuditLogger(config().auditFile(), Ids.newSessionId(), Clock.systemUTC());
    }

    DesignSession open(ScriptedSession script) {
        return script.open(settings(), auditLogger(), knowledge());
    }

    @Command(name = "turn", description = "Run every turn of a JSON script and print the turn results")
    static final class TurnCommand implements Callable<Integer> {
        @ParentCommand
        BenchMeshCommand parent;

        @Option(names = {"--script"}, required = true, description = "Script file (seed document, workers, turns)")
        Path script;

        @Override
        public Integer call() {
            ScriptedSession loaded = ScriptedSession.load(script);
            try (DesignSession session = parent.open(loaded)) {
                List<TurnResult> results = loaded.run(session);
                System.out.println(Jsons.toJson(results));
                boolean valid = !results.isEmpty() && results.get(results.size() - 1).validation().valid();
                return valid ? 0 : 2;
            }
        }
    }

    @Command(name = "rules", description = "List the built-in design rules")
    static final class RulesCommand implements Callable<Integer> {
        @ParentCommand
        BenchMeshCommand parent;

        @Override
        public Integer call() {
            RuleEngine engine = RuleEngine.withBuiltInRules(parent.knowledge());
            List<Map<String, Object>> out = new ArrayList<>();
            for (Rule rule : engine.rules()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("name", rule.name());
                row.put("category", rule.category().name().toLowerCase());
                row.put("severity", rule.severity().label());
                row.put("watches", rule.watchedPaths());
                out.add(row);
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "status", description = "Run a JSON script and print the message bus status")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        BenchMeshCommand parent;

        @Option(names = {"--script"}, required = true, description = "Script file (seed document, workers, turns)")
        Path script;

        @Option(names = {"--prometheus"}, description = "Print Prometheus text exposition instead of JSON")
        boolean prometheus;

        @Override
        public Integer call() {
            ScriptedSession loaded = ScriptedSession.load(script);
            try (DesignSession session = parent.open(loaded)) {
                loaded.run(session);
                if (prometheus) {
                    System.out.print(PrometheusFormatter.format(session.status()));
                } else {
                    System.out.println(Jsons.toJson(session.status()));
                }
                return 0;
            }
        }
    }
}
