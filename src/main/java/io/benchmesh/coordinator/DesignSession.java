package io.benchmesh.coordinator;

import io.benchmesh.bus.BusStatus;
import io.benchmesh.bus.MessageBus;
import io.benchmesh.config.BenchMeshSettings;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Intent;
import io.benchmesh.model.TurnResult;
import io.benchmesh.observability.AuditLogger;
import io.benchmesh.rules.FurnitureKnowledge;
import io.benchmesh.rules.RuleEngine;
import io.benchmesh.rules.RuleValidationWorker;
import io.benchmesh.state.SharedStateStore;
import io.benchmesh.worker.DefaultProvider;
import io.benchmesh.worker.Worker;
import io.benchmesh.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * One design conversation: owns the store, the bus and the coordinator, created together and
 * closed together. Nothing here is shared between sessions.
 */
public final class DesignSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DesignSession.class);
    private static final Set<String> INTERNAL_WRITERS = Set.of(
            MessageBus.COORDINATOR,
            SharedStateStore.SYSTEM_WRITER,
            "user"
    );

    private final BenchMeshSettings settings;
    private final SharedStateStore store;
    private final MessageBus bus;
    private final RuleEngine rules;
    private final Coordinator coordinator;

    private DesignSession(Builder builder) {
        this.settings = builder.settings;
        this.rules = builder.rules == null ? RuleEngine.withBuiltInRules(builder.knowledge) : builder.rules;
        WorkerRegistry registry = new WorkerRegistry();
        this.bus = new MessageBus(registry, settings, builder.clock, builder.auditLogger);
        for (Registration registration : builder.workers) {
            if (registration.provider() == null) {
                bus.registerWorker(registration.worker());
            } else {
                bus.registerWorker(registration.worker(), registration.provider());
            }
        }
        if (settings.validators().contains(RuleValidationWorker.NAME) && !registry.isRegistered(RuleValidationWorker.NAME)) {
            bus.registerWorker(new RuleValidationWorker(rules));
        }
        this.store = new SharedStateStore(
                builder.document,
                builder.constraints,
                settings,
                builder.clock,
                writer -> INTERNAL_WRITERS.contains(writer) || registry.isRegistered(writer),
                builder.auditLogger
        );
        this.coordinator = new Coordinator(
                store,
                bus,
                rules,
                new VariationGenerator(builder.knowledge, rules),
                settings,
                builder.clock,
                builder.auditLogger
        );
        bus.start();
        log.info("Design session started with workers {}", registry.names());
    }

    public static Builder builder() {
        return new Builder();
    }

    public TurnResult processTurn(Intent intent, String rawInput) {
        return coordinator.processTurn(intent, rawInput, -1L);
    }

    public TurnResult processTurn(Intent intent, String rawInput, long currentVersion) {
        return coordinator.processTurn(intent, rawInput, currentVersion);
    }

    public BusStatus status() {
        return bus.status();
    }

    public SharedStateStore store() {
        return store;
    }

    public MessageBus bus() {
        return bus;
    }

    public RuleEngine rules() {
        return rules;
    }

    public BenchMeshSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        bus.close();
        store.close();
        log.info("Design session closed");
    }

    public static final class Builder {
        private BenchMeshSettings settings = BenchMeshSettings.defaults();
        private Clock clock = Clock.systemUTC();
        private AuditLogger auditLogger = AuditLogger.disabled();
        private FurnitureKnowledge knowledge;
        private RuleEngine rules;
        private DesignDocument document = DesignDocument.empty();
        private Constraints constraints = Constraints.defaults();
        private final List<Registration> workers = new ArrayList<>();

        private Builder() {
        }

        public Builder settings(BenchMeshSettings value) {
            this.settings = value == null ? BenchMeshSettings.defaults() : value;
            return this;
        }

        public Builder clock(Clock value) {
            this.clock = value == null ? Clock.systemUTC() : value;
            return this;
        }

        public Builder auditLogger(AuditLogger value) {
            this.auditLogger = value == null ? AuditLogger.disabled() : value;
            return this;
        }

        public Builder knowledge(FurnitureKnowledge value) {
            this.knowledge = value;
            return this;
        }

        public Builder rules(RuleEngine value) {
            this.rules = value;
            return this;
        }

        public Builder document(DesignDocument value) {
            this.document = value == null ? DesignDocument.empty() : value;
            return this;
        }

        public Builder constraints(Constraints value) {
            this.constraints = value == null ? Constraints.defaults() : value;
            return this;
        }

        public Builder worker(Worker worker) {
            return worker(worker, null);
        }

        public Builder worker(Worker worker, DefaultProvider provider) {
            if (worker == null) {
                throw new IllegalArgumentException("worker cannot be null");
            }
            workers.add(new Registration(worker, provider));
            return this;
        }

        public DesignSession build() {
            if (knowledge == null) {
                knowledge = FurnitureKnowledge.bundled();
            }
            return new DesignSession(this);
        }
    }

    private record Registration(Worker worker, DefaultProvider provider) {
    }
}
