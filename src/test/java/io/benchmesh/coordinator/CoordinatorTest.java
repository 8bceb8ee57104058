package io.benchmesh.coordinator;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.config.BenchMeshSettings;
import io.benchmesh.model.ChangeRecord;
import io.benchmesh.model.Conflict;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.Decision;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Intent;
import io.benchmesh.model.TurnResult;
import io.benchmesh.model.ValidationOutcome;
import io.benchmesh.model.Variation;
import io.benchmesh.state.StateUpdate;
import io.benchmesh.util.Jsons;
import io.benchmesh.worker.Proposal;
import io.benchmesh.worker.ScriptedWorker;
import io.benchmesh.worker.Worker;
import io.benchmesh.worker.WorkerContext;
import io.benchmesh.worker.WorkerInput;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

final class CoordinatorTest {
    private static final BenchMeshSettings NO_RETRIES = BenchMeshSettings.fromJson("{\"maxRetries\": 0}");

    @Test
    void wideShelfIsNarrowedAndSecuredWithinOneTurn() {
        DesignDocument start = DesignDocument.empty().with(DesignDocument.TYPE, "bookshelf");
        try (DesignSession session = DesignSession.builder()
                .document(start)
                .worker(scripted("dimension", dimensions(48, 72, 12), null))
                .worker(scripted("material", Jsons.object().set("materials", Jsons.tree(List.of("mdf"))), null))
                .build()) {
            TurnResult result = session.processTurn(Intent.DESIGN_INITIATION, "a 48 inch bookshelf");

            Assertions.assertEquals(List.of("dimension", "material"), result.plan());
            Assertions.assertEquals(20.0, result.document().width());
            Assertions.assertEquals(72.0, result.document().height());
            Assertions.assertEquals(List.of("mdf"), result.document().materials());
            Assertions.assertTrue(result.document().features().contains("anti-tip hardware"));
            Assertions.assertEquals(2, result.resolved().stream().filter(c -> c.type().equals("shelf_deflection")).count());
            Assertions.assertTrue(result.resolved().stream().anyMatch(c -> c.type().equals("stability")));
            Assertions.assertTrue(result.validation().valid());
            Assertions.assertTrue(result.validation().validators().containsKey("validation"));
            Assertions.assertTrue(result.conflicts().isEmpty(), result.conflicts().toString());
            Assertions.assertFalse(result.variations().isEmpty());

            List<ChangeRecord> fixes = session.store().history("coordinator");
            Assertions.assertTrue(fixes.stream().anyMatch(c -> c.reason().equals("auto-fix shelf_deflection")));
            Assertions.assertEquals(result.version(), session.store().version());
        }
    }

    @Test
    void validDesignGetsOnlyTheVariationsThatRespectConstraints() {
        DesignDocument shelf = DesignDocument.empty()
                .with(DesignDocument.TYPE, "bookshelf")
                .with("dimensions", Jsons.tree(Map.of("width", 20, "height", 72, "depth", 12)))
                .with(DesignDocument.MATERIALS, List.of("maple_hard"))
                .with(DesignDocument.BOARD_THICKNESS, 0.75)
                .with(DesignDocument.FEATURES, List.of("adjustable_shelves", "back_panel", "anti_tip"));
        ObjectNode limits = Constraints.defaults().toJson();
        ((ObjectNode) limits.get("dimensional")).put("maxWidth", 20);

        try (DesignSession session = DesignSession.builder()
                .document(shelf)
                .constraints(Constraints.of(limits))
                .build()) {
            TurnResult result = session.processTurn(Intent.VALIDATION_CHECK, "is this ok?");

            Assertions.assertTrue(result.plan().isEmpty());
            Assertions.assertTrue(result.validation().valid());
            Assertions.assertEquals(1.0, result.validation().score(), 1e-9);
            Assertions.assertEquals(1, result.variations().size());
            Variation variation = result.variations().get(0);
            Assertions.assertEquals(Variation.Kind.ALTERNATE_MATERIAL, variation.kind());
            Assertions.assertEquals(List.of("oak_red"), variation.document().materials());
            Assertions.assertEquals(List.of("maple_hard"), result.document().materials());
        }
    }

    @Test
    void failingWorkerFallsBackToConservativeDefault() {
        ScriptedWorker broken = failing("dimension");
        try (DesignSession session = DesignSession.builder()
                .settings(NO_RETRIES)
                .document(DesignDocument.empty().with(DesignDocument.TYPE, "table"))
                .worker(broken)
                .build()) {
            TurnResult result = session.processTurn(Intent.DIMENSION_SPECIFICATION, "make it smaller");

            Assertions.assertEquals(24.0, result.document().width());
            Assertions.assertEquals(30.0, result.document().height());
            Assertions.assertTrue(result.reasoning().stream().anyMatch(line -> line.startsWith("dimension failed:")));
            Assertions.assertTrue(result.reasoning().contains("Using the conservative default for dimension"));
            Assertions.assertTrue(session.store().decision("dimension", "proposal").isPresent());
        }
    }

    @Test
    void failingWorkerPrefersItsLastDecision() {
        try (DesignSession session = DesignSession.builder()
                .settings(NO_RETRIES)
                .document(DesignDocument.empty().with(DesignDocument.TYPE, "table"))
                .worker(failing("dimension"))
                .build()) {
            ObjectNode earlier = dimensions(40, 29, 20);
            session.store().transact("dimension", StateUpdate.create()
                    .reason("seed")
                    .decision(new Decision("dimension", "dimensions", earlier, "earlier turn", 0.9, List.of(), 0L)));

            TurnResult result = session.processTurn(Intent.DIMENSION_SPECIFICATION, "a bit wider");

            Assertions.assertEquals(40.0, result.document().width());
            Assertions.assertEquals(29.0, result.document().height());
            Assertions.assertTrue(result.reasoning().contains("Reusing the last decision of dimension"));
        }
    }

    @Test
    void workerWithoutFallbackIsSkipped() {
        try (DesignSession session = DesignSession.builder()
                .settings(NO_RETRIES)
                .worker(failing("style"))
                .build()) {
            TurnResult result = session.processTurn(Intent.STYLE_AESTHETIC, "shaker please");

            Assertions.assertEquals(List.of("style"), result.plan());
            Assertions.assertTrue(result.reasoning().contains("Skipping style: no previous decision or default"));
            Assertions.assertNull(result.document().style());
        }
    }

    @Test
    void proposalBreakingConstraintsIsRevisedOnceThenSurfaced() {
        ObjectNode limits = Constraints.defaults().toJson();
        ((ObjectNode) limits.get("dimensional")).put("maxWidth", 30);
        ScriptedWorker dimension = new ScriptedWorker(
                "dimension", null, "dimensions",
                List.of(dimensions(48, 30, 24)),
                List.of(dimensions(40, 30, 24)),
                null, null, null, null
        );
        try (DesignSession session = DesignSession.builder()
                .document(DesignDocument.empty().with(DesignDocument.TYPE, "desk"))
                .constraints(Constraints.of(limits))
                .worker(dimension)
                .build()) {
            TurnResult result = session.processTurn(Intent.DIMENSION_SPECIFICATION, "48 wide");

            Assertions.assertEquals(2, dimension.proposeCalls());
            Assertions.assertEquals(40.0, result.document().width());
            Conflict violation = result.conflicts().stream()
                    .filter(c -> c.type().equals(Coordinator.CONSTRAINT_VIOLATION))
                    .findFirst()
                    .orElseThrow();
            Assertions.assertEquals(List.of("dimension"), violation.involvedWorkers());
            Assertions.assertTrue(violation.description().contains("width 40.0 exceeds maximum 30.0"));
            Assertions.assertTrue(result.validation().valid());
        }
    }

    @Test
    void revisionWithinConstraintsIsCommittedQuietly() {
        ObjectNode limits = Constraints.defaults().toJson();
        ((ObjectNode) limits.get("dimensional")).put("maxWidth", 30);
        ScriptedWorker dimension = new ScriptedWorker(
                "dimension", null, "dimensions",
                List.of(dimensions(48, 30, 24)),
                List.of(dimensions(28, 30, 24)),
                null, null, null, null
        );
        try (DesignSession session = DesignSession.builder()
                .document(DesignDocument.empty().with(DesignDocument.TYPE, "desk"))
                .constraints(Constraints.of(limits))
                .worker(dimension)
                .build()) {
            TurnResult result = session.processTurn(Intent.DIMENSION_SPECIFICATION, "48 wide");

            Assertions.assertEquals(28.0, result.document().width());
            Assertions.assertTrue(result.conflicts().isEmpty(), result.conflicts().toString());
        }
    }

    @Test
    void unfixableConflictIsEscalatedToItsOnlyWriter() {
        ObjectNode demanding = Constraints.defaults().toJson();
        ((ObjectNode) demanding.get("structural")).put("min_safety_factor", 10);
        ObjectNode joint = Jsons.object();
        joint.set("joinery", Jsons.tree(List.of("mortise_tenon")));
        ScriptedWorker joinery = new ScriptedWorker("joinery", null, "joinery", List.of(joint), List.of(joint), null, null, null, null);
        try (DesignSession session = DesignSession.builder()
                .document(DesignDocument.empty().with(DesignDocument.TYPE, "chair"))
                .constraints(Constraints.of(demanding))
                .worker(joinery)
                .build()) {
            TurnResult result = session.processTurn(Intent.JOINERY_METHOD, "strongest joints");

            Assertions.assertEquals(List.of("joinery"), result.plan());
            Assertions.assertEquals(2, joinery.proposeCalls());
            Assertions.assertTrue(result.reasoning().contains("Asking joinery to revise for joint_strength"));
            Assertions.assertFalse(result.validation().valid());
            Assertions.assertTrue(result.variations().isEmpty());
            Assertions.assertTrue(result.reasoning().contains("Design not valid yet; variations skipped"));
        }
    }

    @Test
    void writeLandingWhileWorkerProposesIsNotOverwritten() {
        AtomicReference<DesignSession> holder = new AtomicReference<>();
        AtomicInteger calls = new AtomicInteger();
        Worker dimension = proposer("dimension", input -> {
            if (calls.incrementAndGet() == 1) {
                holder.get().store().transact("user", StateUpdate.create().design(DesignDocument.WIDTH, 10));
            }
            return Proposal.ok(dimensions(30, 30, 18), "desk size");
        });
        try (DesignSession session = DesignSession.builder()
                .document(DesignDocument.empty().with(DesignDocument.TYPE, "desk"))
                .worker(dimension)
                .build()) {
            holder.set(session);
            TurnResult result = session.processTurn(Intent.DIMENSION_SPECIFICATION, "30 wide");

            Assertions.assertEquals(2, calls.get());
            Assertions.assertTrue(result.reasoning().contains("Design changed while dimension was proposing; asking again"));
            Assertions.assertTrue(result.conflicts().stream().noneMatch(c -> c.type().equals(Coordinator.WRITE_CONFLICT)));
            Assertions.assertEquals(30.0, result.document().width());

            List<ChangeRecord> widths = session.store().history().stream()
                    .filter(c -> c.path().equals("design.dimensions.width"))
                    .toList();
            Assertions.assertEquals("user", widths.get(0).worker());
            Assertions.assertEquals("dimension", widths.get(1).worker());
            Assertions.assertEquals(10, widths.get(1).previousValue().asInt());
        }
    }

    @Test
    void designThatKeepsChangingSurfacesWriteConflict() {
        BenchMeshSettings settings = BenchMeshSettings.fromJson("{\"maxTransactRetries\": 2, \"transactBackoffMs\": 0}");
        AtomicReference<DesignSession> holder = new AtomicReference<>();
        AtomicInteger calls = new AtomicInteger();
        Worker dimension = proposer("dimension", input -> {
            holder.get().store().transact("user", StateUpdate.create().design(DesignDocument.WIDTH, 10 + calls.incrementAndGet()));
            return Proposal.ok(dimensions(30, 30, 18), "desk size");
        });
        try (DesignSession session = DesignSession.builder()
                .settings(settings)
                .document(DesignDocument.empty().with(DesignDocument.TYPE, "desk"))
                .worker(dimension)
                .build()) {
            holder.set(session);
            TurnResult result = session.processTurn(Intent.DIMENSION_SPECIFICATION, "30 wide");

            Assertions.assertEquals(3, calls.get());
            Conflict conflict = result.conflicts().stream()
                    .filter(c -> c.type().equals(Coordinator.WRITE_CONFLICT))
                    .findFirst()
                    .orElseThrow();
            Assertions.assertEquals(List.of("dimension"), conflict.involvedWorkers());
            Assertions.assertTrue(conflict.description().contains("stale version"), conflict.description());
            Assertions.assertEquals(13.0, result.document().width());
            Assertions.assertTrue(session.store().history("dimension").isEmpty());
        }
    }

    @Test
    void staleCallerVersionIsNotedAndTurnContinues() {
        try (DesignSession session = DesignSession.builder().build()) {
            TurnResult result = session.processTurn(Intent.VALIDATION_CHECK, "check", 7L);

            Assertions.assertTrue(result.reasoning().get(0).startsWith("Caller saw version 7 but the design is at version 0"));
            Assertions.assertTrue(result.reasoning().contains("No workers planned for validation_check"));
        }
    }

    @Test
    void brokenValidatorMakesTheDesignInvalid() {
        BenchMeshSettings settings = BenchMeshSettings.fromJson("{\"maxRetries\": 0, \"validators\": [\"validation\", \"safety\"]}");
        Worker safety = new Worker() {
            @Override
            public String name() {
                return "safety";
            }

            @Override
            public boolean canHandle(Intent intent) {
                return true;
            }

            @Override
            public Proposal propose(WorkerInput input, WorkerContext context) {
                return Proposal.fail("not a proposer");
            }

            @Override
            public ValidationOutcome validate(DesignDocument document, Constraints constraints) {
                throw new IllegalStateException("sensor offline");
            }
        };
        try (DesignSession session = DesignSession.builder()
                .settings(settings)
                .document(DesignDocument.empty().with(DesignDocument.TYPE, "desk"))
                .worker(safety)
                .build()) {
            TurnResult result = session.processTurn(Intent.MODIFICATION_REQUEST, "anything");

            Assertions.assertTrue(result.plan().isEmpty());
            Assertions.assertFalse(result.validation().valid());
            Assertions.assertEquals(0.0, result.validation().score(), 1e-9);
            Assertions.assertTrue(result.conflicts().stream().anyMatch(c -> c.type().equals(Coordinator.VALIDATION_UNAVAILABLE)));
            Assertions.assertTrue(result.validation().validators().get("validation").valid());
            Assertions.assertTrue(session.store().read().validations().containsKey("safety"));
        }
    }

    private static Worker proposer(String name, Function<WorkerInput, Proposal> propose) {
        return new Worker() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public boolean canHandle(Intent intent) {
                return true;
            }

            @Override
            public Proposal propose(WorkerInput input, WorkerContext context) {
                return propose.apply(input);
            }
        };
    }

    private static ScriptedWorker scripted(String name, ObjectNode proposal, String vote) {
        return new ScriptedWorker(name, null, name, List.of(proposal), null, null, null, vote, null);
    }

    private static ScriptedWorker failing(String name) {
        return new ScriptedWorker(name, null, name, null, null, null, null, null, name + " backend down");
    }

    static ObjectNode dimensions(double width, double height, double depth) {
        ObjectNode data = Jsons.object();
        ObjectNode dims = data.putObject("dimensions");
        dims.put("width", width);
        dims.put("height", height);
        dims.put("depth", depth);
        return data;
    }
}
