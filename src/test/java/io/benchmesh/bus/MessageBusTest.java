package io.benchmesh.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.config.BenchMeshSettings;
import io.benchmesh.error.BusSaturatedException;
import io.benchmesh.error.CyclicQueryException;
import io.benchmesh.error.DispatchFailedException;
import io.benchmesh.error.DuplicateWorkerException;
import io.benchmesh.error.PayloadValidationException;
import io.benchmesh.error.QueryTimeoutException;
import io.benchmesh.error.TargetNotFoundException;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Intent;
import io.benchmesh.model.Message;
import io.benchmesh.model.Priority;
import io.benchmesh.model.ValidationOutcome;
import io.benchmesh.observability.AuditLogger;
import io.benchmesh.rules.FurnitureKnowledge;
import io.benchmesh.rules.RuleEngine;
import io.benchmesh.rules.RuleValidationWorker;
import io.benchmesh.util.Jsons;
import io.benchmesh.worker.Proposal;
import io.benchmesh.worker.ScriptedWorker;
import io.benchmesh.worker.Worker;
import io.benchmesh.worker.WorkerContext;
import io.benchmesh.worker.WorkerInput;
import io.benchmesh.worker.WorkerRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class MessageBusTest {

    @Test
    void duplicateRegistrationIsRejected() {
        try (MessageBus bus = newBus(BenchMeshSettings.defaults())) {
            bus.registerWorker(echo("dimension", new AtomicInteger()));
            Assertions.assertThrows(DuplicateWorkerException.class, () -> bus.registerWorker(echo("dimension", new AtomicInteger())));
            Assertions.assertEquals(List.of("dimension"), bus.registry().names());
        }
    }

    @Test
    void unknownTargetFailsWithoutWaitingForTimeout() {
        try (MessageBus bus = newBus(BenchMeshSettings.defaults())) {
            bus.start();
            CompletableFuture<JsonNode> future = bus.query("coordinator", "ghost", command("ping"));

            Assertions.assertTrue(future.isCompletedExceptionally());
            ExecutionException error = Assertions.assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
            Assertions.assertInstanceOf(TargetNotFoundException.class, error.getCause());
            Assertions.assertEquals(0, bus.status().pendingQueries());
        }
    }

    @Test
    void repeatedQueryIsServedFromCache() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        BenchMeshSettings settings = BenchMeshSettings.defaults();
        try (MessageBus bus = newBus(settings)) {
            bus.registerWorker(echo("echo", calls));
            bus.start();

            JsonNode first = bus.query("coordinator", "echo", command("ping")).get(5, TimeUnit.SECONDS);
            JsonNode second = bus.query("coordinator", "echo", command("ping")).get(5, TimeUnit.SECONDS);
            bus.query("coordinator", "echo", command("ping"), QueryOptions.defaults(settings).withoutCache()).get(5, TimeUnit.SECONDS);

            Assertions.assertEquals(first, second);
            Assertions.assertEquals(2, calls.get());
            BusStatus.WorkerStats stats = bus.status().workerMetrics().get("echo");
            Assertions.assertEquals(1L, stats.cacheHits());
            Assertions.assertEquals(2L, stats.totalQueries());
            Assertions.assertEquals(1.0, stats.successRate());
        }
    }

    @Test
    void slowWorkerTimesOut() {
        BenchMeshSettings settings = BenchMeshSettings.defaults();
        try (MessageBus bus = newBus(settings)) {
            bus.registerWorker(worker("slow", (message, context) -> {
                Thread.sleep(2_000L);
                return Jsons.object();
            }));
            bus.start();

            CompletableFuture<JsonNode> future = bus.query("coordinator", "slow", command("ping"),
                    QueryOptions.defaults(settings).withTimeoutMs(100L));
            ExecutionException error = Assertions.assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            Assertions.assertInstanceOf(QueryTimeoutException.class, MessageBus.unwrap(error));
        }
    }

    @Test
    void cancelledQueryStillRunsButItsResultIsNotCached() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try (MessageBus bus = newBus(BenchMeshSettings.defaults())) {
            bus.registerWorker(worker("slow", (message, context) -> {
                calls.incrementAndGet();
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return labelled("done");
            }));
            bus.start();

            CompletableFuture<JsonNode> future = bus.query("coordinator", "slow", command("ping"));
            Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
            Assertions.assertTrue(future.cancel(true));
            release.countDown();

            long deadline = System.currentTimeMillis() + 5_000L;
            while (bus.status().workerMetrics().get("slow").totalQueries() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            BusStatus status = bus.status();
            Assertions.assertEquals(0, status.pendingQueries());
            Assertions.assertEquals(0, status.cacheSize());
            Assertions.assertEquals(1L, status.workerMetrics().get("slow").totalQueries());
            Assertions.assertTrue(future.isCancelled());

            JsonNode again = bus.query("coordinator", "slow", command("ping")).get(5, TimeUnit.SECONDS);
            Assertions.assertEquals("done", again.get("label").asText());
            Assertions.assertEquals(2, calls.get());
        }
    }

    @Test
    void failingWorkerIsRetriedThenDeadLettered() {
        AtomicInteger calls = new AtomicInteger();
        BenchMeshSettings settings = BenchMeshSettings.fromJson("{\"maxRetries\": 2, \"tickIntervalMs\": 5}");
        try (MessageBus bus = newBus(settings)) {
            bus.registerWorker(worker("flaky", (message, context) -> {
                calls.incrementAndGet();
                throw new IllegalStateException("sawdust in the gears");
            }));
            bus.start();

            CompletableFuture<JsonNode> future = bus.query("coordinator", "flaky", command("ping"));
            ExecutionException error = Assertions.assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            Throwable cause = MessageBus.unwrap(error);
            Assertions.assertInstanceOf(DispatchFailedException.class, cause);
            Assertions.assertInstanceOf(IllegalStateException.class, cause.getCause());
            Assertions.assertEquals(3, calls.get());

            BusStatus status = bus.status();
            Assertions.assertEquals(1L, status.deadLetterTotal());
            Assertions.assertEquals(3, status.recentDeadLetters().get(0).attempts());
            Assertions.assertEquals("flaky", status.recentDeadLetters().get(0).toWorker());
        }
    }

    @Test
    void defaultProviderAnswersAfterRetriesAreExhausted() throws Exception {
        BenchMeshSettings settings = BenchMeshSettings.fromJson("{\"maxRetries\": 0, \"tickIntervalMs\": 5}");
        try (MessageBus bus = newBus(settings)) {
            bus.registerWorker(failing("material"));
            bus.start();

            JsonNode answer = bus.query("coordinator", "material", proposePayload()).get(5, TimeUnit.SECONDS);
            Proposal proposal = Jsons.convert(answer, Proposal.class);
            Assertions.assertTrue(proposal.fallback());
            Assertions.assertEquals("pine", proposal.data().path("materials").get(0).asText());
            Assertions.assertEquals(1L, bus.status().workerMetrics().get("material").fallbacks());

            CompletableFuture<JsonNode> strict = bus.query("coordinator", "material", proposePayload(),
                    QueryOptions.defaults(settings).withoutFallback());
            ExecutionException error = Assertions.assertThrows(ExecutionException.class, () -> strict.get(5, TimeUnit.SECONDS));
            Assertions.assertInstanceOf(DispatchFailedException.class, MessageBus.unwrap(error));
        }
    }

    @Test
    void higherPriorityMessagesAreDispatchedFirst() throws Exception {
        BenchMeshSettings settings = BenchMeshSettings.fromJson("{\"dispatchThreads\": 1}");
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        try (MessageBus bus = newBus(settings)) {
            bus.registerWorker(worker("recorder", (message, context) -> {
                order.add(message.payload().path("label").asText());
                return Jsons.object();
            }));
            QueryOptions options = QueryOptions.defaults(settings);
            List<CompletableFuture<JsonNode>> futures = List.of(
                    bus.query("coordinator", "recorder", labelled("low"), options.withPriority(Priority.LOW)),
                    bus.query("coordinator", "recorder", labelled("normal-1"), options),
                    bus.query("coordinator", "recorder", labelled("high"), options.withPriority(Priority.HIGH)),
                    bus.query("coordinator", "recorder", labelled("normal-2"), options)
            );
            Assertions.assertEquals(4, bus.status().queueDepth());
            Assertions.assertEquals(4, bus.drainOnce());
            for (CompletableFuture<JsonNode> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
            Assertions.assertEquals(List.of("high", "normal-1", "normal-2", "low"), order);
        }
    }

    @Test
    void fullQueueRejectsNewQueries() {
        BenchMeshSettings settings = BenchMeshSettings.fromJson("{\"maxQueueSize\": 1}");
        try (MessageBus bus = newBus(settings)) {
            bus.registerWorker(echo("echo", new AtomicInteger()));
            bus.query("coordinator", "echo", labelled("first"));
            CompletableFuture<JsonNode> second = bus.query("coordinator", "echo", labelled("second"));

            ExecutionException error = Assertions.assertThrows(ExecutionException.class, () -> second.get(1, TimeUnit.SECONDS));
            Assertions.assertInstanceOf(BusSaturatedException.class, error.getCause());
            Assertions.assertEquals(1, bus.status().pendingQueries());
        }
    }

    @Test
    void broadcastReachesSubscribersExceptSender() throws Exception {
        ScriptedWorker dimension = scripted("dimension", List.of("design_updated"), null);
        ScriptedWorker joinery = scripted("joinery", List.of("design_updated"), null);
        try (MessageBus bus = newBus(BenchMeshSettings.defaults())) {
            bus.registerWorker(dimension);
            bus.registerWorker(joinery);
            bus.start();

            int queued = bus.broadcast("dimension", "design_updated", Jsons.tree(Map.of("width", 30)));
            Assertions.assertEquals(1, queued);
            Assertions.assertEquals(0, bus.broadcast("dimension", "nobody_listens", Jsons.object()));

            long deadline = System.currentTimeMillis() + 5_000L;
            while (joinery.receivedTopics().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            Assertions.assertEquals(List.of("design_updated"), joinery.receivedTopics());
            Assertions.assertTrue(dimension.receivedTopics().isEmpty());
        }
    }

    @Test
    void failingValidatorYieldsFailedOutcome() {
        BenchMeshSettings settings = BenchMeshSettings.fromJson("{\"tickIntervalMs\": 5}");
        try (MessageBus bus = newBus(settings)) {
            bus.registerWorker(new RuleValidationWorker(RuleEngine.withBuiltInRules(FurnitureKnowledge.bundled())));
            bus.registerWorker(scripted("style", List.of(), null));
            bus.start();

            DesignDocument document = DesignDocument.empty()
                    .with(DesignDocument.TYPE, "nightstand")
                    .with("dimensions", Jsons.tree(Map.of("width", 20, "height", 26, "depth", 16)));
            Map<String, ValidationOutcome> outcomes = bus.requestValidation(document, List.of("validation", "style", "ghost"));

            Assertions.assertEquals(List.of("validation", "style", "ghost"), List.copyOf(outcomes.keySet()));
            Assertions.assertTrue(outcomes.get("validation").valid());
            Assertions.assertFalse(outcomes.get("style").valid());
            Assertions.assertEquals("validator_error", outcomes.get("style").issues().get(0).rule());
            Assertions.assertFalse(outcomes.get("ghost").valid());
        }
    }

    @Test
    void reentrantQueriesFailFast() {
        try (MessageBus bus = newBus(BenchMeshSettings.defaults())) {
            bus.registerWorker(worker("material", (message, context) -> context.bus().query("joinery", command("ask")).join()));
            bus.registerWorker(worker("joinery", (message, context) -> context.bus().query("material", command("ask")).join()));
            bus.start();

            CompletableFuture<JsonNode> self = bus.query("material", "material", command("ask"));
            Assertions.assertTrue(self.isCompletedExceptionally());

            CompletableFuture<JsonNode> loop = bus.query("coordinator", "material", command("ask"));
            ExecutionException error = Assertions.assertThrows(ExecutionException.class, () -> loop.get(5, TimeUnit.SECONDS));
            Assertions.assertInstanceOf(CyclicQueryException.class, MessageBus.unwrap(error));
        }
    }

    @Test
    void payloadsAreCheckedAgainstTheWorkerSchema() {
        try (MessageBus bus = newBus(BenchMeshSettings.defaults())) {
            bus.registerWorker(scripted("dimension", List.of(), null));

            CompletableFuture<JsonNode> missing = bus.query("coordinator", "dimension", command(WorkerInput.PROPOSE));
            CompletableFuture<JsonNode> unknown = bus.query("coordinator", "dimension", command("dance"));
            CompletableFuture<JsonNode> notObject = bus.query("coordinator", "dimension", Jsons.tree("hello"));

            for (CompletableFuture<JsonNode> future : List.of(missing, unknown, notObject)) {
                ExecutionException error = Assertions.assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
                Assertions.assertInstanceOf(PayloadValidationException.class, error.getCause());
            }
        }
    }

    @Test
    void twoWayConflictGoesToHigherPriorityWorker() {
        try (MessageBus bus = newBus(BenchMeshSettings.defaults())) {
            ConflictCase conflict = new ConflictCase("joint_strength", "joints too weak", Map.of(
                    "joinery", Jsons.tree(Map.of("joinery", List.of("dowel")))
            ));
            Resolution single = bus.resolveConflict(conflict);
            Assertions.assertEquals("joinery", single.winner());

            Map<String, JsonNode> proposals = new LinkedHashMap<>();
            proposals.put("joinery", Jsons.tree(Map.of("joinery", List.of("dowel"))));
            proposals.put("material", Jsons.tree(Map.of("materials", List.of("oak_red"))));
            Resolution resolution = bus.resolveConflict(new ConflictCase("joint_strength", "joints too weak", proposals));

            Assertions.assertEquals("material", resolution.winner());
            Assertions.assertEquals(Resolution.Strategy.PRIORITY, resolution.strategy());
            Assertions.assertEquals("oak_red", resolution.proposal().path("materials").get(0).asText());
        }
    }

    @Test
    void manyWayConflictIsSettledByVoteOfUninvolvedWorkers() throws Exception {
        ScriptedWorker listener = scripted("style", List.of(MessageBus.TOPIC_CONFLICT_RESOLVED), "dimension");
        try (MessageBus bus = newBus(BenchMeshSettings.defaults())) {
            bus.registerWorker(listener);
            bus.registerWorker(scripted("finish", List.of(), "dimension"));
            bus.registerWorker(scripted("hardware", List.of(), "joinery"));
            bus.registerWorker(scripted("material", List.of(), "material"));
            bus.start();

            Map<String, JsonNode> proposals = new LinkedHashMap<>();
            proposals.put("material", Jsons.tree(Map.of("materials", List.of("pine"))));
            proposals.put("dimension", Jsons.tree(Map.of("dimensions", Map.of("width", 20))));
            proposals.put("joinery", Jsons.tree(Map.of("joinery", List.of("dowel"))));
            Resolution resolution = bus.resolveConflict(new ConflictCase("shelf_deflection", "shelf sags", proposals));

            Assertions.assertEquals(Resolution.Strategy.VOTE, resolution.strategy());
            Assertions.assertEquals("dimension", resolution.winner());
            Assertions.assertEquals(Map.of("style", "dimension", "finish", "dimension", "hardware", "joinery"), resolution.votes());

            long deadline = System.currentTimeMillis() + 5_000L;
            while (listener.receivedTopics().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            Assertions.assertEquals(List.of(MessageBus.TOPIC_CONFLICT_RESOLVED), listener.receivedTopics());
        }
    }

    private static MessageBus newBus(BenchMeshSettings settings) {
        return new MessageBus(new WorkerRegistry(), settings, Clock.systemUTC(), AuditLogger.disabled());
    }

    private static ObjectNode command(String type) {
        ObjectNode payload = Jsons.object();
        payload.put("type", type);
        return payload;
    }

    private static ObjectNode labelled(String label) {
        ObjectNode payload = command("ping");
        payload.put("label", label);
        return payload;
    }

    private static ObjectNode proposePayload() {
        return new WorkerInput("turn_test", Intent.MATERIAL_SELECTION, "something sturdy", null, null, null, null).toPayload();
    }

    private static Worker echo(String name, AtomicInteger calls) {
        return worker(name, (message, context) -> {
            ObjectNode out = Jsons.object();
            out.put("call", calls.incrementAndGet());
            out.set("echo", message.payload());
            return out;
        });
    }

    private static Worker failing(String name) {
        return new ScriptedWorker(name, Set.of(), null, List.of(), List.of(), null, List.of(), null, "workshop closed");
    }

    private static ScriptedWorker scripted(String name, List<String> topics, String vote) {
        return new ScriptedWorker(name, Set.of(), null, List.of(), List.of(), null, topics, vote, null);
    }

    private static Worker worker(String name, Handler handler) {
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
                throw new UnsupportedOperationException("not used");
            }

            @Override
            public Map<String, List<String>> payloadSchema() {
                return Map.of();
            }

            @Override
            public JsonNode handleMessage(Message message, WorkerContext context) throws Exception {
                return handler.handle(message, context);
            }
        };
    }

    @FunctionalInterface
    private interface Handler {
        JsonNode handle(Message message, WorkerContext context) throws Exception;
    }
}
