package io.benchmesh.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.benchmesh.config.BenchMeshSettings;
import io.benchmesh.error.BenchMeshException;
import io.benchmesh.error.BusSaturatedException;
import io.benchmesh.error.CyclicQueryException;
import io.benchmesh.error.DispatchFailedException;
import io.benchmesh.error.PayloadValidationException;
import io.benchmesh.error.QueryTimeoutException;
import io.benchmesh.error.TargetNotFoundException;
import io.benchmesh.model.Constraints;
import io.benchmesh.model.DesignDocument;
import io.benchmesh.model.Message;
import io.benchmesh.model.MessageKind;
import io.benchmesh.model.Priority;
import io.benchmesh.model.ValidationOutcome;
import io.benchmesh.observability.AuditLogger;
import io.benchmesh.observability.Ids;
import io.benchmesh.util.Jsons;
import io.benchmesh.worker.BusClient;
import io.benchmesh.worker.DefaultProvider;
import io.benchmesh.worker.Proposal;
import io.benchmesh.worker.Worker;
import io.benchmesh.worker.WorkerContext;
import io.benchmesh.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process bus between workers. Queries and broadcasts go through one priority queue that is
 * drained every tick, highest priority first and oldest first within a priority.
 */
public final class MessageBus implements AutoCloseable {
    public static final String COORDINATOR = "coordinator";
    public static final String TOPIC_CONFLICT_RESOLVED = "conflict_resolved";
    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final WorkerRegistry registry;
    private final BenchMeshSettings settings;
    private final Clock clock;
    private final AuditLogger auditLogger;
    private final Map<String, DefaultProvider> defaultProviders = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> subscriptions = new ConcurrentHashMap<>();
    private final PriorityQueue<QueuedMessage> queue = new PriorityQueue<>(QueuedMessage.DISPATCH_ORDER);
    private final Map<String, PendingQuery> pending = new ConcurrentHashMap<>();
    private final Map<String, WorkerMetrics> metrics = new ConcurrentHashMap<>();
    private final Deque<DeadLetter> deadLetters = new ArrayDeque<>();
    private final AtomicLong deadLetterTotal = new AtomicLong();
    private final AtomicLong sequence = new AtomicLong();
    private final QueryCache cache;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService dispatchPool;
    private volatile boolean running;
    private volatile boolean closed;

    public MessageBus(WorkerRegistry registry, BenchMeshSettings settings, Clock clock, AuditLogger auditLogger) {
        this.registry = registry == null ? new WorkerRegistry() : registry;
        this.settings = settings == null ? BenchMeshSettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.auditLogger = auditLogger == null ? AuditLogger.disabled() : auditLogger;
        this.cache = new QueryCache(this.settings.cacheTtlMs());
        AtomicInteger dispatchThreadIds = new AtomicInteger();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "benchmesh-bus-tick");
            t.setDaemon(true);
            return t;
        });
        this.dispatchPool = Executors.newFixedThreadPool(this.settings.dispatchThreads(), r -> {
            Thread t = new Thread(r, "benchmesh-bus-dispatch-" + dispatchThreadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (Map.Entry<String, JsonNode> entry : this.settings.fallbacks().entrySet()) {
            if (entry.getValue() instanceof ObjectNode data) {
                Proposal fallback = Proposal.ok(data, "conservative default for " + entry.getKey())
                        .asFallback("conservative default for " + entry.getKey());
                defaultProviders.put(entry.getKey(), DefaultProvider.fixed(Jsons.tree(fallback)));
            }
        }
    }

    public synchronized void start() {
        if (running || closed) {
            return;
        }
        running = true;
        long tick = settings.tickIntervalMs();
        scheduler.scheduleWithFixedDelay(this::tick, tick, tick, TimeUnit.MILLISECONDS);
        log.info("Message bus started: tick={}ms batch={} threads={}", tick, settings.batchSize(), settings.dispatchThreads());
    }

    public void registerWorker(Worker worker) {
        registry.register(worker);
        metrics.putIfAbsent(worker.name(), new WorkerMetrics());
        for (String topic : worker.topics()) {
            subscriptions.computeIfAbsent(topic, t -> new LinkedHashSet<>());
            Set<String> subscribers = subscriptions.get(topic);
            synchronized (subscribers) {
                subscribers.add(worker.name());
            }
        }
        log.debug("Registered worker {} topics={}", worker.name(), worker.topics());
    }

    public void registerWorker(Worker worker, DefaultProvider defaultProvider) {
        registerWorker(worker);
        setDefaultProvider(worker.name(), defaultProvider);
    }

    public void setDefaultProvider(String workerName, DefaultProvider provider) {
        if (provider == null) {
            defaultProviders.remove(workerName);
        } else {
            defaultProviders.put(workerName, provider);
        }
    }

    public WorkerRegistry registry() {
        return registry;
    }

    public CompletableFuture<JsonNode> query(String from, String to, JsonNode payload) {
        return query(from, to, payload, QueryOptions.defaults(settings));
    }

    public CompletableFuture<JsonNode> query(String from, String to, JsonNode payload, QueryOptions options) {
        return query(from, to, payload, options, List.of(from));
    }

    CompletableFuture<JsonNode> query(String from, String to, JsonNode payload, QueryOptions options, List<String> callerChain) {
        QueryOptions opts = options == null ? QueryOptions.defaults(settings) : options;
        if (closed) {
            return CompletableFuture.failedFuture(new BenchMeshException("message bus is closed"));
        }
        if (to == null || to.equals(from) || callerChain.contains(to)) {
            return CompletableFuture.failedFuture(new CyclicQueryException(from, to));
        }
        Optional<Worker> target = registry.find(to);
        if (target.isEmpty()) {
            return CompletableFuture.failedFuture(new TargetNotFoundException(to));
        }
        try {
            validatePayload(target.get(), payload);
        } catch (PayloadValidationException e) {
            return CompletableFuture.failedFuture(e);
        }

        long nowMs = clock.millis();
        String cacheKey = QueryCache.key(from, to, payload);
        if (opts.useCache()) {
            Optional<JsonNode> cached = cache.get(cacheKey, nowMs);
            if (cached.isPresent()) {
                metricsFor(to).cacheHit(nowMs);
                return CompletableFuture.completedFuture(cached.get());
            }
        }

        List<String> chain = new ArrayList<>(callerChain);
        chain.add(to);
        Message message = new Message(
                Ids.newMessageId(),
                from,
                to,
                MessageKind.QUERY,
                payload,
                true,
                opts.timeoutMs(),
                opts.priority(),
                nowMs,
                chain
        );
        PendingQuery query = new PendingQuery(message, new CompletableFuture<>(), System.nanoTime());
        pending.put(message.id(), query);
        try {
            enqueue(new QueuedMessage(message, 0, sequence.incrementAndGet()));
        } catch (BusSaturatedException e) {
            pending.remove(message.id());
            return CompletableFuture.failedFuture(e);
        }
        ScheduledFuture<?> timeout = scheduler.schedule(
                () -> query.response().completeExceptionally(new QueryTimeoutException(to, opts.timeoutMs())),
                opts.timeoutMs(),
                TimeUnit.MILLISECONDS
        );
        CompletableFuture<JsonNode> answer = new CompletableFuture<>();
        query.response().whenComplete((response, error) -> {
            timeout.cancel(false);
            pending.remove(message.id());
            if (answer.isCancelled()) {
                discard(query, error);
                return;
            }
            try {
                answer.complete(complete(query, opts, cacheKey, response, error));
            } catch (CompletionException e) {
                answer.completeExceptionally(e.getCause() == null ? e : e.getCause());
            } catch (RuntimeException e) {
                answer.completeExceptionally(e);
            }
        });
        return answer;
    }

    // The caller cancelled; the dispatch still counts but its result is dropped and never cached.
    private void discard(PendingQuery query, Throwable error) {
        Message message = query.message();
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - query.startedNanos());
        metricsFor(message.toWorker()).record(error == null, latencyMs, clock.millis());
        log.debug("Discarded result of cancelled query {} to {}", message.id(), message.toWorker());
    }

    /**
     * Fans {@code data} out to every subscriber of {@code topic} except the sender.
     * Returns the number of deliveries queued.
     */
    public int broadcast(String from, String topic, JsonNode data) {
        return broadcast(from, topic, data, Priority.NORMAL);
    }

    public int broadcast(String from, String topic, JsonNode data, Priority priority) {
        Set<String> subscribers = subscriptions.get(topic);
        if (subscribers == null || closed) {
            return 0;
        }
        List<String> targets;
        synchronized (subscribers) {
            targets = new ArrayList<>(subscribers);
        }
        ObjectNode payload = Jsons.object();
        payload.put("topic", topic);
        payload.set("data", data == null ? Jsons.mapper().nullNode() : data.deepCopy());
        int queued = 0;
        for (String target : targets) {
            if (target.equals(from)) {
                continue;
            }
            Message message = new Message(
                    Ids.newMessageId(),
                    from,
                    target,
                    MessageKind.BROADCAST,
                    payload,
                    false,
                    0L,
                    priority,
                    clock.millis(),
                    List.of(from)
            );
            try {
                enqueue(new QueuedMessage(message, 0, sequence.incrementAndGet()));
                queued++;
            } catch (BusSaturatedException e) {
                log.warn("Dropped broadcast {} to {}: {}", topic, target, e.getMessage());
            }
        }
        return queued;
    }

    public Map<String, ValidationOutcome> requestValidation(DesignDocument document, List<String> workerNames) {
        return requestValidation(document, Constraints.defaults(), workerNames);
    }

    /**
     * Queries every named validator in parallel. A validator that errors or times out yields a
     * failed outcome instead of aborting the batch.
     */
    public Map<String, ValidationOutcome> requestValidation(DesignDocument document, Constraints constraints, List<String> workerNames) {
        ObjectNode payload = Jsons.object();
        payload.put("type", Worker.VALIDATE);
        payload.set("document", document.toJson());
        payload.set("constraints", constraints.toJson());
        QueryOptions options = QueryOptions.defaults(settings).withoutFallback().withPriority(Priority.HIGH);
        Map<String, CompletableFuture<JsonNode>> futures = new LinkedHashMap<>();
        for (String name : workerNames) {
            futures.put(name, query(COORDINATOR, name, payload, options));
        }
        Map<String, ValidationOutcome> out = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<JsonNode>> entry : futures.entrySet()) {
            try {
                out.put(entry.getKey(), Jsons.convert(entry.getValue().join(), ValidationOutcome.class));
            } catch (CompletionException | IllegalArgumentException e) {
                Throwable cause = unwrap(e);
                log.warn("Validator {} failed: {}", entry.getKey(), cause.getMessage());
                out.put(entry.getKey(), ValidationOutcome.failure(entry.getKey(), cause.getMessage()));
            }
        }
        return out;
    }

    /**
     * Two proposals are settled by the worker priority table, more than two by a vote of the
     * registered workers not involved. Ties and empty ballots go to the first proposal.
     */
    public Resolution resolveConflict(ConflictCase conflict) {
        List<String> involved = conflict.involvedWorkers();
        Resolution resolution;
        if (involved.size() <= 2) {
            String winner = involved.get(0);
            for (String candidate : involved) {
                if (settings.priorityOf(candidate) > settings.priorityOf(winner)) {
                    winner = candidate;
                }
            }
            resolution = new Resolution(winner, conflict.proposals().get(winner), Resolution.Strategy.PRIORITY, Map.of());
        } else {
            resolution = vote(conflict, involved);
        }
        log.info("Resolved {} between {} in favor of {} by {}", conflict.type(), involved, resolution.winner(), resolution.strategy());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "bus.conflict_resolved",
                COORDINATOR,
                "conflict/" + conflict.type(),
                resolution.strategy().name().toLowerCase(),
                null,
                Map.of(
                        "involved", involved,
                        "winner", resolution.winner(),
                        "votes", resolution.votes()
                )
        ));
        ObjectNode event = Jsons.object();
        event.put("type", conflict.type());
        event.put("issue", conflict.issue());
        event.put("winner", resolution.winner());
        event.put("strategy", resolution.strategy().name().toLowerCase());
        broadcast(COORDINATOR, TOPIC_CONFLICT_RESOLVED, event, Priority.HIGH);
        return resolution;
    }

    public BusStatus status() {
        int depth;
        synchronized (this) {
            depth = queue.size();
        }
        List<DeadLetter> recent;
        synchronized (deadLetters) {
            recent = List.copyOf(deadLetters);
        }
        Map<String, BusStatus.WorkerStats> stats = new LinkedHashMap<>();
        for (String name : registry.names()) {
            stats.put(name, metricsFor(name).view());
        }
        return new BusStatus(
                registry.names(),
                depth,
                pending.size(),
                cache.size(),
                deadLetterTotal.get(),
                recent,
                stats
        );
    }

    /**
     * Dispatches up to one batch from the queue. Returns the number of messages handed to the
     * dispatch pool.
     */
    int drainOnce() {
        List<QueuedMessage> batch = new ArrayList<>();
        synchronized (this) {
            while (batch.size() < settings.batchSize() && !queue.isEmpty()) {
                batch.add(queue.poll());
            }
        }
        for (QueuedMessage queued : batch) {
            try {
                dispatchPool.execute(() -> dispatch(queued));
            } catch (RejectedExecutionException e) {
                log.debug("Dispatch pool closed, dropping {}", queued.message().id());
            }
        }
        return batch.size();
    }

    private void tick() {
        try {
            drainOnce();
            int expired = cache.cleanup(clock.millis());
            if (expired > 0) {
                log.debug("Evicted {} expired cache entries", expired);
            }
        } catch (RuntimeException e) {
            log.warn("Bus tick failed: {}", e.getMessage(), e);
        }
    }

    private synchronized void enqueue(QueuedMessage queued) {
        if (queue.size() >= settings.maxQueueSize()) {
            throw new BusSaturatedException(settings.maxQueueSize());
        }
        queue.add(queued);
    }

    private void dispatch(QueuedMessage queued) {
        Message message = queued.message();
        Optional<Worker> target = registry.find(message.toWorker());
        if (message.kind() == MessageKind.BROADCAST) {
            if (target.isEmpty()) {
                return;
            }
            try {
                target.get().handleMessage(message, contextFor(message));
            } catch (Exception e) {
                log.warn("Worker {} failed on broadcast {}: {}", message.toWorker(), message.id(), e.getMessage());
            }
            return;
        }
        PendingQuery query = pending.get(message.id());
        if (query == null || query.response().isDone()) {
            log.debug("Discarding abandoned query {}", message.id());
            return;
        }
        if (target.isEmpty()) {
            query.response().completeExceptionally(new TargetNotFoundException(message.toWorker()));
            return;
        }
        try {
            JsonNode result = target.get().handleMessage(message, contextFor(message));
            Message response = new Message(
                    Ids.newMessageId(),
                    message.toWorker(),
                    message.fromWorker(),
                    MessageKind.RESPONSE,
                    result == null ? Jsons.mapper().nullNode() : result,
                    false,
                    0L,
                    message.priority(),
                    clock.millis(),
                    message.callChain()
            );
            query.response().complete(response);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            if (retryable(cause) && queued.attempt() < settings.maxRetries()) {
                log.debug("Retrying {} to {} (attempt {}): {}", message.id(), message.toWorker(), queued.attempt() + 1, cause.getMessage());
                try {
                    enqueue(queued.retry(sequence.incrementAndGet()));
                    return;
                } catch (BusSaturatedException saturated) {
                    cause = saturated;
                }
            }
            deadLetter(queued, cause);
            query.response().completeExceptionally(retryable(cause)
                    ? new DispatchFailedException(message.toWorker(), queued.attempt() + 1, cause)
                    : cause);
        }
    }

    private JsonNode complete(PendingQuery query, QueryOptions options, String cacheKey, Message response, Throwable error) {
        Message message = query.message();
        long nowMs = clock.millis();
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - query.startedNanos());
        WorkerMetrics workerMetrics = metricsFor(message.toWorker());
        if (error == null) {
            workerMetrics.record(true, latencyMs, nowMs);
            JsonNode result = response.payload();
            if (options.useCache()) {
                cache.put(cacheKey, result, nowMs);
            }
            return result;
        }
        Throwable cause = unwrap(error);
        workerMetrics.record(false, latencyMs, nowMs);
        boolean fallbackEligible = cause instanceof QueryTimeoutException || cause instanceof DispatchFailedException;
        DefaultProvider provider = defaultProviders.get(message.toWorker());
        if (options.allowFallback() && fallbackEligible && provider != null) {
            Optional<JsonNode> fallback = provider.fallback(message, cause);
            if (fallback.isPresent()) {
                workerMetrics.fallback(nowMs);
                log.warn("Query {} to {} failed ({}), using default", message.id(), message.toWorker(), cause.getMessage());
                JsonNode value = fallback.get();
                if (value instanceof ObjectNode object && !object.has("fallback")) {
                    object.put("fallback", true);
                }
                return value;
            }
        }
        throw cause instanceof CompletionException completion ? completion : new CompletionException(cause);
    }

    private Resolution vote(ConflictCase conflict, List<String> involved) {
        ObjectNode payload = Jsons.object();
        payload.put("type", Worker.VOTE);
        payload.put("issue", conflict.issue());
        ObjectNode candidates = payload.putObject("candidates");
        conflict.proposals().forEach((name, proposal) -> candidates.set(name, proposal == null ? Jsons.mapper().nullNode() : proposal));
        QueryOptions options = QueryOptions.defaults(settings)
                .withTimeoutMs(settings.voteTimeoutMs())
                .withPriority(Priority.HIGH)
                .withoutFallback()
                .withoutCache();
        Map<String, CompletableFuture<JsonNode>> ballots = new LinkedHashMap<>();
        for (String voter : registry.names()) {
            if (!involved.contains(voter)) {
                ballots.put(voter, query(COORDINATOR, voter, payload, options));
            }
        }
        Map<String, String> votes = new LinkedHashMap<>();
        Map<String, Integer> tally = new LinkedHashMap<>();
        involved.forEach(name -> tally.put(name, 0));
        for (Map.Entry<String, CompletableFuture<JsonNode>> ballot : ballots.entrySet()) {
            try {
                JsonNode answer = ballot.getValue().join();
                String choice = answer == null ? null : answer.path("vote").asText(null);
                if (choice != null && tally.containsKey(choice)) {
                    votes.put(ballot.getKey(), choice);
                    tally.merge(choice, 1, Integer::sum);
                }
            } catch (CompletionException e) {
                log.debug("Voter {} abstained: {}", ballot.getKey(), unwrap(e).getMessage());
            }
        }
        if (votes.isEmpty()) {
            String first = involved.get(0);
            return new Resolution(first, conflict.proposals().get(first), Resolution.Strategy.FIRST_PROPOSAL, votes);
        }
        String winner = involved.get(0);
        for (String candidate : involved) {
            if (tally.get(candidate) > tally.get(winner)) {
                winner = candidate;
            }
        }
        return new Resolution(winner, conflict.proposals().get(winner), Resolution.Strategy.VOTE, votes);
    }

    private WorkerContext contextFor(Message message) {
        String self = message.toWorker();
        List<String> chain = message.callChain();
        BusClient client = new BusClient() {
            @Override
            public CompletableFuture<JsonNode> query(String toWorker, JsonNode payload) {
                return MessageBus.this.query(self, toWorker, payload, QueryOptions.defaults(settings), chain);
            }

            @Override
            public void broadcast(String topic, JsonNode data) {
                MessageBus.this.broadcast(self, topic, data);
            }
        };
        String turnId = message.payload() == null ? null : message.payload().path("turnId").asText(null);
        return new WorkerContext(turnId, message.id(), message.fromWorker(), chain, client);
    }

    private void validatePayload(Worker target, JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new PayloadValidationException(target.name(), "payload must be a JSON object");
        }
        String type = payload.path("type").asText("");
        if (type.isBlank()) {
            throw new PayloadValidationException(target.name(), "payload type is required");
        }
        Map<String, List<String>> schema = target.payloadSchema();
        if (schema == null || schema.isEmpty()) {
            return;
        }
        List<String> required = schema.get(type);
        if (required == null) {
            throw new PayloadValidationException(target.name(), "unsupported query type " + type);
        }
        for (String field : required) {
            if (!payload.has(field)) {
                throw new PayloadValidationException(target.name(), "missing field " + field + " for " + type);
            }
        }
    }

    private void deadLetter(QueuedMessage queued, Throwable cause) {
        Message message = queued.message();
        DeadLetter letter = new DeadLetter(
                message.id(),
                message.fromWorker(),
                message.toWorker(),
                message.payloadType(),
                queued.attempt() + 1,
                cause.getMessage(),
                clock.millis()
        );
        synchronized (deadLetters) {
            if (deadLetters.size() >= settings.deadLetterCapacity()) {
                deadLetters.removeFirst();
            }
            deadLetters.addLast(letter);
        }
        deadLetterTotal.incrementAndGet();
        log.warn("Dead-lettered {} from {} to {} after {} attempt(s): {}",
                message.id(), message.fromWorker(), message.toWorker(), letter.attempts(), cause.getMessage());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "bus.dead_letter",
                message.fromWorker(),
                "worker/" + message.toWorker(),
                "dead_lettered",
                null,
                Map.of(
                        "message_id", message.id(),
                        "query_type", message.payloadType(),
                        "attempts", letter.attempts(),
                        "error", String.valueOf(cause.getMessage())
                )
        ));
    }

    private WorkerMetrics metricsFor(String worker) {
        return metrics.computeIfAbsent(worker, w -> new WorkerMetrics());
    }

    private static boolean retryable(Throwable cause) {
        return !(cause instanceof CyclicQueryException
                || cause instanceof PayloadValidationException
                || cause instanceof TargetNotFoundException
                || cause instanceof UnsupportedOperationException
                || cause instanceof BusSaturatedException);
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            running = false;
            queue.clear();
        }
        scheduler.shutdownNow();
        dispatchPool.shutdown();
        try {
            if (!dispatchPool.awaitTermination(1, TimeUnit.SECONDS)) {
                dispatchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatchPool.shutdownNow();
        }
        for (PendingQuery query : pending.values()) {
            query.response().completeExceptionally(new BenchMeshException("message bus is closed"));
        }
        pending.clear();
        log.info("Message bus closed");
    }

    private record PendingQuery(Message message, CompletableFuture<Message> response, long startedNanos) {
    }
}
