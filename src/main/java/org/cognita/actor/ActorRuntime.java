package org.cognita.actor;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.cognita.actor.state.ActorStateSnapshot;
import org.cognita.continuation.AttachResult;
import org.cognita.continuation.ContinuationEngine;
import org.cognita.continuation.ExtensionDelivery;
import org.cognita.continuation.IExtensionChannel;
import org.cognita.document.BehaviorDocument;
import org.cognita.document.DocumentCache;
import org.cognita.document.DocumentHandle;
import org.cognita.document.DocumentParseException;
import org.cognita.document.execution.ActionHandlerRegistry;
import org.cognita.document.execution.DocumentExecutor;
import org.cognita.document.expression.ExpressionEvaluator;
import org.cognita.planning.GoapPlanner;
import org.cognita.planning.PlanningBudgets;
import org.cognita.store.IModelStore;
import org.cognita.store.IStateStore;
import org.cognita.store.ModelUpdateListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Hosts many concurrent actors on a shared scheduled worker pool.
 * <p>
 * Owns the document cache, the action handler registry and the planner shared by all actors.
 * Saving a new version of a behavior document to the model store swaps it into every actor
 * using that reference at its next tick.
 */
public class ActorRuntime {

    private static final Logger log = LoggerFactory.getLogger(ActorRuntime.class);

    private final Config actorConfig;
    private final Duration defaultTickInterval;
    private final Duration defaultAutoSaveInterval;
    private final int defaultPerceptionQueueSize;
    private final Config continuationConfig;
    private final long shutdownTimeoutMs;
    private final IModelStore modelStore;
    private final IStateStore stateStore;
    private final Clock clock;

    private final DocumentCache documents;
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private final ActionHandlerRegistry registry = ActionHandlerRegistry.withBuiltins();
    private final GoapPlanner planner;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ActorRunner> actors = new ConcurrentHashMap<>();
    private final List<IActorStateListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<IExtensionChannel, Consumer<ExtensionDelivery>> channels = new ConcurrentHashMap<>();
    private final ModelUpdateListener hotSwap = this::onModelUpdated;
    private volatile boolean shutdown = false;

    public ActorRuntime(Config config, IModelStore modelStore, IStateStore stateStore) {
        this(config, modelStore, stateStore, Clock.systemUTC());
    }

    /**
     * Creates a runtime.
     * @param config The {@code cognita} configuration block: {@code runtime}, {@code actor},
     *               {@code continuation} and {@code planner} subtrees, each optional.
     * @param modelStore The store behavior documents are loaded from.
     * @param stateStore The store actor snapshots are persisted to.
     * @param clock The clock used by actors and continuation engines.
     */
    public ActorRuntime(Config config, IModelStore modelStore, IStateStore stateStore, Clock clock) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "runtime.workerThreads", Math.max(2, Runtime.getRuntime().availableProcessors()),
                "runtime.shutdownTimeoutMs", 5000,
                "actor.defaultTickIntervalMs", ActorTemplate.DEFAULT_TICK_INTERVAL.toMillis(),
                "actor.defaultAutoSaveIntervalMs", ActorTemplate.DEFAULT_AUTO_SAVE_INTERVAL.toMillis(),
                "actor.defaultPerceptionQueueSize", ActorTemplate.DEFAULT_PERCEPTION_QUEUE_SIZE));
        Config finalConfig = config.withFallback(defaults);
        int workerThreads = finalConfig.getInt("runtime.workerThreads");
        this.shutdownTimeoutMs = finalConfig.getLong("runtime.shutdownTimeoutMs");
        this.actorConfig = subtree(finalConfig, "actor");
        this.defaultTickInterval = Duration.ofMillis(finalConfig.getLong("actor.defaultTickIntervalMs"));
        this.defaultAutoSaveInterval = Duration.ofMillis(finalConfig.getLong("actor.defaultAutoSaveIntervalMs"));
        this.defaultPerceptionQueueSize = finalConfig.getInt("actor.defaultPerceptionQueueSize");
        this.continuationConfig = subtree(finalConfig, "continuation");
        this.planner = new GoapPlanner(new PlanningBudgets(subtree(finalConfig, "planner")));

        this.modelStore = modelStore;
        this.stateStore = stateStore;
        this.clock = clock;
        this.documents = new DocumentCache(modelStore);
        modelStore.addUpdateListener(hotSwap);

        AtomicInteger threadCounter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(workerThreads, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("actor-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("ActorRuntime started with {} worker threads", workerThreads);
    }

    private static Config subtree(Config config, String path) {
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }

    /**
     * Creates a template with the configured default intervals and queue size.
     */
    public ActorTemplate newTemplate(String templateId, String behaviorReference) {
        return new ActorTemplate(templateId, behaviorReference, defaultTickInterval, defaultAutoSaveInterval,
                defaultPerceptionQueueSize, "default", null);
    }

    /**
     * Spawns a fresh actor.
     * @see #spawn(String, ActorTemplate, boolean)
     */
    public ActorRunner spawn(String actorId, ActorTemplate template) throws IOException, DocumentParseException {
        return spawn(actorId, template, false);
    }

    /**
     * Loads the template's behavior document and starts an actor on it.
     *
     * @param actorId The unique actor id.
     * @param template The template.
     * @param restore Whether to restore the actor's last snapshot from the state store, if one exists.
     * @return The started runner.
     * @throws IOException if the document or snapshot cannot be read.
     * @throws DocumentParseException if the document is invalid.
     * @throws IllegalStateException if the id is taken by an actor that has not terminated, or the
     * runtime is shut down. A STOPPED or ERROR actor with the same id is replaced.
     */
    public ActorRunner spawn(String actorId, ActorTemplate template, boolean restore) throws IOException, DocumentParseException {
        if (shutdown) {
            throw new IllegalStateException("ActorRuntime is shut down");
        }
        BehaviorDocument document = documents.get(template.behaviorReference())
                .orElseThrow(() -> new IOException("Behavior document '" + template.behaviorReference() + "' not found"));
        ActorStateSnapshot snapshot = null;
        if (restore) {
            snapshot = stateStore.load(actorId).orElse(null);
            if (snapshot == null) {
                log.debug("No snapshot for actor {}, starting fresh", actorId);
            }
        }

        ContinuationEngine engine = new ContinuationEngine(continuationConfig, clock);
        DocumentExecutor executor = new DocumentExecutor(evaluator, registry, engine);
        ActorRunner runner = new ActorRunner(actorId, template, DocumentHandle.initial(template.behaviorReference(), document),
                actorConfig, executor, planner, stateStore, listeners, clock);
        ActorRunner registered = actors.compute(actorId,
                (id, existing) -> existing == null || existing.getStatus().isTerminal() ? runner : existing);
        if (registered != runner) {
            throw new IllegalStateException("Actor '" + actorId + "' already exists");
        }
        runner.start(scheduler, snapshot);
        return runner;
    }

    /**
     * Stops an actor. The stopped actor stays registered, so its status and last fault remain
     * queryable until it is {@link #remove(String) removed} or replaced by a new spawn.
     * @return false if no such actor exists or it has already terminated.
     */
    public boolean stop(String actorId, boolean graceful) {
        ActorRunner runner = actors.get(actorId);
        if (runner == null || runner.getStatus().isTerminal()) {
            return false;
        }
        runner.stop(graceful);
        return true;
    }

    /**
     * Forgets a terminated actor.
     * @return false if no such actor exists or it is still alive.
     */
    public boolean remove(String actorId) {
        ActorRunner[] removed = new ActorRunner[1];
        actors.computeIfPresent(actorId, (id, runner) -> {
            if (runner.getStatus().isTerminal()) {
                removed[0] = runner;
                return null;
            }
            return runner;
        });
        return removed[0] != null;
    }

    public boolean sendMessage(String actorId, Map<String, Object> payload) {
        ActorRunner runner = actors.get(actorId);
        if (runner == null || runner.getStatus().isTerminal()) {
            log.debug("Message for unknown or terminated actor {} dropped", actorId);
            return false;
        }
        runner.sendMessage(payload);
        return true;
    }

    /**
     * Queues a perception for an actor.
     * @return false if the actor is unknown or has terminated.
     */
    public boolean injectPerception(String actorId, Perception perception) {
        ActorRunner runner = actors.get(actorId);
        if (runner == null || runner.getStatus().isTerminal()) {
            return false;
        }
        runner.offerPerception(perception);
        return true;
    }

    public AttachResult deliverExtension(String actorId, String pointName, byte[] payload) {
        ActorRunner runner = actors.get(actorId);
        if (runner == null) {
            log.debug("Extension for unknown actor {} ignored", actorId);
            return AttachResult.NOT_FOUND;
        }
        return runner.deliverExtension(pointName, payload);
    }

    /**
     * Subscribes to an extension channel; every delivery is routed to its actor.
     */
    public void connect(IExtensionChannel channel) {
        Consumer<ExtensionDelivery> consumer = delivery -> deliverExtension(
                delivery.actorId(), delivery.continuationPointName(), delivery.payload());
        if (channels.putIfAbsent(channel, consumer) == null) {
            channel.subscribe(consumer);
        }
    }

    public void disconnect(IExtensionChannel channel) {
        Consumer<ExtensionDelivery> consumer = channels.remove(channel);
        if (consumer != null) {
            channel.unsubscribe(consumer);
        }
    }

    public Optional<ActorStatus> getStatus(String actorId) {
        return Optional.ofNullable(actors.get(actorId)).map(ActorRunner::getStatus);
    }

    public Optional<String> getLastFault(String actorId) {
        return Optional.ofNullable(actors.get(actorId)).map(ActorRunner::getLastFault);
    }

    public Optional<ActorRunner> getActor(String actorId) {
        return Optional.ofNullable(actors.get(actorId));
    }

    public List<String> listActors() {
        List<String> ids = new ArrayList<>(actors.keySet());
        ids.sort(null);
        return ids;
    }

    public void addStateListener(IActorStateListener listener) {
        listeners.add(listener);
    }

    public void removeStateListener(IActorStateListener listener) {
        listeners.remove(listener);
    }

    public ActionHandlerRegistry getHandlerRegistry() {
        return registry;
    }

    private void onModelUpdated(String reference) {
        Set<String> references = documents.affectedBy(reference);
        documents.invalidate(reference);
        for (String changed : references) {
            reload(changed);
        }
    }

    private void reload(String reference) {
        List<ActorRunner> affected = actors.values().stream()
                .filter(r -> r.getTemplate().behaviorReference().equals(reference))
                .filter(r -> !r.getStatus().isTerminal())
                .toList();
        if (affected.isEmpty()) {
            return;
        }
        try {
            Optional<BehaviorDocument> document = documents.get(reference);
            if (document.isEmpty()) {
                log.warn("Updated behavior document '{}' disappeared before reload", reference);
                return;
            }
            affected.forEach(r -> r.replaceDocument(document.get()));
            log.info("Behavior document '{}' reloaded for {} actors", reference, affected.size());
        } catch (IOException | DocumentParseException e) {
            log.warn("Keeping previous version of behavior document '{}': {}", reference, e.getMessage());
        }
    }

    /**
     * Stops all actors gracefully, waits for them up to the configured timeout and releases the workers.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        modelStore.removeUpdateListener(hotSwap);
        channels.forEach((channel, consumer) -> channel.unsubscribe(consumer));
        channels.clear();

        List<ActorRunner> running = new ArrayList<>(actors.values());
        actors.clear();
        running.forEach(r -> r.stop(true));
        long deadline = System.currentTimeMillis() + shutdownTimeoutMs;
        try {
            for (ActorRunner runner : running) {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                if (!runner.awaitTermination(Duration.ofMillis(remaining))) {
                    log.warn("Actor {} did not stop within {} ms, forcing", runner.getActorId(), shutdownTimeoutMs);
                    runner.stop(false);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.forEach(r -> r.stop(false));
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Actor workers did not terminate within {} ms", shutdownTimeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("ActorRuntime shut down ({} actors stopped)", running.size());
    }
}
