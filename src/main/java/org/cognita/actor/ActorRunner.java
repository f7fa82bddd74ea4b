package org.cognita.actor;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.cognita.actor.state.ActorStateSnapshot;
import org.cognita.actor.state.ExecutionState;
import org.cognita.actor.state.PlanState;
import org.cognita.continuation.AttachResult;
import org.cognita.continuation.ContinuationEngine;
import org.cognita.continuation.PendingContinuation;
import org.cognita.continuation.Resolution;
import org.cognita.document.BehaviorDocument;
import org.cognita.document.DocumentHandle;
import org.cognita.document.DocumentParseException;
import org.cognita.document.execution.DocumentExecutor;
import org.cognita.document.execution.ExecutionOptions;
import org.cognita.document.execution.ExecutionResult;
import org.cognita.document.execution.RecordedEffects;
import org.cognita.document.execution.VariableScope;
import org.cognita.document.parser.DocumentParser;
import org.cognita.planning.GoapAction;
import org.cognita.planning.GoapGoal;
import org.cognita.planning.GoapMetadata;
import org.cognita.planning.GoapPlanner;
import org.cognita.planning.PlanResult;
import org.cognita.planning.PlanValidator;
import org.cognita.planning.UrgencyTier;
import org.cognita.planning.ValidationResult;
import org.cognita.planning.ValidationSuggestion;
import org.cognita.planning.WorldState;
import org.cognita.store.IStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The execution loop of one actor, scheduled on a shared executor.
 * <p>
 * Each tick drains perceptions and messages, advances a paused continuation, runs one cognition
 * pass of the behavior document, applies the resulting feelings, goals and memories, runs a
 * requested GOAP replan and persists the state on the auto-save cadence. Ticks of one actor
 * never overlap.
 * <p>
 * Error handling follows two rules. Transient problems (handler faults, faulted passes, failed
 * saves) are logged at WARN without stack trace, recorded with {@link #recordError} and the actor
 * keeps running. Anything escaping a tick (model corruption, broken invariants) moves the actor
 * to {@link ActorStatus#ERROR} with the last-fault reason set.
 */
public class ActorRunner {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());

    static final Set<String> TRANSIENT_VARIABLES = Set.of("state", "perceptions", "messages", "actor", "plan", "recent_urgent");
    private static final String PROCESS_TICK_FLOW = "process_tick";

    private final String actorId;
    private final ActorTemplate template;
    private final DocumentExecutor executor;
    private final ContinuationEngine continuationEngine;
    private final GoapPlanner planner;
    private final PlanValidator validator = new PlanValidator();
    private final DocumentParser parser = new DocumentParser();
    private final IStateStore stateStore;
    private final List<IActorStateListener> listeners;
    private final Clock clock;

    private final double urgencyThreshold;
    private final int maxErrors;
    private final int recentUrgentCapacity;
    private final int stepBudget;

    private final PerceptionQueue perceptions;
    private final ConcurrentLinkedQueue<Map<String, Object>> messages = new ConcurrentLinkedQueue<>();
    private final AtomicReference<ActorStatus> status = new AtomicReference<>(ActorStatus.PENDING);
    private final AtomicReference<BehaviorDocument> pendingDocument = new AtomicReference<>();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicLong filteredPerceptions = new AtomicLong();

    // Loop state, guarded by this
    private DocumentHandle document;
    private List<GoapGoal> goapGoals = List.of();
    private List<GoapAction> goapActions = List.of();
    private final VariableScope scope = new VariableScope();
    private final Map<String, Double> feelings = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> goals = new LinkedHashMap<>();
    private final Map<String, Object> memories = new LinkedHashMap<>();
    private final Deque<Map<String, Object>> recentUrgent = new ArrayDeque<>();
    private PlanResult currentPlan;
    private PlanState planState;
    private String pendingContinuationId;
    private long waitUntilMs;
    private long iteration;
    private long lastSaveMs;

    private volatile boolean stopRequested;
    private volatile String lastFault;
    private ScheduledFuture<?> future;

    /**
     * Creates a runner in state PENDING.
     * @param actorId The actor id.
     * @param template The template it was spawned from.
     * @param document The initial document handle.
     * @param options The {@code cognita.actor} configuration subtree.
     * @param executor The document executor of this actor; its continuation engine is the actor's.
     * @param planner The shared planner.
     * @param stateStore Where snapshots are persisted.
     * @param listeners Observers, shared with the runtime.
     * @param clock The clock for tick cadence and waits.
     */
    public ActorRunner(String actorId, ActorTemplate template, DocumentHandle document, Config options,
                       DocumentExecutor executor, GoapPlanner planner, IStateStore stateStore,
                       List<IActorStateListener> listeners, Clock clock) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "perceptionUrgencyThreshold", 0.0,
                "maxErrors", 100,
                "recentUrgentCapacity", 10,
                "stepBudget", ExecutionOptions.DEFAULT_STEP_BUDGET));
        Config finalConfig = options.withFallback(defaults);
        this.urgencyThreshold = finalConfig.getDouble("perceptionUrgencyThreshold");
        this.maxErrors = finalConfig.getInt("maxErrors");
        this.recentUrgentCapacity = finalConfig.getInt("recentUrgentCapacity");
        this.stepBudget = finalConfig.getInt("stepBudget");

        this.actorId = actorId;
        this.template = template;
        this.document = document;
        this.executor = executor;
        this.continuationEngine = executor.getContinuationEngine();
        this.planner = planner;
        this.stateStore = stateStore;
        this.listeners = listeners;
        this.clock = clock;
        this.perceptions = new PerceptionQueue(template.perceptionQueueSize());
        loadGoapMetadata();
    }

    /**
     * Starts the loop: PENDING, STARTING, optional restore, RUNNING.
     * @param scheduler The shared executor the ticks run on.
     * @param snapshot A snapshot to restore, or null for a fresh actor.
     */
    public void start(ScheduledExecutorService scheduler, ActorStateSnapshot snapshot) {
        if (!transition(ActorStatus.PENDING, ActorStatus.STARTING)) {
            throw new IllegalStateException(String.format("Cannot start actor '%s' as it is in state %s", actorId, getStatus()));
        }
        synchronized (this) {
            try {
                if (snapshot != null) {
                    applySnapshot(snapshot);
                }
            } catch (RuntimeException e) {
                fail(e);
                return;
            }
            lastSaveMs = clock.millis();
        }
        if (!transition(ActorStatus.STARTING, ActorStatus.RUNNING)) {
            return;
        }
        future = scheduler.scheduleWithFixedDelay(this::runTick, 0, template.tickInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.info("Actor {} started (template {}, tick {} ms{})", actorId, template.templateId(),
                template.tickInterval().toMillis(), snapshot != null ? ", restored at iteration " + snapshot.iteration() : "");
    }

    /**
     * Stops the actor. A graceful stop lets the current tick finish and stops at the next tick
     * boundary; a forced stop interrupts the running tick.
     */
    public void stop(boolean graceful) {
        ActorStatus current = getStatus();
        if (current == ActorStatus.PENDING) {
            if (transition(ActorStatus.PENDING, ActorStatus.STOPPED)) {
                terminated.countDown();
            }
            return;
        }
        if (current.isTerminal()) {
            return;
        }
        stopRequested = true;
        if (graceful) {
            log.debug("Actor {} will stop at the next tick boundary", actorId);
            return;
        }
        if (future != null) {
            future.cancel(true);
        }
        ActorStatus state = getStatus();
        if (state.isActive() && transition(state, ActorStatus.STOPPING) && transition(ActorStatus.STOPPING, ActorStatus.STOPPED)) {
            terminated.countDown();
            log.info("Actor {} stopped (forced)", actorId);
        }
    }

    public void pause() {
        if (!transition(ActorStatus.RUNNING, ActorStatus.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause actor '%s' as it is in state %s", actorId, getStatus()));
        }
        log.info("Actor {} paused", actorId);
    }

    public void resume() {
        if (!transition(ActorStatus.PAUSED, ActorStatus.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume actor '%s' as it is in state %s", actorId, getStatus()));
        }
        log.info("Actor {} resumed", actorId);
    }

    /**
     * Waits until the actor reaches STOPPED or ERROR.
     * @return true if it did within the timeout.
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Queues a perception for the next tick.
     * @return false if an older perception had to be dropped to make room.
     */
    public boolean offerPerception(Perception perception) {
        return !perceptions.offer(perception);
    }

    public void sendMessage(Map<String, Object> payload) {
        messages.add(payload);
    }

    /**
     * Replaces the behavior document. The swap happens at the start of the next tick.
     */
    public void replaceDocument(BehaviorDocument replacement) {
        pendingDocument.set(replacement);
    }

    /**
     * Offers a YAML extension document for a continuation point of this actor.
     * @return {@link AttachResult#MISMATCHED} if the payload is not a valid document.
     */
    public AttachResult deliverExtension(String pointName, byte[] payload) {
        BehaviorDocument extension;
        try {
            extension = parser.parse(payload, actorId + ":" + pointName);
        } catch (DocumentParseException e) {
            log.warn("Actor {} rejected extension for '{}': {}", actorId, pointName, e.getMessage());
            return AttachResult.MISMATCHED;
        }
        return deliverExtension(pointName, extension);
    }

    public AttachResult deliverExtension(String pointName, BehaviorDocument extension) {
        AttachResult result = continuationEngine.attachExtensionByName(pointName, extension);
        log.debug("Actor {} extension for '{}': {}", actorId, pointName, result);
        return result;
    }

    private void runTick() {
        try {
            if (getStatus().isTerminal()) {
                return;
            }
            if (stopRequested) {
                finishStop("stop requested");
                return;
            }
            if (getStatus() != ActorStatus.RUNNING) {
                return;
            }
            synchronized (this) {
                tick();
            }
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    private void tick() {
        applyPendingDocument();
        long now = clock.millis();
        iteration++;

        List<Map<String, Object>> perceived = drainPerceptions();
        List<Map<String, Object>> inbox = new ArrayList<>();
        for (Map<String, Object> message = messages.poll(); message != null; message = messages.poll()) {
            inbox.add(message);
        }
        injectVariables(perceived, inbox);

        RecordedEffects effects = new RecordedEffects();
        ExecutionOptions executionOptions = new ExecutionOptions(stepBudget, () -> Thread.currentThread().isInterrupted(), effects);
        ExecutionResult result = null;
        continuationEngine.poll();
        if (pendingContinuationId != null) {
            if (continuationEngine.isResolvable(pendingContinuationId)) {
                Resolution resolution = continuationEngine.resolve(pendingContinuationId);
                pendingContinuationId = null;
                log.debug("Actor {} resumes '{}' with {}", actorId, resolution.continuation().pointName(),
                        resolution.extended() ? "extension" : "default flow");
                result = executor.resume(document.document(), resolution, scope, executionOptions);
            }
        } else if (now >= waitUntilMs) {
            result = executor.execute(document.document(), tickFlow(), scope, executionOptions);
        }

        if (result != null) {
            handleResult(result, effects, now);
        }

        if (effects.isTerminationRequested()) {
            log.info("Actor {} requested termination: {}", actorId, effects.getTerminationReason());
            finishStop(effects.getTerminationReason());
            return;
        }
        if (!template.autoSaveInterval().isZero() && now - lastSaveMs >= template.autoSaveInterval().toMillis()) {
            lastSaveMs = now;
            persist();
        }
    }

    private void handleResult(ExecutionResult result, RecordedEffects effects, long now) {
        if (result instanceof ExecutionResult.Paused paused) {
            pendingContinuationId = paused.continuationId();
            log.debug("Actor {} paused at continuation point '{}'", actorId, paused.pending().pointName());
        } else if (result instanceof ExecutionResult.Faulted faulted) {
            log.warn("Actor {} cognition pass faulted: {}", actorId, faulted.error());
            recordError("EXECUTION_FAULTED", faulted.error(), "iteration " + iteration);
        }
        for (RecordedEffects.Fault fault : effects.getFaults()) {
            recordError("HANDLER_FAULT", fault.message(), fault.flow() + "/" + fault.action());
        }
        if (effects.getWaitMillis() > 0) {
            waitUntilMs = now + effects.getWaitMillis();
        }
        applyEffects(effects);
        applyPlanning(effects.getReplanRequest());
    }

    private void applyEffects(RecordedEffects effects) {
        Map<String, Double> changedFeelings = new LinkedHashMap<>();
        effects.getFeelings().forEach((name, value) -> {
            if (!Objects.equals(feelings.put(name, value), value)) {
                changedFeelings.put(name, value);
            }
        });
        goals.putAll(effects.getGoals());
        memories.putAll(effects.getMemories());

        if (planState != null && !planState.isComplete()) {
            for (RecordedEffects.Intent intent : effects.getIntents()) {
                if (intent.intent().equals(planState.currentAction())) {
                    planState = planState.advance();
                    log.debug("Actor {} completed plan step '{}'", actorId, intent.intent());
                    break;
                }
            }
        }

        if (changedFeelings.isEmpty() && effects.getGoals().isEmpty() && effects.getMemories().isEmpty()
                && effects.getIntents().isEmpty()) {
            return;
        }
        ActorStateUpdate update = new ActorStateUpdate(actorId, iteration, changedFeelings, effects.getGoals(),
                effects.getMemories(), effects.getIntents(), Instant.ofEpochMilli(clock.millis()));
        for (IActorStateListener listener : listeners) {
            try {
                listener.onStateUpdate(update);
            } catch (RuntimeException e) {
                log.warn("State listener failed for actor {}: {}", actorId, e.getMessage());
            }
        }
    }

    private void applyPlanning(RecordedEffects.ReplanRequest request) {
        if (request != null) {
            replan(request.urgency(), request.goal());
            return;
        }
        if (currentPlan == null || planState == null) {
            return;
        }
        ValidationResult validation = validator.validate(currentPlan, planState.cursor(), worldState(), goapGoals);
        if (validation.suggestion() == ValidationSuggestion.ABORT) {
            log.debug("Actor {} drops plan for '{}': {}", actorId, planState.goalId(), validation.reason());
            currentPlan = null;
            planState = null;
        } else if (validation.suggestion() == ValidationSuggestion.REPLAN) {
            String goal = validation.betterGoal() != null ? validation.betterGoal().id() : planState.goalId();
            replan(UrgencyTier.MEDIUM.representativeUrgency(), goal);
        }
    }

    private void replan(double urgency, String goalId) {
        if (goapGoals.isEmpty() || goapActions.isEmpty()) {
            log.debug("Actor {} requested a replan but its document has no GOAP content", actorId);
            return;
        }
        WorldState world = worldState();
        GoapGoal goal = goalId != null
                ? GoapMetadata.findGoal(goapGoals, goalId).orElse(null)
                : goapGoals.stream().filter(g -> !g.isSatisfiedBy(world)).findFirst().orElse(null);
        if (goal == null) {
            log.debug("Actor {} has no goal to plan for (requested '{}')", actorId, goalId);
            return;
        }
        PlanResult result = planner.plan(world, goal, goapActions, urgency);
        UrgencyTier tier = UrgencyTier.fromUrgency(urgency);
        if (!result.found() && tier != UrgencyTier.LOW) {
            log.debug("Actor {} found no plan for '{}' ({}), retrying at {}", actorId, goal.id(), result.reason(), tier.relax());
            result = planner.plan(world, goal, goapActions, tier.relax().representativeUrgency());
        }
        if (!result.found()) {
            log.debug("Actor {} keeps its previous plan: no plan for '{}' ({})", actorId, goal.id(), result.reason());
            return;
        }
        currentPlan = result;
        planState = new PlanState(goal.id(), result.actionIds(), 0, world.asMap());
        log.debug("Actor {} planned {} for '{}'", actorId, result.actionIds(), goal.id());
    }

    private WorldState worldState() {
        Map<String, Object> facts = new LinkedHashMap<>();
        memories.forEach((key, value) -> {
            if (value instanceof Number || value instanceof Boolean || value instanceof String) {
                facts.put(key, value);
            }
        });
        facts.putAll(feelings);
        if (scope.get("world") instanceof Map<?, ?> world) {
            world.forEach((key, value) -> facts.put(String.valueOf(key), value));
        }
        return WorldState.of(facts);
    }

    private List<Map<String, Object>> drainPerceptions() {
        List<Map<String, Object>> accepted = new ArrayList<>();
        for (Perception perception : perceptions.drain()) {
            if (perception.urgency() < urgencyThreshold) {
                filteredPerceptions.incrementAndGet();
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", perception.type());
            entry.put("source", perception.source());
            entry.put("urgency", perception.urgency());
            entry.put("payload", perception.payload());
            accepted.add(entry);
            if (perception.urgency() >= UrgencyTier.HIGH_THRESHOLD) {
                recentUrgent.addLast(entry);
                while (recentUrgent.size() > recentUrgentCapacity) {
                    recentUrgent.pollFirst();
                }
            }
        }
        return accepted;
    }

    private void injectVariables(List<Map<String, Object>> perceived, List<Map<String, Object>> inbox) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("feelings", new LinkedHashMap<>(feelings));
        state.put("goals", new LinkedHashMap<>(goals));
        state.put("memories", new LinkedHashMap<>(memories));
        scope.defineLocal("state", state);
        scope.defineLocal("perceptions", perceived);
        scope.defineLocal("messages", inbox);
        scope.defineLocal("recent_urgent", new ArrayList<>(recentUrgent));

        Map<String, Object> actor = new LinkedHashMap<>();
        actor.put("id", actorId);
        actor.put("template", template.templateId());
        actor.put("category", template.category());
        actor.put("iteration", (double) iteration);
        scope.defineLocal("actor", actor);

        if (planState == null) {
            scope.defineLocal("plan", null);
        } else {
            Map<String, Object> plan = new LinkedHashMap<>();
            plan.put("goal", planState.goalId());
            plan.put("actions", planState.actionIds());
            plan.put("cursor", (double) planState.cursor());
            plan.put("current_action", planState.currentAction());
            scope.defineLocal("plan", plan);
        }
    }

    private void applyPendingDocument() {
        BehaviorDocument replacement = pendingDocument.getAndSet(null);
        if (replacement == null) {
            return;
        }
        document = document.next(replacement);
        loadGoapMetadata();
        log.info("Actor {} switched to document '{}' version {}", actorId, document.reference(), document.version());
    }

    private void loadGoapMetadata() {
        BehaviorDocument current = document.document();
        try {
            goapGoals = GoapMetadata.goals(current);
            goapActions = GoapMetadata.actions(current);
        } catch (IllegalArgumentException e) {
            log.warn("Actor {} ignores invalid GOAP metadata: {}", actorId, e.getMessage());
            recordError("GOAP_METADATA", e.getMessage(), document.reference());
            goapGoals = List.of();
            goapActions = List.of();
        }
    }

    private String tickFlow() {
        BehaviorDocument current = document.document();
        if (current.hasFlow(PROCESS_TICK_FLOW)) {
            return PROCESS_TICK_FLOW;
        }
        return template.startFlow() != null ? template.startFlow() : current.getEntryFlow();
    }

    private void finishStop(String reason) {
        ActorStatus current = getStatus();
        if (!current.canTransitionTo(ActorStatus.STOPPING) || !transition(current, ActorStatus.STOPPING)) {
            return;
        }
        synchronized (this) {
            persist();
        }
        if (future != null) {
            future.cancel(false);
        }
        if (transition(ActorStatus.STOPPING, ActorStatus.STOPPED)) {
            terminated.countDown();
            log.info("Actor {} stopped ({})", actorId, reason);
        }
    }

    private void fail(RuntimeException e) {
        lastFault = e.getClass().getSimpleName() + ": " + e.getMessage();
        log.error("Actor {} stopped with ERROR due to {}", actorId, lastFault);
        log.debug("Exception details:", e);
        ActorStatus current = getStatus();
        if (current.canTransitionTo(ActorStatus.ERROR)) {
            transition(current, ActorStatus.ERROR);
        }
        if (future != null) {
            future.cancel(false);
        }
        terminated.countDown();
    }

    private void persist() {
        try {
            stateStore.save(createSnapshot());
            log.debug("Actor {} persisted at iteration {}", actorId, iteration);
        } catch (IOException e) {
            log.warn("Actor {} failed to persist state, retrying on next save: {}", actorId, e.getMessage());
            recordError("PERSISTENCE_FAILURE", "Failed to persist actor state", e.getMessage());
        }
    }

    /**
     * Captures the current state as plain data.
     */
    public synchronized ActorStateSnapshot createSnapshot() {
        Map<String, Object> variables = new LinkedHashMap<>(scope.getLocalVariables());
        variables.keySet().removeAll(TRANSIENT_VARIABLES);
        List<PendingContinuation> pending = continuationEngine.snapshot();
        ExecutionState execution = new ExecutionState(variables, tickFlow(), document.version(), pending);
        return new ActorStateSnapshot(actorId, template.templateId(), getStatus(), iteration, feelings, goals,
                memories, execution, planState, clock.millis());
    }

    private void applySnapshot(ActorStateSnapshot snapshot) {
        if (!actorId.equals(snapshot.actorId())) {
            throw new IllegalStateException("Snapshot of actor " + snapshot.actorId() + " cannot restore actor " + actorId);
        }
        feelings.putAll(snapshot.feelings());
        goals.putAll(snapshot.goals());
        memories.putAll(snapshot.memories());
        snapshot.execution().variables().forEach(scope::defineLocal);
        iteration = snapshot.iteration();
        planState = snapshot.plan();
        continuationEngine.restore(snapshot.execution().pendingContinuations());
        pendingContinuationId = snapshot.execution().pendingContinuations().stream()
                .map(PendingContinuation::id)
                .filter(id -> continuationEngine.get(id).isPresent())
                .findFirst()
                .orElse(null);
        log.debug("Actor {} restored: iteration {}, {} variables, {} pending continuations", actorId, iteration,
                snapshot.execution().variables().size(), snapshot.execution().pendingContinuations().size());
    }

    private boolean transition(ActorStatus from, ActorStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Actor " + actorId + " cannot move from " + from + " to " + to);
        }
        if (!status.compareAndSet(from, to)) {
            return false;
        }
        log.debug("Actor {}: {} -> {}", actorId, from, to);
        for (IActorStateListener listener : listeners) {
            try {
                listener.onStatusChanged(actorId, from, to);
            } catch (RuntimeException e) {
                log.warn("Status listener failed for actor {}: {}", actorId, e.getMessage());
            }
        }
        return true;
    }

    /**
     * Records an operational error. The history is bounded; the oldest entries are dropped.
     *
     * @param code    Error code for categorization (e.g. "HANDLER_FAULT", "PERSISTENCE_FAILURE")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    public void clearErrors() {
        errors.clear();
    }

    /**
     * @return false in ERROR state or while errors are recorded.
     */
    public boolean isHealthy() {
        if (getStatus() == ActorStatus.ERROR) return false;
        return errors.isEmpty();
    }

    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        metrics.put("iteration", iteration);
        metrics.put("perceptions_queued", perceptions.size());
        metrics.put("perceptions_dropped", perceptions.getDroppedCount());
        metrics.put("perceptions_filtered", filteredPerceptions.get());
        metrics.put("extensions_accepted", continuationEngine.getAcceptedCount());
        metrics.put("extensions_rejected", continuationEngine.getRejectedCount());
        metrics.put("continuations_timed_out", continuationEngine.getTimedOutCount());
        return metrics;
    }

    public ActorStatus getStatus() {
        return status.get();
    }

    public String getActorId() {
        return actorId;
    }

    public ActorTemplate getTemplate() {
        return template;
    }

    /**
     * @return The reason the actor entered ERROR, or null.
     */
    public String getLastFault() {
        return lastFault;
    }

    public long getPerceptionsDropped() {
        return perceptions.getDroppedCount();
    }

    public synchronized long getIteration() {
        return iteration;
    }

    public synchronized PlanState getPlanState() {
        return planState;
    }

    public synchronized long getDocumentVersion() {
        return document.version();
    }

    /**
     * @return A copy of the actor's root variables, without per-tick inputs.
     */
    public synchronized Map<String, Object> getVariables() {
        Map<String, Object> variables = new LinkedHashMap<>(scope.getLocalVariables());
        variables.keySet().removeAll(TRANSIENT_VARIABLES);
        return variables;
    }

    public synchronized Map<String, Double> getFeelings() {
        return new LinkedHashMap<>(feelings);
    }

    public synchronized Map<String, Object> getMemories() {
        return new LinkedHashMap<>(memories);
    }
}
