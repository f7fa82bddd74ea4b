package org.cognita.document.execution;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.cognita.document.ActionNode;
import org.cognita.document.BehaviorDocument;
import org.cognita.document.Flow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs several flows of one document as cooperative channels.
 * <p>
 * Channels take turns, one top-level action per turn, in the order they were given. Each
 * channel has its own child scope of the shared root scope. Three actions coordinate them:
 * <ul>
 *   <li>{@code emit: {signal, payload}} queues a signal for every other channel;</li>
 *   <li>{@code wait_for: {signal, timeout_ms}} parks the channel until such a signal is queued
 *       for it, then exposes it as {@code _signal} ({@code name}, {@code payload}, {@code source});</li>
 *   <li>{@code sync: point} parks the channel until every channel has reached the same point.</li>
 * </ul>
 * The run fails when a channel fails, a wait times out, all unfinished channels are waiting,
 * or the global timeout or cycle limit is exceeded. Nested blocks run to completion within one
 * turn, so {@code wait_for} and {@code sync} are only valid at the top level of a channel flow.
 */
public class ChannelScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelScheduler.class);

    public static final String SIGNAL_VARIABLE = "_signal";

    private final DocumentExecutor executor;
    private final Clock clock;
    private final long globalTimeoutMs;
    private final long waitTimeoutMs;
    private final int maxCycles;

    public ChannelScheduler(DocumentExecutor executor) {
        this(executor, ConfigFactory.empty(), Clock.systemUTC());
    }

    /**
     * Creates a scheduler.
     * @param executor The executor whose handlers run the ordinary actions.
     * @param options The {@code cognita.channels} configuration subtree: {@code globalTimeoutMs},
     *                {@code waitTimeoutMs} and {@code maxCycles}.
     * @param clock The clock timeouts are measured against.
     */
    public ChannelScheduler(DocumentExecutor executor, Config options, Clock clock) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "globalTimeoutMs", 30000,
                "waitTimeoutMs", 5000,
                "maxCycles", 10000));
        Config finalConfig = options.withFallback(defaults);
        this.globalTimeoutMs = finalConfig.getLong("globalTimeoutMs");
        this.waitTimeoutMs = finalConfig.getLong("waitTimeoutMs");
        this.maxCycles = finalConfig.getInt("maxCycles");
        if (globalTimeoutMs <= 0 || waitTimeoutMs <= 0 || maxCycles <= 0) {
            throw new IllegalArgumentException("Channel timeouts and maxCycles must be positive");
        }
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Runs channels with a fresh root scope and default options.
     * @see #execute(BehaviorDocument, Map, VariableScope, ExecutionOptions)
     */
    public ChannelExecutionResult execute(BehaviorDocument document, Map<String, String> channelFlows) {
        return execute(document, channelFlows, new VariableScope(), ExecutionOptions.defaults());
    }

    /**
     * Runs channels to completion.
     * @param document The document holding the channel flows.
     * @param channelFlows Channel name to the flow it runs, in turn order.
     * @param root The scope shared by all channels.
     * @param options Step budget (over all channels), cancellation and effect sink.
     */
    public ChannelExecutionResult execute(BehaviorDocument document, Map<String, String> channelFlows,
                                          VariableScope root, ExecutionOptions options) {
        if (channelFlows.isEmpty()) {
            return new ChannelExecutionResult.Failed("No channels specified", null, List.of());
        }
        ExecutionContext.Shared shared = new ExecutionContext.Shared(executor, document, options);
        Map<String, Channel> channels = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : channelFlows.entrySet()) {
            Flow flow = document.getFlow(entry.getValue()).orElse(null);
            if (flow == null) {
                return new ChannelExecutionResult.Failed("Flow '" + entry.getValue() + "' not found",
                        entry.getKey(), List.of());
            }
            channels.put(entry.getKey(), new Channel(entry.getKey(), flow, root.createChild()));
        }
        LOG.debug("Running {} channels of {}", channels.size(), document.getId());
        return new Run(shared, channels).run();
    }

    private enum Status {
        READY,
        WAITING,
        COMPLETED,
        FAILED
    }

    private record Signal(String name, Object payload, String source) {
    }

    private static final class Channel {
        final String name;
        final VariableScope scope;
        final Deque<Signal> inbox = new ArrayDeque<>();
        Flow flow;
        int index;
        Status status = Status.READY;
        Object result;
        String error;
        String waitingFor;
        String syncPoint;
        Instant waitStart;
        long waitLimitMs;

        Channel(String name, Flow flow, VariableScope scope) {
            this.name = name;
            this.flow = flow;
            this.scope = scope;
        }

        void complete(Object value) {
            result = value;
            status = Status.COMPLETED;
        }

        void fail(String message) {
            error = message;
            status = Status.FAILED;
        }

        void park(String signal, String point, Instant now, long limitMs) {
            waitingFor = signal;
            syncPoint = point;
            waitStart = now;
            waitLimitMs = limitMs;
            status = Status.WAITING;
        }

        void release() {
            waitingFor = null;
            syncPoint = null;
            waitStart = null;
            status = Status.READY;
        }
    }

    private final class Run {
        private final ExecutionContext.Shared shared;
        private final Map<String, Channel> channels;
        private final Map<String, Set<String>> syncPoints = new HashMap<>();
        private final Instant start = clock.instant();

        Run(ExecutionContext.Shared shared, Map<String, Channel> channels) {
            this.shared = shared;
            this.channels = channels;
        }

        ChannelExecutionResult run() {
            int cycles = 0;
            while (channels.values().stream().anyMatch(c -> c.status == Status.READY || c.status == Status.WAITING)) {
                if (Duration.between(start, clock.instant()).toMillis() > globalTimeoutMs) {
                    return failed("Global timeout of " + globalTimeoutMs + " ms exceeded", null);
                }
                if (++cycles > maxCycles) {
                    return failed("Max cycles of " + maxCycles + " exceeded", null);
                }
                for (Channel channel : channels.values()) {
                    if (channel.status == Status.READY) {
                        step(channel);
                        if (channel.status == Status.FAILED) {
                            return failed(channel.error, channel.name);
                        }
                    }
                }
                for (Channel channel : channels.values()) {
                    if (channel.status == Status.WAITING) {
                        checkWaiting(channel);
                        if (channel.status == Status.FAILED) {
                            return failed(channel.error, channel.name);
                        }
                    }
                }
                if (isDeadlocked()) {
                    return failed("Deadlock detected: all channels waiting", null);
                }
            }
            Map<String, Object> results = new LinkedHashMap<>();
            channels.forEach((name, channel) -> results.put(name, channel.result));
            return new ChannelExecutionResult.Completed(results, shared.logs);
        }

        private void step(Channel channel) {
            if (channel.index >= channel.flow.actions().size()) {
                channel.complete(null);
                return;
            }
            ActionNode action = channel.flow.actions().get(channel.index++);
            ExecutionContext context = new ExecutionContext(shared, channel.scope, channel.flow);
            try {
                DocumentExecutor.step(shared);
                switch (action.kind()) {
                    case EMIT -> {
                        if (action.param("signal") != null) {
                            emit(channel, action, context);
                            return;
                        }
                    }
                    case WAIT_FOR -> {
                        waitFor(channel, action, context);
                        return;
                    }
                    case SYNC -> {
                        sync(channel, context.resolveString(action.param("point")));
                        return;
                    }
                    default -> {
                    }
                }
                apply(channel, executor.runAction(action, context));
            } catch (ExecutionAbortedException e) {
                channel.fail(e.getMessage());
            } catch (RuntimeException e) {
                channel.fail("Action '" + action.name() + "' failed: " + e.getMessage());
            }
        }

        private void apply(Channel channel, ActionOutcome outcome) {
            if (outcome instanceof ActionOutcome.Goto transfer) {
                Flow target = shared.document.getFlow(transfer.flow()).orElse(null);
                if (target == null) {
                    channel.fail("Flow '" + transfer.flow() + "' not found");
                    return;
                }
                transfer.args().forEach(channel.scope::set);
                channel.flow = target;
                channel.index = 0;
            } else if (outcome instanceof ActionOutcome.Return ret) {
                channel.complete(ret.value());
            } else if (outcome instanceof ActionOutcome.Halt) {
                channel.complete(null);
            } else if (outcome instanceof ActionOutcome.Pause pause) {
                shared.executor.getContinuationEngine().discard(pause.continuation().id());
                channel.fail("Continuation point '" + pause.continuation().pointName()
                        + "' is not supported in channel execution");
            }
        }

        private void emit(Channel channel, ActionNode action, ExecutionContext context) {
            Signal signal = new Signal(context.resolveString(action.param("signal")),
                    context.resolve(action.param("payload")), channel.name);
            for (Channel target : channels.values()) {
                if (target != channel) {
                    target.inbox.add(signal);
                }
            }
            LOG.debug("[{}] emit: {}", channel.name, signal.name());
        }

        private void waitFor(Channel channel, ActionNode action, ExecutionContext context) {
            String signal = context.resolveString(action.param("signal"));
            if (deliver(channel, signal)) {
                return;
            }
            long limit = action.param("timeout_ms") != null
                    ? (long) context.resolveNumber(action.param("timeout_ms"))
                    : waitTimeoutMs;
            channel.park(signal, null, clock.instant(), limit);
            LOG.debug("[{}] wait_for: {}", channel.name, signal);
        }

        private void sync(Channel channel, String point) {
            Set<String> arrived = syncPoints.computeIfAbsent(point, k -> new LinkedHashSet<>());
            arrived.add(channel.name);
            if (arrived.size() >= channels.size()) {
                LOG.debug("Sync point '{}' released", point);
                return;
            }
            channel.park(null, point, clock.instant(), waitTimeoutMs);
            LOG.debug("[{}] sync: {} ({}/{})", channel.name, point, arrived.size(), channels.size());
        }

        private void checkWaiting(Channel channel) {
            if (channel.syncPoint != null) {
                if (syncPoints.get(channel.syncPoint).size() >= channels.size()) {
                    channel.release();
                    return;
                }
            } else if (deliver(channel, channel.waitingFor)) {
                channel.release();
                return;
            }
            if (Duration.between(channel.waitStart, clock.instant()).toMillis() > channel.waitLimitMs) {
                channel.fail(channel.syncPoint != null
                        ? "Wait timeout exceeded for sync point: " + channel.syncPoint
                        : "Wait timeout exceeded for signal: " + channel.waitingFor);
            }
        }

        private boolean deliver(Channel channel, String signalName) {
            Iterator<Signal> queued = channel.inbox.iterator();
            while (queued.hasNext()) {
                Signal signal = queued.next();
                if (signal.name().equals(signalName)) {
                    queued.remove();
                    Map<String, Object> value = new LinkedHashMap<>();
                    value.put("name", signal.name());
                    value.put("payload", signal.payload());
                    value.put("source", signal.source());
                    channel.scope.defineLocal(SIGNAL_VARIABLE, value);
                    return true;
                }
            }
            return false;
        }

        private boolean isDeadlocked() {
            List<Channel> active = channels.values().stream().filter(c -> c.status != Status.COMPLETED).toList();
            return !active.isEmpty() && active.stream().allMatch(c -> c.status == Status.WAITING);
        }

        private ChannelExecutionResult failed(String error, String channel) {
            LOG.debug("Channel run of {} failed{}: {}", shared.document.getId(),
                    channel != null ? " in channel '" + channel + "'" : "", error);
            return new ChannelExecutionResult.Failed(error, channel, shared.logs);
        }
    }
}
