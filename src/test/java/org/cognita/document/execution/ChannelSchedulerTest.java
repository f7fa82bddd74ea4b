package org.cognita.document.execution;

import com.typesafe.config.ConfigFactory;
import org.cognita.continuation.ContinuationEngine;
import org.cognita.document.BehaviorDocument;
import org.cognita.document.DocumentParseException;
import org.cognita.document.expression.ExpressionEvaluator;
import org.cognita.document.parser.DocumentParser;
import org.cognita.junit.MutableClock;
import org.cognita.junit.extensions.logging.ExpectLog;
import org.cognita.junit.extensions.logging.LogLevel;
import org.cognita.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Cooperative multi-channel execution: turn order, signals, sync points and the ways a run fails.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ChannelSchedulerTest {

    private final DocumentParser parser = new DocumentParser();
    private MutableClock clock;
    private ContinuationEngine continuations;
    private ActionHandlerRegistry registry;
    private DocumentExecutor executor;
    private ChannelScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        continuations = new ContinuationEngine(ConfigFactory.empty(), clock);
        registry = ActionHandlerRegistry.withBuiltins();
        registry.register("tick", (action, context) -> {
            clock.advance(Duration.ofMillis(100));
            return ActionOutcome.CONTINUE;
        });
        executor = new DocumentExecutor(new ExpressionEvaluator(), registry, continuations);
        scheduler = new ChannelScheduler(executor, ConfigFactory.empty(), clock);
    }

    private BehaviorDocument parse(String yaml) throws DocumentParseException {
        return parser.parse(yaml);
    }

    private static Map<String, String> channels(String... nameAndFlow) {
        Map<String, String> channels = new LinkedHashMap<>();
        for (int i = 0; i < nameAndFlow.length; i += 2) {
            channels.put(nameAndFlow[i], nameAndFlow[i + 1]);
        }
        return channels;
    }

    private static ChannelExecutionResult.Failed failed(ChannelExecutionResult result) {
        assertThat(result).isInstanceOf(ChannelExecutionResult.Failed.class);
        return (ChannelExecutionResult.Failed) result;
    }

    @Test
    void channelsTakeTurnsOneActionAtATime() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  channel_a: [{log: A1}, {log: A2}]
                  channel_b: [{log: B1}, {log: B2}]
                """);

        ChannelExecutionResult result = scheduler.execute(document, channels("A", "channel_a", "B", "channel_b"));

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.logs()).containsExactly("A1", "B1", "A2", "B2");
    }

    @Test
    void rejectsEmptyChannelSetAndUnknownFlows() throws Exception {
        BehaviorDocument document = parse("flows: {main: [{log: hi}]}");

        assertThat(failed(scheduler.execute(document, Map.of())).error()).isEqualTo("No channels specified");
        ChannelExecutionResult.Failed unknown = failed(scheduler.execute(document, channels("main", "main", "x", "missing")));
        assertThat(unknown.error()).isEqualTo("Flow 'missing' not found");
        assertThat(unknown.failedChannel()).isEqualTo("x");
    }

    @Test
    void waitingChannelReceivesSignalWithPayload() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  send:
                    - log: Sent
                    - emit: {signal: go, payload: hello world}
                  receive:
                    - wait_for: go
                    - log: "Got: ${_signal.payload} from ${_signal.source}"
                """);

        ChannelExecutionResult result = scheduler.execute(document, channels("sender", "send", "receiver", "receive"));

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.logs()).containsExactly("Sent", "Got: hello world from sender");
    }

    @Test
    void signalIsDeliveredToEveryOtherChannel() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  send: [{emit: {signal: alarm}}]
                  first: [{wait_for: alarm}, {log: R1 got it}]
                  second: [{wait_for: alarm}, {log: R2 got it}]
                """);

        ChannelExecutionResult result = scheduler.execute(document,
                channels("sender", "send", "r1", "first", "r2", "second"));

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.logs()).containsExactlyInAnyOrder("R1 got it", "R2 got it");
    }

    @Test
    void signalQueuedBeforeWaitIsTakenImmediately() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  send: [{emit: {signal: ready, payload: 7}}]
                  receive: [{log: busy}, {wait_for: ready}, {return: "${_signal.payload}"}]
                """);

        ChannelExecutionResult result = scheduler.execute(document, channels("sender", "send", "receiver", "receive"));

        assertThat(result).isInstanceOf(ChannelExecutionResult.Completed.class);
        assertThat(((ChannelExecutionResult.Completed) result).results()).containsEntry("receiver", 7.0);
    }

    @Test
    void syncPointHoldsChannelsUntilAllArrive() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  fast: [{log: Fast before}, {sync: barrier}, {log: Fast after}]
                  slow: [{log: s1}, {log: s2}, {sync: barrier}, {log: Slow after}]
                """);

        ChannelExecutionResult result = scheduler.execute(document, channels("fast", "fast", "slow", "slow"));

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.logs()).containsExactly("Fast before", "s1", "s2", "Fast after", "Slow after");
    }

    @Test
    void syncPointCountsAllChannels() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  one: [{sync: all_ready}, {log: CH1 done}]
                  two: [{log: warming up}, {sync: all_ready}, {log: CH2 done}]
                  three: [{log: a}, {log: b}, {sync: all_ready}, {log: CH3 done}]
                """);

        ChannelExecutionResult result = scheduler.execute(document,
                channels("c1", "one", "c2", "two", "c3", "three"));

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.logs()).endsWith("CH1 done", "CH2 done", "CH3 done");
    }

    @Test
    void allChannelsWaitingIsADeadlock() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  a: [{wait_for: from_b}]
                  b: [{wait_for: from_a}]
                """);

        ChannelExecutionResult.Failed result = failed(scheduler.execute(document, channels("a", "a", "b", "b")));

        assertThat(result.error()).isEqualTo("Deadlock detected: all channels waiting");
        assertThat(result.failedChannel()).isNull();
    }

    @Test
    void waitTimeoutFailsTheWaitingChannel() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  wait: [{wait_for: {signal: never, timeout_ms: 150}}]
                  busy: [{emit: {signal: wrong_signal}}, {tick: {}}, {tick: {}}, {tick: {}}]
                """);

        ChannelExecutionResult.Failed result = failed(scheduler.execute(document, channels("waiter", "wait", "busy", "busy")));

        assertThat(result.error()).isEqualTo("Wait timeout exceeded for signal: never");
        assertThat(result.failedChannel()).isEqualTo("waiter");
    }

    @Test
    void fatalActionFailsItsChannel() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  good: [{log: fine}, {log: still fine}]
                  bad_flow:
                    - set: {variable: target, value: nowhere}
                    - goto: "${target}"
                      severity: fatal
                """);

        ChannelExecutionResult.Failed result = failed(scheduler.execute(document, channels("good", "good", "bad", "bad_flow")));

        assertThat(result.failedChannel()).isEqualTo("bad");
        assertThat(result.error()).contains("Flow 'nowhere' not found");
    }

    @Test
    void collectsReturnValuesPerChannel() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  main: [{goto: finish}]
                  finish: [{return: result_data}]
                  quiet: [{log: nothing to return}]
                """);

        ChannelExecutionResult result = scheduler.execute(document, channels("main", "main", "quiet", "quiet"));

        assertThat(result).isInstanceOf(ChannelExecutionResult.Completed.class);
        Map<String, Object> results = ((ChannelExecutionResult.Completed) result).results();
        assertThat(results).containsEntry("main", "result_data").containsKey("quiet");
        assertThat(results.get("quiet")).isNull();
    }

    @Test
    void channelsWriteOwnScopesButReadTheSharedRoot() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  one: [{set: {variable: x, value: from_ch1}}, {log: "CH1: ${x} ${shared_data}"}]
                  two: [{set: {variable: x, value: from_ch2}}, {log: "CH2: ${x} ${shared_data}"}]
                """);
        VariableScope root = new VariableScope();
        root.set("shared_data", "initial");

        ChannelExecutionResult result = scheduler.execute(document, channels("c1", "one", "c2", "two"), root,
                ExecutionOptions.defaults());

        assertThat(result.logs()).containsExactly("CH1: from_ch1 initial", "CH2: from_ch2 initial");
        assertThat(root.isDefined("x")).isFalse();
    }

    @Test
    void continuationPointFailsTheChannelAndIsDiscarded() throws Exception {
        BehaviorDocument document = parse("""
                flows:
                  main: [{continuation_point: {name: decide, default_flow: main}}]
                """);

        ChannelExecutionResult.Failed result = failed(scheduler.execute(document, channels("main", "main")));

        assertThat(result.error()).isEqualTo("Continuation point 'decide' is not supported in channel execution");
        assertThat(continuations.getPendingCount()).isZero();
    }

    @Test
    void stopsAtCycleLimit() throws Exception {
        BehaviorDocument document = parse("flows: {main: [{log: a}, {log: b}, {log: c}]}");
        ChannelScheduler limited = new ChannelScheduler(executor, ConfigFactory.parseMap(Map.of("maxCycles", 2)), clock);

        ChannelExecutionResult.Failed result = failed(limited.execute(document, channels("main", "main")));

        assertThat(result.error()).isEqualTo("Max cycles of 2 exceeded");
        assertThat(result.logs()).containsExactly("a", "b");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Action 'wait_for' in flow 'main' failed: 'wait_for' is only valid at the top level of a channel flow")
    void waitForOutsideChannelsIsAHandlerFault() throws Exception {
        BehaviorDocument document = parse("flows: {main: [{wait_for: go}, {log: after}]}");

        ExecutionResult result = executor.execute(document, null, new VariableScope());

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.logs()).containsExactly("after");
    }
}
