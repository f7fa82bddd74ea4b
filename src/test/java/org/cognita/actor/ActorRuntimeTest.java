package org.cognita.actor;

import com.typesafe.config.ConfigFactory;
import org.cognita.actor.state.ActorStateSnapshot;
import org.cognita.actor.state.ExecutionState;
import org.cognita.continuation.AttachResult;
import org.cognita.continuation.ExtensionDelivery;
import org.cognita.continuation.InMemoryExtensionChannel;
import org.cognita.junit.extensions.logging.ExpectLog;
import org.cognita.junit.extensions.logging.LogLevel;
import org.cognita.junit.extensions.logging.LogWatchExtension;
import org.cognita.store.IStateStore;
import org.cognita.store.InMemoryModelStore;
import org.cognita.store.InMemoryStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * Runs real actors on the shared worker pool against in-memory stores.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@ExtendWith(MockitoExtension.class)
class ActorRuntimeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryModelStore models;
    private InMemoryStateStore states;
    private ActorRuntime runtime;

    @Mock
    private IStateStore mockStore;

    @BeforeEach
    void setUp() {
        models = new InMemoryModelStore();
        states = new InMemoryStateStore();
        runtime = newRuntime(states);
    }

    @AfterEach
    void tearDown() {
        runtime.shutdown();
    }

    private ActorRuntime newRuntime(IStateStore stateStore) {
        return new ActorRuntime(ConfigFactory.parseMap(Map.of(
                "runtime.workerThreads", 2,
                "actor.defaultTickIntervalMs", 10)), models, stateStore);
    }

    private void store(String reference, String yaml) {
        models.save(reference, yaml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void actorTicksAndPublishesFeelings() throws Exception {
        store("wolf", """
                flows:
                  main:
                    - set_feeling: {name: fear, value: "${perceptions.length > 0 ? 0.9 : 0.1}"}
                """);
        List<ActorStateUpdate> updates = new CopyOnWriteArrayList<>();
        runtime.addStateListener(updates::add);

        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));
        await().atMost(TIMEOUT).until(() -> wolf.getIteration() >= 3);
        runtime.injectPerception("wolf-1", Perception.of("sound", "bear", 0.8, Map.of()));

        await().atMost(TIMEOUT).until(() -> updates.stream().anyMatch(u -> Double.valueOf(0.9).equals(u.feelings().get("fear"))));
        assertThat(updates.get(0).feelings()).containsEntry("fear", 0.1);
        assertThat(updates).allSatisfy(u -> assertThat(u.actorId()).isEqualTo("wolf-1"));
        assertThat(runtime.getStatus("wolf-1")).contains(ActorStatus.RUNNING);
        assertThat(runtime.listActors()).containsExactly("wolf-1");
    }

    @Test
    void messagesReachTheNextTick() throws Exception {
        store("wolf", """
                flows:
                  main:
                    - for_each:
                        variable: m
                        collection: "${messages}"
                        do:
                          - remember: {key: last_message, value: "${m.text}"}
                """);
        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));

        assertThat(runtime.sendMessage("wolf-1", Map.of("text", "howl"))).isTrue();
        assertThat(runtime.sendMessage("nobody", Map.of("text", "howl"))).isFalse();

        await().atMost(TIMEOUT).until(() -> "howl".equals(wolf.getMemories().get("last_message")));
        assertThat(wolf.getVariables()).doesNotContainKeys("messages", "perceptions", "state");
    }

    @Test
    void selfTerminationStopsAndPersists() throws Exception {
        store("moth", """
                flows:
                  main:
                    - remember: {key: light, value: found}
                    - self_terminate: {reason: burned out}
                """);

        ActorRunner moth = runtime.spawn("moth-1", runtime.newTemplate("moth", "moth"));

        assertThat(moth.awaitTermination(TIMEOUT)).isTrue();
        assertThat(moth.getStatus()).isEqualTo(ActorStatus.STOPPED);
        assertThat(moth.getIteration()).isEqualTo(1);
        assertThat(states.load("moth-1")).hasValueSatisfying(s -> assertThat(s.memories()).containsEntry("light", "found"));
    }

    @Test
    void savedDocumentIsSwappedIn() throws Exception {
        store("wolf", """
                flows:
                  main:
                    - remember: {key: mode, value: one}
                """);
        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));
        await().atMost(TIMEOUT).until(() -> "one".equals(wolf.getMemories().get("mode")));

        store("wolf", """
                flows:
                  main:
                    - remember: {key: mode, value: two}
                """);

        await().atMost(TIMEOUT).until(() -> "two".equals(wolf.getMemories().get("mode")));
        assertThat(wolf.getDocumentVersion()).isEqualTo(2);
    }

    @Test
    void updatedImportIsSwappedIntoImportingActors() throws Exception {
        store("common.yml", """
                flows:
                  mark:
                    - remember: {key: mode, value: one}
                """);
        store("wolf", """
                imports: [{file: common.yml, as: common}]
                flows:
                  main:
                    - call: common.mark
                """);
        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));
        await().atMost(TIMEOUT).until(() -> "one".equals(wolf.getMemories().get("mode")));

        store("common.yml", """
                flows:
                  mark:
                    - remember: {key: mode, value: two}
                """);

        await().atMost(TIMEOUT).until(() -> "two".equals(wolf.getMemories().get("mode")));
        assertThat(wolf.getDocumentVersion()).isEqualTo(2);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Actor wolf-1 rejected extension for 'decide'.*")
    void extensionResumesPausedActor() throws Exception {
        store("wolf", """
                flows:
                  main:
                    - continuation_point: {name: decide, default_flow: fallback, timeout_ms: 60000}
                  fallback:
                    - remember: {key: choice, value: default}
                """);
        byte[] extension = """
                flows:
                  main:
                    - remember: {key: choice, value: extended}
                """.getBytes(StandardCharsets.UTF_8);
        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));

        await().atMost(TIMEOUT).until(() -> wolf.createSnapshot().execution().pendingContinuations().size() == 1);
        assertThat(runtime.deliverExtension("wolf-1", "decide", "{broken: [".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo(AttachResult.MISMATCHED);
        assertThat(runtime.deliverExtension("wolf-1", "decide", extension)).isEqualTo(AttachResult.ACCEPTED);
        assertThat(runtime.deliverExtension("ghost", "decide", extension)).isEqualTo(AttachResult.NOT_FOUND);

        await().atMost(TIMEOUT).until(() -> "extended".equals(wolf.getMemories().get("choice")));
        assertThat(wolf.getMetrics()).containsEntry("extensions_accepted", 1L);
    }

    @Test
    void connectedChannelRoutesDeliveries() throws Exception {
        store("wolf", """
                flows:
                  main:
                    - continuation_point: {name: decide, default_flow: fallback, timeout_ms: 60000}
                  fallback:
                    - log: default
                """);
        byte[] extension = """
                flows:
                  main:
                    - remember: {key: source, value: channel}
                """.getBytes(StandardCharsets.UTF_8);
        InMemoryExtensionChannel channel = new InMemoryExtensionChannel();
        runtime.connect(channel);
        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));
        await().atMost(TIMEOUT).until(() -> wolf.createSnapshot().execution().pendingContinuations().size() == 1);

        channel.deliver(new ExtensionDelivery("wolf-1", "decide", extension));

        await().atMost(TIMEOUT).until(() -> "channel".equals(wolf.getMemories().get("source")));
        runtime.disconnect(channel);
        channel.deliver(new ExtensionDelivery("wolf-1", "decide", extension));
        assertThat(wolf.getMetrics()).containsEntry("extensions_accepted", 1L);
    }

    @Test
    void replanRequestProducesPlan() throws Exception {
        store("wolf", """
                goals:
                  stay_fed: {priority: 10, conditions: {hunger: "<= 0.3"}}
                actions:
                  find_food: {effects: {has_food: true}}
                  eat: {preconditions: {has_food: "== true"}, effects: {hunger: "-0.6"}}
                flows:
                  main:
                    - set_feeling: {name: hunger, value: 0.8}
                    - trigger_goap_replan: {urgency: 0.5}
                """);
        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));

        await().atMost(TIMEOUT).until(() -> wolf.getPlanState() != null);

        assertThat(wolf.getPlanState().goalId()).isEqualTo("stay_fed");
        assertThat(wolf.getPlanState().actionIds()).containsExactly("find_food", "eat");
        assertThat(wolf.getPlanState().worldSnapshot()).containsEntry("hunger", 0.8);
    }

    @Test
    void urgentReplanRetriesWithLargerBudget() throws Exception {
        store("wolf", """
                goals:
                  denned: {priority: 10, conditions: {in_den: "== true"}}
                actions:
                  sniff: {effects: {scent: true}}
                  track: {preconditions: {scent: "== true"}, effects: {trail: true}}
                  follow: {preconditions: {trail: "== true"}, effects: {near_den: true}}
                  enter: {preconditions: {near_den: "== true"}, effects: {in_den: true}}
                flows:
                  main:
                    - trigger_goap_replan: {urgency: 0.9}
                """);
        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));

        await().atMost(TIMEOUT).until(() -> wolf.getPlanState() != null);

        assertThat(wolf.getPlanState().goalId()).isEqualTo("denned");
        assertThat(wolf.getPlanState().actionIds()).containsExactly("sniff", "track", "follow", "enter");
    }

    @Test
    void defaultFlowRunsWhenContinuationTimesOut() throws Exception {
        store("wolf", """
                flows:
                  main:
                    - continuation_point: {name: decide, default_flow: fallback, timeout_ms: 2000}
                  fallback:
                    - remember: {key: choice, value: default}
                    - self_terminate: {reason: decided}
                """);
        byte[] extension = """
                flows:
                  main:
                    - remember: {key: choice, value: extended}
                """.getBytes(StandardCharsets.UTF_8);
        long start = System.nanoTime();
        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));

        await().atMost(TIMEOUT).pollInterval(Duration.ofMillis(5))
                .until(() -> "default".equals(wolf.getMemories().get("choice")));

        double elapsedSeconds = (System.nanoTime() - start) / 1e9;
        assertThat(elapsedSeconds).isGreaterThanOrEqualTo(2.0).isLessThan(2.5);
        assertThat(wolf.awaitTermination(TIMEOUT)).isTrue();
        assertThat(runtime.deliverExtension("wolf-1", "decide", extension)).isEqualTo(AttachResult.ALREADY_RESOLVED);
        assertThat(wolf.getMetrics()).containsEntry("extensions_rejected", 1L);
    }

    @Test
    void extensionAfterResolutionIsAlreadyResolved() throws Exception {
        store("wolf", """
                flows:
                  main:
                    - continuation_point: {name: decide, default_flow: fallback, timeout_ms: 60000}
                  fallback:
                    - remember: {key: choice, value: default}
                """);
        byte[] extension = """
                flows:
                  main:
                    - remember: {key: choice, value: extended}
                    - self_terminate: {reason: decided}
                """.getBytes(StandardCharsets.UTF_8);
        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));
        await().atMost(TIMEOUT).until(() -> wolf.createSnapshot().execution().pendingContinuations().size() == 1);

        assertThat(runtime.deliverExtension("wolf-1", "decide", extension)).isEqualTo(AttachResult.ACCEPTED);
        assertThat(wolf.awaitTermination(TIMEOUT)).isTrue();

        assertThat(wolf.getMemories()).containsEntry("choice", "extended");
        assertThat(runtime.deliverExtension("wolf-1", "decide", extension)).isEqualTo(AttachResult.ALREADY_RESOLVED);
        assertThat(wolf.getMetrics()).containsEntry("extensions_accepted", 1L).containsEntry("extensions_rejected", 1L);
    }

    @Test
    void restoresFromSnapshot() throws Exception {
        store("wolf", """
                flows:
                  main:
                    - increment: visits
                """);
        states.save(new ActorStateSnapshot("wolf-1", "wolf", ActorStatus.RUNNING, 41, Map.of("fear", 0.3),
                Map.of(), Map.of("den", "north"), new ExecutionState(Map.of("visits", 10.0), "main", 1, List.of()),
                null, 0L));

        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"), true);

        await().atMost(TIMEOUT).until(() -> wolf.getIteration() > 42);
        assertThat(wolf.getFeelings()).containsEntry("fear", 0.3);
        assertThat(wolf.getMemories()).containsEntry("den", "north");
        assertThat((Double) wolf.getVariables().get("visits")).isGreaterThan(11.0);
    }

    @Test
    void rejectsDuplicateIdsAndMissingDocuments() throws Exception {
        store("wolf", "flows: {main: []}");
        runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));

        assertThatThrownBy(() -> runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already exists");
        assertThatThrownBy(() -> runtime.spawn("bear-1", runtime.newTemplate("bear", "bear")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("'bear' not found");
    }

    @Test
    void gracefulStopKeepsActorQueryableUntilRemoved() throws Exception {
        store("wolf", "flows: {main: []}");
        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));
        await().atMost(TIMEOUT).until(() -> wolf.getIteration() >= 1);
        assertThat(runtime.remove("wolf-1")).isFalse();

        assertThat(runtime.stop("wolf-1", true)).isTrue();

        assertThat(wolf.awaitTermination(TIMEOUT)).isTrue();
        assertThat(runtime.getStatus("wolf-1")).contains(ActorStatus.STOPPED);
        assertThat(runtime.listActors()).containsExactly("wolf-1");
        assertThat(runtime.stop("wolf-1", true)).isFalse();
        assertThat(runtime.sendMessage("wolf-1", Map.of("text", "howl"))).isFalse();
        assertThat(states.load("wolf-1")).isPresent();

        assertThat(runtime.remove("wolf-1")).isTrue();
        assertThat(runtime.listActors()).isEmpty();
        assertThat(runtime.getStatus("wolf-1")).isEmpty();
    }

    @Test
    void selfTerminatedActorCanBeRespawnedFromItsSnapshot() throws Exception {
        store("moth", """
                flows:
                  main:
                    - increment: flights
                    - self_terminate: {reason: burned out}
                """);
        ActorRunner first = runtime.spawn("moth-1", runtime.newTemplate("moth", "moth"));
        assertThat(first.awaitTermination(TIMEOUT)).isTrue();
        assertThat(runtime.getStatus("moth-1")).contains(ActorStatus.STOPPED);

        ActorRunner second = runtime.spawn("moth-1", runtime.newTemplate("moth", "moth"), true);

        assertThat(second).isNotSameAs(first);
        assertThat(second.awaitTermination(TIMEOUT)).isTrue();
        assertThat(runtime.getActor("moth-1")).containsSame(second);
        assertThat(second.getIteration()).isEqualTo(2);
        assertThat(second.getVariables()).containsEntry("flights", 2.0);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Actor wolf-1 failed to persist state, retrying on next save: disk full")
    void persistenceFailureKeepsActorRunning() throws Exception {
        doThrow(new IOException("disk full")).when(mockStore).save(any());
        runtime.shutdown();
        runtime = newRuntime(mockStore);
        store("wolf", "flows: {main: []}");

        ActorRunner wolf = runtime.spawn("wolf-1",
                runtime.newTemplate("wolf", "wolf").withAutoSaveInterval(Duration.ofMillis(20)));

        await().atMost(TIMEOUT).until(() -> wolf.getErrors().stream()
                .anyMatch(e -> e.errorType().equals("PERSISTENCE_FAILURE")));
        assertThat(wolf.getStatus()).isEqualTo(ActorStatus.RUNNING);
        assertThat(wolf.isHealthy()).isFalse();
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Actor wolf-1 stopped with ERROR due to IllegalStateException: .*")
    void corruptSnapshotMovesActorToError() throws Exception {
        when(mockStore.load("wolf-1")).thenReturn(Optional.of(new ActorStateSnapshot("other", "wolf", ActorStatus.RUNNING,
                1, Map.of(), Map.of(), Map.of(), ExecutionState.empty(), null, 0L)));
        runtime.shutdown();
        runtime = newRuntime(mockStore);
        store("wolf", "flows: {main: []}");

        ActorRunner wolf = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"), true);

        assertThat(wolf.awaitTermination(TIMEOUT)).isTrue();
        assertThat(wolf.getStatus()).isEqualTo(ActorStatus.ERROR);
        assertThat(runtime.getLastFault("wolf-1")).hasValueSatisfying(f -> assertThat(f).contains("cannot restore actor wolf-1"));
        assertThat(runtime.getStatus("wolf-1")).contains(ActorStatus.ERROR);

        ActorRunner fresh = runtime.spawn("wolf-1", runtime.newTemplate("wolf", "wolf"));
        await().atMost(TIMEOUT).until(() -> fresh.getIteration() >= 1);
        assertThat(runtime.getStatus("wolf-1")).contains(ActorStatus.RUNNING);
    }
}
