package org.cognita.actor.state;

import org.cognita.actor.ActorStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything needed to restore an actor. Plain data; serialized with {@link SnapshotCodec}.
 *
 * @param actorId The actor id.
 * @param templateId The template the actor was spawned from.
 * @param status The status at save time.
 * @param iteration The number of completed ticks.
 * @param feelings Feeling intensities in [0, 1].
 * @param goals Active goals with their parameters.
 * @param memories Working memory.
 * @param execution The document execution state.
 * @param plan The current plan, or null.
 * @param savedAtEpochMs When the snapshot was taken.
 */
public record ActorStateSnapshot(
        String actorId,
        String templateId,
        ActorStatus status,
        long iteration,
        Map<String, Double> feelings,
        Map<String, Map<String, Object>> goals,
        Map<String, Object> memories,
        ExecutionState execution,
        PlanState plan,
        long savedAtEpochMs
) {
    public ActorStateSnapshot {
        feelings = feelings == null ? Map.of() : new LinkedHashMap<>(feelings);
        goals = goals == null ? Map.of() : new LinkedHashMap<>(goals);
        memories = memories == null ? Map.of() : new LinkedHashMap<>(memories);
        execution = execution == null ? ExecutionState.empty() : execution;
    }
}
