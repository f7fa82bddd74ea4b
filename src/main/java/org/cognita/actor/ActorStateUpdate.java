package org.cognita.actor;

import org.cognita.document.execution.RecordedEffects;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The observable outcome of one cognition tick: changed feelings, goals and memories, plus the
 * intents emitted during the tick. Execution internals are not exposed.
 *
 * @param actorId The actor.
 * @param iteration The tick number.
 * @param feelings Feelings changed in this tick.
 * @param goals Goals set in this tick.
 * @param memories Memories written in this tick.
 * @param intents Intents emitted in this tick.
 * @param timestamp When the update was produced.
 */
public record ActorStateUpdate(
        String actorId,
        long iteration,
        Map<String, Double> feelings,
        Map<String, Map<String, Object>> goals,
        Map<String, Object> memories,
        List<RecordedEffects.Intent> intents,
        Instant timestamp
) {
    public ActorStateUpdate {
        feelings = Map.copyOf(feelings);
        goals = Map.copyOf(goals);
        // memory values may be null
        memories = Collections.unmodifiableMap(new LinkedHashMap<>(memories));
        intents = List.copyOf(intents);
    }
}
