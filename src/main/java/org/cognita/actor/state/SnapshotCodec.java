package org.cognita.actor.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.cognita.document.expression.Values;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON encoding of {@link ActorStateSnapshot}. Numbers inside variables and memories decode as
 * doubles, matching what the document executor produces.
 */
public class SnapshotCodec {

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, false)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public byte[] encode(ActorStateSnapshot snapshot) throws IOException {
        try {
            return mapper.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to encode snapshot of actor " + snapshot.actorId(), e);
        }
    }

    /**
     * @throws IOException if the bytes are not a valid snapshot.
     */
    public ActorStateSnapshot decode(byte[] json) throws IOException {
        ActorStateSnapshot raw = mapper.readValue(json, ActorStateSnapshot.class);
        ExecutionState execution = raw.execution();
        ExecutionState normalizedExecution = new ExecutionState(normalizeMap(execution.variables()),
                execution.currentFlow(), execution.documentVersion(), execution.pendingContinuations());
        PlanState plan = raw.plan() == null ? null
                : new PlanState(raw.plan().goalId(), raw.plan().actionIds(), raw.plan().cursor(),
                        normalizeMap(raw.plan().worldSnapshot()));
        Map<String, Map<String, Object>> goals = new LinkedHashMap<>();
        raw.goals().forEach((name, params) -> goals.put(name, normalizeMap(params)));
        return new ActorStateSnapshot(raw.actorId(), raw.templateId(), raw.status(), raw.iteration(),
                raw.feelings(), goals, normalizeMap(raw.memories()), normalizedExecution, plan, raw.savedAtEpochMs());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> normalizeMap(Map<String, Object> map) {
        if (map == null) {
            return null;
        }
        return (Map<String, Object>) Values.normalize(map);
    }
}
