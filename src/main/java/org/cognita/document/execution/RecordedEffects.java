package org.cognita.document.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the effects of one execution so the caller can apply them afterwards.
 */
public class RecordedEffects implements IActorEffects {

    /**
     * An emitted intent.
     */
    public record Intent(String intent, Map<String, Object> data) {
    }

    /**
     * A requested replan.
     */
    public record ReplanRequest(double urgency, String goal) {
    }

    /**
     * A recovered handler fault.
     */
    public record Fault(String flow, String action, String message) {
    }

    private final Map<String, Double> feelings = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> goals = new LinkedHashMap<>();
    private final Map<String, Object> memories = new LinkedHashMap<>();
    private final List<Intent> intents = new ArrayList<>();
    private final List<Fault> faults = new ArrayList<>();
    private ReplanRequest replanRequest;
    private String terminationReason;
    private long waitMillis;

    @Override
    public void setFeeling(String name, double value) {
        feelings.put(name, value);
    }

    @Override
    public void setGoal(String name, Map<String, Object> parameters) {
        goals.put(name, parameters);
    }

    @Override
    public void remember(String key, Object value) {
        memories.put(key, value);
    }

    @Override
    public void emitIntent(String intent, Map<String, Object> data) {
        intents.add(new Intent(intent, data));
    }

    @Override
    public void requestReplan(double urgency, String goal) {
        // the most urgent request of a pass wins
        if (replanRequest == null || urgency > replanRequest.urgency()) {
            replanRequest = new ReplanRequest(urgency, goal);
        }
    }

    @Override
    public void requestTermination(String reason) {
        terminationReason = reason == null ? "self_terminate" : reason;
    }

    @Override
    public void requestWait(long millis) {
        waitMillis = Math.max(waitMillis, millis);
    }

    @Override
    public void reportFault(String flow, String action, String message) {
        faults.add(new Fault(flow, action, message));
    }

    public Map<String, Double> getFeelings() {
        return Collections.unmodifiableMap(feelings);
    }

    public Map<String, Map<String, Object>> getGoals() {
        return Collections.unmodifiableMap(goals);
    }

    public Map<String, Object> getMemories() {
        return Collections.unmodifiableMap(memories);
    }

    public List<Intent> getIntents() {
        return Collections.unmodifiableList(intents);
    }

    public List<Fault> getFaults() {
        return Collections.unmodifiableList(faults);
    }

    public ReplanRequest getReplanRequest() {
        return replanRequest;
    }

    public String getTerminationReason() {
        return terminationReason;
    }

    public boolean isTerminationRequested() {
        return terminationReason != null;
    }

    public long getWaitMillis() {
        return waitMillis;
    }

    public boolean hasStateChanges() {
        return !feelings.isEmpty() || !goals.isEmpty() || !memories.isEmpty();
    }
}
