package org.cognita.document.execution;

import java.util.Map;

/**
 * Receives the actor-facing side effects of a document execution. The actor runner applies them
 * after the cognition pass; standalone executions collect them in {@link RecordedEffects}.
 */
public interface IActorEffects {

    void setFeeling(String name, double value);

    void setGoal(String name, Map<String, Object> parameters);

    void remember(String key, Object value);

    void emitIntent(String intent, Map<String, Object> data);

    /**
     * Requests a GOAP replan after this pass.
     * @param urgency The urgency in [0, 1], selects the planning budget tier.
     * @param goal The goal to plan for, or null for the highest-priority unsatisfied goal.
     */
    void requestReplan(double urgency, String goal);

    void requestTermination(String reason);

    void requestWait(long millis);

    /**
     * Reports a recovered handler fault.
     */
    void reportFault(String flow, String action, String message);
}
