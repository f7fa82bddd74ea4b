package org.cognita.actor.state;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Map;

/**
 * The GOAP plan an actor is following.
 *
 * @param goalId The goal the plan achieves.
 * @param actionIds The ordered plan steps.
 * @param cursor The index of the next step.
 * @param worldSnapshot The world state the plan was computed for.
 */
public record PlanState(String goalId, List<String> actionIds, int cursor, Map<String, Object> worldSnapshot) {

    public PlanState {
        actionIds = List.copyOf(actionIds);
        worldSnapshot = worldSnapshot == null ? Map.of() : Map.copyOf(worldSnapshot);
        if (cursor < 0 || cursor > actionIds.size()) {
            throw new IllegalArgumentException("cursor " + cursor + " outside plan of " + actionIds.size() + " steps");
        }
    }

    @JsonIgnore
    public boolean isComplete() {
        return cursor >= actionIds.size();
    }

    /**
     * @return The id of the next step, or null if the plan is complete.
     */
    public String currentAction() {
        return isComplete() ? null : actionIds.get(cursor);
    }

    public PlanState advance() {
        return new PlanState(goalId, actionIds, Math.min(cursor + 1, actionIds.size()), worldSnapshot);
    }
}
