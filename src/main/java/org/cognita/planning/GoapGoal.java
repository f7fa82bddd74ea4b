package org.cognita.planning;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A goal: a set of conditions with a priority (higher wins).
 */
public record GoapGoal(String id, int priority, List<Condition> conditions) {

    public GoapGoal {
        conditions = List.copyOf(conditions);
    }

    public static GoapGoal fromMetadata(String id, int priority, Map<String, String> conditions) {
        List<Condition> parsed = new ArrayList<>();
        conditions.forEach((key, text) -> parsed.add(Condition.parse(key, text)));
        return new GoapGoal(id, priority, parsed);
    }

    public boolean isSatisfiedBy(WorldState state) {
        return unsatisfiedCount(state) == 0;
    }

    /**
     * @return The number of conditions the state does not meet; the planner's heuristic.
     */
    public int unsatisfiedCount(WorldState state) {
        int count = 0;
        for (Condition condition : conditions) {
            if (!condition.isSatisfiedBy(state)) {
                count++;
            }
        }
        return count;
    }
}
