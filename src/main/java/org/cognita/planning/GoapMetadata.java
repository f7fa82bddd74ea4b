package org.cognita.planning;

import org.cognita.document.BehaviorDocument;
import org.cognita.document.expression.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts GOAP goals and actions from the {@code goals} and {@code actions} sections of a
 * behavior document.
 * <pre>
 * goals:   { stay_fed: { priority: 100, conditions: { hunger: "&lt;= 0.3" } } }
 * actions: { eat: { preconditions: { has_food: "== true" }, effects: { hunger: "-0.6" }, cost: 1 } }
 * </pre>
 */
public final class GoapMetadata {

    private GoapMetadata() {}

    public static boolean hasGoapContent(BehaviorDocument document) {
        return !document.getGoals().isEmpty() && !document.getActions().isEmpty();
    }

    /**
     * @return Goals ordered by descending priority, document order among equals.
     * @throws IllegalArgumentException if a goal definition is malformed.
     */
    public static List<GoapGoal> goals(BehaviorDocument document) {
        List<GoapGoal> goals = new ArrayList<>();
        document.getGoals().forEach((id, definition) -> {
            int priority = (int) Values.toNumber(definition.getOrDefault("priority", 50.0));
            goals.add(GoapGoal.fromMetadata(id, priority, textMap(definition.get("conditions"))));
        });
        goals.sort(Comparator.comparingInt(GoapGoal::priority).reversed());
        return Collections.unmodifiableList(goals);
    }

    /**
     * @return Actions in document order, which is their registration order.
     * @throws IllegalArgumentException if an action definition is malformed.
     */
    public static List<GoapAction> actions(BehaviorDocument document) {
        List<GoapAction> actions = new ArrayList<>();
        document.getActions().forEach((id, definition) -> actions.add(GoapAction.fromMetadata(id,
                textMap(definition.get("preconditions")),
                textMap(definition.get("effects")),
                Values.toNumber(definition.getOrDefault("cost", 1.0)))));
        return Collections.unmodifiableList(actions);
    }

    public static Optional<GoapGoal> findGoal(List<GoapGoal> goals, String id) {
        return goals.stream().filter(g -> g.id().equals(id)).findFirst();
    }

    private static Map<String, String> textMap(Object raw) {
        Map<String, String> result = new LinkedHashMap<>();
        if (raw == null) {
            return result;
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Expected a mapping of fact names, got " + Values.format(raw));
        }
        map.forEach((key, value) -> result.put(String.valueOf(key), Values.format(value)));
        return result;
    }
}
