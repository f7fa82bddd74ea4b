package org.cognita.planning;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A plannable action with preconditions, effects and a positive cost.
 */
public record GoapAction(String id, List<Condition> preconditions, List<Effect> effects, double cost) {

    public GoapAction {
        preconditions = List.copyOf(preconditions);
        effects = List.copyOf(effects);
        if (!(cost > 0.0)) {
            throw new IllegalArgumentException("Action '" + id + "' must have a positive cost, got " + cost);
        }
    }

    /**
     * Creates an action from document metadata.
     * @param id The action id.
     * @param preconditions Fact name to condition text.
     * @param effects Fact name to effect text.
     * @param cost The cost.
     */
    public static GoapAction fromMetadata(String id, Map<String, String> preconditions, Map<String, String> effects,
                                          double cost) {
        List<Condition> conditions = new ArrayList<>();
        preconditions.forEach((key, text) -> conditions.add(Condition.parse(key, text)));
        List<Effect> changes = new ArrayList<>();
        effects.forEach((key, text) -> changes.add(Effect.parse(key, text)));
        return new GoapAction(id, conditions, changes, cost);
    }

    public boolean isApplicable(WorldState state) {
        for (Condition condition : preconditions) {
            if (!condition.isSatisfiedBy(state)) {
                return false;
            }
        }
        return true;
    }

    public WorldState apply(WorldState state) {
        WorldState result = state;
        for (Effect effect : effects) {
            result = effect.apply(result);
        }
        return result;
    }
}
