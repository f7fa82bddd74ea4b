package org.cognita.document.execution.handlers;

import org.cognita.document.ActionNode;
import org.cognita.document.execution.ActionOutcome;
import org.cognita.document.execution.ExecutionContext;
import org.cognita.document.execution.IActionHandler;
import org.cognita.document.execution.IActorEffects;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Handles the actions that affect the owning actor: emit, set_feeling, set_goal, remember and
 * trigger_goap_replan. The effects are handed to the execution's {@link IActorEffects} sink.
 * An {@code emit} of a channel signal without an intent does nothing outside channel execution.
 */
public class ActorEffectActionHandler implements IActionHandler {

    private static final double DEFAULT_REPLAN_URGENCY = 0.5;

    @Override
    public ActionOutcome handle(ActionNode action, ExecutionContext context) {
        IActorEffects effects = context.getEffects();
        switch (action.kind()) {
            case EMIT -> {
                if (action.param("intent") != null || action.param("signal") == null) {
                    effects.emitIntent(required(action, context, "intent"), rest(action, context, Set.of("intent")));
                }
            }
            case SET_FEELING -> {
                double value = context.resolveNumber(action.param("value"));
                effects.setFeeling(required(action, context, "name"), Math.max(0.0, Math.min(1.0, value)));
            }
            case SET_GOAL -> effects.setGoal(required(action, context, "name"), rest(action, context, Set.of("name")));
            case REMEMBER -> effects.remember(required(action, context, "key"), context.resolve(action.param("value")));
            case TRIGGER_GOAP_REPLAN -> {
                double urgency = context.resolveNumber(action.param("urgency", DEFAULT_REPLAN_URGENCY));
                effects.requestReplan(Math.max(0.0, Math.min(1.0, urgency)), context.resolveString(action.param("goal")));
            }
            default -> throw new IllegalStateException("Unexpected action for ActorEffectActionHandler: " + action.name());
        }
        return ActionOutcome.CONTINUE;
    }

    private static String required(ActionNode action, ExecutionContext context, String param) {
        String value = context.resolveString(action.param(param));
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + action.name() + "' requires '" + param + "'");
        }
        return value;
    }

    private static Map<String, Object> rest(ActionNode action, ExecutionContext context, Set<String> excluded) {
        Map<String, Object> data = new LinkedHashMap<>();
        action.params().forEach((key, raw) -> {
            if (!excluded.contains(key)) {
                data.put(key, context.resolve(raw));
            }
        });
        return data;
    }
}
