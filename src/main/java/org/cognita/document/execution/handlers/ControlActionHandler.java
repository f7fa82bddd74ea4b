package org.cognita.document.execution.handlers;

import org.cognita.continuation.ContinuationEngine;
import org.cognita.continuation.PendingContinuation;
import org.cognita.document.ActionNode;
import org.cognita.document.execution.ActionOutcome;
import org.cognita.document.execution.DocumentExecutor;
import org.cognita.document.execution.ExecutionContext;
import org.cognita.document.execution.IActionHandler;
import org.cognita.document.execution.VariableScope;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handles the control actions: cond, repeat, for_each, goto, call, return,
 * continuation_point, wait and self_terminate. {@code wait_for} and {@code sync} are handled by
 * the {@link org.cognita.document.execution.ChannelScheduler}; reaching this handler with them
 * is a fault.
 */
public class ControlActionHandler implements IActionHandler {

    @Override
    public ActionOutcome handle(ActionNode action, ExecutionContext context) {
        switch (action.kind()) {
            case COND:
                for (ActionNode.ConditionalBranch branch : action.branches()) {
                    if (branch.isElse() || context.evaluateCondition(branch.when())) {
                        return context.runBlock(branch.then(), context.getScope());
                    }
                }
                return ActionOutcome.CONTINUE;
            case REPEAT:
                return repeat(action, context);
            case FOR_EACH:
                return forEach(action, context);
            case GOTO:
                return new ActionOutcome.Goto(targetFlow(action, context, "flow"), arguments(action, context));
            case CALL:
                return call(action, context);
            case RETURN:
                return new ActionOutcome.Return(context.resolve(action.param("value")));
            case CONTINUATION_POINT:
                return continuationPoint(action, context);
            case WAIT:
                long ms = (long) context.resolveNumber(action.param("ms"));
                if (ms < 0) {
                    throw new IllegalArgumentException("'wait' requires a non-negative duration, got " + ms);
                }
                context.getEffects().requestWait(ms);
                return ActionOutcome.CONTINUE;
            case SELF_TERMINATE:
                String reason = context.resolveString(action.param("reason"));
                context.getEffects().requestTermination(reason);
                return new ActionOutcome.Halt(reason);
            case WAIT_FOR:
            case SYNC:
                throw new UnsupportedOperationException("'" + action.name() + "' is only valid at the top level of a channel flow");
            default:
                throw new IllegalStateException("Unexpected action for ControlActionHandler: " + action.name());
        }
    }

    private ActionOutcome repeat(ActionNode action, ExecutionContext context) {
        int times = (int) context.resolveNumber(action.param("times"));
        for (int i = 0; i < times; i++) {
            VariableScope iterationScope = context.getScope().createChild();
            iterationScope.defineLocal("_index", (double) i);
            ActionOutcome outcome = context.runBlock(action.body(), iterationScope);
            if (!(outcome instanceof ActionOutcome.Continue)) {
                return outcome;
            }
        }
        return ActionOutcome.CONTINUE;
    }

    private ActionOutcome forEach(ActionNode action, ExecutionContext context) {
        String variable = context.resolveString(action.param("variable"));
        Object collection = context.resolve(action.param("collection"));
        List<Object> items;
        if (collection == null) {
            items = List.of();
        } else if (collection instanceof Collection<?> c) {
            items = new ArrayList<>(c);
        } else if (collection instanceof Map<?, ?> m) {
            items = new ArrayList<>(m.keySet());
        } else {
            throw new IllegalArgumentException("'for_each' expects a list or map, got " + collection.getClass().getSimpleName());
        }
        for (int i = 0; i < items.size(); i++) {
            VariableScope iterationScope = context.getScope().createChild();
            iterationScope.defineLocal(variable, items.get(i));
            iterationScope.defineLocal("_index", (double) i);
            ActionOutcome outcome = context.runBlock(action.body(), iterationScope);
            if (!(outcome instanceof ActionOutcome.Continue)) {
                return outcome;
            }
        }
        return ActionOutcome.CONTINUE;
    }

    private ActionOutcome call(ActionNode action, ExecutionContext context) {
        ActionOutcome outcome = context.callFlow(targetFlow(action, context, "flow"), arguments(action, context));
        if (outcome instanceof ActionOutcome.Return ret) {
            context.getScope().defineLocal(DocumentExecutor.RESULT_VARIABLE, ret.value());
            return ActionOutcome.CONTINUE;
        }
        return outcome;
    }

    private ActionOutcome continuationPoint(ActionNode action, ExecutionContext context) {
        String name = context.resolveString(action.param("name"));
        String defaultFlow = targetFlow(action, context, "default_flow");
        Object timeout = action.param("timeout_ms");
        Duration duration = timeout == null ? null : Duration.ofMillis((long) context.resolveNumber(timeout));
        ContinuationEngine engine = context.getContinuationEngine();
        PendingContinuation continuation = engine.open(name, duration, defaultFlow);
        return new ActionOutcome.Pause(continuation);
    }

    private static String targetFlow(ActionNode action, ExecutionContext context, String param) {
        String flow = context.resolveString(action.param(param));
        if (flow == null || !context.getDocument().hasFlow(flow)) {
            throw new IllegalArgumentException("Flow '" + flow + "' not found");
        }
        return flow;
    }

    private static Map<String, Object> arguments(ActionNode action, ExecutionContext context) {
        Object raw = action.param("args");
        if (raw == null) {
            return Map.of();
        }
        if (!(context.resolve(raw) instanceof Map<?, ?> resolved)) {
            throw new IllegalArgumentException("'" + action.name() + "' args must be a mapping");
        }
        Map<String, Object> args = new LinkedHashMap<>();
        resolved.forEach((k, v) -> args.put(String.valueOf(k), v));
        return args;
    }
}
