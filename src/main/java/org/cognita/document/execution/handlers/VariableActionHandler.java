package org.cognita.document.execution.handlers;

import org.cognita.document.ActionKind;
import org.cognita.document.ActionNode;
import org.cognita.document.execution.ActionOutcome;
import org.cognita.document.execution.ExecutionContext;
import org.cognita.document.execution.IActionHandler;
import org.cognita.document.execution.VariableScope;
import org.cognita.document.expression.Values;

/**
 * Handles the variable actions: set, local, global, clear, increment and decrement.
 */
public class VariableActionHandler implements IActionHandler {

    @Override
    public ActionOutcome handle(ActionNode action, ExecutionContext context) {
        VariableScope scope = context.getScope();
        String variable = variableName(action, context);

        switch (action.kind()) {
            case SET -> scope.set(variable, context.resolve(action.param("value")));
            case LOCAL -> scope.defineLocal(variable, context.resolve(action.param("value")));
            case GLOBAL -> scope.setGlobal(variable, context.resolve(action.param("value")));
            case CLEAR -> scope.remove(variable);
            case INCREMENT, DECREMENT -> {
                Object current = scope.get(variable);
                double base = current == null ? 0.0 : Values.toNumber(current);
                double by = context.resolveNumber(action.param("by", 1.0));
                scope.set(variable, action.kind() == ActionKind.INCREMENT ? base + by : base - by);
            }
            default -> throw new IllegalStateException("Unexpected action for VariableActionHandler: " + action.name());
        }
        return ActionOutcome.CONTINUE;
    }

    private static String variableName(ActionNode action, ExecutionContext context) {
        String name = context.resolveString(action.param("variable"));
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("'" + action.name() + "' requires a variable name");
        }
        return name;
    }
}
