package org.cognita.document.execution;

import org.cognita.document.ActionNode;

/**
 * Executes one kind of action. Handlers are stateless and shared by all executions.
 */
@FunctionalInterface
public interface IActionHandler {

    /**
     * Executes an action.
     * @param action The action node.
     * @param context The execution context, giving access to scope, expressions and effects.
     * @return How execution proceeds.
     * @throws Exception any failure; the executor turns it into a handler fault.
     */
    ActionOutcome handle(ActionNode action, ExecutionContext context) throws Exception;
}
