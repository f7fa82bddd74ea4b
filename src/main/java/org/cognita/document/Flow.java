package org.cognita.document;

import java.util.List;

/**
 * A named sequence of actions.
 *
 * @param name The flow name.
 * @param actions The actions in execution order.
 * @param onError Actions run when an action of this flow faults and has no own handler.
 */
public record Flow(String name, List<ActionNode> actions, List<ActionNode> onError) {
    public Flow {
        actions = List.copyOf(actions);
        onError = List.copyOf(onError);
    }
}
