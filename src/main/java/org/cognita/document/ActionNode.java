package org.cognita.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One action of a flow.
 *
 * @param kind The built-in kind, or {@link ActionKind#EXTENSION}.
 * @param name The action key as written in the document.
 * @param params The normalized parameters; scalar shorthand forms are expanded to named parameters.
 * @param body The nested actions of {@code repeat} and {@code for_each}.
 * @param branches The branches of {@code cond}.
 * @param fatal true if a fault of this action aborts the execution.
 * @param onError Actions run when this action faults.
 * @param path The location of the action inside the document.
 */
public record ActionNode(
        ActionKind kind,
        String name,
        Map<String, Object> params,
        List<ActionNode> body,
        List<ConditionalBranch> branches,
        boolean fatal,
        List<ActionNode> onError,
        String path
) {
    public ActionNode {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        body = List.copyOf(body);
        branches = List.copyOf(branches);
        onError = List.copyOf(onError);
    }

    /**
     * Gets a parameter.
     * @param key The parameter name.
     * @return The raw value, or null.
     */
    public Object param(String key) {
        return params.get(key);
    }

    /**
     * Gets a parameter, falling back to a default.
     */
    public Object param(String key, Object defaultValue) {
        Object value = params.get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * One branch of a {@code cond} action.
     * @param when The condition expression, or null for the {@code else} branch.
     * @param then The actions of the branch.
     */
    public record ConditionalBranch(String when, List<ActionNode> then) {
        public ConditionalBranch {
            then = List.copyOf(then);
        }

        public boolean isElse() {
            return when == null;
        }
    }
}
