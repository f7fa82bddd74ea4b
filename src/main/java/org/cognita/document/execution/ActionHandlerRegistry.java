package org.cognita.document.execution;

import org.cognita.document.ActionKind;
import org.cognita.document.ActionNode;
import org.cognita.document.execution.handlers.ActorEffectActionHandler;
import org.cognita.document.execution.handlers.ControlActionHandler;
import org.cognita.document.execution.handlers.LogActionHandler;
import org.cognita.document.execution.handlers.VariableActionHandler;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps actions to their handlers: one handler per built-in {@link ActionKind}, plus extension
 * handlers registered by action name.
 */
public class ActionHandlerRegistry {

    private final Map<ActionKind, IActionHandler> builtins = new EnumMap<>(ActionKind.class);
    private final Map<String, IActionHandler> extensions = new ConcurrentHashMap<>();

    /**
     * Creates an empty registry. Most callers want {@link #withBuiltins()}.
     */
    public ActionHandlerRegistry() {
    }

    /**
     * Creates a registry with handlers for every built-in action kind.
     */
    public static ActionHandlerRegistry withBuiltins() {
        ActionHandlerRegistry registry = new ActionHandlerRegistry();
        registry.registerFamily(EnumSet.of(ActionKind.SET, ActionKind.LOCAL, ActionKind.GLOBAL, ActionKind.CLEAR,
                ActionKind.INCREMENT, ActionKind.DECREMENT), new VariableActionHandler());
        registry.registerFamily(EnumSet.of(ActionKind.LOG), new LogActionHandler());
        registry.registerFamily(EnumSet.of(ActionKind.COND, ActionKind.REPEAT, ActionKind.FOR_EACH, ActionKind.GOTO,
                ActionKind.CALL, ActionKind.RETURN, ActionKind.CONTINUATION_POINT, ActionKind.WAIT,
                ActionKind.WAIT_FOR, ActionKind.SYNC, ActionKind.SELF_TERMINATE), new ControlActionHandler());
        registry.registerFamily(EnumSet.of(ActionKind.EMIT, ActionKind.SET_FEELING, ActionKind.SET_GOAL,
                ActionKind.REMEMBER, ActionKind.TRIGGER_GOAP_REPLAN), new ActorEffectActionHandler());
        return registry;
    }

    /**
     * Registers one handler for a family of built-in kinds.
     * @throws IllegalStateException if a kind already has a handler.
     */
    public void registerFamily(Set<ActionKind> kinds, IActionHandler handler) {
        for (ActionKind kind : kinds) {
            if (kind == ActionKind.EXTENSION) {
                throw new IllegalArgumentException("Extension actions are registered by name");
            }
            if (builtins.putIfAbsent(kind, handler) != null) {
                throw new IllegalStateException("Handler for '" + kind.key() + "' registered twice");
            }
        }
    }

    /**
     * Registers a handler for an extension action.
     * @param name The action key as written in documents.
     * @param handler The handler.
     * @throws IllegalArgumentException if the name is a built-in action key.
     * @throws IllegalStateException if the name is already registered.
     */
    public void register(String name, IActionHandler handler) {
        if (ActionKind.fromKey(name) != ActionKind.EXTENSION) {
            throw new IllegalArgumentException("'" + name + "' is a built-in action");
        }
        if (extensions.putIfAbsent(name, handler) != null) {
            throw new IllegalStateException("Handler for '" + name + "' registered twice");
        }
    }

    public boolean isRegistered(String name) {
        ActionKind kind = ActionKind.fromKey(name);
        return kind == ActionKind.EXTENSION ? extensions.containsKey(name) : builtins.containsKey(kind);
    }

    /**
     * Finds the handler of an action.
     */
    public Optional<IActionHandler> lookup(ActionNode action) {
        if (action.kind() == ActionKind.EXTENSION) {
            return Optional.ofNullable(extensions.get(action.name()));
        }
        return Optional.ofNullable(builtins.get(action.kind()));
    }
}
