package org.cognita.document.execution;

import org.cognita.document.expression.VariableResolver;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A lexical variable scope with a parent chain.
 * <p>
 * {@link #set} updates the nearest scope that already defines the variable and otherwise
 * defines it here; {@link #defineLocal} always defines it here, shadowing outer scopes;
 * {@link #setGlobal} writes to the root scope. Not thread-safe: a scope belongs to one execution.
 */
public class VariableScope implements VariableResolver {

    private final VariableScope parent;
    private final Map<String, Object> variables = new HashMap<>();

    public VariableScope() {
        this(null);
    }

    private VariableScope(VariableScope parent) {
        this.parent = parent;
    }

    /**
     * Creates a root scope pre-populated with the given variables.
     */
    public static VariableScope of(Map<String, ?> initial) {
        VariableScope scope = new VariableScope();
        initial.forEach(scope::defineLocal);
        return scope;
    }

    public VariableScope createChild() {
        return new VariableScope(this);
    }

    public VariableScope getParent() {
        return parent;
    }

    public VariableScope getRoot() {
        VariableScope scope = this;
        while (scope.parent != null) {
            scope = scope.parent;
        }
        return scope;
    }

    /**
     * Looks a variable up along the parent chain.
     * @return The value, or null if undefined.
     */
    public Object get(String name) {
        VariableScope owner = findOwner(name);
        return owner == null ? null : owner.variables.get(name);
    }

    @Override
    public Object resolve(String name) {
        return get(name);
    }

    public boolean isDefined(String name) {
        return findOwner(name) != null;
    }

    public void set(String name, Object value) {
        VariableScope owner = findOwner(name);
        (owner == null ? this : owner).variables.put(name, value);
    }

    public void defineLocal(String name, Object value) {
        variables.put(name, value);
    }

    public void setGlobal(String name, Object value) {
        getRoot().variables.put(name, value);
    }

    /**
     * Removes a variable from the nearest scope that defines it.
     */
    public void remove(String name) {
        VariableScope owner = findOwner(name);
        if (owner != null) {
            owner.variables.remove(name);
        }
    }

    /**
     * @return The variables defined directly in this scope.
     */
    public Map<String, Object> getLocalVariables() {
        return Collections.unmodifiableMap(variables);
    }

    /**
     * @return All visible variables, inner definitions shadowing outer ones.
     */
    public Map<String, Object> flatten() {
        Map<String, Object> result = parent == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parent.flatten());
        result.putAll(variables);
        return result;
    }

    private VariableScope findOwner(String name) {
        VariableScope scope = this;
        while (scope != null) {
            if (scope.variables.containsKey(name)) {
                return scope;
            }
            scope = scope.parent;
        }
        return null;
    }
}
