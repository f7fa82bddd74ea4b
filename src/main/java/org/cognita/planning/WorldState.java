package org.cognita.planning;

import org.cognita.document.expression.Values;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * An immutable set of named facts. Values are {@link Double}, {@link Boolean} or {@link String};
 * other numbers are normalized to Double. Two states with the same facts are equal, which the
 * planner relies on to detect revisited states.
 */
public final class WorldState {

    private static final WorldState EMPTY = new WorldState(new TreeMap<>());

    private final Map<String, Object> facts;
    private final int hash;

    private WorldState(TreeMap<String, Object> facts) {
        this.facts = Collections.unmodifiableMap(facts);
        this.hash = facts.hashCode();
    }

    public static WorldState empty() {
        return EMPTY;
    }

    /**
     * Creates a state from a map of facts. Null values are skipped.
     */
    public static WorldState of(Map<String, ?> facts) {
        TreeMap<String, Object> copy = new TreeMap<>();
        facts.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, normalize(value));
            }
        });
        return new WorldState(copy);
    }

    /**
     * @return A new state with one fact replaced.
     */
    public WorldState with(String key, Object value) {
        TreeMap<String, Object> copy = new TreeMap<>(facts);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, normalize(value));
        }
        return new WorldState(copy);
    }

    public Object get(String key) {
        return facts.get(key);
    }

    public boolean has(String key) {
        return facts.containsKey(key);
    }

    /**
     * @return The fact as a number; absent or non-numeric facts count as 0.
     */
    public double getNumber(String key) {
        Object value = facts.get(key);
        return Values.isNumeric(value) ? Values.toNumber(value) : 0.0;
    }

    public Map<String, Object> asMap() {
        return facts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof WorldState other && hash == other.hash && facts.equals(other.facts);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "WorldState" + facts;
    }

    private static Object normalize(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean || value instanceof String) {
            return value;
        }
        return Values.format(value);
    }
}
