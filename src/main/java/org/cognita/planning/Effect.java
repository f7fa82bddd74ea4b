package org.cognita.planning;

import org.cognita.document.expression.Values;

/**
 * A change to one world-state fact, parsed from text: {@code "-0.6"} and {@code "+1"} add a
 * delta, {@code "=5"} sets a number, {@code "true"} and {@code "walking"} set a value. An
 * unsigned number also sets.
 *
 * @param key The fact name.
 * @param delta true if {@code value} is added to the current number.
 * @param value The delta or the new value.
 */
public record Effect(String key, boolean delta, Object value) {

    public static Effect parse(String key, String expression) {
        String text = expression.trim();
        if ((text.startsWith("+") || text.startsWith("-")) && Values.isNumeric(text)) {
            return new Effect(key, true, Values.toNumber(text));
        }
        if (text.startsWith("=")) {
            return new Effect(key, false, Condition.parseLiteral(text.substring(1)));
        }
        return new Effect(key, false, Condition.parseLiteral(text));
    }

    public WorldState apply(WorldState state) {
        if (delta) {
            return state.with(key, state.getNumber(key) + (Double) value);
        }
        return state.with(key, value);
    }

    @Override
    public String toString() {
        if (delta) {
            double d = (Double) value;
            return key + (d >= 0 ? " += " : " -= ") + Values.formatNumber(Math.abs(d));
        }
        return key + " = " + Values.format(value);
    }
}
