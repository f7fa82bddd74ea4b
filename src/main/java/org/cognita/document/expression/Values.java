package org.cognita.document.expression;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Coercion and formatting rules shared by the expression evaluator and the action handlers.
 * <p>
 * Numbers are represented as {@link Double}. Integral doubles render without a fraction,
 * null renders as {@code "null"}.
 */
public final class Values {

    private Values() {}

    /**
     * Applies truthiness: null, false, zero, the empty string and empty collections are false.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof String s) {
            return !s.isEmpty() && !s.equalsIgnoreCase("false");
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    /**
     * Checks whether a value can be used as a number.
     */
    public static boolean isNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        if (value instanceof String s) {
            return parseNumber(s) != null;
        }
        return false;
    }

    /**
     * Coerces a value to a double.
     * @throws ExpressionException if the value is not numeric.
     */
    public static double toNumber(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof String s) {
            Double parsed = parseNumber(s);
            if (parsed != null) {
                return parsed;
            }
        }
        throw new ExpressionException("Not a number: " + format(value), null);
    }

    /**
     * Normalizes numbers of any boxed type to {@link Double}, recursing into lists and maps.
     */
    public static Object normalize(Object value) {
        if (value instanceof Number n && !(value instanceof Double)) {
            return n.doubleValue();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Values::normalize).collect(Collectors.toList());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new java.util.LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), normalize(v)));
            return copy;
        }
        return value;
    }

    /**
     * Compares two values for equality, numerically when both are numeric.
     */
    public static boolean areEqual(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if ((a instanceof Number || b instanceof Number) && isNumeric(a) && isNumeric(b)) {
            return toNumber(a) == toNumber(b);
        }
        if (a instanceof Boolean && b instanceof String || a instanceof String && b instanceof Boolean) {
            return String.valueOf(a).equalsIgnoreCase(String.valueOf(b));
        }
        return Objects.equals(a, b);
    }

    /**
     * Renders a value as text.
     */
    public static String format(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double d) {
            return formatNumber(d);
        }
        if (value instanceof Float || value instanceof Number) {
            return formatNumber(((Number) value).doubleValue());
        }
        if (value instanceof List<?> list) {
            return list.stream().map(Values::format).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(e -> e.getKey() + ": " + format(e.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        return value.toString();
    }

    /**
     * Renders a number, dropping the fraction of integral values.
     */
    public static String formatNumber(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    private static Double parseNumber(String s) {
        String trimmed = s.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        char first = trimmed.charAt(0);
        if (!(Character.isDigit(first) || first == '-' || first == '+' || first == '.')) {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
