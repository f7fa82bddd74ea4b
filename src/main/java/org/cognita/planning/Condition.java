package org.cognita.planning;

import org.cognita.document.expression.Values;

/**
 * A test on one world-state fact, parsed from text such as {@code "<= 0.3"}, {@code "== true"}
 * or {@code "!= idle"}. A value without operator means equality.
 *
 * @param key The fact name.
 * @param operator The comparison.
 * @param target The value compared against: Double, Boolean or String.
 */
public record Condition(String key, Operator operator, Object target) {

    public enum Operator {
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * Parses a condition.
     * @param key The fact name.
     * @param expression The condition text.
     * @throws IllegalArgumentException if an ordering operator is used with a non-numeric target.
     */
    public static Condition parse(String key, String expression) {
        String text = expression.trim();
        Operator operator = Operator.EQ;
        // two-character operators first
        for (Operator candidate : new Operator[]{Operator.LE, Operator.GE, Operator.EQ, Operator.NE, Operator.LT, Operator.GT}) {
            if (text.startsWith(candidate.symbol())) {
                operator = candidate;
                text = text.substring(candidate.symbol().length()).trim();
                break;
            }
        }
        if (operator == Operator.EQ && text.startsWith("=")) {
            text = text.substring(1).trim();
        }
        Object target = parseLiteral(text);
        if (operator != Operator.EQ && operator != Operator.NE && !(target instanceof Double)) {
            throw new IllegalArgumentException("Condition on '" + key + "' compares " + operator.symbol() + " with non-number '" + text + "'");
        }
        return new Condition(key, operator, target);
    }

    public boolean isSatisfiedBy(WorldState state) {
        Object actual = state.get(key);
        switch (operator) {
            case EQ:
                return matches(actual);
            case NE:
                return !matches(actual);
            default:
                double value = state.getNumber(key);
                double bound = (Double) target;
                return switch (operator) {
                    case LT -> value < bound;
                    case LE -> value <= bound;
                    case GT -> value > bound;
                    case GE -> value >= bound;
                    default -> false;
                };
        }
    }

    private boolean matches(Object actual) {
        if (target instanceof Boolean expected) {
            return expected == Values.isTruthy(actual);
        }
        if (target instanceof Double) {
            return Values.areEqual(actual == null ? 0.0 : actual, target);
        }
        return Values.areEqual(actual, target);
    }

    static Object parseLiteral(String text) {
        String trimmed = text.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        if (Values.isNumeric(trimmed)) {
            return Values.toNumber(trimmed);
        }
        if (trimmed.length() >= 2 && (trimmed.startsWith("'") && trimmed.endsWith("'")
                || trimmed.startsWith("\"") && trimmed.endsWith("\""))) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    @Override
    public String toString() {
        return key + " " + operator.symbol() + " " + Values.format(target);
    }
}
