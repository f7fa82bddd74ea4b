package org.cognita.document.expression;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates expressions and {@code ${...}} templates against a {@link VariableResolver}.
 * <p>
 * A value that is exactly one {@code ${...}} keeps the type of the expression result; text
 * mixed with placeholders is interpolated into a string. Parsed expressions are cached, so one
 * evaluator can be shared by all executions of a process.
 */
public class ExpressionEvaluator {

    private final Map<String, Expr> cache = new ConcurrentHashMap<>();

    /**
     * Parses (or fetches from cache) and evaluates an expression.
     * @param expression The source text, with or without {@code ${...}}.
     * @param variables The variable resolver.
     * @return The result value.
     */
    public Object evaluate(String expression, VariableResolver variables) {
        Expr expr = cache.computeIfAbsent(expression, e -> new ExpressionParser().parse(e));
        try {
            return eval(expr, variables);
        } catch (ExpressionException e) {
            if (e.getExpression() == null) {
                throw new ExpressionException(e.getMessage(), expression);
            }
            throw e;
        }
    }

    /**
     * Evaluates a condition with truthiness rules.
     */
    public boolean evaluateCondition(String expression, VariableResolver variables) {
        return Values.isTruthy(evaluate(expression, variables));
    }

    /**
     * Resolves a raw document value: strings are treated as templates, lists and maps are resolved
     * element-wise, everything else is returned as-is.
     * @param raw The raw value from the document.
     * @param variables The variable resolver.
     * @return The resolved value.
     */
    public Object resolve(Object raw, VariableResolver variables) {
        if (raw instanceof String s) {
            return interpolate(s, variables);
        }
        if (raw instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object item : list) {
                resolved.add(resolve(item, variables));
            }
            return resolved;
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            map.forEach((k, v) -> resolved.put(String.valueOf(k), resolve(v, variables)));
            return resolved;
        }
        return raw;
    }

    /**
     * Expands a template string.
     * @param template Text that may contain {@code ${...}} placeholders.
     * @param variables The variable resolver.
     * @return The typed value for a single placeholder, otherwise the interpolated string.
     */
    public Object interpolate(String template, VariableResolver variables) {
        int open = template.indexOf("${");
        if (open < 0) {
            return template;
        }
        String trimmed = template.trim();
        if (trimmed.startsWith("${") && findClose(trimmed, 2) == trimmed.length() - 1) {
            return evaluate(trimmed, variables);
        }
        StringBuilder out = new StringBuilder();
        int pos = 0;
        while (open >= 0) {
            int close = findClose(template, open + 2);
            if (close < 0) {
                throw new ExpressionException("Unterminated '${'", template);
            }
            out.append(template, pos, open);
            out.append(Values.format(evaluate(template.substring(open + 2, close), variables)));
            pos = close + 1;
            open = template.indexOf("${", pos);
        }
        out.append(template.substring(pos));
        return out.toString();
    }

    private static int findClose(String text, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    private Object eval(Expr expr, VariableResolver variables) {
        if (expr instanceof Expr.Literal literal) {
            return literal.value();
        }
        if (expr instanceof Expr.Variable variable) {
            return variables.resolve(variable.name());
        }
        if (expr instanceof Expr.Property property) {
            return property(eval(property.target(), variables), property);
        }
        if (expr instanceof Expr.Index index) {
            return index(eval(index.target(), variables), eval(index.index(), variables), index.nullSafe());
        }
        if (expr instanceof Expr.Unary unary) {
            return unary(unary, variables);
        }
        if (expr instanceof Expr.Binary binary) {
            return binary(binary.operator(), eval(binary.left(), variables), eval(binary.right(), variables));
        }
        if (expr instanceof Expr.Logical logical) {
            return logical(logical, variables);
        }
        if (expr instanceof Expr.Conditional conditional) {
            return Values.isTruthy(eval(conditional.condition(), variables))
                    ? eval(conditional.then(), variables)
                    : eval(conditional.otherwise(), variables);
        }
        return call((Expr.Call) expr, variables);
    }

    private Object property(Object target, Expr.Property property) {
        if (target == null) {
            return null;
        }
        if (target instanceof Map<?, ?> map) {
            return map.get(property.name());
        }
        if (target instanceof List<?> list && property.name().equals("length")) {
            return (double) list.size();
        }
        if (target instanceof String s && property.name().equals("length")) {
            return (double) s.length();
        }
        if (property.nullSafe()) {
            return null;
        }
        throw new ExpressionException("Cannot read property '" + property.name() + "' of " + Values.format(target), null);
    }

    private Object index(Object target, Object index, boolean nullSafe) {
        if (target == null) {
            return null;
        }
        if (target instanceof Map<?, ?> map) {
            return map.get(Values.format(index));
        }
        if (target instanceof List<?> list) {
            int i = (int) Values.toNumber(index);
            return i >= 0 && i < list.size() ? list.get(i) : null;
        }
        if (nullSafe) {
            return null;
        }
        throw new ExpressionException("Cannot index " + Values.format(target), null);
    }

    private Object unary(Expr.Unary unary, VariableResolver variables) {
        Object operand = eval(unary.operand(), variables);
        if (unary.operator() == TokenType.BANG) {
            return !Values.isTruthy(operand);
        }
        return -Values.toNumber(operand);
    }

    private Object logical(Expr.Logical logical, VariableResolver variables) {
        Object left = eval(logical.left(), variables);
        return switch (logical.operator()) {
            case AND -> Values.isTruthy(left) && Values.isTruthy(eval(logical.right(), variables));
            case OR -> Values.isTruthy(left) || Values.isTruthy(eval(logical.right(), variables));
            default -> left != null ? left : eval(logical.right(), variables);
        };
    }

    private Object binary(TokenType operator, Object left, Object right) {
        return switch (operator) {
            case PLUS -> {
                if (left instanceof String && !Values.isNumeric(left) || right instanceof String && !Values.isNumeric(right)
                        || left instanceof String && right instanceof String) {
                    yield Values.format(left) + Values.format(right);
                }
                yield Values.toNumber(left) + Values.toNumber(right);
            }
            case MINUS -> Values.toNumber(left) - Values.toNumber(right);
            case STAR -> Values.toNumber(left) * Values.toNumber(right);
            case SLASH -> {
                double divisor = Values.toNumber(right);
                if (divisor == 0.0) {
                    throw new ExpressionException("Division by zero", null);
                }
                yield Values.toNumber(left) / divisor;
            }
            case PERCENT -> {
                double divisor = Values.toNumber(right);
                if (divisor == 0.0) {
                    throw new ExpressionException("Modulo by zero", null);
                }
                yield Values.toNumber(left) % divisor;
            }
            case EQUAL_EQUAL -> Values.areEqual(left, right);
            case BANG_EQUAL -> !Values.areEqual(left, right);
            case LESS -> compare(left, right) < 0;
            case LESS_EQUAL -> compare(left, right) <= 0;
            case GREATER -> compare(left, right) > 0;
            case GREATER_EQUAL -> compare(left, right) >= 0;
            case IN -> contains(right, left);
            default -> throw new ExpressionException("Unsupported operator " + operator, null);
        };
    }

    private static int compare(Object left, Object right) {
        if (Values.isNumeric(left) && Values.isNumeric(right)) {
            return Double.compare(Values.toNumber(left), Values.toNumber(right));
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        throw new ExpressionException("Cannot compare " + Values.format(left) + " with " + Values.format(right), null);
    }

    private static boolean contains(Object container, Object item) {
        if (container == null) {
            return false;
        }
        if (container instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (Values.areEqual(element, item)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(Values.format(item));
        }
        if (container instanceof String s) {
            return s.contains(Values.format(item));
        }
        throw new ExpressionException("'in' requires a list, map or string", null);
    }

    private Object call(Expr.Call call, VariableResolver variables) {
        List<Object> args = new ArrayList<>(call.arguments().size());
        for (Expr argument : call.arguments()) {
            args.add(eval(argument, variables));
        }
        String name = call.function().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "length" -> {
                requireArgs(name, args, 1);
                Object v = args.get(0);
                if (v instanceof Collection<?> c) yield (double) c.size();
                if (v instanceof Map<?, ?> m) yield (double) m.size();
                yield v == null ? 0.0 : (double) Values.format(v).length();
            }
            case "min" -> {
                requireArgs(name, args, 2);
                yield Math.min(Values.toNumber(args.get(0)), Values.toNumber(args.get(1)));
            }
            case "max" -> {
                requireArgs(name, args, 2);
                yield Math.max(Values.toNumber(args.get(0)), Values.toNumber(args.get(1)));
            }
            case "clamp" -> {
                requireArgs(name, args, 3);
                double value = Values.toNumber(args.get(0));
                yield Math.max(Values.toNumber(args.get(1)), Math.min(Values.toNumber(args.get(2)), value));
            }
            case "abs" -> {
                requireArgs(name, args, 1);
                yield Math.abs(Values.toNumber(args.get(0)));
            }
            case "floor" -> {
                requireArgs(name, args, 1);
                yield Math.floor(Values.toNumber(args.get(0)));
            }
            case "ceil" -> {
                requireArgs(name, args, 1);
                yield Math.ceil(Values.toNumber(args.get(0)));
            }
            case "round" -> {
                requireArgs(name, args, 1);
                yield (double) Math.round(Values.toNumber(args.get(0)));
            }
            case "lower" -> {
                requireArgs(name, args, 1);
                yield Values.format(args.get(0)).toLowerCase(Locale.ROOT);
            }
            case "upper" -> {
                requireArgs(name, args, 1);
                yield Values.format(args.get(0)).toUpperCase(Locale.ROOT);
            }
            case "contains" -> {
                requireArgs(name, args, 2);
                yield contains(args.get(0), args.get(1));
            }
            case "is_null" -> {
                requireArgs(name, args, 1);
                yield args.get(0) == null;
            }
            case "str" -> {
                requireArgs(name, args, 1);
                yield Values.format(args.get(0));
            }
            case "num" -> {
                requireArgs(name, args, 1);
                yield Values.toNumber(args.get(0));
            }
            default -> throw new ExpressionException("Unknown function '" + call.function() + "'", null);
        };
    }

    private static void requireArgs(String name, List<Object> args, int count) {
        if (args.size() != count) {
            throw new ExpressionException(name + "() expects " + count + " argument(s), got " + args.size(), null);
        }
    }
}
