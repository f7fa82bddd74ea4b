package org.cognita.document.expression;

import java.util.List;

/**
 * The syntax tree of a parsed expression.
 */
public sealed interface Expr {

    /** A number, string, boolean or null literal. */
    record Literal(Object value) implements Expr {}

    /** A reference to a scope variable. */
    record Variable(String name) implements Expr {}

    /** {@code target.name} or {@code target?.name}. */
    record Property(Expr target, String name, boolean nullSafe) implements Expr {}

    /** {@code target[index]} or {@code target?[index]}. */
    record Index(Expr target, Expr index, boolean nullSafe) implements Expr {}

    /** {@code -operand} or {@code !operand}. */
    record Unary(TokenType operator, Expr operand) implements Expr {}

    /** Arithmetic, comparison and membership operators. */
    record Binary(Expr left, TokenType operator, Expr right) implements Expr {}

    /** Short-circuit operators: {@code &&}, {@code ||} and {@code ??}. */
    record Logical(Expr left, TokenType operator, Expr right) implements Expr {}

    /** {@code condition ? then : otherwise}. */
    record Conditional(Expr condition, Expr then, Expr otherwise) implements Expr {}

    /** A call of a built-in function. */
    record Call(String function, List<Expr> arguments) implements Expr {
        public Call {
            arguments = List.copyOf(arguments);
        }
    }
}
