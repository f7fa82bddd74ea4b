package org.cognita.document.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * A recursive-descent parser for the document expression language.
 * <p>
 * Precedence, lowest first: conditional ({@code ?:}), null coalescing ({@code ??}),
 * {@code ||}, {@code &&}, equality, comparison and {@code in}, additive, multiplicative,
 * unary, then member access, indexing and calls. A surrounding {@code ${...}} is accepted
 * and stripped.
 */
public class ExpressionParser {

    private List<Token> tokens;
    private String source;
    private int current;

    /**
     * Parses one expression.
     * @param expression The source text, with or without a surrounding {@code ${...}}.
     * @return The syntax tree.
     * @throws ExpressionException on a syntax error.
     */
    public Expr parse(String expression) {
        String text = expression.trim();
        if (text.startsWith("${") && text.endsWith("}")) {
            text = text.substring(2, text.length() - 1).trim();
        }
        if (text.isEmpty()) {
            throw new ExpressionException("Empty expression", expression);
        }
        this.source = expression;
        this.tokens = new ExpressionLexer(text).scanTokens();
        this.current = 0;
        Expr result = conditional();
        if (!check(TokenType.END_OF_INPUT)) {
            throw error("Unexpected '" + peek().text() + "'");
        }
        return result;
    }

    private Expr conditional() {
        Expr condition = coalesce();
        if (match(TokenType.QUESTION)) {
            Expr then = conditional();
            consume(TokenType.COLON, "Expected ':' in conditional expression");
            Expr otherwise = conditional();
            return new Expr.Conditional(condition, then, otherwise);
        }
        return condition;
    }

    private Expr coalesce() {
        Expr expr = or();
        while (match(TokenType.QUESTION_QUESTION)) {
            expr = new Expr.Logical(expr, TokenType.QUESTION_QUESTION, or());
        }
        return expr;
    }

    private Expr or() {
        Expr expr = and();
        while (match(TokenType.OR)) {
            expr = new Expr.Logical(expr, TokenType.OR, and());
        }
        return expr;
    }

    private Expr and() {
        Expr expr = equality();
        while (match(TokenType.AND)) {
            expr = new Expr.Logical(expr, TokenType.AND, equality());
        }
        return expr;
    }

    private Expr equality() {
        Expr expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            TokenType operator = previous().type();
            expr = new Expr.Binary(expr, operator, comparison());
        }
        return expr;
    }

    private Expr comparison() {
        Expr expr = term();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.IN)) {
            TokenType operator = previous().type();
            expr = new Expr.Binary(expr, operator, term());
        }
        return expr;
    }

    private Expr term() {
        Expr expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            TokenType operator = previous().type();
            expr = new Expr.Binary(expr, operator, factor());
        }
        return expr;
    }

    private Expr factor() {
        Expr expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            TokenType operator = previous().type();
            expr = new Expr.Binary(expr, operator, unary());
        }
        return expr;
    }

    private Expr unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            TokenType operator = previous().type();
            return new Expr.Unary(operator, unary());
        }
        return postfix();
    }

    private Expr postfix() {
        Expr expr = primary();
        while (true) {
            if (match(TokenType.DOT)) {
                expr = new Expr.Property(expr, consume(TokenType.IDENTIFIER, "Expected property name after '.'").text(), false);
            } else if (match(TokenType.QUESTION_DOT)) {
                expr = new Expr.Property(expr, consume(TokenType.IDENTIFIER, "Expected property name after '?.'").text(), true);
            } else if (match(TokenType.LEFT_BRACKET)) {
                Expr index = conditional();
                consume(TokenType.RIGHT_BRACKET, "Expected ']'");
                expr = new Expr.Index(expr, index, false);
            } else if (match(TokenType.QUESTION_BRACKET)) {
                Expr index = conditional();
                consume(TokenType.RIGHT_BRACKET, "Expected ']'");
                expr = new Expr.Index(expr, index, true);
            } else {
                return expr;
            }
        }
    }

    private Expr primary() {
        if (match(TokenType.NUMBER, TokenType.STRING)) {
            return new Expr.Literal(previous().value());
        }
        if (match(TokenType.TRUE)) {
            return new Expr.Literal(Boolean.TRUE);
        }
        if (match(TokenType.FALSE)) {
            return new Expr.Literal(Boolean.FALSE);
        }
        if (match(TokenType.NULL)) {
            return new Expr.Literal(null);
        }
        if (match(TokenType.IDENTIFIER)) {
            String name = previous().text();
            if (match(TokenType.LEFT_PAREN)) {
                List<Expr> arguments = new ArrayList<>();
                if (!check(TokenType.RIGHT_PAREN)) {
                    do {
                        arguments.add(conditional());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
                return new Expr.Call(name, arguments);
            }
            return new Expr.Variable(name);
        }
        if (match(TokenType.LEFT_PAREN)) {
            Expr expr = conditional();
            consume(TokenType.RIGHT_PAREN, "Expected ')'");
            return expr;
        }
        throw error(check(TokenType.END_OF_INPUT) ? "Unexpected end of expression" : "Unexpected '" + peek().text() + "'");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                current++;
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return tokens.get(current++);
        }
        throw error(message);
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private ExpressionException error(String message) {
        return new ExpressionException(message + " at position " + peek().position(), source);
    }
}
