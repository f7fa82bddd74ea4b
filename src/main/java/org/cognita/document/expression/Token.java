package org.cognita.document.expression;

/**
 * A single token of an expression.
 *
 * @param type The token type.
 * @param text The exact source text of the token.
 * @param value The literal value for NUMBER (Double) and STRING tokens, otherwise null.
 * @param position The zero-based character position in the expression.
 */
public record Token(TokenType type, String text, Object value, int position) {
}
