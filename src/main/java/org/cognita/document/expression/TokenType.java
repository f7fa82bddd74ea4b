package org.cognita.document.expression;

/**
 * Defines the types of tokens the expression lexer recognizes.
 */
public enum TokenType {
    // Single-character tokens
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, COMMA, DOT, COLON,
    PLUS, MINUS, STAR, SLASH, PERCENT,

    // One or two character tokens
    BANG, BANG_EQUAL, EQUAL_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AND, OR, QUESTION, QUESTION_DOT, QUESTION_BRACKET, QUESTION_QUESTION,

    // Literals
    IDENTIFIER, STRING, NUMBER,

    // Keywords
    TRUE, FALSE, NULL, IN,

    END_OF_INPUT
}
