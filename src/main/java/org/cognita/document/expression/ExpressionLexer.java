package org.cognita.document.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts expression source text into tokens.
 * Keywords {@code and}, {@code or} and {@code not} are accepted as aliases of
 * {@code &&}, {@code ||} and {@code !}.
 */
public class ExpressionLexer {

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "null", TokenType.NULL,
            "in", TokenType.IN,
            "and", TokenType.AND,
            "or", TokenType.OR,
            "not", TokenType.BANG);

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    public ExpressionLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the whole expression.
     * @return The tokens, terminated by {@link TokenType#END_OF_INPUT}.
     * @throws ExpressionException on an unexpected character or an unterminated string.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_INPUT, "", null, current));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\r', '\t', '\n' -> { }
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case '[' -> addToken(TokenType.LEFT_BRACKET);
            case ']' -> addToken(TokenType.RIGHT_BRACKET);
            case ',' -> addToken(TokenType.COMMA);
            case '.' -> {
                if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
            }
            case ':' -> addToken(TokenType.COLON);
            case '+' -> addToken(TokenType.PLUS);
            case '-' -> addToken(TokenType.MINUS);
            case '*' -> addToken(TokenType.STAR);
            case '/' -> addToken(TokenType.SLASH);
            case '%' -> addToken(TokenType.PERCENT);
            case '!' -> addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '=' -> {
                if (!match('=')) {
                    throw error("Unexpected '=' (use '==')");
                }
                addToken(TokenType.EQUAL_EQUAL);
            }
            case '<' -> addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&' -> {
                if (!match('&')) {
                    throw error("Unexpected '&' (use '&&')");
                }
                addToken(TokenType.AND);
            }
            case '|' -> {
                if (!match('|')) {
                    throw error("Unexpected '|' (use '||')");
                }
                addToken(TokenType.OR);
            }
            case '?' -> {
                if (match('.')) {
                    addToken(TokenType.QUESTION_DOT);
                } else if (match('[')) {
                    addToken(TokenType.QUESTION_BRACKET);
                } else if (match('?')) {
                    addToken(TokenType.QUESTION_QUESTION);
                } else {
                    addToken(TokenType.QUESTION);
                }
            }
            case '"', '\'' -> string(c);
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
            }
        }
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    default -> value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) {
            throw error("Unterminated string");
        }
        advance();
        addToken(TokenType.STRING, value.toString());
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        addToken(TokenType.NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        current++;
        return true;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(current);
    }

    private char peekNext() {
        return current + 1 >= source.length() ? '\0' : source.charAt(current + 1);
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        tokens.add(new Token(type, source.substring(start, current), value, start));
    }

    private ExpressionException error(String message) {
        return new ExpressionException(message + " at position " + start, source);
    }
}
