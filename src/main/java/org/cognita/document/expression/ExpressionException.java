package org.cognita.document.expression;

/**
 * Raised when an expression cannot be parsed or evaluated.
 * The executor converts it into a handler fault of the action that evaluated the expression.
 */
public class ExpressionException extends RuntimeException {

    private final String expression;

    public ExpressionException(String message, String expression) {
        super(message + (expression != null ? " in '" + expression + "'" : ""));
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
