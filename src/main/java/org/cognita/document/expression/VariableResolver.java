package org.cognita.document.expression;

/**
 * Resolves variable names during expression evaluation.
 */
@FunctionalInterface
public interface VariableResolver {

    /**
     * @param name The variable name.
     * @return The value, or null if the variable is undefined.
     */
    Object resolve(String name);
}
