package io.github.cyfko.truthtable.core.exception;

/**
 * Exception thrown when an expression exceeds a limit of the active
 * {@link io.github.cyfko.truthtable.core.config.ExpressionPolicy}.
 * <p>
 * Guards the expression length and the number of free variables, the latter
 * bounding the table at {@code 2^maxVariables} rows.
 * </p>
 *
 * @since 1.0.0
 */
public class ComplexityLimitException extends ExpressionException {

    public ComplexityLimitException(String message) {
        super(message);
    }
}
