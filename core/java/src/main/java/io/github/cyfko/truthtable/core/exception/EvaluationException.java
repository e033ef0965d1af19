package io.github.cyfko.truthtable.core.exception;

import java.util.Optional;

/**
 * Exception thrown when an expression cannot be evaluated under a given assignment.
 * <p>
 * During table generation these failures are caught row by row and downgraded to a
 * {@code false} result, so they only reach callers that evaluate directly.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class EvaluationException extends ExpressionException {

    /**
     * Category of evaluation failure.
     */
    public enum Reason {
        /** A variable has no value in the assignment. */
        UNBOUND_VARIABLE,
        /** Operands were missing or left over on the evaluation stack. */
        MALFORMED_EXPRESSION,
        /** An operator was applied to a number of operands other than its arity. */
        UNSUPPORTED_ARITY
    }

    private final Reason reason;
    private final String variable;

    public EvaluationException(Reason reason, String message) {
        this(reason, message, null);
    }

    private EvaluationException(Reason reason, String message, String variable) {
        super(message);
        this.reason = reason;
        this.variable = variable;
    }

    /**
     * Creates the exception raised when {@code name} is absent from the assignment.
     *
     * @param name the unbound variable
     * @return a new exception with reason {@link Reason#UNBOUND_VARIABLE}
     */
    public static EvaluationException unboundVariable(String name) {
        return new EvaluationException(Reason.UNBOUND_VARIABLE, "Unbound variable '" + name + "'", name);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the unbound variable name, present only for {@link Reason#UNBOUND_VARIABLE}
     */
    public Optional<String> getVariable() {
        return Optional.ofNullable(variable);
    }
}
