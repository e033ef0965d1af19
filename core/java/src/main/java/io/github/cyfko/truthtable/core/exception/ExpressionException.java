package io.github.cyfko.truthtable.core.exception;

/**
 * Base type of every error raised while turning an expression into a truth table.
 * <p>
 * Messages are written for end users: the presentation layer is expected to display
 * {@link #getMessage()} verbatim.
 * </p>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     TruthTable table = TruthTableFactory.of().generate(userExpression, options);
 *     render(table);
 * } catch (ExpressionException e) {
 *     showError(e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see LexicalException
 * @see ExpressionSyntaxException
 * @see EvaluationException
 * @see ComplexityLimitException
 */
public class ExpressionException extends RuntimeException {

    /**
     * @param message the message describing the failure
     */
    public ExpressionException(String message) {
        super(message);
    }

    /**
     * @param message the message describing the failure
     * @param cause   the original cause of this exception
     */
    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
