package io.github.cyfko.truthtable.core.exception;

/**
 * Exception thrown when a token sequence does not form a well-formed expression.
 * <p>
 * Typical causes:
 * </p>
 * <ul>
 *   <li><strong>Unmatched parentheses:</strong> a {@code ')'} without its {@code '('}, or the reverse</li>
 *   <li><strong>Missing operands:</strong> an operator with fewer operands than its arity requires</li>
 *   <li><strong>Dangling operands:</strong> several values left once the whole expression is consumed</li>
 *   <li><strong>Unknown operators:</strong> an operator token that names no registered connective</li>
 *   <li><strong>Empty input</strong></li>
 * </ul>
 *
 * <pre>{@code
 * parser.parse("(a & b");
 * // → "Mismatched parentheses: unmatched '('"
 *
 * parser.parse("a & ");
 * // → "Invalid expression: missing operands for binary operator '&'"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ExpressionSyntaxException extends ExpressionException {

    public ExpressionSyntaxException(String message) {
        super(message);
    }

    public ExpressionSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
