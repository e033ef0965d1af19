package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.ExpressionException;

/**
 * Interface for turning expression text into a {@link ParsedExpression}.
 * <p>
 * Implementations run the whole front end: lexing, variable collection, resource limits,
 * postfix conversion and tree construction. A parse starts from scratch every time; nothing
 * is carried over between calls.
 * </p>
 *
 * <p><strong>Supported syntax:</strong></p>
 * <ul>
 *   <li>Operators in ASCII ({@code ! ~ & | ^ -> => <-> <=>}), Unicode ({@code ¬ ∧ ∨ ⊕ → ↔})
 *       or words ({@code not and or xor implies iff}, any case)</li>
 *   <li>Constants {@code true t 1} and {@code false f 0}, any case</li>
 *   <li>Identifiers: a letter or underscore followed by letters, digits or underscores, case-sensitive</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 *
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 * ParsedExpression parsed = parser.parse("(a and b) -> ¬c");
 * parsed.variables(); // [a, b, c]
 * }</pre>
 *
 * @since 1.0.0
 */
public interface ExpressionParser {

    /**
     * @param expression the expression text
     * @return the parsed expression
     * @throws ExpressionException if the text cannot be tokenized, is malformed, or exceeds a limit
     */
    ParsedExpression parse(String expression) throws ExpressionException;
}
