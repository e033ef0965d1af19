package io.github.cyfko.truthtable.core.exception;

import java.util.OptionalInt;

/**
 * Exception thrown when the raw text cannot be split into tokens.
 * <p>
 * Raised for characters that start no known lexeme and for numeric literals other than
 * {@code 0} or {@code 1}. Where the offending input has a location, the 1-based position
 * within the trimmed expression is available through {@link #getPosition()}.
 * </p>
 *
 * <pre>{@code
 * Lexer.tokenize("a $ b");
 * // → "Unexpected character '$' at position 3"
 *
 * Lexer.tokenize("a & 23");
 * // → "Unexpected number '23'. Only 0 or 1 are allowed as constants."
 * }</pre>
 *
 * @since 1.0.0
 */
public class LexicalException extends ExpressionException {

    private final int position;

    public LexicalException(String message) {
        this(message, -1);
    }

    /**
     * @param message  the message describing the failure
     * @param position the 1-based position of the offending input, or a negative value when unknown
     */
    public LexicalException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * @return the 1-based position of the offending input, empty when not applicable
     */
    public OptionalInt getPosition() {
        return position > 0 ? OptionalInt.of(position) : OptionalInt.empty();
    }
}
