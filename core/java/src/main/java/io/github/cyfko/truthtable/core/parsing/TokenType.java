package io.github.cyfko.truthtable.core.parsing;

/**
 * Lexical category of a {@link Token}.
 */
public enum TokenType {
    LEFT_PAREN,
    RIGHT_PAREN,
    OPERATOR,
    CONSTANT,
    IDENTIFIER;

    /**
     * @return {@code true} for identifiers and constants, the tokens that produce a value
     */
    public boolean isOperand() {
        return this == IDENTIFIER || this == CONSTANT;
    }

    public boolean isParenthesis() {
        return this == LEFT_PAREN || this == RIGHT_PAREN;
    }
}
