package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Operator;

import java.util.Objects;

/**
 * A single lexical unit of an expression.
 * <p>
 * {@code raw} is the surface form exactly as written; for identifiers it is also the
 * case-sensitive variable name. {@code operator} is set only for {@link TokenType#OPERATOR}
 * tokens and {@code value} is meaningful only for {@link TokenType#CONSTANT} tokens.
 * </p>
 *
 * @param type     lexical category
 * @param raw      surface form as written in the input
 * @param operator the connective of an operator token, {@code null} otherwise
 * @param value    the literal of a constant token
 * @param position 1-based start position in the trimmed input
 * @since 1.0.0
 */
public record Token(TokenType type, String raw, Operator operator, boolean value, int position) {

    public Token {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(raw, "raw is required");
    }

    public static Token leftParen(int position) {
        return new Token(TokenType.LEFT_PAREN, "(", null, false, position);
    }

    public static Token rightParen(int position) {
        return new Token(TokenType.RIGHT_PAREN, ")", null, false, position);
    }

    public static Token operator(Operator operator, String raw, int position) {
        return new Token(TokenType.OPERATOR, raw, operator, false, position);
    }

    public static Token constant(boolean value, String raw, int position) {
        return new Token(TokenType.CONSTANT, raw, null, value, position);
    }

    public static Token identifier(String name, int position) {
        return new Token(TokenType.IDENTIFIER, name, null, false, position);
    }

    /**
     * @return the variable name of an identifier token
     * @throws IllegalStateException if this token is not an identifier
     */
    public String name() {
        if (type != TokenType.IDENTIFIER) {
            throw new IllegalStateException("Token '" + raw + "' is not an identifier");
        }
        return raw;
    }

    @Override
    public String toString() {
        return switch (type) {
            case OPERATOR -> operator + "(" + raw + ")";
            case CONSTANT -> value ? "T" : "F";
            default -> raw;
        };
    }
}
