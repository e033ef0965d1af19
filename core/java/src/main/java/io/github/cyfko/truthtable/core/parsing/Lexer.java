package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.exception.LexicalException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits mixed-notation boolean expressions into {@link Token}s.
 * <p>
 * The input is trimmed and scanned left to right. At each position, in priority order:
 * </p>
 * <ol>
 *   <li>whitespace is skipped</li>
 *   <li>{@code (} and {@code )} become parenthesis tokens</li>
 *   <li>the first symbolic lexeme of the {@link Lexicon} that matches becomes an operator token</li>
 *   <li>a letter or underscore starts a word: the maximal run of letters, digits and underscores
 *       is read and classified as constant, operator word, or identifier, in that order</li>
 *   <li>a digit starts a digit run, accepted only as {@code 0} or {@code 1}</li>
 *   <li>anything else is a {@link LexicalException}</li>
 * </ol>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = Lexer.tokenize("p implies (q ∧ ¬r)");
 * // [IDENTIFIER p, OPERATOR IMP, LEFT_PAREN, IDENTIFIER q, OPERATOR AND, OPERATOR NOT, IDENTIFIER r, RIGHT_PAREN]
 * }</pre>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Lexer {

    private Lexer() {}

    /**
     * Tokenizes an expression.
     *
     * @param input the raw expression text
     * @return an unmodifiable token list, empty for blank input
     * @throws LexicalException on an unexpected character or a numeric literal other than 0 or 1
     * @throws NullPointerException if {@code input} is null
     */
    public static List<Token> tokenize(String input) {
        Objects.requireNonNull(input, "input cannot be null");

        String s = input.strip();
        List<Token> tokens = new ArrayList<>();
        int i = 0;

        while (i < s.length()) {
            char c = s.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (c == '(') {
                tokens.add(Token.leftParen(i + 1));
                i++;
                continue;
            }
            if (c == ')') {
                tokens.add(Token.rightParen(i + 1));
                i++;
                continue;
            }

            Optional<Lexicon.Lexeme> symbol = Lexicon.matchSymbol(s, i);
            if (symbol.isPresent()) {
                Lexicon.Lexeme lexeme = symbol.get();
                tokens.add(Token.operator(lexeme.operator(), lexeme.form(), i + 1));
                i += lexeme.form().length();
                continue;
            }

            if (isIdentifierStart(c)) {
                int j = i + 1;
                while (j < s.length() && isIdentifierPart(s.charAt(j))) j++;
                tokens.add(classifyWord(s.substring(i, j), i + 1));
                i = j;
                continue;
            }

            if (isDigit(c)) {
                int j = i + 1;
                while (j < s.length() && isDigit(s.charAt(j))) j++;
                String digits = s.substring(i, j);
                if (!digits.equals("0") && !digits.equals("1")) {
                    throw new LexicalException(String.format(
                            "Unexpected number '%s'. Only 0 or 1 are allowed as constants.", digits
                    ), i + 1);
                }
                tokens.add(Token.constant(digits.equals("1"), digits, i + 1));
                i = j;
                continue;
            }

            throw new LexicalException(String.format("Unexpected character '%c' at position %d", c, i + 1), i + 1);
        }

        return Collections.unmodifiableList(tokens);
    }

    private static Token classifyWord(String word, int position) {
        Optional<Boolean> constant = Lexicon.constant(word);
        if (constant.isPresent()) {
            return Token.constant(constant.get(), word, position);
        }

        Optional<Operator> operator = Lexicon.wordOperator(word);
        if (operator.isPresent()) {
            return Token.operator(operator.get(), word, position);
        }

        return Token.identifier(word, position);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
