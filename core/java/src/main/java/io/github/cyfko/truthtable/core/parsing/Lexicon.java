package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Operator;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Surface forms recognized by the {@link Lexer}.
 * <p>
 * Symbolic forms are matched against the raw input in list order, so longer literals come
 * before any shorter literal sharing their prefix ({@code <=>} is never read as
 * {@code <}, {@code =}, {@code >}). Word forms and constants are matched only against a whole
 * identifier, after lowercasing.
 * </p>
 *
 * <table>
 *   <caption>Operator lexemes</caption>
 *   <tr><th>Operator</th><th>ASCII</th><th>Unicode</th><th>Word</th></tr>
 *   <tr><td>IFF</td><td>{@code <=>} {@code <->}</td><td>↔</td><td>iff</td></tr>
 *   <tr><td>IMP</td><td>{@code ->} {@code =>}</td><td>→</td><td>implies</td></tr>
 *   <tr><td>XOR</td><td>{@code ^}</td><td>⊕</td><td>xor</td></tr>
 *   <tr><td>AND</td><td>{@code &}</td><td>∧</td><td>and</td></tr>
 *   <tr><td>OR</td><td>{@code |}</td><td>∨</td><td>or</td></tr>
 *   <tr><td>NOT</td><td>{@code !} {@code ~}</td><td>¬</td><td>not</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class Lexicon {

    /**
     * A surface form and the operator it denotes.
     *
     * @param form     the literal text
     * @param operator the denoted connective
     */
    public record Lexeme(String form, Operator operator) {}

    private static final List<Lexeme> SYMBOLS = List.of(
            new Lexeme("<=>", Operator.IFF),
            new Lexeme("<->", Operator.IFF),
            new Lexeme("↔", Operator.IFF),
            new Lexeme("->", Operator.IMP),
            new Lexeme("=>", Operator.IMP),
            new Lexeme("→", Operator.IMP),
            new Lexeme("⊕", Operator.XOR),
            new Lexeme("^", Operator.XOR),
            new Lexeme("∧", Operator.AND),
            new Lexeme("&", Operator.AND),
            new Lexeme("∨", Operator.OR),
            new Lexeme("|", Operator.OR),
            new Lexeme("¬", Operator.NOT),
            new Lexeme("~", Operator.NOT),
            new Lexeme("!", Operator.NOT)
    );

    private static final Map<String, Operator> WORDS = Map.of(
            "iff", Operator.IFF,
            "implies", Operator.IMP,
            "xor", Operator.XOR,
            "and", Operator.AND,
            "or", Operator.OR,
            "not", Operator.NOT
    );

    private static final Map<String, Boolean> CONSTANTS = Map.of(
            "true", Boolean.TRUE,
            "t", Boolean.TRUE,
            "1", Boolean.TRUE,
            "false", Boolean.FALSE,
            "f", Boolean.FALSE,
            "0", Boolean.FALSE
    );

    private Lexicon() {}

    /**
     * Finds the first symbolic lexeme that occurs in {@code input} at {@code offset}.
     *
     * @param input  the expression text
     * @param offset 0-based start offset
     * @return the matching lexeme, or empty if none starts there
     */
    public static Optional<Lexeme> matchSymbol(String input, int offset) {
        for (Lexeme lexeme : SYMBOLS) {
            if (input.startsWith(lexeme.form(), offset)) {
                return Optional.of(lexeme);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up a word-form operator, case-insensitively.
     *
     * @param word a whole identifier
     * @return the operator, or empty if the word is not reserved as one
     */
    public static Optional<Operator> wordOperator(String word) {
        return Optional.ofNullable(WORDS.get(word.toLowerCase(Locale.ROOT)));
    }

    /**
     * Looks up a constant literal, case-insensitively.
     *
     * @param word a whole identifier or digit run
     * @return the literal value, or empty if the word is not a constant
     */
    public static Optional<Boolean> constant(String word) {
        return Optional.ofNullable(CONSTANTS.get(word.toLowerCase(Locale.ROOT)));
    }
}
