package io.github.cyfko.truthtable.core.utils;

import io.github.cyfko.truthtable.core.parsing.Token;
import io.github.cyfko.truthtable.core.parsing.TokenType;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Helpers for the free variables of an expression.
 *
 * @since 1.0.0
 */
public final class VariableUtils {

    private static final Collator COLLATOR = Collator.getInstance(Locale.ROOT);

    /**
     * Ascending lexical order of variable names under root-locale collation, with natural order
     * breaking ties. Lowercase sorts before uppercase and {@code _} before digits, so
     * {@code [b, A, a]} sorts as {@code [a, A, b]} and {@code [x1, x_a]} as {@code [x_a, x1]}.
     */
    public static final Comparator<String> VARIABLE_ORDER =
            ((Comparator<String>) COLLATOR::compare).thenComparing(Comparator.naturalOrder());

    private VariableUtils() {}

    /**
     * Collects the distinct identifier names of a token sequence.
     *
     * @param tokens tokens in any order
     * @return unmodifiable list of names sorted with {@link #VARIABLE_ORDER}
     */
    public static List<String> collectVariables(Collection<Token> tokens) {
        Set<String> names = new HashSet<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.IDENTIFIER) {
                names.add(token.name());
            }
        }

        List<String> sorted = new ArrayList<>(names);
        sorted.sort(VARIABLE_ORDER);
        return List.copyOf(sorted);
    }
}
