package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.ast.ExpressionTree;
import io.github.cyfko.truthtable.core.ast.Subexpression;
import io.github.cyfko.truthtable.core.ast.SubexpressionCollector;
import io.github.cyfko.truthtable.core.parsing.Token;

import java.util.List;
import java.util.Objects;

/**
 * Output of the front end for one expression.
 *
 * @param expression the trimmed source text
 * @param tokens     infix tokens
 * @param postfix    the same tokens in postfix order, without parentheses
 * @param tree       the tree built from {@code postfix}
 * @param variables  distinct identifier names in sorted order; fixes column order and row bit positions
 * @since 1.0.0
 */
public record ParsedExpression(
    String expression,
    List<Token> tokens,
    List<Token> postfix,
    ExpressionTree tree,
    List<String> variables
) {

    public ParsedExpression {
        Objects.requireNonNull(expression, "expression is required");
        Objects.requireNonNull(postfix, "postfix is required");
        Objects.requireNonNull(tree, "tree is required");
        tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens is required"));
        variables = List.copyOf(Objects.requireNonNull(variables, "variables is required"));
    }

    /**
     * @return the distinct sub-expressions in evaluation order
     */
    public List<Subexpression> steps() {
        return SubexpressionCollector.collect(tree);
    }
}
