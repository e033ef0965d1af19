package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.ExpressionParser;
import io.github.cyfko.truthtable.core.api.ParsedExpression;
import io.github.cyfko.truthtable.core.ast.ExpressionTree;
import io.github.cyfko.truthtable.core.ast.PostfixTreeBuilder;
import io.github.cyfko.truthtable.core.config.ExpressionPolicy;
import io.github.cyfko.truthtable.core.exception.ComplexityLimitException;
import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;
import io.github.cyfko.truthtable.core.parsing.Lexer;
import io.github.cyfko.truthtable.core.parsing.PostfixConverter;
import io.github.cyfko.truthtable.core.parsing.Token;
import io.github.cyfko.truthtable.core.utils.VariableUtils;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link ExpressionParser}, applying the limits of an {@link ExpressionPolicy}.
 *
 * <h2>Phases</h2>
 * <ol>
 *   <li>Reject blank input and input longer than {@link ExpressionPolicy#maxExpressionLength()}</li>
 *   <li>{@link Lexer}: text to tokens</li>
 *   <li>{@link VariableUtils}: collect and sort the free variables, then enforce
 *       {@link ExpressionPolicy#maxVariables()}</li>
 *   <li>{@link PostfixConverter}: Shunting-Yard to postfix, checking parentheses</li>
 *   <li>{@link PostfixTreeBuilder}: postfix to tree, checking operand counts</li>
 * </ol>
 * <p>
 * The tree is always built, so an expression such as {@code a &} is rejected here rather than
 * silently producing a column of {@code false}.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default configuration (12 variables max)
 * ExpressionParser parser = new BasicExpressionParser();
 * ParsedExpression parsed = parser.parse("p xor q");
 *
 * // Strict configuration (for public endpoints)
 * ExpressionParser strictParser = new BasicExpressionParser(ExpressionPolicy.strict());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicExpressionParser implements ExpressionParser {

    private static final Logger log = Logger.getLogger(BasicExpressionParser.class.getName());

    private final ExpressionPolicy policy;

    /**
     * Default constructor using {@link ExpressionPolicy#defaults()}.
     */
    public BasicExpressionParser() {
        this(ExpressionPolicy.defaults());
    }

    /**
     * @param policy the resource limits to enforce
     * @throws NullPointerException if policy is null
     */
    public BasicExpressionParser(ExpressionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    public ExpressionPolicy getPolicy() {
        return policy;
    }

    @Override
    public ParsedExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionSyntaxException("Please enter an expression.");
        }

        String trimmed = expression.strip();
        if (trimmed.length() > policy.maxExpressionLength()) {
            throw new ComplexityLimitException(String.format(
                "Expression too long (%d characters, max: %d). Policy applied: %s",
                trimmed.length(), policy.maxExpressionLength(), policy.policyName()
            ));
        }

        List<Token> tokens = Lexer.tokenize(trimmed);

        List<String> variables = VariableUtils.collectVariables(tokens);
        if (variables.size() > policy.maxVariables()) {
            throw new ComplexityLimitException(String.format(
                "Too many variables (%d). This would create %d rows. Limit is %d variables.",
                variables.size(), BigInteger.ONE.shiftLeft(variables.size()), policy.maxVariables()
            ));
        }

        List<Token> postfix = PostfixConverter.toPostfix(tokens);
        ExpressionTree tree = PostfixTreeBuilder.build(postfix);

        log.fine(() -> String.format("Parsed '%s': %d tokens, %d variables, tree %s",
                trimmed, tokens.size(), variables.size(), tree.label()));

        return new ParsedExpression(trimmed, tokens, postfix, tree, variables);
    }
}
