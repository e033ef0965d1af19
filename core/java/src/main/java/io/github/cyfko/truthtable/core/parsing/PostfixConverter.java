package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Converts an infix token sequence into postfix (RPN) order with the Shunting-Yard algorithm.
 * <p>
 * Precedence and associativity come from {@link Operator}. Operands go straight to the output;
 * an incoming operator first pops every stacked operator that binds tighter, or equally tight
 * when the incoming operator is left-associative. NOT needs no special case: it is the only
 * unary connective, binds tightest and is right-associative, so it always attaches to the
 * operand that follows it.
 * </p>
 *
 * <p>
 * Only parenthesis balance and the prefix position of NOT are checked here. Operand counts are
 * validated when the postfix sequence is turned into a tree.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> postfix = PostfixConverter.toPostfix(Lexer.tokenize("!(a & b) | c"));
 * // a b & ! c |
 * }</pre>
 *
 * <p><strong>Performance:</strong> O(n) time, single pass, O(n) space for the output and stack.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PostfixConverter {

    private PostfixConverter() {}

    /**
     * @param tokens infix tokens as produced by {@link Lexer#tokenize(String)}
     * @return an unmodifiable postfix token list, free of parentheses
     * @throws ExpressionSyntaxException on mismatched parentheses, an operator token with no connective,
     *                                   or a NOT placed after an operand
     */
    public static List<Token> toPostfix(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens cannot be null");

        List<Token> output = new ArrayList<>(tokens.size());
        Deque<Token> operators = new ArrayDeque<>();
        Token previous = null;

        for (Token token : tokens) {
            switch (token.type()) {
                case IDENTIFIER, CONSTANT -> output.add(token);

                case OPERATOR -> {
                    Operator op = token.operator();
                    if (op == null) {
                        throw new ExpressionSyntaxException("Unknown operator '" + token.raw() + "'");
                    }
                    if (op.isUnary() && endsOperand(previous)) {
                        throw new ExpressionSyntaxException(
                            "Invalid expression: operator '" + token.raw() + "' must precede its operand");
                    }
                    while (!operators.isEmpty() && shouldPop(operators.peek(), op)) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
                }

                case LEFT_PAREN -> operators.push(token);

                case RIGHT_PAREN -> {
                    while (!operators.isEmpty() && operators.peek().type() != TokenType.LEFT_PAREN) {
                        output.add(operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw new ExpressionSyntaxException("Mismatched parentheses: unmatched ')'");
                    }
                    operators.pop();
                }
            }
            previous = token;
        }

        while (!operators.isEmpty()) {
            Token top = operators.pop();
            if (top.type().isParenthesis()) {
                throw new ExpressionSyntaxException("Mismatched parentheses: unmatched '('");
            }
            output.add(top);
        }

        return Collections.unmodifiableList(output);
    }

    private static boolean endsOperand(Token token) {
        return token != null && (token.type().isOperand() || token.type() == TokenType.RIGHT_PAREN);
    }

    private static boolean shouldPop(Token stacked, Operator incoming) {
        if (stacked.type() != TokenType.OPERATOR) return false;
        int top = stacked.operator().getPrecedence();
        return top > incoming.getPrecedence()
                || (top == incoming.getPrecedence() && incoming.getAssociativity() == Operator.Associativity.LEFT);
    }
}
