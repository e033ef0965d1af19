package io.github.cyfko.truthtable.core.ast;

import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;
import io.github.cyfko.truthtable.core.parsing.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Builds an {@link ExpressionTree} from a postfix token sequence in a single pass.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * For each token in postfix expression:
 *   - If IDENTIFIER: push a new variable node
 *   - If CONSTANT: push a new constant node
 *   - If unary operator: pop operand, push new unary node
 *   - If binary operator: pop right, pop left, push new binary node (left, right)
 *
 * Stack should contain exactly ONE node at the end.
 * </pre>
 *
 * <h2>Error Detection</h2>
 * <ul>
 *   <li>Stack underflow (operator without enough operands)</li>
 *   <li>Several nodes left on the stack at the end (missing operator)</li>
 *   <li>Empty postfix sequence</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> postfix = PostfixConverter.toPostfix(Lexer.tokenize("(a & b) | c"));
 * ExpressionTree tree = PostfixTreeBuilder.build(postfix);
 * tree.label(); // "((a & b) | c)"
 * }</pre>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.truthtable.core.parsing.PostfixConverter
 */
public final class PostfixTreeBuilder {

    private PostfixTreeBuilder() {
        // Utility class - prevent instantiation
    }

    /**
     * @param postfix postfix token list
     * @return the tree, whose root is the whole expression
     * @throws ExpressionSyntaxException if an operator lacks operands or the sequence does not reduce to one node
     */
    public static ExpressionTree build(List<Token> postfix) {
        Objects.requireNonNull(postfix, "postfix cannot be null");

        if (postfix.isEmpty()) {
            throw new ExpressionSyntaxException("Cannot build expression tree from empty postfix expression");
        }

        List<Node> arena = new ArrayList<>(postfix.size());
        Deque<Node> stack = new ArrayDeque<>();

        for (Token token : postfix) {
            switch (token.type()) {
                case IDENTIFIER -> stack.push(add(arena, Node.variable(arena.size(), token.name())));

                case CONSTANT -> stack.push(add(arena, Node.constant(arena.size(), token.value())));

                case OPERATOR -> {
                    Operator op = token.operator();
                    if (op == null) {
                        throw new ExpressionSyntaxException("Unknown operator '" + token.raw() + "'");
                    }
                    if (op.isUnary()) {
                        if (stack.isEmpty()) {
                            throw new ExpressionSyntaxException(
                                "Invalid expression: missing operand for unary operator '" + token.raw() + "'");
                        }
                        Node operand = stack.pop();
                        stack.push(add(arena, Node.unary(arena.size(), op, operand.id())));
                    } else {
                        if (stack.size() < 2) {
                            throw new ExpressionSyntaxException(
                                "Invalid expression: missing operands for binary operator '" + token.raw() + "'");
                        }
                        Node right = stack.pop();
                        Node left = stack.pop();
                        stack.push(add(arena, Node.binary(arena.size(), op, left.id(), right.id())));
                    }
                }

                default -> throw new ExpressionSyntaxException(
                    "Unexpected token '" + token.raw() + "' in postfix expression");
            }
        }

        if (stack.size() != 1) {
            throw new ExpressionSyntaxException(String.format(
                "Invalid expression: %d values left after parsing (expected 1). " +
                "An operator may be missing between operands.",
                stack.size()
            ));
        }

        return new ExpressionTree(arena);
    }

    private static Node add(List<Node> arena, Node node) {
        arena.add(node);
        return node;
    }
}
