package io.github.cyfko.truthtable.core.evaluation;

import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.exception.EvaluationException;
import io.github.cyfko.truthtable.core.parsing.Token;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates a postfix token sequence directly with a stack machine.
 * <p>
 * This is the fast path used for the result column: no tree and no cache are involved.
 * Operands push their value; an operator pops its arity (right operand first, then left)
 * and pushes the result. Exactly one value must remain at the end.
 * </p>
 *
 * <pre>{@code
 * List<Token> postfix = PostfixConverter.toPostfix(Lexer.tokenize("p -> q"));
 * PostfixEvaluator.evaluate(postfix, Map.of("p", true, "q", false)); // false
 * }</pre>
 *
 * @since 1.0.0
 * @see NodeEvaluator
 */
public final class PostfixEvaluator {

    private PostfixEvaluator() {}

    /**
     * @param postfix    postfix token list
     * @param assignment value of every variable referenced by {@code postfix}
     * @return the truth value of the expression
     * @throws EvaluationException on an unbound variable or a malformed sequence
     */
    public static boolean evaluate(List<Token> postfix, Map<String, Boolean> assignment) {
        Objects.requireNonNull(postfix, "postfix cannot be null");
        Objects.requireNonNull(assignment, "assignment cannot be null");

        boolean[] stack = new boolean[postfix.size()];
        int size = 0;

        for (Token token : postfix) {
            switch (token.type()) {
                case IDENTIFIER -> {
                    Boolean value = assignment.get(token.name());
                    if (value == null) {
                        throw EvaluationException.unboundVariable(token.name());
                    }
                    stack[size++] = value;
                }

                case CONSTANT -> stack[size++] = token.value();

                case OPERATOR -> {
                    Operator op = token.operator();
                    if (op == null) {
                        throw new EvaluationException(EvaluationException.Reason.MALFORMED_EXPRESSION,
                                "Unknown operator '" + token.raw() + "'");
                    }
                    if (op.isUnary()) {
                        if (size < 1) {
                            throw new EvaluationException(EvaluationException.Reason.MALFORMED_EXPRESSION,
                                    "Invalid expression: missing operand for unary operator '" + token.raw() + "'");
                        }
                        stack[size - 1] = op.apply(stack[size - 1]);
                    } else {
                        if (size < 2) {
                            throw new EvaluationException(EvaluationException.Reason.MALFORMED_EXPRESSION,
                                    "Invalid expression: missing operands for binary operator '" + token.raw() + "'");
                        }
                        boolean right = stack[--size];
                        boolean left = stack[size - 1];
                        stack[size - 1] = op.apply(left, right);
                    }
                }

                default -> throw new EvaluationException(EvaluationException.Reason.MALFORMED_EXPRESSION,
                        "Unexpected token '" + token.raw() + "' in evaluation");
            }
        }

        if (size != 1) {
            throw new EvaluationException(EvaluationException.Reason.MALFORMED_EXPRESSION,
                    "Invalid expression: leftover values after evaluation");
        }
        return stack[0];
    }
}
