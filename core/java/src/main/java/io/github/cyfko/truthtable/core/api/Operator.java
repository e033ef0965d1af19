package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.EvaluationException;

/**
 * Enumeration of the supported boolean connectives.
 * <p>
 * Each operator defines its arity, precedence, associativity and the label used when a
 * sub-expression is rendered. The enum is the process-wide operator registry: it is
 * initialized once and never mutated, so it can be shared freely across parses.
 * </p>
 *
 * <p><strong>Precedence table</strong> (higher binds tighter):</p>
 * <ul>
 *     <li>NOT / ! - arity 1, precedence 5, right</li>
 *     <li>AND / &amp; - arity 2, precedence 4, left</li>
 *     <li>XOR / ^ - arity 2, precedence 3, left</li>
 *     <li>OR / | - arity 2, precedence 2, left</li>
 *     <li>IMP / -&gt; - arity 2, precedence 1, right</li>
 *     <li>IFF / &lt;-&gt; - arity 2, precedence 0, left</li>
 * </ul>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * boolean value = Operator.IMP.apply(true, false); // false
 * if (Operator.NOT.isUnary()) {
 *     // handle single operand
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Operator {

    /** Negation: "!" */
    NOT("!", 1, 5, Associativity.RIGHT),

    /** Conjunction: "&amp;" */
    AND("&", 2, 4, Associativity.LEFT),

    /** Exclusive disjunction: "^" */
    XOR("^", 2, 3, Associativity.LEFT),

    /** Disjunction: "|" */
    OR("|", 2, 2, Associativity.LEFT),

    /** Material implication: "-&gt;" */
    IMP("->", 2, 1, Associativity.RIGHT),

    /** Biconditional: "&lt;-&gt;" */
    IFF("<->", 2, 0, Associativity.LEFT);

    /**
     * Grouping direction for operators of equal precedence.
     */
    public enum Associativity {
        LEFT,
        RIGHT
    }

    private final String label;
    private final int arity;
    private final int precedence;
    private final Associativity associativity;

    Operator(String label, int arity, int precedence, Associativity associativity) {
        this.label = label;
        this.arity = arity;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    /**
     * Returns the canonical symbol used when rendering sub-expressions, e.g. {@code "&"} or {@code "<->"}.
     *
     * @return the display label of the operator
     */
    public String getLabel() {
        return label;
    }

    public int getArity() {
        return arity;
    }

    public int getPrecedence() {
        return precedence;
    }

    public Associativity getAssociativity() {
        return associativity;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    /**
     * Applies the truth function of this operator.
     * <p>
     * Binary operators take {@code (left, right)} in that order.
     * </p>
     *
     * @param operands operand values, exactly {@link #getArity()} of them
     * @return the resulting truth value
     * @throws EvaluationException if the operand count does not match the arity
     */
    public boolean apply(boolean... operands) {
        if (operands == null || operands.length != arity) {
            throw new EvaluationException(
                    EvaluationException.Reason.UNSUPPORTED_ARITY,
                    String.format("Operator %s expects %d operand(s), got %d",
                            name(), arity, operands == null ? 0 : operands.length)
            );
        }

        return switch (this) {
            case NOT -> !operands[0];
            case AND -> operands[0] && operands[1];
            case XOR -> operands[0] != operands[1];
            case OR -> operands[0] || operands[1];
            case IMP -> !operands[0] || operands[1];
            case IFF -> operands[0] == operands[1];
        };
    }
}
