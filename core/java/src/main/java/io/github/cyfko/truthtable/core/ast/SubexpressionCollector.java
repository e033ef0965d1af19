package io.github.cyfko.truthtable.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Lists the distinct combinators of an expression in evaluation order.
 * <p>
 * Nodes are visited in post-order (operands before their combinator, left before right) and
 * leaves are skipped. De-duplication is textual: once a label has been seen, any later node
 * rendering to the same label is dropped, regardless of its identity. For
 * {@code (a & b) | (a & b)} the result is {@code [(a & b), ((a & b) | (a & b))]}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SubexpressionCollector {

    private SubexpressionCollector() {}

    /**
     * @param tree the parsed expression
     * @return the first occurrence of each distinct combinator label, in post-order
     */
    public static List<Subexpression> collect(ExpressionTree tree) {
        Objects.requireNonNull(tree, "tree cannot be null");

        List<Subexpression> steps = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        // arena order is post-order
        for (Node node : tree.nodes()) {
            if (node.isLeaf()) continue;
            String label = tree.label(node);
            if (seen.add(label)) {
                steps.add(new Subexpression(node, label));
            }
        }

        return Collections.unmodifiableList(steps);
    }
}
