package io.github.cyfko.truthtable.core.evaluation;

import io.github.cyfko.truthtable.core.ast.ExpressionTree;
import io.github.cyfko.truthtable.core.ast.Node;
import io.github.cyfko.truthtable.core.exception.EvaluationException;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates tree nodes recursively, memoizing each node's value by id.
 * <p>
 * Used for step columns: evaluating every distinct sub-expression of a row through a single
 * shared cache computes each node at most once. A cache is valid for one assignment only and
 * must be discarded once the row is done.
 * </p>
 *
 * <pre>{@code
 * Map<Integer, Boolean> cache = NodeEvaluator.newCache();
 * for (Subexpression step : steps) {
 *     values.add(NodeEvaluator.evaluate(tree, step.node(), assignment, cache));
 * }
 * }</pre>
 *
 * @since 1.0.0
 * @see PostfixEvaluator
 */
public final class NodeEvaluator {

    private NodeEvaluator() {}

    /**
     * @return an empty cache for one row
     */
    public static Map<Integer, Boolean> newCache() {
        return new HashMap<>();
    }

    /**
     * @param tree       the tree owning {@code node}
     * @param node       the sub-expression to evaluate
     * @param assignment value of every variable below {@code node}
     * @param cache      values already computed for this assignment, keyed by node id; updated in place
     * @return the truth value of the sub-expression
     * @throws EvaluationException on an unbound variable
     */
    public static boolean evaluate(ExpressionTree tree, Node node, Map<String, Boolean> assignment,
                                   Map<Integer, Boolean> cache) {
        Objects.requireNonNull(tree, "tree cannot be null");
        Objects.requireNonNull(assignment, "assignment cannot be null");
        Objects.requireNonNull(cache, "cache cannot be null");

        Boolean cached = cache.get(node.id());
        if (cached != null) return cached;

        boolean value = switch (node.kind()) {
            case VARIABLE -> {
                Boolean bound = assignment.get(node.name());
                if (bound == null) {
                    throw EvaluationException.unboundVariable(node.name());
                }
                yield bound;
            }
            case CONSTANT -> node.value();
            case UNARY -> node.operator().apply(
                    evaluate(tree, tree.node(node.left()), assignment, cache));
            case BINARY -> node.operator().apply(
                    evaluate(tree, tree.node(node.left()), assignment, cache),
                    evaluate(tree, tree.node(node.right()), assignment, cache));
        };

        cache.put(node.id(), value);
        return value;
    }

    /**
     * Evaluates the whole tree with a fresh cache.
     *
     * @param tree       the parsed expression
     * @param assignment value of every variable of the expression
     * @return the truth value of the root
     */
    public static boolean evaluate(ExpressionTree tree, Map<String, Boolean> assignment) {
        return evaluate(tree, tree.root(), assignment, newCache());
    }
}
