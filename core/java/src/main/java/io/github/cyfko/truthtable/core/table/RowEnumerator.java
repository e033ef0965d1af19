package io.github.cyfko.truthtable.core.table;

import io.github.cyfko.truthtable.core.api.RowListener;
import io.github.cyfko.truthtable.core.ast.ExpressionTree;
import io.github.cyfko.truthtable.core.ast.PostfixTreeBuilder;
import io.github.cyfko.truthtable.core.ast.Subexpression;
import io.github.cyfko.truthtable.core.ast.SubexpressionCollector;
import io.github.cyfko.truthtable.core.config.ExpressionPolicy;
import io.github.cyfko.truthtable.core.config.RowOrder;
import io.github.cyfko.truthtable.core.config.TableOptions;
import io.github.cyfko.truthtable.core.evaluation.NodeEvaluator;
import io.github.cyfko.truthtable.core.evaluation.PostfixEvaluator;
import io.github.cyfko.truthtable.core.exception.EvaluationException;
import io.github.cyfko.truthtable.core.parsing.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Evaluates an expression over every assignment of its variables.
 *
 * <h2>Row encoding</h2>
 * <p>
 * For {@code n} variables there are {@code 2^n} rows. In row {@code i}, the variable at sorted
 * position {@code j} (leftmost is most significant) takes bit {@code (i >> (n - j - 1)) & 1},
 * mapped to a truth value by the {@link RowOrder}.
 * </p>
 *
 * <h2>Evaluation</h2>
 * <ul>
 *   <li>The result column uses {@link PostfixEvaluator}.</li>
 *   <li>Step columns use {@link NodeEvaluator}, with one cache shared by all steps of a row
 *       and discarded afterwards.</li>
 *   <li>An {@link EvaluationException} in a row is absorbed: the affected value becomes
 *       {@code false}, the message goes to {@link Row#diagnostic()}, and the remaining rows
 *       are still produced.</li>
 * </ul>
 *
 * <p>
 * The enumerator itself accepts up to {@link ExpressionPolicy#VARIABLE_CEILING} variables;
 * callers are expected to apply the tighter {@link ExpressionPolicy#maxVariables()} first.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RowEnumerator {

    private static final Logger log = Logger.getLogger(RowEnumerator.class.getName());

    private RowEnumerator() {}

    /**
     * Enumerates all rows into a list.
     *
     * @param variables sorted variable names
     * @param postfix   postfix token list
     * @param tree      tree of {@code postfix}, or {@code null} to build it on demand when steps are requested
     * @param options   uses {@link TableOptions#showSteps()} and {@link TableOptions#rowOrder()}
     * @return the {@code 2^n} rows in index order
     */
    public static List<Row> enumerate(List<String> variables, List<Token> postfix, ExpressionTree tree,
                                      TableOptions options) {
        List<Row> rows = new ArrayList<>(rowCount(variables));
        enumerate(variables, postfix, tree, options, rows::add);
        return Collections.unmodifiableList(rows);
    }

    /**
     * Enumerates all rows, handing each one to {@code listener} as soon as it is computed.
     *
     * @param variables sorted variable names
     * @param postfix   postfix token list
     * @param tree      tree of {@code postfix}, or {@code null} to build it on demand when steps are requested
     * @param options   uses {@link TableOptions#showSteps()} and {@link TableOptions#rowOrder()}
     * @param listener  receives every row, then {@link RowListener#onComplete(int)}
     */
    public static void enumerate(List<String> variables, List<Token> postfix, ExpressionTree tree,
                                 TableOptions options, RowListener listener) {
        Objects.requireNonNull(options, "options cannot be null");

        List<Subexpression> steps = List.of();
        if (options.showSteps()) {
            if (tree == null) tree = PostfixTreeBuilder.build(postfix);
            steps = SubexpressionCollector.collect(tree);
        }
        enumerate(variables, postfix, tree, steps, options.rowOrder(), listener);
    }

    /**
     * Enumerates all rows with an explicit list of step columns.
     *
     * @param variables sorted variable names
     * @param postfix   postfix token list
     * @param tree      tree owning the step nodes; may be {@code null} only when {@code steps} is empty
     * @param steps     sub-expressions to evaluate in each row
     * @param order     row ordering mode
     * @param listener  receives every row, then {@link RowListener#onComplete(int)}
     */
    public static void enumerate(List<String> variables, List<Token> postfix, ExpressionTree tree,
                                 List<Subexpression> steps, RowOrder order, RowListener listener) {
        Objects.requireNonNull(variables, "variables cannot be null");
        Objects.requireNonNull(postfix, "postfix cannot be null");
        Objects.requireNonNull(steps, "steps cannot be null");
        Objects.requireNonNull(order, "order cannot be null");
        Objects.requireNonNull(listener, "listener cannot be null");
        if (!steps.isEmpty() && tree == null) {
            throw new IllegalArgumentException("A tree is required to evaluate step columns");
        }

        int rowCount = rowCount(variables);
        for (int i = 0; i < rowCount; i++) {
            listener.onRow(evaluateRow(i, variables, postfix, tree, steps, order));
        }
        listener.onComplete(rowCount);
    }

    /**
     * Computes the assignment of one row.
     *
     * @param variables sorted variable names
     * @param index     0-based row index
     * @param order     row ordering mode
     * @return an unmodifiable assignment iterating in {@code variables} order
     */
    public static Map<String, Boolean> assignmentFor(List<String> variables, int index, RowOrder order) {
        int n = variables.size();
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (int j = 0; j < n; j++) {
            int bit = (index >> (n - j - 1)) & 1;
            assignment.put(variables.get(j), order.valueOf(bit));
        }
        return Collections.unmodifiableMap(assignment);
    }

    /**
     * @param variables sorted variable names
     * @return {@code 2^n}
     * @throws IllegalArgumentException above {@link ExpressionPolicy#VARIABLE_CEILING} variables
     */
    public static int rowCount(List<String> variables) {
        if (variables.size() > ExpressionPolicy.VARIABLE_CEILING) {
            throw new IllegalArgumentException(String.format(
                    "Cannot enumerate %d variables (max: %d)", variables.size(), ExpressionPolicy.VARIABLE_CEILING));
        }
        return 1 << variables.size();
    }

    private static Row evaluateRow(int index, List<String> variables, List<Token> postfix, ExpressionTree tree,
                                   List<Subexpression> steps, RowOrder order) {
        Map<String, Boolean> assignment = assignmentFor(variables, index, order);
        String error = null;

        boolean result;
        try {
            result = PostfixEvaluator.evaluate(postfix, assignment);
        } catch (EvaluationException e) {
            log.fine(() -> String.format("Row %d evaluated as false: %s", index + 1, e.getMessage()));
            result = false;
            error = e.getMessage();
        }

        List<Boolean> stepValues = new ArrayList<>(steps.size());
        Map<Integer, Boolean> cache = NodeEvaluator.newCache();
        for (Subexpression step : steps) {
            boolean value;
            try {
                value = NodeEvaluator.evaluate(tree, step.node(), assignment, cache);
            } catch (EvaluationException e) {
                log.fine(() -> String.format("Row %d, step %s evaluated as false: %s",
                        index + 1, step.label(), e.getMessage()));
                value = false;
                if (error == null) error = e.getMessage();
            }
            stepValues.add(value);
        }

        return new Row(index, assignment, stepValues, result, error);
    }
}
