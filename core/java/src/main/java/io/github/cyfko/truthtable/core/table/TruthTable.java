package io.github.cyfko.truthtable.core.table;

import io.github.cyfko.truthtable.core.ast.Subexpression;
import io.github.cyfko.truthtable.core.config.TableOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A complete truth table, ready for rendering.
 * <p>
 * Columns are, in order: the optional 1-based row number ({@code #}), one column per
 * variable in sorted order, one column per step when steps are shown, and {@code Result}.
 * </p>
 *
 * <pre>{@code
 * TruthTable table = TruthTableFactory.of().generate("p -> q", TableOptions.defaults());
 * table.columnHeaders();            // [p, q, Result]
 * table.cells(table.rows().get(2)); // [T, F, F]
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TruthTable {

    public static final String ROW_INDEX_HEADER = "#";
    public static final String RESULT_HEADER = "Result";

    private final String expression;
    private final List<String> variables;
    private final List<Subexpression> steps;
    private final List<Row> rows;
    private final TableOptions options;

    public TruthTable(String expression, List<String> variables, List<Subexpression> steps, List<Row> rows,
                      TableOptions options) {
        this.expression = Objects.requireNonNull(expression, "expression is required");
        this.variables = List.copyOf(variables);
        this.steps = List.copyOf(steps);
        this.rows = List.copyOf(rows);
        this.options = Objects.requireNonNull(options, "options is required");
    }

    public String getExpression() {
        return expression;
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<Subexpression> getSteps() {
        return steps;
    }

    public List<String> getStepLabels() {
        return steps.stream().map(Subexpression::label).toList();
    }

    public List<Row> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public TableOptions getOptions() {
        return options;
    }

    /**
     * @return {@code true} if at least one row had its evaluation coerced to {@code false}
     */
    public boolean hasFailures() {
        return rows.stream().anyMatch(Row::failed);
    }

    public List<String> columnHeaders() {
        List<String> headers = new ArrayList<>(variables.size() + steps.size() + 2);
        if (options.showRowIndex()) headers.add(ROW_INDEX_HEADER);
        headers.addAll(variables);
        headers.addAll(getStepLabels());
        headers.add(RESULT_HEADER);
        return headers;
    }

    /**
     * Renders one row as cell strings aligned with {@link #columnHeaders()}.
     *
     * @param row a row of this table
     * @return the formatted cells
     */
    public List<String> cells(Row row) {
        List<String> cells = new ArrayList<>(variables.size() + row.stepValues().size() + 2);
        if (options.showRowIndex()) cells.add(String.valueOf(row.displayIndex()));
        for (String variable : variables) {
            cells.add(format(row.valueOf(variable)));
        }
        for (Boolean value : row.stepValues()) {
            cells.add(format(value));
        }
        cells.add(format(row.result()));
        return cells;
    }

    /**
     * @param value a truth value
     * @return {@code T}/{@code F} or {@code 1}/{@code 0} depending on {@link TableOptions#trueFalseLabels()}
     */
    public String format(boolean value) {
        if (options.trueFalseLabels()) {
            return value ? "T" : "F";
        }
        return value ? "1" : "0";
    }
}
