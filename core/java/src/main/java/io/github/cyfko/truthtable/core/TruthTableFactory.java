package io.github.cyfko.truthtable.core;

import io.github.cyfko.truthtable.core.api.ExpressionParser;
import io.github.cyfko.truthtable.core.api.ParsedExpression;
import io.github.cyfko.truthtable.core.api.RowListener;
import io.github.cyfko.truthtable.core.ast.Subexpression;
import io.github.cyfko.truthtable.core.config.ExpressionPolicy;
import io.github.cyfko.truthtable.core.config.TableOptions;
import io.github.cyfko.truthtable.core.exception.ExpressionException;
import io.github.cyfko.truthtable.core.impl.BasicExpressionParser;
import io.github.cyfko.truthtable.core.table.Row;
import io.github.cyfko.truthtable.core.table.RowEnumerator;
import io.github.cyfko.truthtable.core.table.TruthTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * High-level facade turning expression text into a truth table.
 * <p>
 * Orchestrates the whole pipeline for one submission:
 * </p>
 * <ol>
 *   <li><strong>Parse:</strong> text to tokens, postfix and tree through an {@link ExpressionParser}</li>
 *   <li><strong>Collect:</strong> distinct sub-expressions when step columns are requested</li>
 *   <li><strong>Enumerate:</strong> every assignment through {@link RowEnumerator}</li>
 * </ol>
 * <p>
 * Lexing, parsing and limit violations abort the request with an {@link ExpressionException}
 * whose message is meant for the end user. Evaluation failures never abort: they are
 * absorbed row by row (see {@link Row#diagnostic()}).
 * </p>
 *
 * <p><strong>Complete Usage Example:</strong></p>
 * <pre>{@code
 * TruthTableFactory factory = TruthTableFactory.of(ExpressionPolicy.strict());
 *
 * TableOptions options = TableOptions.builder()
 *     .showSteps(true)
 *     .showRowIndex(true)
 *     .build();
 *
 * try {
 *     TruthTable table = factory.generate("!(a & b)", options);
 *     table.columnHeaders(); // [#, a, b, (a & b), !(a & b), Result]
 * } catch (ExpressionException e) {
 *     showError(e.getMessage());
 * }
 * }</pre>
 *
 * <p>Instances hold no per-expression state and may be shared across threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTableFactory {

    private static final Logger log = Logger.getLogger(TruthTableFactory.class.getName());

    private final ExpressionParser parser;

    private TruthTableFactory(ExpressionParser parser) {
        this.parser = parser;
    }

    /**
     * @return a factory using a {@link BasicExpressionParser} with default limits
     */
    public static TruthTableFactory of() {
        return of(new BasicExpressionParser());
    }

    /**
     * @param policy the resource limits to enforce
     * @return a factory using a {@link BasicExpressionParser} with the given limits
     */
    public static TruthTableFactory of(ExpressionPolicy policy) {
        return of(new BasicExpressionParser(policy));
    }

    /**
     * @param parser the front end to use
     * @return a factory delegating parsing to {@code parser}
     */
    public static TruthTableFactory of(ExpressionParser parser) {
        return new TruthTableFactory(Objects.requireNonNull(parser, "parser cannot be null"));
    }

    /**
     * Parses an expression and computes its full truth table.
     *
     * @param expression the expression text
     * @param options    rendering and enumeration options
     * @return the table
     * @throws ExpressionException if the expression cannot be parsed or exceeds a limit
     */
    public TruthTable generate(String expression, TableOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        ParsedExpression parsed = parser.parse(expression);
        List<Subexpression> steps = options.showSteps() ? parsed.steps() : List.of();

        List<Row> rows = new ArrayList<>();
        run(parsed, steps, options, rows::add);

        return new TruthTable(parsed.expression(), parsed.variables(), steps, rows, options);
    }

    /**
     * Parses an expression and pushes its rows to {@code listener} as they are computed.
     *
     * @param expression the expression text
     * @param options    rendering and enumeration options
     * @param listener   receives each row, then the completion callback
     * @return the parsed expression, giving access to variables and steps for headers
     * @throws ExpressionException if the expression cannot be parsed or exceeds a limit
     */
    public ParsedExpression stream(String expression, TableOptions options, RowListener listener) {
        Objects.requireNonNull(options, "options cannot be null");
        Objects.requireNonNull(listener, "listener cannot be null");
        ParsedExpression parsed = parser.parse(expression);
        List<Subexpression> steps = options.showSteps() ? parsed.steps() : List.of();

        run(parsed, steps, options, listener);
        return parsed;
    }

    private void run(ParsedExpression parsed, List<Subexpression> steps, TableOptions options, RowListener listener) {
        log.fine(() -> String.format("Enumerating '%s': variables=%s, steps=%d, order=%s",
                parsed.expression(), parsed.variables(), steps.size(), options.rowOrder()));

        long start = System.nanoTime();
        RowEnumerator.enumerate(parsed.variables(), parsed.postfix(), parsed.tree(), steps, options.rowOrder(), listener);
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        log.info(() -> String.format("Truth table for '%s' generated: %d rows in %d ms",
                parsed.expression(), 1 << parsed.variables().size(), durationMs));
    }
}
