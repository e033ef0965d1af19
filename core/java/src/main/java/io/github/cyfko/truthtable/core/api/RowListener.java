package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.table.Row;

/**
 * Callback receiving truth-table rows as they are produced.
 * <p>
 * This is the seam toward the presentation layer: a renderer implements it to write each
 * row out without waiting for the whole table. Rows arrive in ascending index order on the
 * calling thread.
 * </p>
 *
 * <pre>{@code
 * TruthTableFactory.of().stream("p -> q", options, row -> writer.println(row.result()));
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RowListener {

    /**
     * @param row the next row
     */
    void onRow(Row row);

    /**
     * Called once after the last row.
     *
     * @param rowCount number of rows delivered
     */
    default void onComplete(int rowCount) {
    }
}
