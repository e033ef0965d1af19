package io.github.cyfko.truthtable.core.ast;

/**
 * A distinct combinator of an expression, shown as its own step column.
 *
 * @param node  the first node rendering to {@code label}
 * @param label canonical rendering, also used as the column header
 */
public record Subexpression(Node node, String label) {
}
