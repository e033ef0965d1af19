package io.github.cyfko.truthtable.core.config;

import java.util.Objects;

/**
 * Rendering options supplied by the presentation layer.
 * <p>
 * Only {@link #showSteps()} and {@link #rowOrder()} influence enumeration; the other two are
 * carried through to {@link io.github.cyfko.truthtable.core.table.TruthTable} for rendering.
 * </p>
 *
 * <pre>{@code
 * TableOptions options = TableOptions.builder()
 *     .showSteps(true)
 *     .rowOrder(RowOrder.T_FIRST)
 *     .build();
 * }</pre>
 *
 * @param trueFalseLabels render cells as {@code T}/{@code F} instead of {@code 1}/{@code 0}
 * @param showRowIndex    prepend a 1-based row number column
 * @param showSteps       add one column per distinct sub-expression
 * @param rowOrder        which value fills the first half of each variable column
 * @since 1.0.0
 */
public record TableOptions(
    boolean trueFalseLabels,
    boolean showRowIndex,
    boolean showSteps,
    RowOrder rowOrder
) {

    public TableOptions {
        Objects.requireNonNull(rowOrder, "rowOrder is required");
    }

    /**
     * T/F labels, no row index, no step columns, {@link RowOrder#F_FIRST}.
     *
     * @return default options
     */
    public static TableOptions defaults() {
        return new TableOptions(true, false, false, RowOrder.F_FIRST);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean trueFalseLabels = true;
        private boolean showRowIndex = false;
        private boolean showSteps = false;
        private RowOrder rowOrder = RowOrder.F_FIRST;

        private Builder() {}

        public Builder trueFalseLabels(boolean trueFalseLabels) {
            this.trueFalseLabels = trueFalseLabels;
            return this;
        }

        public Builder showRowIndex(boolean showRowIndex) {
            this.showRowIndex = showRowIndex;
            return this;
        }

        public Builder showSteps(boolean showSteps) {
            this.showSteps = showSteps;
            return this;
        }

        public Builder rowOrder(RowOrder rowOrder) {
            this.rowOrder = Objects.requireNonNull(rowOrder, "rowOrder");
            return this;
        }

        public TableOptions build() { return new TableOptions(trueFalseLabels, showRowIndex, showSteps, rowOrder); }
    }
}
