package io.github.cyfko.truthtable.core.config;

/**
 * Controls which truth value fills the first half of each variable column.
 * <p>
 * Both modes produce the same rows with the same bit extraction; they only invert which
 * bit value maps to {@code true}.
 * </p>
 */
public enum RowOrder {

    /** Bit {@code 0} maps to {@code false}: the first row assigns {@code false} everywhere. */
    F_FIRST,

    /** Bit {@code 0} maps to {@code true}: the first row assigns {@code true} everywhere. */
    T_FIRST;

    /**
     * Maps an extracted row bit to the value assigned to the variable.
     *
     * @param bit the bit extracted from the row index, {@code 0} or {@code 1}
     * @return the assigned truth value
     */
    public boolean valueOf(int bit) {
        return this == F_FIRST ? bit == 1 : bit == 0;
    }
}
