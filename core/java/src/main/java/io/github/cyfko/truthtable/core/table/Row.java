package io.github.cyfko.truthtable.core.table;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One line of a truth table.
 *
 * @param index      0-based row index; its bits encode the assignment
 * @param assignment variable values, iterated in sorted variable order
 * @param stepValues value of each distinct sub-expression in step order, empty when steps are off
 * @param result     value of the whole expression, {@code false} when evaluation failed
 * @param error      message of the evaluation failure coerced to {@code false}, {@code null} if none
 * @since 1.0.0
 */
public record Row(int index, Map<String, Boolean> assignment, List<Boolean> stepValues, boolean result, String error) {

    public Row {
        Objects.requireNonNull(assignment, "assignment is required");
        stepValues = List.copyOf(Objects.requireNonNull(stepValues, "stepValues is required"));
    }

    /**
     * @return the 1-based row number shown to users
     */
    public int displayIndex() {
        return index + 1;
    }

    /**
     * @param variable a variable of the expression
     * @return its value in this row
     * @throws IllegalArgumentException if the variable is not part of the assignment
     */
    public boolean valueOf(String variable) {
        Boolean value = assignment.get(variable);
        if (value == null) {
            throw new IllegalArgumentException("Unknown variable '" + variable + "'");
        }
        return value;
    }

    /**
     * Diagnostic channel for the partial-failure policy: rows whose evaluation failed still
     * render as {@code false}, and this holds the reason.
     *
     * @return the evaluation failure message, empty for rows that evaluated cleanly
     */
    public Optional<String> diagnostic() {
        return Optional.ofNullable(error);
    }

    public boolean failed() {
        return error != null;
    }
}
