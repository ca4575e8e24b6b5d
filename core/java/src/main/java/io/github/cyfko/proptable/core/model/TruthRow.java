package io.github.cyfko.proptable.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One row of a truth table: the atom values of an assignment followed by the value of every
 * group and, last, the value of the whole formula.
 *
 * @param values cell values in column order
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthRow(List<Boolean> values) {

    public TruthRow {
        values = List.copyOf(Objects.requireNonNull(values, "values"));
        if (values.isEmpty()) {
            throw new IllegalArgumentException("A truth row holds at least the formula value");
        }
    }

    public boolean value(int column) {
        return values.get(column);
    }

    /**
     * @return the value of the whole formula for this assignment
     */
    public boolean result() {
        return values.get(values.size() - 1);
    }

    public int size() {
        return values.size();
    }
}
