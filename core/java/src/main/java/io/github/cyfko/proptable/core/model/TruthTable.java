package io.github.cyfko.proptable.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Truth table of a formula and of all its parenthesized sub-expressions.
 * <p>
 * Columns are laid out as: atoms in ascending order, then groups in discovery order (labelled
 * with their original text), then the formula itself. Rows follow the assignment order of
 * {@link io.github.cyfko.proptable.core.utils.Assignments}.
 * </p>
 *
 * <pre>
 *  p | q | p&gt;q
 *  T | T |  T
 *  T | F |  F
 *  F | T |  T
 *  F | F |  T
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTable {

    private final List<String> header;
    private final List<TruthRow> rows;
    private final int atomCount;

    /**
     * @param header    column labels
     * @param rows      one row per assignment
     * @param atomCount number of leading atom columns
     * @throws IllegalArgumentException if a row width differs from the header width
     */
    public TruthTable(List<String> header, List<TruthRow> rows, int atomCount) {
        this.header = List.copyOf(Objects.requireNonNull(header, "header"));
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
        if (atomCount < 0 || atomCount >= this.header.size()) {
            throw new IllegalArgumentException("atomCount out of range: " + atomCount);
        }
        for (TruthRow row : this.rows) {
            if (row.size() != this.header.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row has %d cells but header has %d columns", row.size(), this.header.size()));
            }
        }
        this.atomCount = atomCount;
    }

    public List<String> getHeader() {
        return header;
    }

    public List<TruthRow> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return header.size();
    }

    public int atomCount() {
        return atomCount;
    }

    public int tokenCount() {
        return header.size() - atomCount - 1;
    }

    /**
     * @return label of the last column, i.e. the formula text
     */
    public String formula() {
        return header.get(header.size() - 1);
    }

    /**
     * Returns the values of one column, top to bottom.
     *
     * @param index the column index
     * @return the column values
     */
    public List<Boolean> column(int index) {
        Objects.checkIndex(index, header.size());
        List<Boolean> column = new ArrayList<>(rows.size());
        for (TruthRow row : rows) {
            column.add(row.value(index));
        }
        return column;
    }

    /**
     * @return the values of the whole formula, top to bottom
     */
    public List<Boolean> resultColumn() {
        return column(header.size() - 1);
    }
}
