package io.github.cyfko.proptable.core.utils;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Enumeration of every truth assignment over an ordered list of propositions.
 * <p>
 * Assignments are produced as the Cartesian product of {@code {true, false}} with {@code true}
 * first in each position and the first proposition varying slowest. Reading {@code true} as 1,
 * the rows count down in binary from {@code 2^n - 1} to {@code 0}:
 * </p>
 * <pre>
 * n = 2:  TT, TF, FT, FF
 * </pre>
 * <p>
 * This order is observable: it fixes the row order of every truth table.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Assignments implements Iterable<boolean[]> {

    /**
     * Largest supported number of propositions, so that row indices fit in an {@code int}.
     */
    public static final int MAX_PROPOSITIONS = 30;

    private final int size;

    private Assignments(int size) {
        this.size = size;
    }

    /**
     * @param propositions number of propositions
     * @return the enumeration of all {@code 2^propositions} assignments
     * @throws IllegalArgumentException if the count is negative or above {@link #MAX_PROPOSITIONS}
     */
    public static Assignments over(int propositions) {
        if (propositions < 0 || propositions > MAX_PROPOSITIONS) {
            throw new IllegalArgumentException(String.format(
                    "Number of propositions must be in [0, %d], got: %d", MAX_PROPOSITIONS, propositions));
        }
        return new Assignments(propositions);
    }

    /**
     * @return the number of assignments, {@code 2^n}
     */
    public int count() {
        return 1 << size;
    }

    /**
     * Returns the assignment at a given row.
     *
     * @param row the row index, {@code 0 <= row < count()}
     * @return a fresh array of values, one per proposition
     */
    public boolean[] get(int row) {
        if (row < 0 || row >= count()) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range for " + count() + " assignments");
        }
        boolean[] values = new boolean[size];
        for (int j = 0; j < size; j++) {
            // bit set means false, so that row 0 is all true
            values[j] = ((row >> (size - 1 - j)) & 1) == 0;
        }
        return values;
    }

    @Override
    public Iterator<boolean[]> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < count();
            }

            @Override
            public boolean[] next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return get(next++);
            }
        };
    }
}
