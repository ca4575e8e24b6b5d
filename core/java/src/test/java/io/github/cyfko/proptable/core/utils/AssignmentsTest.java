package io.github.cyfko.proptable.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Assignments Tests")
class AssignmentsTest {

    @Test
    @DisplayName("True comes first and the first proposition varies slowest")
    void twoPropositionOrder() {
        List<boolean[]> rows = new ArrayList<>();
        Assignments.over(2).forEach(rows::add);

        assertEquals(4, rows.size());
        assertArrayEquals(new boolean[]{true, true}, rows.get(0));
        assertArrayEquals(new boolean[]{true, false}, rows.get(1));
        assertArrayEquals(new boolean[]{false, true}, rows.get(2));
        assertArrayEquals(new boolean[]{false, false}, rows.get(3));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 3, 5})
    @DisplayName("Rows count down in binary, first proposition most significant")
    void rowsAreDescendingBinary(int n) {
        Assignments assignments = Assignments.over(n);
        assertEquals(1 << n, assignments.count());

        int row = 0;
        for (boolean[] values : assignments) {
            int number = 0;
            for (boolean value : values) {
                number = (number << 1) | (value ? 1 : 0);
            }
            assertEquals(assignments.count() - 1 - row, number);
            row++;
        }
        assertEquals(assignments.count(), row);
    }

    @Test
    void zeroPropositionsGiveOneEmptyAssignment() {
        Iterator<boolean[]> it = Assignments.over(0).iterator();
        assertEquals(0, it.next().length);
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void rejectsOutOfRangeSizes() {
        assertThrows(IllegalArgumentException.class, () -> Assignments.over(-1));
        assertThrows(IllegalArgumentException.class, () -> Assignments.over(Assignments.MAX_PROPOSITIONS + 1));
        assertThrows(IndexOutOfBoundsException.class, () -> Assignments.over(2).get(4));
    }
}
