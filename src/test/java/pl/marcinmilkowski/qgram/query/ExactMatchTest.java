package pl.marcinmilkowski.qgram.query;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the ExactMatch and Diagonal records.
 */
class ExactMatchTest {

    @Test
    @DisplayName("ExactMatch should expose length and diagonal")
    void testLengthAndDiagonal() {
        ExactMatch m = new ExactMatch(3, 7, 10, 14);
        assertEquals(4, m.length());
        assertEquals(7, m.diagonal());
        assertEquals(-3, new ExactMatch(5, 8, 2, 5).diagonal());
    }

    @Test
    @DisplayName("Intervals of different length are rejected")
    void testUnequalLengths() {
        assertThrows(IllegalArgumentException.class, () -> new ExactMatch(0, 4, 0, 5));
    }

    @Test
    @DisplayName("toString() shows both half-open intervals")
    void testToString() {
        assertEquals("ExactMatch[pattern=[0, 8) text=[0, 8)]", new ExactMatch(0, 8, 0, 8).toString());
        assertEquals("Diagonal[offset=-4 count=2]", new Diagonal(-4, 2).toString());
    }

    @Test
    @DisplayName("Diagonals sort by count descending, then offset")
    void testDiagonalOrder() {
        List<Diagonal> diagonals = new ArrayList<>(List.of(
            new Diagonal(5, 1),
            new Diagonal(2, 7),
            new Diagonal(-1, 7),
            new Diagonal(0, 3)
        ));
        Collections.sort(diagonals);

        assertEquals(List.of(
            new Diagonal(-1, 7),
            new Diagonal(2, 7),
            new Diagonal(0, 3),
            new Diagonal(5, 1)
        ), diagonals);
    }
}
