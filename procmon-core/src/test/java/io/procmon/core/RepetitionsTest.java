package io.procmon.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RepetitionsTest {

    @Test
    void parseShouldAcceptCountsAndInf() {
        assertEquals(Repetitions.of(3), Repetitions.parse("3"));
        assertSame(Repetitions.UNBOUNDED, Repetitions.parse("INF"));
    }

    @Test
    void parseShouldRejectZeroAndGarbage() {
        assertThrows(IllegalArgumentException.class, () -> Repetitions.parse("0"));
        assertThrows(IllegalArgumentException.class, () -> Repetitions.parse("-2"));
        assertThrows(IllegalArgumentException.class, () -> Repetitions.parse("many"));
    }

    @Test
    void decrementShouldStopAtZeroAndIgnoreUnbounded() {
        Repetitions one = Repetitions.of(1);
        Repetitions zero = one.decrement();

        assertTrue(zero.isExhausted());
        assertSame(zero, zero.decrement());
        assertSame(Repetitions.UNBOUNDED, Repetitions.UNBOUNDED.decrement());
        assertEquals("inf", Repetitions.UNBOUNDED.toString());
    }
}
