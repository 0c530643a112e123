package com.airsentinel.core.window;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HistoryWindowTest {
    @Test
    void emptyWindowReportsEmptyStats() {
        HistoryWindow window = new HistoryWindow(5);

        assertSame(WindowStats.EMPTY, window.stats());
        assertEquals(0, window.size());
        assertEquals(5, window.capacity());
    }

    @Test
    void statsUsePopulationStandardDeviation() {
        HistoryWindow window = new HistoryWindow(10);
        for (double value : new double[]{2, 4, 4, 4, 5, 5, 7, 9}) {
            window.push(value);
        }

        WindowStats stats = window.stats();
        assertEquals(5.0, stats.mean(), 1e-9);
        assertEquals(2.0, stats.stdDev(), 1e-9);
        assertEquals(8, stats.count());
    }

    @Test
    void oldestValueIsEvictedOnceFull() {
        HistoryWindow window = new HistoryWindow(3);
        window.push(1000);
        window.push(10);
        window.push(20);
        window.push(30);

        WindowStats stats = window.stats();
        assertEquals(3, window.size());
        assertEquals(20.0, stats.mean(), 1e-9);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new HistoryWindow(0));
    }
}
