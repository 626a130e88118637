package com.conveyal.rastertools.progress;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LoggingProgressListenerTest {

    @Test
    public void testCountsIncrements () {
        LoggingProgressListener listener = new LoggingProgressListener(25);
        listener.beginTask("Test", 7);
        for (int i = 0; i < 7; i++) {
            listener.increment();
        }
        assertEquals(7, listener.done());
        listener.beginTask("Again", 0);
        listener.increment(3);
        assertEquals(3, listener.done());
    }

    @Test
    public void testInvalidStep () {
        assertThrows(IllegalArgumentException.class, () -> new LoggingProgressListener(0));
        assertThrows(IllegalArgumentException.class, () -> new LoggingProgressListener(101));
    }

}
