package com.purchasingpower.timegraph.service.analysis;

import com.purchasingpower.timegraph.model.analysis.AnalysisWindow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Analysis Window Planning Tests")
class AnalysisWindowsTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Fixed-size windows cover the span and the last one is cut at the end")
    void testFixedSize() {
        Instant end = START.plus(Duration.ofDays(200));

        List<AnalysisWindow> windows = AnalysisWindows.fixedSize(START, end, 90);

        assertEquals(3, windows.size());
        assertEquals(START, windows.get(0).start());
        assertEquals(START.plus(Duration.ofDays(90)), windows.get(0).end());
        assertEquals(windows.get(0).end(), windows.get(1).start());
        assertEquals(end, windows.get(2).end());
        assertFalse(windows.get(1).last());
        assertTrue(windows.get(2).last());
    }

    @Test
    @DisplayName("A span that is an exact multiple of the chunk size has no empty trailing window")
    void testFixedSize_ExactMultiple() {
        List<AnalysisWindow> windows = AnalysisWindows.fixedSize(START, START.plus(Duration.ofDays(180)), 90);

        assertEquals(2, windows.size());
        assertTrue(windows.get(1).last());
    }

    @Test
    @DisplayName("A zero-length span still yields one closed window")
    void testFixedSize_ZeroLength() {
        List<AnalysisWindow> windows = AnalysisWindows.fixedSize(START, START, 30);

        assertEquals(1, windows.size());
        assertTrue(windows.get(0).contains(START));
    }

    @Test
    @DisplayName("Window boundaries belong to exactly one window")
    void testContains_HalfOpen() {
        List<AnalysisWindow> windows = AnalysisWindows.fixedSize(START, START.plus(Duration.ofDays(20)), 10);
        Instant boundary = START.plus(Duration.ofDays(10));

        assertFalse(windows.get(0).contains(boundary));
        assertTrue(windows.get(1).contains(boundary));
        assertTrue(windows.get(1).contains(START.plus(Duration.ofDays(20))));
    }

    @Test
    @DisplayName("Equal parts are contiguous and end exactly at the span end")
    void testEqualParts() {
        Instant end = START.plus(Duration.ofDays(10)).plusSeconds(7);

        List<AnalysisWindow> windows = AnalysisWindows.equalParts(START, end, 4);

        assertEquals(4, windows.size());
        assertEquals(START, windows.get(0).start());
        for (int i = 0; i + 1 < windows.size(); i++) {
            assertEquals(windows.get(i).end(), windows.get(i + 1).start());
        }
        assertEquals(end, windows.get(3).end());
        assertTrue(windows.get(3).last());
    }

    @Test
    @DisplayName("Invalid spans and sizes are rejected")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisWindows.fixedSize(START, START, 0));
        assertThrows(IllegalArgumentException.class, () -> AnalysisWindows.equalParts(START, START, 0));
        assertThrows(IllegalArgumentException.class,
                () -> AnalysisWindows.fixedSize(START, START.minusSeconds(1), 10));
    }
}
