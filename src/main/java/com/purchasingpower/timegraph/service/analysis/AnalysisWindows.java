package com.purchasingpower.timegraph.service.analysis;

import com.google.common.base.Preconditions;
import com.purchasingpower.timegraph.model.analysis.AnalysisWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Partitions a time span into consecutive analysis windows without gaps or overlap.
 */
public final class AnalysisWindows {

    private AnalysisWindows() {
    }

    /**
     * Windows of {@code chunkSizeDays} starting at {@code start}; the final one is cut at
     * {@code end}. A zero-length span yields a single window.
     */
    public static List<AnalysisWindow> fixedSize(Instant start, Instant end, int chunkSizeDays) {
        Preconditions.checkArgument(chunkSizeDays > 0, "chunkSizeDays must be positive");
        Preconditions.checkArgument(!end.isBefore(start), "Span end %s is before start %s", end, start);

        Duration chunk = Duration.ofDays(chunkSizeDays);
        List<AnalysisWindow> windows = new ArrayList<>();
        Instant cursor = start;
        while (true) {
            Instant next = cursor.plus(chunk);
            if (!next.isBefore(end)) {
                windows.add(new AnalysisWindow(windows.size(), cursor, end, true));
                return windows;
            }
            windows.add(new AnalysisWindow(windows.size(), cursor, next, false));
            cursor = next;
        }
    }

    /**
     * {@code count} windows of equal length; the last one ends exactly at {@code end}.
     */
    public static List<AnalysisWindow> equalParts(Instant start, Instant end, int count) {
        Preconditions.checkArgument(count > 0, "count must be positive");
        Preconditions.checkArgument(!end.isBefore(start), "Span end %s is before start %s", end, start);

        Duration span = Duration.between(start, end);
        List<AnalysisWindow> windows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Instant windowStart = start.plus(span.multipliedBy(i).dividedBy(count));
            boolean last = i == count - 1;
            Instant windowEnd = last ? end : start.plus(span.multipliedBy(i + 1).dividedBy(count));
            windows.add(new AnalysisWindow(i, windowStart, windowEnd, last));
        }
        return windows;
    }
}
