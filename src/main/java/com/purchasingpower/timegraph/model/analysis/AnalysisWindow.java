package com.purchasingpower.timegraph.model.analysis;

import java.time.Instant;

/**
 * Time span of one window. Half-open {@code [start, end)} except for the final window of a run,
 * which also includes {@code end}, so consecutive windows never share a document.
 */
public record AnalysisWindow(int index, Instant start, Instant end, boolean last) {

    public boolean contains(Instant timestamp) {
        if (timestamp.isBefore(start)) {
            return false;
        }
        return last ? !timestamp.isAfter(end) : timestamp.isBefore(end);
    }
}
