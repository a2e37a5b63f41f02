package com.purchasingpower.timegraph.model.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Local, carryover-free overview of one slice of a temporal summary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowSummary {

    private int index;
    private Instant start;
    private Instant end;

    /** Human-readable period, e.g. {@code 2024-01-01 to 2024-03-31}. */
    private String period;

    /** Documents first seen in this slice; no id appears in two slices. */
    @Builder.Default
    private List<String> newDocumentIds = new ArrayList<>();

    private int documentCount;

    @Builder.Default
    private List<CriticalEvent> keyEvents = new ArrayList<>();

    @Builder.Default
    private List<String> keyEntities = new ArrayList<>();

    private int causalChainCount;
}
