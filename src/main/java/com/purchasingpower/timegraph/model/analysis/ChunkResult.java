package com.purchasingpower.timegraph.model.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of analyzing one window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResult {

    private int windowIndex;
    private Instant windowStart;
    private Instant windowEnd;

    /** Documents whose timestamp falls in this window. */
    @Builder.Default
    private List<String> documentIds = new ArrayList<>();

    /** Window documents reachable from documents flagged by the previous carryover. */
    @Builder.Default
    private List<String> continuationIds = new ArrayList<>();

    /** Carried documents from earlier windows that took part in this window's analysis. */
    @Builder.Default
    private List<String> contextDocumentIds = new ArrayList<>();

    @Builder.Default
    private List<CriticalEvent> criticalEvents = new ArrayList<>();

    @Builder.Default
    private List<EntityStat> keyEntities = new ArrayList<>();

    @Builder.Default
    private List<CausalChain> causalChains = new ArrayList<>();

    /** Questions raised by this window. */
    @Builder.Default
    private List<OpenQuestion> openQuestions = new ArrayList<>();

    /** Questions from earlier windows that this window answered. */
    private int resolvedQuestions;

    private CarryoverState carryover;

    private double processingTimeMs;

    /** Window documents plus carried context documents. */
    private int workingSetSize;
}
