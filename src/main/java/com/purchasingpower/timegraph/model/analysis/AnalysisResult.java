package com.purchasingpower.timegraph.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Synthesized result of a chunked analysis run.
 *
 * <p>When {@link #isCancelled()} is true the result holds every window that completed before the
 * cancellation was observed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    private String startDocumentId;
    private String endDocumentId;
    private Instant spanStart;
    private Instant spanEnd;
    private long totalSpanDays;
    private int chunkSizeDays;

    /** Windows planned for the span; {@code chunkResults} may hold fewer. */
    private int plannedWindows;

    @Builder.Default
    private List<ChunkResult> chunkResults = new ArrayList<>();

    /** Unique by document id, most important first. */
    @Builder.Default
    private List<CriticalEvent> criticalEvents = new ArrayList<>();

    @Builder.Default
    private List<EntityStat> keyEntities = new ArrayList<>();

    /** No chain is contained in another. */
    @Builder.Default
    private List<CausalChain> causalChains = new ArrayList<>();

    @Builder.Default
    private List<OpenQuestion> openQuestions = new ArrayList<>();

    private CarryoverState finalCarryover;

    private PerformanceMetrics metrics;

    private boolean cancelled;

    private boolean endDocumentReached;

    @JsonIgnore
    public int getNumWindows() {
        return chunkResults.size();
    }

    /**
     * Multi-line overview for logs and consoles.
     */
    @JsonIgnore
    public String getSummary() {
        StringBuilder summary = new StringBuilder();
        summary.append("Analysis from ").append(startDocumentId);
        if (endDocumentId != null) {
            summary.append(" to ").append(endDocumentId);
        }
        summary.append(" over ").append(totalSpanDays).append(" days")
                .append(" in ").append(chunkResults.size()).append('/').append(plannedWindows)
                .append(" windows of ").append(chunkSizeDays).append(" days");
        if (cancelled) {
            summary.append(" (cancelled)");
        }
        summary.append('\n');
        summary.append("Critical events: ").append(criticalEvents.size()).append('\n');
        criticalEvents.stream().limit(5).forEach(event ->
                summary.append("  - ").append(event.getDocumentId())
                        .append(String.format(" (%.3f) ", event.getImportance()))
                        .append(event.getSummary()).append('\n'));
        summary.append("Key entities: ")
                .append(keyEntities.stream().limit(10).map(EntityStat::getToken).toList()).append('\n');
        summary.append("Causal chains: ").append(causalChains.size()).append('\n');
        causalChains.stream().limit(5).forEach(chain -> summary.append("  - ").append(chain).append('\n'));
        summary.append("Open questions: ").append(openQuestions.size()).append('\n');
        if (metrics != null) {
            summary.append(String.format("Processed %d documents in %.1f ms (avg %.1f ms per window)",
                    metrics.getTotalDocuments(), metrics.getTotalProcessingTimeMs(), metrics.getAvgChunkTimeMs()));
            if (metrics.getSpeedupFactor() != null) {
                summary.append(String.format(", estimated speedup %.1fx", metrics.getSpeedupFactor()));
            }
        }
        return summary.toString();
    }
}
