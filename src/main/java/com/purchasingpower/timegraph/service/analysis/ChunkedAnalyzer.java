package com.purchasingpower.timegraph.service.analysis;

import com.purchasingpower.timegraph.model.analysis.AnalysisRequest;
import com.purchasingpower.timegraph.model.analysis.AnalysisResult;
import com.purchasingpower.timegraph.model.analysis.WindowSummary;

import java.time.Instant;
import java.util.List;

/**
 * Windowed analysis of long document chains.
 *
 * <p>A run walks the span window by window. Each window sees only its own documents plus the
 * bounded carryover produced by the previous window, so memory stays constant however many
 * documents the span holds. Windows are processed strictly in order.
 */
public interface ChunkedAnalyzer {

    /**
     * Analyze the span starting at the request's start document.
     *
     * @throws com.purchasingpower.timegraph.exception.DocumentNotFoundException if the start or end document is unknown
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Analyze from {@code startDocumentId} up to {@code endDocumentId} (nullable) with configured defaults.
     */
    default AnalysisResult analyzeLongChain(String startDocumentId, String endDocumentId) {
        return analyze(AnalysisRequest.builder()
                .startDocumentId(startDocumentId)
                .endDocumentId(endDocumentId)
                .build());
    }

    /**
     * Split the span between two documents into {@code numChunks} equal windows and summarize each
     * one on its own, without carryover.
     */
    List<WindowSummary> getTemporalSummary(String startDocumentId, String endDocumentId, int numChunks);

    List<WindowSummary> getTemporalSummary(Instant start, Instant end, int numChunks);
}
