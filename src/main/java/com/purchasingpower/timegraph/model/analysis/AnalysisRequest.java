package com.purchasingpower.timegraph.model.analysis;

import com.purchasingpower.timegraph.core.CancellationToken;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one chunked analysis run. Null numeric fields fall back to the analyzer
 * configuration.
 */
@Value
@Builder
public class AnalysisRequest {

    String startDocumentId;

    /** Optional; the run stops after the window containing this document. */
    String endDocumentId;

    Integer maxDays;

    Integer chunkSizeDays;

    @Builder.Default
    CancellationToken cancellationToken = CancellationToken.none();
}
