package com.purchasingpower.timegraph.model.dto;

import com.purchasingpower.timegraph.service.similarity.SimilarityCacheStatistics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of the graph for diagnostics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStatistics {

    private int documentCount;
    private int relationshipCount;

    /** Relation kind value to edge count. */
    private Map<String, Long> relationshipsByKind;

    private int layerCount;

    /** Null for an empty graph. */
    private Instant earliestTimestamp;
    private Instant latestTimestamp;

    private int temporalOrderWarnings;
    private long traversals;
    private SimilarityCacheStatistics similarityCache;
}
