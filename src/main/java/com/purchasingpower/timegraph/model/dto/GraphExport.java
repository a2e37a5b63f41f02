package com.purchasingpower.timegraph.model.dto;

import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.Relationship;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Full node and edge dump of the graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphExport {

    private Instant exportedAt;

    /** Ordered by timestamp, then id. */
    @Builder.Default
    private List<Document> documents = new ArrayList<>();

    @Builder.Default
    private List<Relationship> relationships = new ArrayList<>();

    private GraphStatistics statistics;
}
