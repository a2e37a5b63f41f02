package com.purchasingpower.timegraph.service.graph;

import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Documents reached by a bounded breadth-first search, already ordered and truncated.
 *
 * <p>{@code cancelled} marks a partial result: the search stopped at a hop boundary because the
 * caller asked it to, and {@code documents} holds everything reached until then.
 */
@Value
@Builder
public class ReachabilityResult {

    String sourceId;
    RelationshipDirection direction;
    List<Document> documents;
    int hopsExplored;
    boolean cancelled;

    public List<String> getDocumentIds() {
        return documents.stream().map(Document::getId).toList();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    public int size() {
        return documents.size();
    }
}
