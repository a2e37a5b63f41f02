package com.purchasingpower.timegraph.service;

import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.RelationKind;
import com.purchasingpower.timegraph.core.Relationship;
import com.purchasingpower.timegraph.core.ScoredDocument;
import com.purchasingpower.timegraph.core.TemporalOrderWarning;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;
import com.purchasingpower.timegraph.model.analysis.AnalysisRequest;
import com.purchasingpower.timegraph.model.analysis.AnalysisResult;
import com.purchasingpower.timegraph.model.analysis.WindowSummary;
import com.purchasingpower.timegraph.model.dto.GraphExport;
import com.purchasingpower.timegraph.model.dto.GraphStatistics;
import com.purchasingpower.timegraph.service.graph.PathResult;
import com.purchasingpower.timegraph.service.graph.ReachabilityResult;
import com.purchasingpower.timegraph.service.similarity.AttentionResult;

import java.util.List;
import java.util.Map;

/**
 * Entry point for callers of the engine: ingestion, temporal queries, similarity, chunked
 * analysis and diagnostics. Errors of the underlying components surface unchanged.
 *
 * @since 1.0.0
 */
public interface TemporalGraphService {

    // ================================================================
    // Ingestion
    // ================================================================

    /**
     * @param timestamp Any value the timestamp normalizer accepts; {@code null} stamps the document
     *                  with the current instant
     */
    Document addDocument(String id, String content, Object timestamp, Map<String, Object> metadata);

    default Document addDocument(String id, String content, Object timestamp) {
        return addDocument(id, content, timestamp, Map.of());
    }

    Relationship addRelationship(String fromId, String toId, RelationKind kind, double weight);

    /**
     * @param kind Relation kind value, e.g. {@code "causal"}
     */
    Relationship addRelationship(String fromId, String toId, String kind, double weight);

    Document updateMetadata(String documentId, String key, Object value);

    // ================================================================
    // Queries
    // ================================================================

    Document getDocument(String documentId);

    List<Document> listDocuments(int limit);

    /**
     * Documents with a timestamp in {@code [start, end]}; both bounds are normalized first.
     */
    List<Document> getDocumentsInRange(Object start, Object end);

    ReachabilityResult getFutureDocuments(String documentId, int timeWindowDays, int maxHops, int maxResults);

    ReachabilityResult getPastDocuments(String documentId, int timeWindowDays, int maxHops, int maxResults);

    PathResult findPath(String fromId, String toId, int maxHops);

    List<TemporalOrderWarning> getTemporalOrderWarnings();

    // ================================================================
    // Similarity
    // ================================================================

    double similarity(String firstId, String secondId);

    AttentionResult computeAttention(String documentId, int maxPerDirection);

    List<ScoredDocument> findRelatedDocuments(String documentId, int maxResults, RelationshipDirection direction);

    // ================================================================
    // Analysis
    // ================================================================

    AnalysisResult analyzeLongChain(AnalysisRequest request);

    AnalysisResult analyzeLongChain(String startDocumentId, String endDocumentId);

    List<WindowSummary> getTemporalSummary(String startDocumentId, String endDocumentId, int numChunks);

    // ================================================================
    // Diagnostics
    // ================================================================

    GraphStatistics getStatistics();

    GraphExport exportGraph();

    /**
     * {@link #exportGraph()} as JSON, timestamps in the canonical profile.
     */
    String exportJson();
}
