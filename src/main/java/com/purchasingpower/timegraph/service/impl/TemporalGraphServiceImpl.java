package com.purchasingpower.timegraph.service.impl;

import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.RelationKind;
import com.purchasingpower.timegraph.core.Relationship;
import com.purchasingpower.timegraph.core.ScoredDocument;
import com.purchasingpower.timegraph.core.TemporalOrderWarning;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;
import com.purchasingpower.timegraph.knowledge.TemporalGraphStore;
import com.purchasingpower.timegraph.model.analysis.AnalysisRequest;
import com.purchasingpower.timegraph.model.analysis.AnalysisResult;
import com.purchasingpower.timegraph.model.analysis.WindowSummary;
import com.purchasingpower.timegraph.model.dto.GraphExport;
import com.purchasingpower.timegraph.model.dto.GraphStatistics;
import com.purchasingpower.timegraph.serialization.TemporalJsonCodec;
import com.purchasingpower.timegraph.service.TemporalGraphService;
import com.purchasingpower.timegraph.service.analysis.ChunkedAnalyzer;
import com.purchasingpower.timegraph.service.graph.GraphTraversalService;
import com.purchasingpower.timegraph.service.graph.PathResult;
import com.purchasingpower.timegraph.service.graph.ReachabilityResult;
import com.purchasingpower.timegraph.service.similarity.AttentionResult;
import com.purchasingpower.timegraph.service.similarity.SimilarityService;
import com.purchasingpower.timegraph.time.TimestampNormalizer;
import com.purchasingpower.timegraph.util.LogFormat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class TemporalGraphServiceImpl implements TemporalGraphService {

    private final TemporalGraphStore store;
    private final TimestampNormalizer normalizer;
    private final GraphTraversalService traversalService;
    private final SimilarityService similarityService;
    private final ChunkedAnalyzer chunkedAnalyzer;
    private final TemporalJsonCodec jsonCodec;

    @Override
    public Document addDocument(String id, String content, Object timestamp, Map<String, Object> metadata) {
        // Missing timestamp means "now"; the store itself rejects null
        Object effective = timestamp != null ? timestamp : Instant.now();
        return store.addDocument(id, content, effective, metadata);
    }

    @Override
    public Relationship addRelationship(String fromId, String toId, RelationKind kind, double weight) {
        return store.addRelationship(fromId, toId, kind, weight);
    }

    @Override
    public Relationship addRelationship(String fromId, String toId, String kind, double weight) {
        return addRelationship(fromId, toId, RelationKind.fromValue(kind), weight);
    }

    @Override
    public Document updateMetadata(String documentId, String key, Object value) {
        return store.updateMetadata(documentId, key, value);
    }

    @Override
    public Document getDocument(String documentId) {
        return store.getDocument(documentId);
    }

    @Override
    public List<Document> listDocuments(int limit) {
        return store.listDocuments(limit);
    }

    @Override
    public List<Document> getDocumentsInRange(Object start, Object end) {
        return store.getDocumentsInRange(normalizer.normalize(start), normalizer.normalize(end));
    }

    @Override
    public ReachabilityResult getFutureDocuments(String documentId, int timeWindowDays, int maxHops, int maxResults) {
        return traversalService.forwardReachable(documentId, timeWindowDays, maxHops, maxResults);
    }

    @Override
    public ReachabilityResult getPastDocuments(String documentId, int timeWindowDays, int maxHops, int maxResults) {
        return traversalService.backwardReachable(documentId, timeWindowDays, maxHops, maxResults);
    }

    @Override
    public PathResult findPath(String fromId, String toId, int maxHops) {
        return traversalService.findPath(fromId, toId, maxHops);
    }

    @Override
    public List<TemporalOrderWarning> getTemporalOrderWarnings() {
        return store.getTemporalOrderWarnings();
    }

    @Override
    public double similarity(String firstId, String secondId) {
        return similarityService.similarity(firstId, secondId);
    }

    @Override
    public AttentionResult computeAttention(String documentId, int maxPerDirection) {
        return similarityService.computeAttention(documentId, maxPerDirection);
    }

    @Override
    public List<ScoredDocument> findRelatedDocuments(String documentId, int maxResults,
                                                     RelationshipDirection direction) {
        return similarityService.findRelatedDocuments(documentId, maxResults, direction);
    }

    @Override
    public AnalysisResult analyzeLongChain(AnalysisRequest request) {
        return chunkedAnalyzer.analyze(request);
    }

    @Override
    public AnalysisResult analyzeLongChain(String startDocumentId, String endDocumentId) {
        return chunkedAnalyzer.analyzeLongChain(startDocumentId, endDocumentId);
    }

    @Override
    public List<WindowSummary> getTemporalSummary(String startDocumentId, String endDocumentId, int numChunks) {
        return chunkedAnalyzer.getTemporalSummary(startDocumentId, endDocumentId, numChunks);
    }

    @Override
    public GraphStatistics getStatistics() {
        List<Document> documents = store.getAllDocuments();
        List<Relationship> relationships = store.getAllRelationships();

        Map<String, Long> byKind = relationships.stream()
                .collect(Collectors.groupingBy(relationship -> relationship.getKind().getValue(),
                        TreeMap::new, Collectors.counting()));

        GraphStatistics statistics = GraphStatistics.builder()
                .documentCount(documents.size())
                .relationshipCount(relationships.size())
                .relationshipsByKind(byKind)
                .layerCount(store.getLayerIds().size())
                .earliestTimestamp(documents.isEmpty() ? null : documents.get(0).getTimestamp())
                .latestTimestamp(documents.isEmpty() ? null : documents.get(documents.size() - 1).getTimestamp())
                .temporalOrderWarnings(store.getTemporalOrderWarnings().size())
                .traversals(traversalService.getTraversalCount())
                .similarityCache(similarityService.getCacheStatistics())
                .build();

        log.info("📊 Graph statistics: {} documents, {} relationships {}, {} layers",
                statistics.getDocumentCount(), statistics.getRelationshipCount(), LogFormat.formatMap(byKind),
                statistics.getLayerCount());
        return statistics;
    }

    @Override
    public GraphExport exportGraph() {
        return GraphExport.builder()
                .exportedAt(Instant.now().truncatedTo(ChronoUnit.MICROS))
                .documents(store.getAllDocuments())
                .relationships(store.getAllRelationships())
                .statistics(getStatistics())
                .build();
    }

    @Override
    public String exportJson() {
        return jsonCodec.toJson(exportGraph());
    }
}
