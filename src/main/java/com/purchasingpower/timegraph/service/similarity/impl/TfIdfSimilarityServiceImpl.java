package com.purchasingpower.timegraph.service.similarity.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.timegraph.configuration.EngineProperties;
import com.purchasingpower.timegraph.configuration.SimilarityProperties;
import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.ScoredDocument;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;
import com.purchasingpower.timegraph.knowledge.TemporalGraphStore;
import com.purchasingpower.timegraph.parser.TextTokenizer;
import com.purchasingpower.timegraph.service.graph.GraphTraversalService;
import com.purchasingpower.timegraph.service.similarity.AttentionResult;
import com.purchasingpower.timegraph.service.similarity.SimilarityCacheStatistics;
import com.purchasingpower.timegraph.service.similarity.SimilarityService;
import com.purchasingpower.timegraph.service.similarity.TermVectorCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class TfIdfSimilarityServiceImpl implements SimilarityService {

    private final TemporalGraphStore store;
    private final GraphTraversalService traversalService;
    private final SimilarityProperties properties;
    private final TermVectorCache cache;

    public TfIdfSimilarityServiceImpl(TemporalGraphStore store,
                                      GraphTraversalService traversalService,
                                      EngineProperties properties) {
        this.store = store;
        this.traversalService = traversalService;
        this.properties = properties.getSimilarity();
        this.cache = new TermVectorCache(store, new TextTokenizer(this.properties.getMinTokenLength()),
                this.properties.getPairCacheMaxSize());
    }

    @Override
    public double similarity(String firstId, String secondId) {
        store.getDocument(firstId);
        store.getDocument(secondId);
        return cache.similarity(firstId, secondId);
    }

    @Override
    public double textSimilarity(String first, String second) {
        return cache.textSimilarity(first, second);
    }

    @Override
    public AttentionResult computeAttention(String documentId, int maxPerDirection) {
        Preconditions.checkArgument(maxPerDirection >= 0, "maxPerDirection must not be negative");
        Document source = store.getDocument(documentId);

        List<ScoredDocument> forward = rank(source, candidates(documentId, RelationshipDirection.OUTGOING), maxPerDirection);
        List<ScoredDocument> backward = rank(source, candidates(documentId, RelationshipDirection.INCOMING), maxPerDirection);

        AttentionResult result = AttentionResult.builder()
                .documentId(documentId)
                .forward(forward)
                .backward(backward)
                .build();
        log.debug("Attention for {}: {} forward, {} backward, balance {}",
                documentId, forward.size(), backward.size(), String.format("%.3f", result.getAttentionBalance()));
        return result;
    }

    @Override
    public List<ScoredDocument> findRelatedDocuments(String documentId, int maxResults,
                                                     RelationshipDirection direction) {
        Preconditions.checkArgument(maxResults >= 0, "maxResults must not be negative");
        Preconditions.checkNotNull(direction, "direction");
        Document source = store.getDocument(documentId);

        Map<String, Document> candidates = new LinkedHashMap<>();
        if (direction != RelationshipDirection.INCOMING) {
            candidates(documentId, RelationshipDirection.OUTGOING).forEach(d -> candidates.put(d.getId(), d));
        }
        if (direction != RelationshipDirection.OUTGOING) {
            candidates(documentId, RelationshipDirection.INCOMING).forEach(d -> candidates.put(d.getId(), d));
        }
        return rank(source, new ArrayList<>(candidates.values()), maxResults);
    }

    @Override
    public SimilarityCacheStatistics getCacheStatistics() {
        return cache.statistics();
    }

    @Override
    public void clearCache() {
        cache.clear();
        log.info("Similarity cache cleared");
    }

    private List<Document> candidates(String documentId, RelationshipDirection direction) {
        int window = properties.getAttentionTimeWindowDays();
        int hops = properties.getAttentionMaxHops();
        int limit = Integer.MAX_VALUE;
        return direction == RelationshipDirection.OUTGOING
                ? traversalService.forwardReachable(documentId, window, hops, limit).getDocuments()
                : traversalService.backwardReachable(documentId, window, hops, limit).getDocuments();
    }

    private List<ScoredDocument> rank(Document source, List<Document> candidates, int limit) {
        Comparator<ScoredDocument> order = Comparator.comparingDouble(ScoredDocument::score).reversed()
                .thenComparing(scored -> Duration.between(source.getTimestamp(), scored.timestamp()).abs())
                .thenComparing(ScoredDocument::documentId);

        return candidates.stream()
                .map(candidate -> new ScoredDocument(candidate.getId(), candidate.getTimestamp(),
                        cache.similarity(source.getId(), candidate.getId())))
                .sorted(order)
                .limit(limit)
                .toList();
    }
}
