package com.purchasingpower.timegraph.service.similarity;

import com.purchasingpower.timegraph.core.ScoredDocument;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;

import java.util.List;

/**
 * Content similarity between documents of the temporal graph.
 *
 * <p>Scores are cosine similarities of TF-IDF vectors: in [0, 1], symmetric, 1 for a non-blank
 * document with itself and 0 when two documents share no weighted term.
 */
public interface SimilarityService {

    /**
     * @throws com.purchasingpower.timegraph.exception.DocumentNotFoundException if either id is unknown
     */
    double similarity(String firstId, String secondId);

    /**
     * Similarity of two arbitrary texts, using the current corpus for term weighting.
     */
    double textSimilarity(String first, String second);

    /**
     * Rank forward and backward reachable documents by similarity to {@code documentId}.
     * Ties go to the document closest in time, then to the smaller id.
     *
     * @param maxPerDirection Maximum number of documents per direction
     */
    AttentionResult computeAttention(String documentId, int maxPerDirection);

    /**
     * Reachable documents ranked by similarity, in one or both directions.
     */
    List<ScoredDocument> findRelatedDocuments(String documentId, int maxResults, RelationshipDirection direction);

    SimilarityCacheStatistics getCacheStatistics();

    /**
     * Drop all cached vectors and scores; they are rebuilt on the next call.
     */
    void clearCache();
}
