package com.purchasingpower.timegraph.service.similarity;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.knowledge.TemporalGraphStore;
import com.purchasingpower.timegraph.parser.TextTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * TF-IDF vectors and memoized pair scores for the documents of one store.
 *
 * <p>Invalidation rule: whenever the store's corpus version differs from the one the cache was
 * built against, the new documents' term counts are added, and every vector and pair score is
 * dropped, since a new document shifts the IDF weight of every term. Term counts themselves are
 * kept because document content never changes after insertion.
 *
 * <p>All methods synchronize on the cache and bring it in line with the store inside the same
 * critical section, so a score is never computed from a half-refreshed or stale corpus.
 *
 * <p>A document with content always has similarity 1 with itself, even when none of its words
 * survive tokenization.
 */
@Slf4j
public class TermVectorCache {

    private final TemporalGraphStore store;
    private final TextTokenizer tokenizer;
    private final Set<String> documentsWithContent = new HashSet<>();
    private final Map<String, Map<String, Integer>> termCounts = new HashMap<>();
    private final Map<String, Integer> documentFrequency = new HashMap<>();
    private final Map<String, Map<String, Double>> vectors = new HashMap<>();
    private final Cache<PairKey, Double> pairScores;

    private long syncedVersion = -1;

    public TermVectorCache(TemporalGraphStore store, TextTokenizer tokenizer, long maxCachedPairs) {
        this.store = store;
        this.tokenizer = tokenizer;
        this.pairScores = CacheBuilder.newBuilder()
                .maximumSize(maxCachedPairs)
                .recordStats()
                .build();
    }

    /**
     * Bring the cache in line with the store if the corpus changed since the last call.
     * Callers hold the monitor.
     */
    private void refresh() {
        long version = store.getCorpusVersion();
        if (version == syncedVersion) {
            return;
        }

        int added = 0;
        for (Document document : store.getAllDocuments()) {
            if (termCounts.containsKey(document.getId())) {
                continue;
            }
            Map<String, Integer> counts = tokenizer.termCounts(document.getContent());
            termCounts.put(document.getId(), counts);
            if (document.hasContent()) {
                documentsWithContent.add(document.getId());
            }
            counts.keySet().forEach(term -> documentFrequency.merge(term, 1, Integer::sum));
            added++;
        }

        vectors.clear();
        pairScores.invalidateAll();
        syncedVersion = version;
        log.debug("Term vectors refreshed: {} new documents, corpus {} documents, {} terms",
                added, termCounts.size(), documentFrequency.size());
    }

    /**
     * Cosine similarity of two indexed documents, memoized by unordered pair.
     */
    public synchronized double similarity(String firstId, String secondId) {
        refresh();
        if (firstId.equals(secondId)) {
            return documentsWithContent.contains(firstId) ? 1.0 : 0.0;
        }

        PairKey key = PairKey.of(firstId, secondId);
        Double cached = pairScores.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        double score = cosine(vector(firstId), vector(secondId));
        pairScores.put(key, score);
        return score;
    }

    /**
     * Cosine similarity of two free texts, weighted with the current corpus IDF. Not memoized.
     */
    public synchronized double textSimilarity(String first, String second) {
        refresh();
        Map<String, Double> a = weigh(tokenizer.termCounts(first));
        Map<String, Double> b = weigh(tokenizer.termCounts(second));
        return cosine(a, b);
    }

    public synchronized SimilarityCacheStatistics statistics() {
        CacheStats stats = pairScores.stats();
        return new SimilarityCacheStatistics(stats.hitCount(), stats.missCount(), pairScores.size(),
                termCounts.size(), documentFrequency.size());
    }

    public synchronized void clear() {
        documentsWithContent.clear();
        termCounts.clear();
        documentFrequency.clear();
        vectors.clear();
        pairScores.invalidateAll();
        syncedVersion = -1;
    }

    private Map<String, Double> vector(String documentId) {
        return vectors.computeIfAbsent(documentId, id -> weigh(termCounts.getOrDefault(id, Map.of())));
    }

    /**
     * Unit-length TF-IDF vector for the given term counts.
     */
    private Map<String, Double> weigh(Map<String, Integer> counts) {
        if (counts.isEmpty()) {
            return Map.of();
        }
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        int corpusSize = termCounts.size();

        Map<String, Double> weights = new HashMap<>();
        double norm = 0.0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            double tf = (double) entry.getValue() / total;
            int df = documentFrequency.getOrDefault(entry.getKey(), 0);
            double idf = Math.log((1.0 + corpusSize) / (1.0 + df)) + 1.0;
            double weight = tf * idf;
            weights.put(entry.getKey(), weight);
            norm += weight * weight;
        }

        double length = Math.sqrt(norm);
        weights.replaceAll((term, weight) -> weight / length);
        return weights;
    }

    private static double cosine(Map<String, Double> a, Map<String, Double> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Map<String, Double> smaller = a.size() <= b.size() ? a : b;
        Map<String, Double> larger = smaller == a ? b : a;
        double dot = 0.0;
        for (Map.Entry<String, Double> entry : smaller.entrySet()) {
            Double other = larger.get(entry.getKey());
            if (other != null) {
                dot += entry.getValue() * other;
            }
        }
        return Math.max(0.0, Math.min(1.0, dot));
    }

    /**
     * Unordered document pair.
     */
    private record PairKey(String low, String high) {

        static PairKey of(String a, String b) {
            return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
        }
    }
}
