package com.purchasingpower.timegraph.service.similarity;

/**
 * Snapshot of the term vector cache.
 *
 * @param hits        Pair lookups answered from the cache
 * @param misses      Pair lookups that had to be computed
 * @param cachedPairs Pairs currently memoized
 * @param corpusSize  Documents the IDF weights are built from
 * @param uniqueTerms Distinct terms in the corpus
 */
public record SimilarityCacheStatistics(long hits, long misses, long cachedPairs, int corpusSize, int uniqueTerms) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
