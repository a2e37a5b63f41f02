package com.purchasingpower.timegraph.service.analysis;

import com.purchasingpower.timegraph.configuration.ImportanceWeights;
import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.Relationship;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;
import com.purchasingpower.timegraph.knowledge.TemporalGraphStore;
import com.purchasingpower.timegraph.model.analysis.AnalysisWindow;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scores window documents as
 * {@code connectivity * wc + carriedAttention * wa + recency * wr}, each term in [0, 1].
 *
 * <ul>
 *   <li>connectivity: edges to other working-set documents, relative to the best-connected window document</li>
 *   <li>carried attention: score handed over by the previous window, 0 if none</li>
 *   <li>recency: position of the timestamp inside the window</li>
 * </ul>
 */
public class ImportanceScorer {

    private static final Comparator<Map.Entry<String, Double>> BY_SCORE =
            Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.<String, Double>comparingByKey());

    private final TemporalGraphStore store;
    private final ImportanceWeights weights;

    public ImportanceScorer(TemporalGraphStore store, ImportanceWeights weights) {
        this.store = store;
        this.weights = weights;
    }

    /**
     * @param windowDocuments  Documents to score
     * @param workingSet       Ids whose edges count towards connectivity
     * @param carriedAttention Attention from the previous carryover
     * @param parallel         Score on the common pool; the result order is the same either way
     * @return Document id to score, highest first, ties by id
     */
    public Map<String, Double> score(List<Document> windowDocuments, Set<String> workingSet,
                                     Map<String, Double> carriedAttention, AnalysisWindow window,
                                     boolean parallel) {
        Stream<Document> degreeStream = parallel ? windowDocuments.parallelStream() : windowDocuments.stream();
        Map<String, Integer> degrees = degreeStream
                .collect(Collectors.toMap(Document::getId, d -> degree(d.getId(), workingSet)));
        int maxDegree = degrees.values().stream().mapToInt(Integer::intValue).max().orElse(0);

        Stream<Document> scoreStream = parallel ? windowDocuments.parallelStream() : windowDocuments.stream();
        List<Map.Entry<String, Double>> scored = scoreStream
                .map(document -> Map.entry(document.getId(), importance(document, degrees.get(document.getId()),
                        maxDegree, carriedAttention, window)))
                .sorted(BY_SCORE)
                .toList();

        Map<String, Double> result = new LinkedHashMap<>();
        scored.forEach(entry -> result.put(entry.getKey(), entry.getValue()));
        return result;
    }

    /**
     * Upper bound of a score, used to map scores onto [0, 1].
     */
    public double maxScore() {
        return weights.getConnectivity() + weights.getAttention() + weights.getRecency();
    }

    private double importance(Document document, int degree, int maxDegree,
                              Map<String, Double> carriedAttention, AnalysisWindow window) {
        double connectivity = maxDegree == 0 ? 0.0 : (double) degree / maxDegree;
        double attention = clamp(carriedAttention.getOrDefault(document.getId(), 0.0));
        double recency = recency(document, window);
        return weights.getConnectivity() * connectivity
                + weights.getAttention() * attention
                + weights.getRecency() * recency;
    }

    private int degree(String documentId, Set<String> workingSet) {
        int degree = 0;
        for (Relationship relationship : store.getRelationships(documentId, RelationshipDirection.BOTH)) {
            String other = relationship.getFromId().equals(documentId) ? relationship.getToId() : relationship.getFromId();
            if (!other.equals(documentId) && workingSet.contains(other)) {
                degree++;
            }
        }
        return degree;
    }

    private static double recency(Document document, AnalysisWindow window) {
        long span = Duration.between(window.start(), window.end()).toMillis();
        if (span <= 0) {
            return 1.0;
        }
        long offset = Duration.between(window.start(), document.getTimestamp()).toMillis();
        return clamp((double) offset / span);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
