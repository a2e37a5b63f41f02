package com.purchasingpower.timegraph.parser;

import com.purchasingpower.timegraph.configuration.AnalyzerProperties;
import com.purchasingpower.timegraph.configuration.EngineProperties;
import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.model.analysis.EntityStat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts key entities from a window of documents.
 *
 * <p>An entity here is just a frequent long token; it is a scoring rule, not named-entity
 * recognition. Mentions are weighted by the importance of the document they occur in, so terms
 * from central documents outrank equally frequent terms from peripheral ones.
 */
@Slf4j
@Component
public class EntityExtractor {

    /** Weight first, then raw mentions, then token for a stable order. */
    public static final Comparator<EntityStat> BY_WEIGHT =
            Comparator.comparingDouble(EntityStat::getWeight).reversed()
                    .thenComparing(Comparator.comparingInt(EntityStat::getMentions).reversed())
                    .thenComparing(EntityStat::getToken);

    private final TextTokenizer tokenizer;
    private final int minMentions;

    public EntityExtractor(EngineProperties properties) {
        AnalyzerProperties analyzer = properties.getAnalyzer();
        this.tokenizer = new TextTokenizer(analyzer.getMinEntityLength());
        this.minMentions = analyzer.getMinEntityMentions();
    }

    /**
     * @param documents Window documents
     * @param importance Importance per document id; absent ids count as 0
     * @param limit Maximum number of entities returned
     * @return Entities mentioned at least the configured minimum number of times, best first
     */
    public List<EntityStat> extract(List<Document> documents, Map<String, Double> importance, int limit) {
        Map<String, EntityStat> entities = new HashMap<>();

        for (Document document : documents) {
            double documentImportance = importance.getOrDefault(document.getId(), 0.0);
            tokenizer.termCounts(document.getContent()).forEach((token, count) ->
                    entities.merge(token,
                            EntityStat.builder()
                                    .token(token)
                                    .mentions(count)
                                    .weight(count * documentImportance)
                                    .firstSeen(document.getTimestamp())
                                    .lastSeen(document.getTimestamp())
                                    .build(),
                            EntityStat::merge));
        }

        List<EntityStat> result = entities.values().stream()
                .filter(entity -> entity.getMentions() >= minMentions)
                .sorted(BY_WEIGHT)
                .limit(limit)
                .toList();

        log.debug("Extracted {} entities from {} documents ({} candidate tokens)",
                result.size(), documents.size(), entities.size());
        return result;
    }
}
