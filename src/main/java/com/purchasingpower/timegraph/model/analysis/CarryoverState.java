package com.purchasingpower.timegraph.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bounded summary handed from one analysis window to the next.
 *
 * <p>Every collection is capped by a configured capacity when the state is produced, so its size
 * is independent of how many documents the run has seen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CarryoverState {

    /** Ordered by importance, highest first. */
    @Builder.Default
    private List<CriticalEvent> criticalEvents = new ArrayList<>();

    /** Token to stats, ordered by weight. */
    @Builder.Default
    private Map<String, EntityStat> keyEntities = new LinkedHashMap<>();

    /** Oldest first. */
    @Builder.Default
    private List<CausalChain> causalChains = new ArrayList<>();

    /** Document id to attention in [0, 1] for the next window. */
    @Builder.Default
    private Map<String, Double> attentionScores = new LinkedHashMap<>();

    @Builder.Default
    private List<OpenQuestion> openQuestions = new ArrayList<>();

    /** Number of windows folded into this state. */
    private int windowsProcessed;

    /** Documents seen by all windows so far. */
    private int documentCount;

    /** End of the last window folded in; null before the first window. */
    private Instant coveredUntil;

    public static CarryoverState empty() {
        return CarryoverState.builder().build();
    }

    @JsonIgnore
    public int getSize() {
        return criticalEvents.size() + keyEntities.size() + causalChains.size()
                + attentionScores.size() + openQuestions.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return getSize() == 0;
    }

    /**
     * Documents the next window must take into account: critical events and the tails of open
     * questions.
     */
    @JsonIgnore
    public Set<String> getFlaggedDocumentIds() {
        Set<String> flagged = new LinkedHashSet<>();
        criticalEvents.forEach(event -> flagged.add(event.getDocumentId()));
        openQuestions.forEach(question -> flagged.add(question.getDocumentId()));
        return flagged;
    }
}
