package com.purchasingpower.timegraph.service.similarity;

import com.purchasingpower.timegraph.core.ScoredDocument;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Forward and backward documents that a document attends to, best first.
 */
@Value
@Builder
public class AttentionResult {

    private static final double MIN_BACKWARD_TOTAL = 0.001;

    String documentId;
    List<ScoredDocument> forward;
    List<ScoredDocument> backward;

    public double getTotalForwardWeight() {
        return forward.stream().mapToDouble(ScoredDocument::score).sum();
    }

    public double getTotalBackwardWeight() {
        return backward.stream().mapToDouble(ScoredDocument::score).sum();
    }

    /**
     * Forward total over backward total; values above 1 lean towards the future.
     */
    public double getAttentionBalance() {
        return getTotalForwardWeight() / Math.max(MIN_BACKWARD_TOTAL, getTotalBackwardWeight());
    }

    public Optional<ScoredDocument> getMostAttendedForward() {
        return forward.stream().findFirst();
    }

    public Optional<ScoredDocument> getMostAttendedBackward() {
        return backward.stream().findFirst();
    }
}
