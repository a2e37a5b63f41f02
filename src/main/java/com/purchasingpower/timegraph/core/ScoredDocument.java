package com.purchasingpower.timegraph.core;

import java.time.Instant;

/**
 * Document id with a score, used for attention and related-document rankings.
 */
public record ScoredDocument(String documentId, Instant timestamp, double score) {
}
