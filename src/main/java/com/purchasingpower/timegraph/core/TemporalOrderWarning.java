package com.purchasingpower.timegraph.core;

import java.time.Instant;

/**
 * Non-fatal audit flag on a sequential or causal relationship whose source is later than its
 * target. The relationship is stored regardless; the warning stays attached to it.
 */
public record TemporalOrderWarning(
        String fromId,
        String toId,
        RelationKind kind,
        Instant fromTimestamp,
        Instant toTimestamp) {

    public String getMessage() {
        return kind.getValue() + " relationship " + fromId + " -> " + toId
                + " goes backward in time (" + fromTimestamp + " > " + toTimestamp + ")";
    }
}
