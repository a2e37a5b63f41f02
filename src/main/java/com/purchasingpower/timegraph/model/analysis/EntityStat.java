package com.purchasingpower.timegraph.model.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Frequency and weight of one key entity (a frequent token) over the documents seen so far.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityStat {

    private String token;
    private int mentions;
    private double weight;
    private Instant firstSeen;
    private Instant lastSeen;

    /**
     * Combine two observations of the same token.
     */
    public EntityStat merge(EntityStat other) {
        return EntityStat.builder()
                .token(token)
                .mentions(mentions + other.mentions)
                .weight(weight + other.weight)
                .firstSeen(earliest(firstSeen, other.firstSeen))
                .lastSeen(latest(lastSeen, other.lastSeen))
                .build();
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
