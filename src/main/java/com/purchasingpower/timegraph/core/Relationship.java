package com.purchasingpower.timegraph.core;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;
import java.util.Optional;

/**
 * Directed, typed edge between two documents, referenced by id only.
 *
 * <p>Several relationships may connect the same pair as long as their kinds differ in meaning to
 * the caller; the store does not collapse them.
 */
@Value
@Builder
@Jacksonized
public class Relationship {

    String fromId;
    String toId;
    RelationKind kind;

    @Builder.Default
    double weight = 1.0;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    /** Present only for sequential/causal edges that point backward in time. */
    TemporalOrderWarning temporalOrderWarning;

    public Optional<TemporalOrderWarning> warning() {
        return Optional.ofNullable(temporalOrderWarning);
    }

    public boolean hasTemporalOrderWarning() {
        return temporalOrderWarning != null;
    }
}
