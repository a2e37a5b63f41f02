package com.purchasingpower.timegraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.timegraph.exception.ErrorCode;
import com.purchasingpower.timegraph.exception.TemporalGraphException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Kinds of temporal relationship between two documents.
 */
public enum RelationKind {
    SEQUENTIAL("sequential"),
    CAUSAL("causal"),
    CONCURRENT("concurrent"),
    BRANCH("branch"),
    MERGE("merge");

    private final String value;

    RelationKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Sequential and causal edges claim that {@code from} happens no later than {@code to}.
     */
    public boolean isTemporallyOrdered() {
        return this == SEQUENTIAL || this == CAUSAL;
    }

    @JsonCreator
    public static RelationKind fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (RelationKind kind : values()) {
                if (kind.value.equals(normalized)) {
                    return kind;
                }
            }
        }
        String valid = Arrays.stream(values()).map(RelationKind::getValue).collect(Collectors.joining(", "));
        throw new TemporalGraphException(ErrorCode.INVALID_ARGUMENT,
                "Invalid relation kind: " + value + ". Use: " + valid,
                Map.of("value", String.valueOf(value)));
    }
}
