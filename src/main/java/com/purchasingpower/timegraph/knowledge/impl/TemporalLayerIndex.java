package com.purchasingpower.timegraph.knowledge.impl;

import com.google.common.base.Preconditions;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Coarse time-bucket index: bucket number ({@code epochDay / layerDurationDays}) to document ids.
 *
 * <p>Not thread-safe on its own; the owning store guards it with its read/write lock. A document is
 * placed once, at insert time, in the bucket of its canonical timestamp and never moved.
 */
class TemporalLayerIndex {

    private static final String LAYER_PREFIX = "layer_";

    private final int layerDurationDays;
    private final NavigableMap<Long, Set<String>> layers = new TreeMap<>();

    TemporalLayerIndex(int layerDurationDays) {
        Preconditions.checkArgument(layerDurationDays > 0, "layerDurationDays must be positive");
        this.layerDurationDays = layerDurationDays;
    }

    long bucketOf(Instant canonical) {
        long epochDay = canonical.atOffset(ZoneOffset.UTC).toLocalDate().toEpochDay();
        return Math.floorDiv(epochDay, layerDurationDays);
    }

    void add(String documentId, Instant canonical) {
        layers.computeIfAbsent(bucketOf(canonical), bucket -> new LinkedHashSet<>()).add(documentId);
    }

    /**
     * Candidate ids for a range: every id in a bucket overlapping {@code [start, end]}. Callers
     * still filter by exact timestamp.
     */
    List<String> candidates(Instant start, Instant end) {
        List<String> ids = new ArrayList<>();
        for (Set<String> bucket : layers.subMap(bucketOf(start), true, bucketOf(end), true).values()) {
            ids.addAll(bucket);
        }
        return ids;
    }

    Collection<String> bucket(long bucket) {
        return layers.getOrDefault(bucket, Set.of());
    }

    boolean hasBucket(long bucket) {
        return layers.containsKey(bucket);
    }

    List<String> labels() {
        return layers.keySet().stream().map(TemporalLayerIndex::label).toList();
    }

    static String label(long bucket) {
        return LAYER_PREFIX + bucket;
    }

    static long parse(String label) {
        Preconditions.checkArgument(label != null && label.startsWith(LAYER_PREFIX), "Invalid layer id: %s", label);
        try {
            return Long.parseLong(label.substring(LAYER_PREFIX.length()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid layer id: " + label, e);
        }
    }
}
