package com.purchasingpower.timegraph.service.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Shortest hop-count path between two documents, source and target included.
 */
@Value
@Builder
public class PathResult {

    String fromId;
    String toId;
    List<String> path;
    boolean cancelled;

    public int getHops() {
        return path.isEmpty() ? 0 : path.size() - 1;
    }

    public String toArrowString() {
        return String.join(" -> ", path);
    }
}
