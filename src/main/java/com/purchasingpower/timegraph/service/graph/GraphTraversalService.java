package com.purchasingpower.timegraph.service.graph;

import com.purchasingpower.timegraph.core.CancellationToken;
import com.purchasingpower.timegraph.exception.DocumentNotFoundException;
import com.purchasingpower.timegraph.exception.NoPathException;

/**
 * Bounded traversal over the temporal graph.
 * Answers reachability in both directions and shortest-path queries.
 */
public interface GraphTraversalService {

    /**
     * Find every document reachable from {@code documentId} along outgoing relationships.
     * Multi-hop connections count: for a chain A -> B -> C -> D the result from A is B, C, D.
     *
     * @param documentId Source document
     * @param timeWindowDays Only documents within this many days after the source are visited
     * @param maxHops Maximum path length in relationships
     * @param maxResults Result cap, applied after ordering
     * @return Documents ordered by timestamp ascending (then id), source excluded
     * @throws DocumentNotFoundException if the source does not exist
     */
    ReachabilityResult forwardReachable(String documentId, int timeWindowDays, int maxHops, int maxResults);

    /**
     * Same as {@link #forwardReachable(String, int, int, int)}, checking {@code token} between hops.
     */
    ReachabilityResult forwardReachable(String documentId, int timeWindowDays, int maxHops, int maxResults,
                                        CancellationToken token);

    /**
     * Forward reachability with the configured default time window and result cap.
     */
    ReachabilityResult forwardReachable(String documentId, int maxHops);

    /**
     * Find every document that reaches {@code documentId}, following relationships in reverse.
     *
     * @return Documents ordered nearest-first (timestamp descending, then id), target excluded
     * @throws DocumentNotFoundException if the target does not exist
     */
    ReachabilityResult backwardReachable(String documentId, int timeWindowDays, int maxHops, int maxResults);

    ReachabilityResult backwardReachable(String documentId, int timeWindowDays, int maxHops, int maxResults,
                                         CancellationToken token);

    ReachabilityResult backwardReachable(String documentId, int maxHops);

    /**
     * Shortest hop-count path. Among several shortest paths the one whose next hop has the earliest
     * timestamp wins, recursively.
     *
     * @param fromId Start document
     * @param toId End document
     * @param maxHops Maximum path length
     * @return Path including both endpoints; a single element when {@code fromId == toId}
     * @throws NoPathException if no route exists within {@code maxHops}
     * @throws DocumentNotFoundException if either endpoint does not exist
     */
    PathResult findPath(String fromId, String toId, int maxHops);

    PathResult findPath(String fromId, String toId, int maxHops, CancellationToken token);

    /**
     * Shortest path with the configured default hop bound.
     */
    PathResult findPath(String fromId, String toId);

    boolean hasPath(String fromId, String toId, int maxHops);

    /** Number of traversals served so far. */
    long getTraversalCount();
}
