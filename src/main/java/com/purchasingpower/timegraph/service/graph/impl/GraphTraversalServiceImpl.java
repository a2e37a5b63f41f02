package com.purchasingpower.timegraph.service.graph.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.timegraph.configuration.EngineProperties;
import com.purchasingpower.timegraph.configuration.TraversalProperties;
import com.purchasingpower.timegraph.core.CancellationToken;
import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.Relationship;
import com.purchasingpower.timegraph.exception.NoPathException;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;
import com.purchasingpower.timegraph.knowledge.TemporalGraphStore;
import com.purchasingpower.timegraph.service.graph.GraphTraversalService;
import com.purchasingpower.timegraph.service.graph.PathResult;
import com.purchasingpower.timegraph.service.graph.ReachabilityResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Service
public class GraphTraversalServiceImpl implements GraphTraversalService {

    private static final Comparator<Document> NEAREST_PAST_FIRST =
            Comparator.comparing(Document::getTimestamp).reversed().thenComparing(Document::getId);

    private final TemporalGraphStore store;
    private final TraversalProperties properties;
    private final AtomicLong traversals = new AtomicLong();

    public GraphTraversalServiceImpl(TemporalGraphStore store, EngineProperties properties) {
        this.store = store;
        this.properties = properties.getTraversal();
    }

    @Override
    public ReachabilityResult forwardReachable(String documentId, int timeWindowDays, int maxHops, int maxResults) {
        return forwardReachable(documentId, timeWindowDays, maxHops, maxResults, CancellationToken.none());
    }

    @Override
    public ReachabilityResult forwardReachable(String documentId, int timeWindowDays, int maxHops, int maxResults,
                                               CancellationToken token) {
        return reachable(documentId, RelationshipDirection.OUTGOING, timeWindowDays, maxHops, maxResults, token);
    }

    @Override
    public ReachabilityResult forwardReachable(String documentId, int maxHops) {
        return forwardReachable(documentId, properties.getDefaultTimeWindowDays(), maxHops,
                properties.getDefaultMaxResults());
    }

    @Override
    public ReachabilityResult backwardReachable(String documentId, int timeWindowDays, int maxHops, int maxResults) {
        return backwardReachable(documentId, timeWindowDays, maxHops, maxResults, CancellationToken.none());
    }

    @Override
    public ReachabilityResult backwardReachable(String documentId, int timeWindowDays, int maxHops, int maxResults,
                                                CancellationToken token) {
        return reachable(documentId, RelationshipDirection.INCOMING, timeWindowDays, maxHops, maxResults, token);
    }

    @Override
    public ReachabilityResult backwardReachable(String documentId, int maxHops) {
        return backwardReachable(documentId, properties.getDefaultTimeWindowDays(), maxHops,
                properties.getDefaultMaxResults());
    }

    @Override
    public PathResult findPath(String fromId, String toId, int maxHops) {
        return findPath(fromId, toId, maxHops, CancellationToken.none());
    }

    @Override
    public PathResult findPath(String fromId, String toId) {
        return findPath(fromId, toId, properties.getPathMaxHops());
    }

    @Override
    public PathResult findPath(String fromId, String toId, int maxHops, CancellationToken token) {
        Preconditions.checkArgument(maxHops >= 0, "maxHops must not be negative");
        store.getDocument(fromId);
        store.getDocument(toId);
        traversals.incrementAndGet();

        if (fromId.equals(toId)) {
            return PathResult.builder().fromId(fromId).toId(toId).path(List.of(fromId)).build();
        }

        Map<String, String> parents = new HashMap<>();
        parents.put(fromId, null);
        List<String> frontier = List.of(fromId);

        for (int hop = 1; hop <= maxHops && !frontier.isEmpty(); hop++) {
            if (token.isCancellationRequested()) {
                log.warn("Path search {} -> {} cancelled after {} hops", fromId, toId, hop - 1);
                return PathResult.builder().fromId(fromId).toId(toId).path(List.of()).cancelled(true).build();
            }

            List<String> next = new ArrayList<>();
            for (String current : frontier) {
                for (Document neighbor : neighboursInTemporalOrder(current)) {
                    String neighborId = neighbor.getId();
                    if (parents.containsKey(neighborId)) {
                        continue;
                    }
                    parents.put(neighborId, current);
                    if (neighborId.equals(toId)) {
                        List<String> path = rebuildPath(parents, toId);
                        log.debug("Found path: {}", String.join(" -> ", path));
                        return PathResult.builder().fromId(fromId).toId(toId).path(path).build();
                    }
                    next.add(neighborId);
                }
            }
            frontier = next;
        }

        throw new NoPathException(fromId, toId, maxHops);
    }

    @Override
    public boolean hasPath(String fromId, String toId, int maxHops) {
        try {
            return !findPath(fromId, toId, maxHops).getPath().isEmpty();
        } catch (NoPathException e) {
            return false;
        }
    }

    @Override
    public long getTraversalCount() {
        return traversals.get();
    }

    // ================================================================
    // BFS
    // ================================================================

    private ReachabilityResult reachable(String documentId, RelationshipDirection direction, int timeWindowDays,
                                         int maxHops, int maxResults, CancellationToken token) {
        Preconditions.checkArgument(timeWindowDays >= 0, "timeWindowDays must not be negative");
        Preconditions.checkArgument(maxHops >= 0, "maxHops must not be negative");
        Preconditions.checkArgument(maxResults >= 0, "maxResults must not be negative");

        Document source = store.getDocument(documentId);
        Duration window = Duration.ofDays(timeWindowDays);
        boolean forward = direction == RelationshipDirection.OUTGOING;
        Instant lower = forward ? source.getTimestamp() : source.getTimestamp().minus(window);
        Instant upper = forward ? source.getTimestamp().plus(window) : source.getTimestamp();

        Set<String> visited = new HashSet<>();
        visited.add(documentId);
        List<Document> reached = new ArrayList<>();
        Queue<String> frontier = new ArrayDeque<>();
        frontier.add(documentId);

        int hopsExplored = 0;
        boolean cancelled = false;
        while (!frontier.isEmpty() && hopsExplored < maxHops) {
            if (token.isCancellationRequested()) {
                cancelled = true;
                break;
            }
            hopsExplored++;

            Queue<String> next = new LinkedList<>();
            while (!frontier.isEmpty()) {
                String current = frontier.poll();
                for (Relationship relationship : store.getRelationships(current, direction)) {
                    String neighborId = forward ? relationship.getToId() : relationship.getFromId();
                    if (!visited.add(neighborId)) {
                        continue;
                    }
                    Document neighbor = store.getDocument(neighborId);
                    Instant timestamp = neighbor.getTimestamp();
                    if (timestamp.isBefore(lower) || timestamp.isAfter(upper)) {
                        continue;
                    }
                    reached.add(neighbor);
                    next.add(neighborId);
                }
            }
            frontier = next;
        }

        reached.sort(forward ? TemporalGraphStore.TEMPORAL_ORDER : NEAREST_PAST_FIRST);
        List<Document> limited = reached.size() > maxResults ? List.copyOf(reached.subList(0, maxResults)) : reached;
        traversals.incrementAndGet();

        if (cancelled) {
            log.warn("Traversal from {} cancelled after {} hops, returning {} partial results",
                    documentId, hopsExplored, limited.size());
        } else {
            log.debug("Found {} {} reachable documents for {} (hops {}, window {}d)",
                    reached.size(), forward ? "forward" : "backward", documentId, maxHops, timeWindowDays);
        }

        return ReachabilityResult.builder()
                .sourceId(documentId)
                .direction(direction)
                .documents(limited)
                .hopsExplored(hopsExplored)
                .cancelled(cancelled)
                .build();
    }

    private List<Document> neighboursInTemporalOrder(String documentId) {
        return store.getDirectSuccessors(documentId).stream()
                .map(store::getDocument)
                .sorted(TemporalGraphStore.TEMPORAL_ORDER)
                .toList();
    }

    private List<String> rebuildPath(Map<String, String> parents, String toId) {
        LinkedList<String> path = new LinkedList<>();
        for (String node = toId; node != null; node = parents.get(node)) {
            path.addFirst(node);
        }
        return List.copyOf(path);
    }
}
