package com.purchasingpower.timegraph.service.analysis;

import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.RelationKind;
import com.purchasingpower.timegraph.core.Relationship;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;
import com.purchasingpower.timegraph.knowledge.TemporalGraphStore;
import com.purchasingpower.timegraph.model.analysis.CausalChain;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds maximal simple paths over {@code causal} relationships inside a set of documents.
 *
 * <p>Only edges with both endpoints in the set are followed. A path that passes through the tail
 * of a chain carried from an earlier window is grafted onto that chain, so chains keep growing
 * across window boundaries.
 */
@Slf4j
public class CausalChainExtractor {

    /** Hard stop for path enumeration on densely connected sets. */
    static final int MAX_ENUMERATED_PATHS = 1_000;

    private final TemporalGraphStore store;

    public CausalChainExtractor(TemporalGraphStore store) {
        this.store = store;
    }

    /**
     * @param workingSet     Documents the paths may use
     * @param requiredIds    A chain is kept only if it contains at least one of these
     * @param carriedChains  Chains from earlier windows that may be extended
     * @param limit          Maximum number of chains returned; longer chains win
     * @return Chains ordered by the timestamp of their last document
     */
    public List<CausalChain> extract(Set<String> workingSet, Collection<String> requiredIds,
                                     List<CausalChain> carriedChains, int limit) {
        List<Document> ordered = workingSet.stream()
                .map(store::getDocument)
                .sorted(TemporalGraphStore.TEMPORAL_ORDER)
                .toList();

        Map<String, List<String>> successors = new HashMap<>();
        Set<String> hasPredecessor = new HashSet<>();
        for (Document document : ordered) {
            List<String> next = causalSuccessors(document.getId(), workingSet);
            successors.put(document.getId(), next);
            hasPredecessor.addAll(next);
        }

        List<List<String>> paths = new ArrayList<>();
        Set<String> covered = new HashSet<>();
        for (Document document : ordered) {
            if (!hasPredecessor.contains(document.getId())) {
                enumerate(document.getId(), successors, paths, covered);
            }
        }
        // Pure cycles have no head; start from their earliest member.
        for (Document document : ordered) {
            if (!covered.contains(document.getId()) && !successors.get(document.getId()).isEmpty()) {
                enumerate(document.getId(), successors, paths, covered);
            }
        }

        Set<String> required = new HashSet<>(requiredIds);
        Set<CausalChain> chains = new LinkedHashSet<>();
        for (List<String> path : paths) {
            CausalChain chain = graft(path, carriedChains);
            if (chain.getDocumentIds().stream().anyMatch(required::contains)) {
                chains.add(chain);
            }
        }

        List<CausalChain> maximal = removeContained(new ArrayList<>(chains));
        List<CausalChain> result = maximal.stream()
                .sorted(Comparator.comparingInt(CausalChain::getLength).reversed()
                        .thenComparing(CausalChain::toString))
                .limit(limit)
                .sorted(byTail())
                .toList();

        log.debug("Extracted {} causal chains from {} documents ({} paths enumerated)",
                result.size(), workingSet.size(), paths.size());
        return result;
    }

    /**
     * Order chains by the timestamp of their tail, then by their ids.
     */
    public Comparator<CausalChain> byTail() {
        return Comparator.<CausalChain, Document>comparing(chain -> store.getDocument(chain.getTail()),
                        TemporalGraphStore.TEMPORAL_ORDER)
                .thenComparing(CausalChain::toString);
    }

    /**
     * Drop every chain whose ids appear contiguously inside another chain of the list.
     */
    public static List<CausalChain> removeContained(List<CausalChain> chains) {
        List<CausalChain> result = new ArrayList<>();
        for (int i = 0; i < chains.size(); i++) {
            CausalChain candidate = chains.get(i);
            boolean contained = false;
            for (int j = 0; j < chains.size() && !contained; j++) {
                if (i == j) {
                    continue;
                }
                CausalChain other = chains.get(j);
                boolean sameLength = other.getLength() == candidate.getLength();
                // Equal chains: keep the first occurrence only.
                contained = candidate.isContainedIn(other) && (!sameLength || j < i);
            }
            if (!contained) {
                result.add(candidate);
            }
        }
        return result;
    }

    public List<String> causalSuccessors(String documentId, Set<String> allowed) {
        return store.getRelationships(documentId, RelationshipDirection.OUTGOING).stream()
                .filter(relationship -> relationship.getKind() == RelationKind.CAUSAL)
                .map(Relationship::getToId)
                .filter(id -> !id.equals(documentId) && (allowed == null || allowed.contains(id)))
                .distinct()
                .map(store::getDocument)
                .sorted(TemporalGraphStore.TEMPORAL_ORDER)
                .map(Document::getId)
                .toList();
    }

    private void enumerate(String head, Map<String, List<String>> successors,
                           List<List<String>> paths, Set<String> covered) {
        if (paths.size() >= MAX_ENUMERATED_PATHS) {
            return;
        }
        List<String> path = new ArrayList<>();
        Set<String> onPath = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        stack.push(new Frame(head));
        path.add(head);
        onPath.add(head);
        covered.add(head);

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            List<String> next = successors.get(top.node);
            String child = null;
            while (top.cursor < next.size()) {
                String candidate = next.get(top.cursor++);
                if (!onPath.contains(candidate)) {
                    child = candidate;
                    break;
                }
            }

            if (child != null) {
                top.descended = true;
                stack.push(new Frame(child));
                path.add(child);
                onPath.add(child);
                covered.add(child);
                continue;
            }

            if (!top.descended && path.size() >= 2) {
                paths.add(List.copyOf(path));
                if (paths.size() >= MAX_ENUMERATED_PATHS) {
                    log.debug("Path enumeration stopped at {} paths", MAX_ENUMERATED_PATHS);
                    return;
                }
            }
            stack.pop();
            onPath.remove(path.remove(path.size() - 1));
        }
    }

    private static CausalChain graft(List<String> path, List<CausalChain> carriedChains) {
        List<String> best = path;
        for (CausalChain carried : carriedChains) {
            int index = path.indexOf(carried.getTail());
            if (index < 0 || !endsWith(carried.getDocumentIds(), path.subList(0, index + 1))) {
                continue;
            }
            List<String> rest = path.subList(index + 1, path.size());
            if (rest.stream().anyMatch(carried.getDocumentIds()::contains)) {
                continue;
            }
            List<String> ids = new ArrayList<>(carried.getDocumentIds());
            ids.addAll(rest);
            if (ids.size() > best.size()) {
                best = ids;
            }
        }
        return CausalChain.of(best);
    }

    private static boolean endsWith(List<String> ids, List<String> suffix) {
        int offset = ids.size() - suffix.size();
        return offset >= 0 && ids.subList(offset, ids.size()).equals(suffix);
    }

    private static final class Frame {
        private final String node;
        private int cursor;
        private boolean descended;

        private Frame(String node) {
            this.node = node;
        }
    }
}
