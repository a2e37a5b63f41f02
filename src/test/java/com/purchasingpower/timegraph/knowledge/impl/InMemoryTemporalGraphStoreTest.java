package com.purchasingpower.timegraph.knowledge.impl;

import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.RelationKind;
import com.purchasingpower.timegraph.core.Relationship;
import com.purchasingpower.timegraph.core.TemporalOrderWarning;
import com.purchasingpower.timegraph.exception.DocumentNotFoundException;
import com.purchasingpower.timegraph.exception.DuplicateDocumentException;
import com.purchasingpower.timegraph.exception.ErrorCode;
import com.purchasingpower.timegraph.exception.UnknownDocumentException;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;
import com.purchasingpower.timegraph.knowledge.TemporalGraphStore;
import com.purchasingpower.timegraph.time.TimestampNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.purchasingpower.timegraph.TemporalGraphFixture.day;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("In-Memory Temporal Graph Store Tests")
class InMemoryTemporalGraphStoreTest {

    private InMemoryTemporalGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTemporalGraphStore(TimestampNormalizer.utc(), 7);
    }

    @Test
    @DisplayName("Documents are stored with canonical timestamps")
    void testAddDocument_NormalizesTimestamp() {
        Document document = store.addDocument("claim", "Claim filed", "2024-03-01T12:00:00+02:00", Map.of("source", "mail"));

        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), document.getTimestamp());
        assertEquals("Claim filed", store.getDocument("claim").getContent());
        assertEquals("mail", store.getDocument("claim").getMetadata().get("source"));
        assertEquals(1, store.documentCount());
    }

    @Test
    @DisplayName("A missing timestamp is rejected before anything is stored")
    void testAddDocument_NullTimestamp() {
        NullPointerException error = assertThrows(NullPointerException.class,
                () -> store.addDocument("a", "undated", null, Map.of()));

        assertThat(error.getMessage()).contains("timestamp");
        assertEquals(0, store.documentCount());
    }

    @Test
    @DisplayName("Duplicate ids are rejected and the original document is kept")
    void testAddDocument_Duplicate() {
        store.addDocument("a", "first", day(0), Map.of());

        DuplicateDocumentException error = assertThrows(DuplicateDocumentException.class,
                () -> store.addDocument("a", "second", day(1), Map.of()));

        assertEquals(ErrorCode.DUPLICATE_DOCUMENT, error.getCode());
        assertEquals("first", store.getDocument("a").getContent());
        assertEquals(1, store.documentCount());
    }

    @Test
    @DisplayName("Unknown ids raise NOT_FOUND on lookup")
    void testGetDocument_NotFound() {
        DocumentNotFoundException error = assertThrows(DocumentNotFoundException.class,
                () -> store.getDocument("missing"));

        assertEquals(ErrorCode.NOT_FOUND, error.getCode());
        assertTrue(store.findDocument("missing").isEmpty());
        assertFalse(store.containsDocument("missing"));
    }

    @Test
    @DisplayName("Relationships to unknown documents are rejected")
    void testAddRelationship_UnknownEndpoint() {
        store.addDocument("a", "known", day(0), Map.of());

        UnknownDocumentException error = assertThrows(UnknownDocumentException.class,
                () -> store.addRelationship("a", "ghost", RelationKind.CAUSAL, 1.0));

        assertEquals(ErrorCode.UNKNOWN_DOCUMENT, error.getCode());
        assertEquals("ghost", error.getContext().get("missing"));
        assertEquals(0, store.relationshipCount());
    }

    @Test
    @DisplayName("Backward causal edge is created and carries a temporal order warning")
    void testAddRelationship_BackwardCausalEdge() {
        store.addDocument("late", "effect", day(10), Map.of());
        store.addDocument("early", "cause", day(1), Map.of());

        Relationship relationship = store.addRelationship("late", "early", RelationKind.CAUSAL, 1.0);

        assertTrue(relationship.hasTemporalOrderWarning());
        assertTrue(store.hasEdge("late", "early"));
        List<TemporalOrderWarning> warnings = store.getTemporalOrderWarnings();
        assertEquals(1, warnings.size());
        assertEquals("late", warnings.get(0).fromId());
        assertThat(warnings.get(0).getMessage()).contains("late -> early");
    }

    @Test
    @DisplayName("Unordered kinds never produce temporal order warnings")
    void testAddRelationship_ConcurrentBackwardIsFine() {
        store.addDocument("late", "one", day(10), Map.of());
        store.addDocument("early", "two", day(1), Map.of());

        Relationship relationship = store.addRelationship("late", "early", RelationKind.CONCURRENT, 0.5,
                Map.of("reason", "same incident"));

        assertFalse(relationship.hasTemporalOrderWarning());
        assertTrue(store.getTemporalOrderWarnings().isEmpty());
        assertEquals("same incident", relationship.getMetadata().get("reason"));
        assertEquals(0.5, relationship.getWeight());
    }

    @Test
    @DisplayName("Relationships are listed per direction")
    void testGetRelationships_Directions() {
        store.addDocument("a", "a", day(0), Map.of());
        store.addDocument("b", "b", day(1), Map.of());
        store.addDocument("c", "c", day(2), Map.of());
        store.addRelationship("a", "b", RelationKind.SEQUENTIAL, 1.0);
        store.addRelationship("b", "c", RelationKind.CAUSAL, 1.0);

        assertEquals(1, store.getRelationships("b", RelationshipDirection.OUTGOING).size());
        assertEquals(1, store.getRelationships("b", RelationshipDirection.INCOMING).size());
        assertEquals(2, store.getRelationships("b", RelationshipDirection.BOTH).size());
        assertEquals(List.of("c"), store.getDirectSuccessors("b"));
        assertEquals(List.of("a"), store.getDirectPredecessors("b"));
        assertEquals(2, store.getAllRelationships().size());
        assertThrows(DocumentNotFoundException.class,
                () -> store.getRelationships("zzz", RelationshipDirection.BOTH));
    }

    @Test
    @DisplayName("Range query bounds are inclusive and results are ordered by time, then id")
    void testGetDocumentsInRange_InclusiveBounds() {
        store.addDocument("b", "x", day(5), Map.of());
        store.addDocument("a", "x", day(5), Map.of());
        store.addDocument("c", "x", day(10), Map.of());
        store.addDocument("d", "x", day(11), Map.of());
        store.addDocument("z", "x", day(4), Map.of());

        List<Document> result = store.getDocumentsInRange(day(5), day(10));

        assertEquals(List.of("a", "b", "c"), result.stream().map(Document::getId).toList());
        assertThrows(IllegalArgumentException.class, () -> store.getDocumentsInRange(day(10), day(5)));
    }

    @Test
    @DisplayName("Layer-indexed range queries match a linear scan")
    void testGetDocumentsInRange_MatchesLinearScan() {
        Random random = new Random(42);
        for (int i = 0; i < 400; i++) {
            Instant timestamp = day(0).plus(Duration.ofMinutes(random.nextInt(200 * 24 * 60)));
            store.addDocument("doc-" + i, "content " + i, timestamp, Map.of());
        }
        List<Document> all = store.getAllDocuments();

        for (int i = 0; i < 100; i++) {
            Instant start = day(-5).plus(Duration.ofMinutes(random.nextInt(210 * 24 * 60)));
            Instant end = start.plus(Duration.ofMinutes(random.nextInt(40 * 24 * 60)));

            List<Document> expected = all.stream()
                    .filter(d -> !d.getTimestamp().isBefore(start) && !d.getTimestamp().isAfter(end))
                    .sorted(TemporalGraphStore.TEMPORAL_ORDER)
                    .toList();

            assertEquals(expected, store.getDocumentsInRange(start, end), "range " + start + " - " + end);
        }
    }

    @Test
    @DisplayName("Layer lookups follow the configured bucket width")
    void testLayers() {
        store.addDocument("a", "x", Instant.parse("1970-01-01T00:00:00Z"), Map.of());
        store.addDocument("b", "x", Instant.parse("1970-01-07T23:59:59Z"), Map.of());
        store.addDocument("c", "x", Instant.parse("1970-01-08T00:00:00Z"), Map.of());
        store.addDocument("d", "x", Instant.parse("1970-01-29T00:00:00Z"), Map.of());

        assertEquals("layer_0", store.getLayerId("a"));
        assertEquals("layer_0", store.getLayerId("b"));
        assertEquals("layer_1", store.getLayerId("c"));
        assertEquals("layer_4", store.getLayerId("d"));
        assertEquals(List.of("layer_0", "layer_1", "layer_4"), store.getLayerIds());
        assertThat(store.getLayerDocuments("layer_0")).containsExactlyInAnyOrder("a", "b");
        assertEquals(List.of("layer_0"), store.getAdjacentLayers("layer_1"));
        assertTrue(store.getAdjacentLayers("layer_4").isEmpty());
    }

    @Test
    @DisplayName("Metadata is the only mutable part of a document")
    void testUpdateMetadata() {
        store.addDocument("a", "x", day(0), Map.of("status", "open"));

        store.updateMetadata("a", "status", "closed");

        assertEquals("closed", store.getDocument("a").getMetadata().get("status"));
        assertThrows(UnsupportedOperationException.class,
                () -> store.getDocument("a").getMetadata().put("status", "hacked"));
        assertThrows(DocumentNotFoundException.class, () -> store.updateMetadata("b", "k", "v"));
    }

    @Test
    @DisplayName("List keeps insertion order and honours the limit")
    void testListDocuments() {
        store.addDocument("late", "x", day(9), Map.of());
        store.addDocument("early", "x", day(1), Map.of());
        store.addDocument("middle", "x", day(5), Map.of());

        assertEquals(List.of("late", "early"), store.listDocuments(2).stream().map(Document::getId).toList());
        assertEquals(List.of("early", "middle", "late"), store.getAllDocuments().stream().map(Document::getId).toList());
    }

    @Test
    @DisplayName("Every insert bumps the corpus version")
    void testCorpusVersion() {
        long before = store.getCorpusVersion();
        store.addDocument("a", "x", day(0), Map.of());

        assertEquals(before + 1, store.getCorpusVersion());
    }

    @Test
    @DisplayName("Concurrent writers and readers leave a consistent store")
    void testConcurrentAccess() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 8; worker++) {
                int offset = worker;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 125; i++) {
                        store.addDocument("w" + offset + "-" + i, "text", day(i), Map.of());
                        store.getDocumentsInRange(day(0), day(200));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }

        assertEquals(1000, store.documentCount());
        assertEquals(1000, store.getDocumentsInRange(day(0), day(200)).size());
    }
}
