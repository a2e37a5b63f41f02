package com.purchasingpower.timegraph.service.impl;

import com.purchasingpower.timegraph.TemporalGraphFixture;
import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.RelationKind;
import com.purchasingpower.timegraph.core.Relationship;
import com.purchasingpower.timegraph.core.ScoredDocument;
import com.purchasingpower.timegraph.exception.ErrorCode;
import com.purchasingpower.timegraph.exception.TemporalGraphException;
import com.purchasingpower.timegraph.exception.UnknownDocumentException;
import com.purchasingpower.timegraph.model.analysis.AnalysisResult;
import com.purchasingpower.timegraph.model.analysis.CausalChain;
import com.purchasingpower.timegraph.model.dto.GraphExport;
import com.purchasingpower.timegraph.model.dto.GraphStatistics;
import com.purchasingpower.timegraph.service.TemporalGraphService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Temporal Graph Service Facade Tests")
class TemporalGraphServiceImplTest {

    private TemporalGraphService service;

    @BeforeEach
    void setUp() {
        service = TemporalGraphFixture.create().service;

        service.addDocument("c", "Insurance contract signed for the warehouse", "2024-01-01");
        service.addDocument("claim", "Water damage claim filed for the warehouse", "2024-03-01T09:30:00Z");
        service.addDocument("resp", "Insurer response to the water damage claim", "2024-04-01");
        service.addDocument("settle", "Water damage claim settled with the insurer", "2024-05-01", Map.of("amount", 12000));
        service.addRelationship("c", "claim", "causal", 1.0);
        service.addRelationship("claim", "resp", "CAUSAL", 1.0);
        service.addRelationship("resp", "settle", RelationKind.CAUSAL, 0.8);
    }

    private static List<String> ids(List<Document> documents) {
        return documents.stream().map(Document::getId).toList();
    }

    @Test
    @DisplayName("Future documents of the claim include the settlement")
    void testGetFutureDocuments() {
        assertEquals(List.of("resp", "settle"), service.getFutureDocuments("claim", 365, 5, 50).getDocumentIds());
        assertEquals(List.of("claim", "c"), service.getPastDocuments("resp", 365, 5, 50).getDocumentIds());
    }

    @Test
    @DisplayName("Range bounds in any accepted representation are normalized before the query")
    void testGetDocumentsInRange_RawBounds() {
        List<Document> documents = service.getDocumentsInRange("2024-02-01", Instant.parse("2024-04-01T00:00:00Z"));

        assertEquals(List.of("claim", "resp"), ids(documents));
    }

    @Test
    @DisplayName("A document without a timestamp is stamped with the current instant")
    void testAddDocument_MissingTimestampDefaultsToNow() {
        // Given
        Instant before = Instant.now().truncatedTo(ChronoUnit.MICROS);

        // When
        Document document = service.addDocument("undated", "Follow-up call with the insurer", null);

        // Then
        Instant after = Instant.now();
        assertThat(document.getTimestamp()).isBetween(before, after);
        assertEquals(0, document.getTimestamp().getNano() % 1_000);
        assertEquals(document, service.getDocument("undated"));
    }

    @Test
    @DisplayName("Relation kinds given as text are validated")
    void testAddRelationship_InvalidKind() {
        TemporalGraphException error = assertThrows(TemporalGraphException.class,
                () -> service.addRelationship("c", "settle", "caused-by", 1.0));

        assertEquals(ErrorCode.INVALID_ARGUMENT, error.getCode());
        assertThat(error.getMessage()).contains("sequential");
    }

    @Test
    @DisplayName("Structural errors surface unchanged")
    void testAddRelationship_UnknownEndpoint() {
        assertThrows(UnknownDocumentException.class, () -> service.addRelationship("c", "ghost", "causal", 1.0));
    }

    @Test
    @DisplayName("Backward-in-time causal edges are kept and auditable")
    void testTemporalOrderWarnings() {
        Relationship relationship = service.addRelationship("settle", "claim", "causal", 1.0);

        assertTrue(relationship.hasTemporalOrderWarning());
        assertEquals(1, service.getTemporalOrderWarnings().size());
        assertEquals(List.of("claim", "resp", "settle"), service.findPath("claim", "settle", 5).getPath());
    }

    @Test
    @DisplayName("Statistics summarize documents, edges and layers")
    void testGetStatistics() {
        GraphStatistics statistics = service.getStatistics();

        assertEquals(4, statistics.getDocumentCount());
        assertEquals(3, statistics.getRelationshipCount());
        assertEquals(Map.of("causal", 3L), statistics.getRelationshipsByKind());
        assertEquals(4, statistics.getLayerCount());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), statistics.getEarliestTimestamp());
        assertEquals(Instant.parse("2024-05-01T00:00:00Z"), statistics.getLatestTimestamp());
        assertEquals(0, statistics.getTemporalOrderWarnings());
    }

    @Test
    @DisplayName("Export is a read-only dump of every node and edge")
    void testExportGraph() {
        GraphExport export = service.exportGraph();
        String json = service.exportJson();

        assertEquals(List.of("c", "claim", "resp", "settle"), ids(export.getDocuments()));
        assertEquals(3, export.getRelationships().size());
        assertThat(json).contains("\"id\":\"settle\"").contains("\"kind\":\"causal\"")
                .contains("\"timestamp\":\"2024-03-01T09:30:00.000000Z\"");
        assertEquals(4, service.listDocuments(10).size());
    }

    @Test
    @DisplayName("Similarity and attention are available through the facade")
    void testSimilarityAndAttention() {
        assertEquals(1.0, service.similarity("claim", "claim"));
        assertThat(service.similarity("claim", "settle")).isGreaterThan(service.similarity("claim", "c"));
        assertThat(service.computeAttention("claim", 3).getForward())
                .extracting(ScoredDocument::documentId)
                .containsExactlyInAnyOrder("resp", "settle");
    }

    @Test
    @DisplayName("Chunked analysis and temporal summary run over the stored graph")
    void testAnalysis() {
        AnalysisResult result = service.analyzeLongChain("c", "settle");

        assertTrue(result.isEndDocumentReached());
        assertThat(result.getCausalChains())
                .extracting(CausalChain::getDocumentIds)
                .contains(List.of("c", "claim", "resp", "settle"));
        assertEquals(3, service.getTemporalSummary("c", "settle", 3).size());
    }
}
