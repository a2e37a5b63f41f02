package com.purchasingpower.timegraph.integration;

import com.purchasingpower.timegraph.configuration.EngineProperties;
import com.purchasingpower.timegraph.model.analysis.AnalysisResult;
import com.purchasingpower.timegraph.service.TemporalGraphService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application context with the packaged configuration and runs a small
 * ingest, query and analysis flow through the wired facade.
 */
@SpringBootTest
@DisplayName("Application Context Tests")
class TemporalGraphApplicationTest {

    @Autowired
    private TemporalGraphService service;

    @Autowired
    private EngineProperties properties;

    @Test
    @DisplayName("Configuration binds the packaged defaults")
    void testConfigurationDefaults() {
        assertEquals(90, properties.getAnalyzer().getChunkSizeDays());
        assertEquals(50, properties.getAnalyzer().getMaxChainLength());
        assertEquals(365, properties.getTraversal().getDefaultTimeWindowDays());
        assertEquals("UTC", properties.getTime().getNaiveZone());
    }

    @Test
    @DisplayName("Ingest, query and analyze through the wired services")
    void testEndToEndFlow() {
        // Given
        service.addDocument("ctx-kickoff", "Kickoff meeting for the pipeline migration", "2023-06-01");
        service.addDocument("ctx-design", "Pipeline migration design approved", "2023-07-15T10:00:00Z");
        service.addDocument("ctx-rollout", "Pipeline migration rollout completed", "2023-11-20");
        service.addRelationship("ctx-kickoff", "ctx-design", "causal", 1.0);
        service.addRelationship("ctx-design", "ctx-rollout", "causal", 1.0);

        // When
        AnalysisResult result = service.analyzeLongChain("ctx-kickoff", "ctx-rollout");

        // Then
        assertEquals(2, service.getFutureDocuments("ctx-kickoff", 365, 5, 10).size());
        assertTrue(result.isEndDocumentReached());
        assertThat(result.getChunkResults()).hasSize(result.getPlannedWindows());
        assertThat(service.exportJson()).contains("\"id\":\"ctx-rollout\"");
    }
}
