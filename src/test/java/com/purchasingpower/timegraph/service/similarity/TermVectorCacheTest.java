package com.purchasingpower.timegraph.service.similarity;

import com.purchasingpower.timegraph.TemporalGraphFixture;
import com.purchasingpower.timegraph.parser.TextTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Term Vector Cache Tests")
class TermVectorCacheTest {

    private TemporalGraphFixture fixture;
    private TermVectorCache cache;

    @BeforeEach
    void setUp() {
        fixture = TemporalGraphFixture.create();
        cache = new TermVectorCache(fixture.store, new TextTokenizer(3), 1_000);
    }

    @Test
    @DisplayName("Documents added after the last lookup are indexed by the next lookup itself")
    void testSimilarity_SyncsWithStoreOnEveryLookup() {
        // Given
        fixture.addOnDay("a", "payment invoice overdue", 0);
        fixture.addOnDay("b", "gardening tomatoes greenhouse", 1);
        assertEquals(0.0, cache.similarity("a", "b"));

        // When
        fixture.addOnDay("late", "payment invoice overdue reminder", 2);
        double score = cache.similarity("a", "late");

        // Then
        assertThat(score).isGreaterThan(0.5);
        assertEquals(3, cache.statistics().corpusSize());
    }

    @Test
    @DisplayName("A score computed before a corpus change is not served after it")
    void testSimilarity_NoStaleScoreAfterInsert() {
        // Given
        fixture.addOnDay("a", "payment invoice overdue", 0);
        fixture.addOnDay("b", "payment refund issued", 1);
        double before = cache.similarity("a", "b");

        // When
        fixture.addOnDay("c", "payment ledger entry", 2);
        fixture.addOnDay("d", "payment batch scheduled", 3);
        double after = cache.similarity("a", "b");

        // Then
        assertThat(after).isLessThan(before);
        assertEquals(0, cache.statistics().hits());
    }

    @Test
    @DisplayName("Self similarity depends on content, not on indexed terms")
    void testSimilarity_Self() {
        fixture.addOnDay("short", "to be or not", 0);
        fixture.addOnDay("blank", " ", 1);

        assertEquals(1.0, cache.similarity("short", "short"));
        assertEquals(0.0, cache.similarity("blank", "blank"));
    }
}
