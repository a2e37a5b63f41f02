package com.purchasingpower.timegraph.service.analysis;

import com.purchasingpower.timegraph.TemporalGraphFixture;
import com.purchasingpower.timegraph.core.RelationKind;
import com.purchasingpower.timegraph.model.analysis.CausalChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Causal Chain Extractor Tests")
class CausalChainExtractorTest {

    private TemporalGraphFixture fixture;
    private CausalChainExtractor extractor;

    @BeforeEach
    void setUp() {
        fixture = TemporalGraphFixture.create();
        extractor = new CausalChainExtractor(fixture.store);
    }

    private static List<List<String>> ids(List<CausalChain> chains) {
        return chains.stream().map(CausalChain::getDocumentIds).toList();
    }

    @Test
    @DisplayName("Branches produce one maximal chain each, ordered by their last document")
    void testExtract_Branches() {
        fixture.addOnDay("a", "a", 1);
        fixture.addOnDay("b", "b", 2);
        fixture.addOnDay("c", "c", 3);
        fixture.addOnDay("d", "d", 4);
        fixture.causal("a", "b");
        fixture.causal("a", "c");
        fixture.causal("b", "d");

        List<CausalChain> chains = extractor.extract(Set.of("a", "b", "c", "d"), Set.of("a"), List.of(), 10);

        assertEquals(List.of(List.of("a", "c"), List.of("a", "b", "d")), ids(chains));
    }

    @Test
    @DisplayName("Only causal edges inside the working set are followed")
    void testExtract_IgnoresOtherKindsAndOutsideDocuments() {
        fixture.addOnDay("a", "a", 1);
        fixture.addOnDay("b", "b", 2);
        fixture.addOnDay("seq", "seq", 3);
        fixture.addOnDay("outside", "outside", 4);
        fixture.causal("a", "b");
        fixture.link("b", "seq", RelationKind.SEQUENTIAL);
        fixture.causal("b", "outside");

        List<CausalChain> chains = extractor.extract(Set.of("a", "b", "seq"), Set.of("a", "b", "seq"), List.of(), 10);

        assertEquals(List.of(List.of("a", "b")), ids(chains));
    }

    @Test
    @DisplayName("Causal cycles terminate and still yield a chain")
    void testExtract_Cycle() {
        fixture.addOnDay("x", "x", 1);
        fixture.addOnDay("y", "y", 2);
        fixture.causal("x", "y");
        fixture.causal("y", "x");

        List<CausalChain> chains = extractor.extract(Set.of("x", "y"), Set.of("x"), List.of(), 10);

        assertEquals(List.of(List.of("x", "y")), ids(chains));
    }

    @Test
    @DisplayName("A chain carried from an earlier window is extended")
    void testExtract_GraftsCarriedChain() {
        fixture.addOnDay("a", "a", 1);
        fixture.addOnDay("b", "b", 2);
        fixture.addOnDay("c", "c", 100);
        fixture.causal("a", "b");
        fixture.causal("b", "c");
        CausalChain carried = CausalChain.of(List.of("root", "a", "b"));

        List<CausalChain> chains = extractor.extract(Set.of("b", "c"), Set.of("c"), List.of(carried), 10);

        assertEquals(List.of(List.of("root", "a", "b", "c")), ids(chains));
    }

    @Test
    @DisplayName("Chains without a required document are dropped")
    void testExtract_RequiresWindowDocument() {
        fixture.addOnDay("a", "a", 1);
        fixture.addOnDay("b", "b", 2);
        fixture.causal("a", "b");

        assertTrue(extractor.extract(Set.of("a", "b"), Set.of("other"), List.of(), 10).isEmpty());
    }

    @Test
    @DisplayName("Contained and duplicate chains are removed")
    void testRemoveContained() {
        CausalChain inner = CausalChain.of(List.of("a", "b"));
        CausalChain outer = CausalChain.of(List.of("z", "a", "b", "c"));
        CausalChain duplicate = CausalChain.of(List.of("z", "a", "b", "c"));
        CausalChain unrelated = CausalChain.of(List.of("b", "a"));

        List<CausalChain> result = CausalChainExtractor.removeContained(List.of(inner, outer, duplicate, unrelated));

        assertEquals(List.of(outer, unrelated), result);
    }
}
