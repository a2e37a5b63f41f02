package com.purchasingpower.timegraph.knowledge;

import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.RelationKind;
import com.purchasingpower.timegraph.core.Relationship;
import com.purchasingpower.timegraph.core.TemporalOrderWarning;
import com.purchasingpower.timegraph.exception.DocumentNotFoundException;
import com.purchasingpower.timegraph.exception.DuplicateDocumentException;
import com.purchasingpower.timegraph.exception.UnknownDocumentException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owner of documents (nodes) and typed relationships (edges), with a time-bucketed layer index.
 *
 * <p>Writes ({@code addDocument}, {@code addRelationship}, {@code updateMetadata}) are serialized
 * against each other and against reads; reads may run concurrently. No read ever observes the
 * layer index mid-update.
 *
 * @since 1.0.0
 */
public interface TemporalGraphStore {

    /** Canonical order for every document listing: timestamp, then id. */
    Comparator<Document> TEMPORAL_ORDER =
            Comparator.comparing(Document::getTimestamp).thenComparing(Document::getId);

    // =========================================================================
    // Document Operations
    // =========================================================================

    /**
     * Normalize the timestamp and insert a document into the primary map and the layer index.
     *
     * @param id Unique document id
     * @param content Document text
     * @param timestamp Any representation accepted by the timestamp normalizer
     * @param metadata Optional metadata, copied
     * @return The stored document
     * @throws DuplicateDocumentException if the id is taken
     */
    Document addDocument(String id, String content, Object timestamp, Map<String, Object> metadata);

    /**
     * @throws DocumentNotFoundException if no document has this id
     */
    Document getDocument(String id);

    Optional<Document> findDocument(String id);

    boolean containsDocument(String id);

    /**
     * Replace or add one metadata entry. Content and timestamp stay immutable.
     */
    Document updateMetadata(String id, String key, Object value);

    /**
     * All documents with canonical timestamp in {@code [start, end]}, ordered by timestamp then id.
     * Returns exactly what a linear scan would; the layer index only skips buckets.
     */
    List<Document> getDocumentsInRange(Instant start, Instant end);

    /** Documents in insertion order, at most {@code limit}. */
    List<Document> listDocuments(int limit);

    /** Every document in temporal order. */
    List<Document> getAllDocuments();

    int documentCount();

    // =========================================================================
    // Relationship Operations
    // =========================================================================

    /**
     * Create a directed relationship.
     *
     * <p>Sequential and causal relationships whose source is later than their target are still
     * created, carrying a {@link TemporalOrderWarning}.
     *
     * @throws UnknownDocumentException if either endpoint is absent
     */
    Relationship addRelationship(String fromId, String toId, RelationKind kind, double weight,
                                 Map<String, Object> metadata);

    default Relationship addRelationship(String fromId, String toId, RelationKind kind, double weight) {
        return addRelationship(fromId, toId, kind, weight, Map.of());
    }

    /**
     * Relationships touching a document.
     *
     * @param documentId Document id
     * @param direction OUTGOING (edges from it), INCOMING (edges to it) or BOTH
     * @throws DocumentNotFoundException if the document does not exist
     */
    List<Relationship> getRelationships(String documentId, RelationshipDirection direction);

    List<String> getDirectSuccessors(String documentId);

    List<String> getDirectPredecessors(String documentId);

    boolean hasEdge(String fromId, String toId);

    List<Relationship> getAllRelationships();

    int relationshipCount();

    /** Every warning recorded so far, in creation order. */
    List<TemporalOrderWarning> getTemporalOrderWarnings();

    // =========================================================================
    // Layer Index
    // =========================================================================

    /** Layer labels ({@code layer_<n>}) in ascending time order. */
    List<String> getLayerIds();

    String getLayerId(String documentId);

    List<String> getLayerDocuments(String layerId);

    /** Existing neighbour layers of a layer (one before, one after). */
    List<String> getAdjacentLayers(String layerId);

    // =========================================================================
    // Change Tracking
    // =========================================================================

    /**
     * Monotonic counter bumped by every document insert. Derived caches compare it to decide
     * whether they are stale.
     */
    long getCorpusVersion();
}
