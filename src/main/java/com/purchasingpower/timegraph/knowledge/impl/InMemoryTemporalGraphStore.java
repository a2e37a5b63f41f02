package com.purchasingpower.timegraph.knowledge.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.timegraph.configuration.EngineProperties;
import com.purchasingpower.timegraph.core.Document;
import com.purchasingpower.timegraph.core.RelationKind;
import com.purchasingpower.timegraph.core.Relationship;
import com.purchasingpower.timegraph.core.TemporalOrderWarning;
import com.purchasingpower.timegraph.exception.DocumentNotFoundException;
import com.purchasingpower.timegraph.exception.DuplicateDocumentException;
import com.purchasingpower.timegraph.exception.UnknownDocumentException;
import com.purchasingpower.timegraph.knowledge.RelationshipDirection;
import com.purchasingpower.timegraph.knowledge.TemporalGraphStore;
import com.purchasingpower.timegraph.time.TimestampNormalizer;
import com.purchasingpower.timegraph.util.LogFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Heap-backed implementation of {@link TemporalGraphStore}.
 *
 * <p>One {@link ReentrantReadWriteLock} guards the document map, both adjacency maps and the layer
 * index together, which makes each write atomic with respect to every read.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class InMemoryTemporalGraphStore implements TemporalGraphStore {

    private final TimestampNormalizer normalizer;
    private final TemporalLayerIndex layerIndex;

    private final Map<String, Document> documents = new LinkedHashMap<>();
    private final Map<String, List<Relationship>> outgoing = new HashMap<>();
    private final Map<String, List<Relationship>> incoming = new HashMap<>();
    private final Map<String, Long> documentLayers = new HashMap<>();
    private final List<TemporalOrderWarning> warnings = new ArrayList<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private int relationshipCount;
    private long corpusVersion;

    @Autowired
    public InMemoryTemporalGraphStore(TimestampNormalizer normalizer, EngineProperties properties) {
        this(normalizer, properties.getGraph().getLayerDurationDays());
    }

    public InMemoryTemporalGraphStore(TimestampNormalizer normalizer, int layerDurationDays) {
        this.normalizer = normalizer;
        this.layerIndex = new TemporalLayerIndex(layerDurationDays);
    }

    // =========================================================================
    // Document Operations
    // =========================================================================

    @Override
    public Document addDocument(String id, String content, Object timestamp, Map<String, Object> metadata) {
        Preconditions.checkArgument(id != null && !id.isBlank(), "Document id is required");
        Instant canonical = normalizer.normalize(timestamp);
        Document document = new Document(id, content, canonical, metadata);

        return write(() -> {
            if (documents.containsKey(id)) {
                throw new DuplicateDocumentException(id);
            }
            documents.put(id, document);
            long bucket = layerIndex.bucketOf(canonical);
            layerIndex.add(id, canonical);
            documentLayers.put(id, bucket);
            corpusVersion++;

            log.debug("Added document {} at {} ({}), content: {}", id, normalizer.format(canonical),
                    TemporalLayerIndex.label(bucket), LogFormat.truncate(document.getContent(), 60));
            return document;
        });
    }

    @Override
    public Document getDocument(String id) {
        return findDocument(id).orElseThrow(() -> new DocumentNotFoundException(id));
    }

    @Override
    public Optional<Document> findDocument(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return read(() -> Optional.ofNullable(documents.get(id)));
    }

    @Override
    public boolean containsDocument(String id) {
        return findDocument(id).isPresent();
    }

    @Override
    public Document updateMetadata(String id, String key, Object value) {
        return write(() -> {
            Document document = documents.get(id);
            if (document == null) {
                throw new DocumentNotFoundException(id);
            }
            document.putMetadata(key, value);
            return document;
        });
    }

    @Override
    public List<Document> getDocumentsInRange(Instant start, Instant end) {
        Preconditions.checkNotNull(start, "start");
        Preconditions.checkNotNull(end, "end");
        Preconditions.checkArgument(!end.isBefore(start), "Range end %s is before start %s", end, start);

        return read(() -> {
            List<Document> result = new ArrayList<>();
            for (String id : layerIndex.candidates(start, end)) {
                Document document = documents.get(id);
                Instant timestamp = document.getTimestamp();
                if (!timestamp.isBefore(start) && !timestamp.isAfter(end)) {
                    result.add(document);
                }
            }
            result.sort(TEMPORAL_ORDER);
            return result;
        });
    }

    @Override
    public List<Document> listDocuments(int limit) {
        Preconditions.checkArgument(limit >= 0, "limit must not be negative");
        return read(() -> documents.values().stream().limit(limit).toList());
    }

    @Override
    public List<Document> getAllDocuments() {
        return read(() -> documents.values().stream().sorted(TEMPORAL_ORDER).toList());
    }

    @Override
    public int documentCount() {
        return read(documents::size);
    }

    // =========================================================================
    // Relationship Operations
    // =========================================================================

    @Override
    public Relationship addRelationship(String fromId, String toId, RelationKind kind, double weight,
                                        Map<String, Object> metadata) {
        Preconditions.checkNotNull(kind, "Relation kind is required");
        Preconditions.checkArgument(Double.isFinite(weight), "Relationship weight must be finite");

        return write(() -> {
            Document from = documents.get(fromId);
            if (from == null) {
                throw new UnknownDocumentException(fromId, toId, fromId);
            }
            Document to = documents.get(toId);
            if (to == null) {
                throw new UnknownDocumentException(fromId, toId, toId);
            }

            TemporalOrderWarning warning = null;
            if (kind.isTemporallyOrdered() && from.getTimestamp().isAfter(to.getTimestamp())) {
                warning = new TemporalOrderWarning(fromId, toId, kind, from.getTimestamp(), to.getTimestamp());
                warnings.add(warning);
                log.warn("⚠️  {}", warning.getMessage());
            }

            Relationship relationship = Relationship.builder()
                    .fromId(fromId)
                    .toId(toId)
                    .kind(kind)
                    .weight(weight)
                    .metadata(metadata == null || metadata.isEmpty()
                            ? Map.of()
                            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                    .temporalOrderWarning(warning)
                    .build();

            outgoing.computeIfAbsent(fromId, key -> new ArrayList<>()).add(relationship);
            incoming.computeIfAbsent(toId, key -> new ArrayList<>()).add(relationship);
            relationshipCount++;

            log.debug("Added {} relationship {} -> {} (weight {})", kind.getValue(), fromId, toId, weight);
            return relationship;
        });
    }

    @Override
    public List<Relationship> getRelationships(String documentId, RelationshipDirection direction) {
        return read(() -> {
            if (!documents.containsKey(documentId)) {
                throw new DocumentNotFoundException(documentId);
            }
            List<Relationship> result = new ArrayList<>();
            if (direction != RelationshipDirection.INCOMING) {
                result.addAll(outgoing.getOrDefault(documentId, List.of()));
            }
            if (direction != RelationshipDirection.OUTGOING) {
                result.addAll(incoming.getOrDefault(documentId, List.of()));
            }
            return result;
        });
    }

    @Override
    public List<String> getDirectSuccessors(String documentId) {
        return getRelationships(documentId, RelationshipDirection.OUTGOING).stream()
                .map(Relationship::getToId)
                .distinct()
                .toList();
    }

    @Override
    public List<String> getDirectPredecessors(String documentId) {
        return getRelationships(documentId, RelationshipDirection.INCOMING).stream()
                .map(Relationship::getFromId)
                .distinct()
                .toList();
    }

    @Override
    public boolean hasEdge(String fromId, String toId) {
        return read(() -> outgoing.getOrDefault(fromId, List.of()).stream()
                .anyMatch(relationship -> relationship.getToId().equals(toId)));
    }

    @Override
    public List<Relationship> getAllRelationships() {
        return read(() -> {
            List<Relationship> result = new ArrayList<>(relationshipCount);
            for (String id : documents.keySet()) {
                result.addAll(outgoing.getOrDefault(id, List.of()));
            }
            return result;
        });
    }

    @Override
    public int relationshipCount() {
        return read(() -> relationshipCount);
    }

    @Override
    public List<TemporalOrderWarning> getTemporalOrderWarnings() {
        return read(() -> List.copyOf(warnings));
    }

    // =========================================================================
    // Layer Index
    // =========================================================================

    @Override
    public List<String> getLayerIds() {
        return read(layerIndex::labels);
    }

    @Override
    public String getLayerId(String documentId) {
        return read(() -> {
            Long bucket = documentLayers.get(documentId);
            if (bucket == null) {
                Document document = documents.get(documentId);
                if (document == null) {
                    throw new DocumentNotFoundException(documentId);
                }
                bucket = layerIndex.bucketOf(document.getTimestamp());
            }
            return TemporalLayerIndex.label(bucket);
        });
    }

    @Override
    public List<String> getLayerDocuments(String layerId) {
        long bucket = TemporalLayerIndex.parse(layerId);
        return read(() -> List.copyOf(layerIndex.bucket(bucket)));
    }

    @Override
    public List<String> getAdjacentLayers(String layerId) {
        long bucket = TemporalLayerIndex.parse(layerId);
        return read(() -> {
            List<String> adjacent = new ArrayList<>(2);
            if (layerIndex.hasBucket(bucket - 1)) {
                adjacent.add(TemporalLayerIndex.label(bucket - 1));
            }
            if (layerIndex.hasBucket(bucket + 1)) {
                adjacent.add(TemporalLayerIndex.label(bucket + 1));
            }
            return adjacent;
        });
    }

    @Override
    public long getCorpusVersion() {
        return read(() -> corpusVersion);
    }

    // =========================================================================
    // Locking helpers
    // =========================================================================

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
