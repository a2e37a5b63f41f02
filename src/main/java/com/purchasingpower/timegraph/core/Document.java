package com.purchasingpower.timegraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A timestamped document, the node type of the temporal graph.
 *
 * <p>Identity, content and timestamp are fixed at creation. The timestamp is always canonical
 * (see {@code TimestampNormalizer}). Metadata is the only mutable part and is guarded by its own
 * monitor, so readers always see a consistent copy.
 */
@Getter
@ToString(exclude = "metadata")
@EqualsAndHashCode(of = "id")
public class Document {

    private final String id;
    private final String content;
    private final Instant timestamp;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Object> metadata;

    @JsonCreator
    public Document(@JsonProperty("id") String id,
                    @JsonProperty("content") String content,
                    @JsonProperty("timestamp") Instant timestamp,
                    @JsonProperty("metadata") Map<String, Object> metadata) {
        this.id = Preconditions.checkNotNull(id, "id");
        this.content = content == null ? "" : content;
        this.timestamp = Preconditions.checkNotNull(timestamp, "timestamp");
        this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
    }

    public Map<String, Object> getMetadata() {
        synchronized (metadata) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }
    }

    public void putMetadata(String key, Object value) {
        Preconditions.checkNotNull(key, "metadata key");
        synchronized (metadata) {
            metadata.put(key, value);
        }
    }

    public boolean hasContent() {
        return !content.isBlank();
    }
}
