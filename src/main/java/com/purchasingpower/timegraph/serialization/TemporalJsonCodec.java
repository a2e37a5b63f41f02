package com.purchasingpower.timegraph.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.base.Preconditions;
import com.purchasingpower.timegraph.exception.SerializationException;
import com.purchasingpower.timegraph.exception.TemporalGraphException;
import com.purchasingpower.timegraph.time.TimestampNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;

/**
 * JSON interchange for documents, analysis results and graph exports.
 *
 * <p>Every {@link Instant} is written in the canonical profile
 * {@code uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'} and read back through the {@link TimestampNormalizer},
 * so a round trip never changes a timestamp.
 */
@Slf4j
@Component
public class TemporalJsonCodec {

    private final ObjectMapper objectMapper;

    public TemporalJsonCodec(TimestampNormalizer normalizer) {
        SimpleModule canonicalTime = new SimpleModule("canonical-time");
        canonicalTime.addSerializer(Instant.class, new CanonicalInstantSerializer(normalizer));
        canonicalTime.addDeserializer(Instant.class, new CanonicalInstantDeserializer(normalizer));

        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .addModule(canonicalTime)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + typeName(value), e);
        }
    }

    public String toPrettyJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + typeName(value), e);
        }
    }

    public <T> T fromJson(String json, Class<T> type) {
        Preconditions.checkNotNull(json, "json");
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.debug("Rejected {} JSON: {}", type.getSimpleName(), e.getOriginalMessage());
            throw new SerializationException("Failed to read " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    public JsonNode toTree(Object value) {
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Failed to convert " + typeName(value), e);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static final class CanonicalInstantSerializer extends JsonSerializer<Instant> {

        private final TimestampNormalizer normalizer;

        private CanonicalInstantSerializer(TimestampNormalizer normalizer) {
            this.normalizer = normalizer;
        }

        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(normalizer.format(value));
        }
    }

    private static final class CanonicalInstantDeserializer extends JsonDeserializer<Instant> {

        private final TimestampNormalizer normalizer;

        private CanonicalInstantDeserializer(TimestampNormalizer normalizer) {
            this.normalizer = normalizer;
        }

        @Override
        public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String text = parser.getValueAsString();
            if (text == null || text.isBlank()) {
                return null;
            }
            try {
                return normalizer.parseCanonical(text);
            } catch (TemporalGraphException e) {
                return (Instant) context.handleWeirdStringValue(Instant.class, text, e.getMessage());
            }
        }
    }
}
