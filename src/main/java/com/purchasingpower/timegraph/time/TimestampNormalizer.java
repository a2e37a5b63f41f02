package com.purchasingpower.timegraph.time;

import com.google.common.base.Preconditions;
import com.purchasingpower.timegraph.configuration.EngineProperties;
import com.purchasingpower.timegraph.exception.ErrorCode;
import com.purchasingpower.timegraph.exception.IncomparableTimestampException;
import com.purchasingpower.timegraph.exception.TemporalGraphException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Map;

/**
 * The single normalization boundary for time values.
 *
 * <p>Every timestamp that enters the graph, and every bound used to query it, passes through
 * {@link #normalize(Object)} and comes out as a UTC {@link Instant} truncated to microseconds.
 * Nothing downstream ever sees a zone-less or offset-carrying value.
 *
 * <p>Zone-less inputs ({@link LocalDateTime}, {@link LocalDate}, ISO strings without an offset)
 * are interpreted in the configured naive zone, UTC unless overridden.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class TimestampNormalizer {

    /**
     * Fixed textual profile for canonical timestamps: always UTC, always six fractional digits.
     */
    public static final DateTimeFormatter CANONICAL_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    @Getter
    private final ZoneId naiveZone;

    @Autowired
    public TimestampNormalizer(EngineProperties properties) {
        this(ZoneId.of(properties.getTime().getNaiveZone()));
    }

    public TimestampNormalizer(ZoneId naiveZone) {
        this.naiveZone = Preconditions.checkNotNull(naiveZone, "naiveZone");
    }

    public static TimestampNormalizer utc() {
        return new TimestampNormalizer(ZoneOffset.UTC);
    }

    /**
     * Converts any supported representation into the canonical instant.
     *
     * @param raw Instant, OffsetDateTime, ZonedDateTime, LocalDateTime, LocalDate, Date,
     *            epoch millis or an ISO-8601 string
     * @return canonical UTC instant, microsecond precision
     */
    public Instant normalize(Object raw) {
        Preconditions.checkNotNull(raw, "timestamp must not be null");

        Instant instant;
        if (raw instanceof Instant value) {
            instant = value;
        } else if (raw instanceof OffsetDateTime value) {
            instant = value.toInstant();
        } else if (raw instanceof ZonedDateTime value) {
            instant = value.toInstant();
        } else if (raw instanceof LocalDateTime value) {
            instant = value.atZone(naiveZone).toInstant();
        } else if (raw instanceof LocalDate value) {
            instant = value.atStartOfDay(naiveZone).toInstant();
        } else if (raw instanceof Date value) {
            instant = value.toInstant();
        } else if (raw instanceof Number value) {
            instant = Instant.ofEpochMilli(value.longValue());
        } else if (raw instanceof CharSequence value) {
            instant = normalize(parse(value.toString()));
        } else {
            throw new TemporalGraphException(ErrorCode.INVALID_ARGUMENT,
                    "Unsupported timestamp type: " + raw.getClass().getName(),
                    Map.of("type", raw.getClass().getName()));
        }
        return instant.truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Compares two raw values. Both sides must agree on carrying zone information; mixing a
     * zone-aware value with a zone-naive one is rejected instead of guessed.
     *
     * @throws IncomparableTimestampException when exactly one side is zone-naive
     */
    public int compareRaw(Object left, Object right) {
        Object leftValue = left instanceof CharSequence text ? parse(text.toString()) : left;
        Object rightValue = right instanceof CharSequence text ? parse(text.toString()) : right;

        if (isZoneAware(leftValue) != isZoneAware(rightValue)) {
            throw new IncomparableTimestampException(left, right);
        }
        return normalize(leftValue).compareTo(normalize(rightValue));
    }

    public String format(Instant canonical) {
        return CANONICAL_FORMAT.format(canonical);
    }

    public Instant parseCanonical(String text) {
        return normalize(text);
    }

    private boolean isZoneAware(Object value) {
        return !(value instanceof LocalDateTime || value instanceof LocalDate);
    }

    private TemporalAccessor parse(String text) {
        String trimmed = text.trim();
        if (trimmed.length() > 10 && trimmed.charAt(10) == ' ') {
            trimmed = trimmed.substring(0, 10) + 'T' + trimmed.substring(11);
        }
        try {
            return (TemporalAccessor) DateTimeFormatter.ISO_DATE_TIME.parseBest(trimmed,
                    ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException dateTimeFailure) {
            try {
                return LocalDate.parse(trimmed);
            } catch (DateTimeException dateFailure) {
                log.debug("Rejected timestamp text '{}': {}", trimmed, dateTimeFailure.getMessage());
                throw new TemporalGraphException(ErrorCode.INVALID_ARGUMENT,
                        "Unparseable timestamp: " + text, Map.of("value", text), dateTimeFailure);
            }
        }
    }
}
