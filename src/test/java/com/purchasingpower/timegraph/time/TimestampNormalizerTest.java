package com.purchasingpower.timegraph.time;

import com.purchasingpower.timegraph.exception.ErrorCode;
import com.purchasingpower.timegraph.exception.IncomparableTimestampException;
import com.purchasingpower.timegraph.exception.TemporalGraphException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Timestamp Normalizer Tests")
class TimestampNormalizerTest {

    private final TimestampNormalizer normalizer = TimestampNormalizer.utc();

    @Test
    @DisplayName("Every supported representation of the same moment normalizes to one instant")
    void testNormalize_AllRepresentationsAgree() {
        Instant expected = Instant.parse("2024-03-01T08:00:00Z");

        assertEquals(expected, normalizer.normalize(expected));
        assertEquals(expected, normalizer.normalize(OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.ofHours(2))));
        assertEquals(expected, normalizer.normalize(ZonedDateTime.of(2024, 3, 1, 9, 0, 0, 0, ZoneId.of("Europe/Paris"))));
        assertEquals(expected, normalizer.normalize(LocalDateTime.of(2024, 3, 1, 8, 0)));
        assertEquals(expected, normalizer.normalize(Date.from(expected)));
        assertEquals(expected, normalizer.normalize(expected.toEpochMilli()));
        assertEquals(expected, normalizer.normalize("2024-03-01T10:00:00+02:00"));
        assertEquals(expected, normalizer.normalize("2024-03-01T08:00:00Z"));
        assertEquals(expected, normalizer.normalize("2024-03-01T08:00:00"));
        assertEquals(expected, normalizer.normalize("2024-03-01 08:00:00"));
    }

    @Test
    @DisplayName("Date-only input means start of day in the naive zone")
    void testNormalize_DateOnly() {
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), normalizer.normalize("2024-03-01"));
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), normalizer.normalize(LocalDate.of(2024, 3, 1)));
    }

    @Test
    @DisplayName("Naive inputs use the configured zone")
    void testNormalize_ConfiguredNaiveZone() {
        TimestampNormalizer berlin = new TimestampNormalizer(ZoneId.of("Europe/Berlin"));

        Instant result = berlin.normalize(LocalDateTime.of(2024, 1, 15, 12, 0));

        assertEquals(Instant.parse("2024-01-15T11:00:00Z"), result);
        assertEquals(ZoneId.of("Europe/Berlin"), berlin.getNaiveZone());
    }

    @Test
    @DisplayName("Canonical instants are truncated to microseconds")
    void testNormalize_TruncatesToMicros() {
        Instant result = normalizer.normalize(Instant.parse("2024-01-01T00:00:00.123456789Z"));

        assertEquals(Instant.parse("2024-01-01T00:00:00.123456Z"), result);
        assertEquals("2024-01-01T00:00:00.123456Z", normalizer.format(result));
    }

    @Test
    @DisplayName("Unsupported and unparseable values fail with INVALID_ARGUMENT")
    void testNormalize_RejectsBadInput() {
        TemporalGraphException wrongType = assertThrows(TemporalGraphException.class,
                () -> normalizer.normalize(new Object()));
        TemporalGraphException garbage = assertThrows(TemporalGraphException.class,
                () -> normalizer.normalize("yesterday-ish"));

        assertEquals(ErrorCode.INVALID_ARGUMENT, wrongType.getCode());
        assertEquals(ErrorCode.INVALID_ARGUMENT, garbage.getCode());
        assertThrows(NullPointerException.class, () -> normalizer.normalize(null));
    }

    @Test
    @DisplayName("Comparing a zone-naive with a zone-aware raw value is rejected")
    void testCompareRaw_MixedRepresentations() {
        IncomparableTimestampException error = assertThrows(IncomparableTimestampException.class,
                () -> normalizer.compareRaw(LocalDateTime.of(2024, 1, 1, 0, 0), Instant.parse("2024-01-01T00:00:00Z")));
        assertEquals(ErrorCode.INCOMPARABLE_TIMESTAMP, error.getCode());

        assertThrows(IncomparableTimestampException.class,
                () -> normalizer.compareRaw("2024-01-01T00:00:00", "2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Raw values of the same kind compare by instant")
    void testCompareRaw_SameKind() {
        assertTrue(normalizer.compareRaw("2024-01-01T00:00:00", "2024-01-02T00:00:00") < 0);
        assertTrue(normalizer.compareRaw("2024-01-01T03:00:00+02:00", "2024-01-01T00:00:00Z") > 0);
        assertEquals(0, normalizer.compareRaw(Instant.parse("2024-01-01T00:00:00Z"), "2024-01-01T01:00:00+01:00"));
    }

    @Test
    @DisplayName("Canonical text parses back to the same instant")
    void testParseCanonical() {
        Instant instant = Instant.parse("2024-06-30T23:59:59.000001Z");

        assertEquals(instant, normalizer.parseCanonical(normalizer.format(instant)));
    }
}
