package me.golemcore.recall.domain.service;

import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EventTimeNormalizerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private EventTimeNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EventTimeNormalizer(Clock.fixed(NOW, ZoneOffset.UTC), new RecallProperties());
    }

    @Test
    void shouldParseSupportedShapes() {
        assertEquals(Optional.of(Instant.parse("2026-01-02T17:00:00Z")),
                normalizer.parse("2026-01-02T17:00:00Z"));
        assertEquals(Optional.of(Instant.parse("2026-01-02T11:30:00Z")),
                normalizer.parse("2026-01-02T17:00:00+05:30"));
        assertEquals(Optional.of(Instant.parse("2026-01-02T17:00:00Z")),
                normalizer.parse("2026-01-02 17:00:00"));
        assertEquals(Optional.of(Instant.parse("2026-01-02T17:00:00Z")),
                normalizer.parse("2026-01-02T17:00"));
        assertEquals(Optional.of(Instant.parse("2026-01-02T00:00:00Z")),
                normalizer.parse("2026-01-02"));
        assertEquals(Optional.of(Instant.ofEpochSecond(1767369600L)),
                normalizer.parse("1767369600"));
    }

    @Test
    void shouldTreatGarbageAsAbsent() {
        assertTrue(normalizer.parse(null).isEmpty());
        assertTrue(normalizer.parse("  ").isEmpty());
        assertTrue(normalizer.parse("null").isEmpty());
        assertTrue(normalizer.parse("next friday-ish").isEmpty());
    }

    @Test
    void shouldKeepFutureAndSlightlyPastTimes() {
        Instant future = NOW.plusSeconds(3600);
        Instant slightlyPast = NOW.minusSeconds(1800);

        assertEquals(future, normalizer.rollForward(future));
        assertEquals(slightlyPast, normalizer.rollForward(slightlyPast));
    }

    @Test
    void shouldRollStaleTimesForwardByWeeks() {
        Instant lastWeek = Instant.parse("2025-12-26T17:00:00Z");
        Instant threeWeeksAgo = Instant.parse("2025-12-12T17:00:00Z");

        assertEquals(Instant.parse("2026-01-02T17:00:00Z"), normalizer.rollForward(lastWeek));
        assertEquals(Instant.parse("2026-01-02T17:00:00Z"), normalizer.rollForward(threeWeeksAgo));
    }

    @Test
    void shouldNormalizeEndToEnd() {
        assertEquals(Optional.of(Instant.parse("2026-01-02T17:00:00Z")),
                normalizer.normalize("2025-12-26 17:00"));
    }

    @Test
    void shouldDescribeInConfiguredZone() {
        assertEquals("Friday, Jan 2 5:00 PM", normalizer.describe(Instant.parse("2026-01-02T17:00:00Z")));
    }

    @Test
    void shouldHonourConfiguredZone() {
        RecallProperties properties = new RecallProperties();
        properties.getIngestion().setZoneId("Asia/Kolkata");
        EventTimeNormalizer kolkata = new EventTimeNormalizer(Clock.fixed(NOW, ZoneOffset.UTC), properties);

        assertEquals(Optional.of(Instant.parse("2026-01-02T11:30:00Z")), kolkata.parse("2026-01-02T17:00"));
    }
}
