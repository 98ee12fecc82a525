package me.golemcore.recall.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class EventStatusTest {

    @Test
    void shouldAllowLifecycleTransitions() {
        assertTrue(EventStatus.DISCOVERED.canTransitionTo(EventStatus.SCHEDULED));
        assertTrue(EventStatus.SCHEDULED.canTransitionTo(EventStatus.REMINDED));
        assertTrue(EventStatus.REMINDED.canTransitionTo(EventStatus.SNOOZED));
        assertTrue(EventStatus.SNOOZED.canTransitionTo(EventStatus.SCHEDULED));
    }

    @Test
    void shouldRejectUnlistedTransitions() {
        assertFalse(EventStatus.DISCOVERED.canTransitionTo(EventStatus.COMPLETED));
        assertFalse(EventStatus.REMINDED.canTransitionTo(EventStatus.IGNORED));
        assertFalse(EventStatus.SCHEDULED.canTransitionTo(EventStatus.DISCOVERED));
    }

    @ParameterizedTest
    @EnumSource(value = EventStatus.class, names = { "COMPLETED", "IGNORED" })
    void shouldTreatTerminalStatusesAsFinal(EventStatus status) {
        assertTrue(status.isTerminal());
        for (EventStatus target : EventStatus.values()) {
            assertFalse(status.canTransitionTo(target));
        }
    }

    @Test
    void shouldParseValuesLeniently() {
        assertEquals(EventStatus.SNOOZED, EventStatus.fromValue(" Snoozed "));
        assertTrue(EventStatus.find("expired").isEmpty());
        assertTrue(EventStatus.find(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> EventStatus.fromValue("archived"));
    }

    @Test
    void shouldExposeDistinctMarkers() {
        assertEquals("⏰", EventStatus.SCHEDULED.getMarker());
        assertEquals("✅", EventStatus.COMPLETED.getMarker());
        assertNotEquals(EventStatus.EXPIRED_MARKER, EventStatus.UNKNOWN_MARKER);
    }
}
