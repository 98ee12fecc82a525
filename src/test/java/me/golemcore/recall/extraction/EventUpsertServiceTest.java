package me.golemcore.recall.extraction;

import me.golemcore.recall.domain.model.EventAction;
import me.golemcore.recall.domain.model.EventCandidate;
import me.golemcore.recall.domain.model.EventChanges;
import me.golemcore.recall.domain.model.EventStatus;
import me.golemcore.recall.domain.model.EventType;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.Trigger;
import me.golemcore.recall.domain.model.TriggerType;
import me.golemcore.recall.domain.service.EventTimeNormalizer;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.EventStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EventUpsertServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private EventStorePort eventStore;
    private EventUpsertService service;

    @BeforeEach
    void setUp() {
        eventStore = mock(EventStorePort.class);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        RecallProperties properties = new RecallProperties();
        service = new EventUpsertService(eventStore, new EventTimeNormalizer(clock, properties),
                new ContextTagResolver(), new TriggerPlanner(clock), properties);
        when(eventStore.insertEvent(any(MemoryEvent.class))).thenAnswer(inv -> {
            MemoryEvent event = inv.getArgument(0);
            event.setId(10L);
            return event;
        });
        when(eventStore.insertTrigger(any(Trigger.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void shouldScheduleTaggedRecommendationWithContextTriggers() {
        EventCandidate lipstick = EventCandidate.builder()
                .type(EventType.RECOMMENDATION)
                .title("Buy MAC lipstick for sister's birthday")
                .keywords(List.of("lipstick", "mac", "birthday", "gift"))
                .confidence(0.85)
                .build();

        UpsertSummary summary = service.upsert(List.of(lipstick), "msg-1", "Rahul");

        assertEquals(1, summary.eventsCreated());
        MemoryEvent event = summary.events().get(0).getEvent();
        assertEquals(EventStatus.SCHEDULED, event.getStatus());
        assertEquals("nykaa", event.getContextUrl());
        assertEquals("Rahul", event.getSenderName());
        assertEquals("msg-1", event.getMessageId());
        assertEquals("lipstick,mac,birthday,gift", event.getKeywords());

        ArgumentCaptor<Trigger> triggers = ArgumentCaptor.forClass(Trigger.class);
        verify(eventStore, times(3)).insertTrigger(triggers.capture());
        assertEquals(List.of("nykaa", "birthday", "gift"), triggers.getAllValues().stream()
                .map(Trigger::getValue).toList());
        assertEquals(TriggerType.URL, triggers.getAllValues().get(0).getType());
        assertEquals(3, summary.triggersCreated());
    }

    @Test
    void shouldLeaveUntaggedTimedEventDiscovered() {
        EventCandidate meeting = EventCandidate.builder()
                .type(EventType.MEETING)
                .title("Meeting with Nityam")
                .eventTime("2026-01-02T17:00:00Z")
                .keywords(List.of("nityam"))
                .confidence(0.9)
                .build();

        UpsertSummary summary = service.upsert(List.of(meeting), "msg-2", "Nityam");

        MemoryEvent event = summary.events().get(0).getEvent();
        assertEquals(EventStatus.DISCOVERED, event.getStatus());
        assertNull(event.getContextUrl());
        assertEquals(Instant.parse("2026-01-02T17:00:00Z"), event.getEventTime());
        assertEquals(3, summary.triggersCreated());
    }

    @Test
    void shouldSkipLowConfidenceCandidates() {
        UpsertSummary summary = service.upsert(List.of(candidate("Maybe lunch", 0.64)), "m", "s");

        assertEquals(0, summary.eventsCreated());
        verify(eventStore, never()).insertEvent(any());
    }

    @Test
    void shouldSkipDuplicates() {
        when(eventStore.findDuplicateEvent(eq("Dinner with Priya"), eq(48)))
                .thenReturn(Optional.of(MemoryEvent.builder().id(4L).title("Dinner with Priya").build()));

        UpsertSummary summary = service.upsert(List.of(candidate("Dinner with Priya", 0.9)), "m", "s");

        assertEquals(0, summary.eventsCreated());
        assertTrue(summary.events().isEmpty());
        verify(eventStore, never()).insertEvent(any());
    }

    @Test
    void shouldReportConflictsExcludingItself() {
        Instant at = Instant.parse("2026-01-02T17:00:00Z");
        when(eventStore.findTimeConflicts(at, 60)).thenReturn(List.of(
                MemoryEvent.builder().id(10L).title("Self").eventTime(at).build(),
                MemoryEvent.builder().id(7L).title("Dentist").eventTime(at.plusSeconds(1800)).build()));
        EventCandidate candidate = candidate("Call with bank", 0.9);
        candidate.setEventTime("2026-01-02T17:00:00Z");

        UpsertSummary summary = service.upsert(List.of(candidate), "m", "s");

        assertEquals(1, summary.events().get(0).getConflicts().size());
        assertEquals(7L, summary.events().get(0).getConflicts().get(0).id());
    }

    @Test
    void shouldApplyUpdateToTarget() {
        MemoryEvent target = MemoryEvent.builder().id(12L).title("Standup").status(EventStatus.SCHEDULED).build();
        when(eventStore.findEvent(12L)).thenReturn(Optional.of(target));
        when(eventStore.updateEvent(eq(12L), any(EventChanges.class))).thenReturn(Optional.of(target));
        EventCandidate update = candidate("Standup", 0.9);
        update.setEventAction(EventAction.UPDATE);
        update.setTargetEventId(12L);
        update.setLocation("Room 4");

        UpsertSummary summary = service.upsert(List.of(update), "m", "s");

        assertEquals(1, summary.eventsUpdated());
        assertEquals(0, summary.eventsCreated());
        assertTrue(summary.events().get(0).isUpdated());
        ArgumentCaptor<EventChanges> changes = ArgumentCaptor.forClass(EventChanges.class);
        verify(eventStore).updateEvent(eq(12L), changes.capture());
        assertEquals("Room 4", changes.getValue().getLocation());
        verify(eventStore, never()).insertEvent(any());
        verify(eventStore, never()).findDuplicateEvent(anyString(), anyInt());
    }

    @Test
    void shouldMergeDescriptionAndParticipants() {
        MemoryEvent target = MemoryEvent.builder().id(5L).title("Goa trip").description("Flights booked")
                .participants(List.of("Asha")).status(EventStatus.DISCOVERED).build();
        EventCandidate merge = candidate("Goa trip", 0.9);
        merge.setEventAction(EventAction.MERGE);
        merge.setDescription("Hotel near Baga");
        merge.setParticipants(List.of("Asha", "Ravi"));

        EventChanges changes = service.mergeChanges(merge, target);

        assertEquals("Flights booked. Hotel near Baga", changes.getDescription());
        assertEquals(List.of("Asha", "Ravi"), changes.getParticipants());
        assertNull(changes.getTitle());
    }

    @Test
    void shouldSkipMergeWithoutAdditions() {
        MemoryEvent target = MemoryEvent.builder().id(5L).title("Goa trip").status(EventStatus.DISCOVERED).build();
        when(eventStore.findEvent(5L)).thenReturn(Optional.of(target));
        EventCandidate merge = candidate("Goa trip", 0.9);
        merge.setEventAction(EventAction.MERGE);
        merge.setTargetEventId(5L);

        UpsertSummary summary = service.upsert(List.of(merge), "m", "s");

        assertEquals(0, summary.eventsUpdated());
        verify(eventStore, never()).updateEvent(anyLong(), any());
    }

    @Test
    void shouldCreateWhenUpdateTargetIsMissing() {
        when(eventStore.findEvent(99L)).thenReturn(Optional.empty());
        EventCandidate update = candidate("Pay electricity bill", 0.9);
        update.setEventAction(EventAction.UPDATE);
        update.setTargetEventId(99L);

        UpsertSummary summary = service.upsert(List.of(update), "m", "s");

        assertEquals(1, summary.eventsCreated());
        assertEquals(0, summary.eventsUpdated());
        verify(eventStore).insertEvent(any(MemoryEvent.class));
    }

    private static EventCandidate candidate(String title, double confidence) {
        return EventCandidate.builder()
                .type(EventType.TASK)
                .title(title)
                .confidence(confidence)
                .build();
    }
}
