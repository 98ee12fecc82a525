package me.golemcore.recall.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.recall.domain.model.ChatMessage;
import me.golemcore.recall.domain.model.Contact;
import me.golemcore.recall.domain.model.EventChanges;
import me.golemcore.recall.domain.model.EventStatus;
import me.golemcore.recall.domain.model.EventType;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.StoreStats;
import me.golemcore.recall.domain.model.Trigger;
import me.golemcore.recall.domain.model.TriggerType;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LocalEventStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    @TempDir
    java.nio.file.Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private Clock clock;
    private LocalEventStoreAdapter store;

    @BeforeEach
    void setUp() {
        RecallProperties properties = new RecallProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = newStore();
    }

    @Test
    void shouldAssignIdsAndDefaults() {
        MemoryEvent first = store.insertEvent(event("Netflix renewal").confidence(1.4).build());
        MemoryEvent second = store.insertEvent(event("Dinner").status(EventStatus.SCHEDULED).build());

        assertEquals(1L, first.getId());
        assertEquals(2L, second.getId());
        assertEquals(EventStatus.DISCOVERED, first.getStatus());
        assertEquals(EventStatus.SCHEDULED, second.getStatus());
        assertEquals(1.0, first.getConfidence());
        assertEquals(NOW, first.getCreatedAt());
    }

    @Test
    void shouldSurviveReload() {
        MemoryEvent inserted = store.insertEvent(event("Goa trip").type(EventType.TRAVEL)
                .eventTime(NOW.plus(Duration.ofDays(3))).participants(List.of("Asha")).build());
        store.insertTrigger(Trigger.builder().eventId(inserted.getId()).type(TriggerType.URL).value("goa").build());
        store.insertMessage(ChatMessage.builder().id("m1").chatId("c1").sender("Asha").content("goa?")
                .timestamp(NOW).build());

        LocalEventStoreAdapter reloaded = newStore();

        MemoryEvent loaded = reloaded.findEvent(inserted.getId()).orElseThrow();
        assertEquals("Goa trip", loaded.getTitle());
        assertEquals(EventType.TRAVEL, loaded.getType());
        assertEquals(List.of("Asha"), loaded.getParticipants());
        assertEquals(1, reloaded.getTriggers(inserted.getId()).size());
        assertEquals(1, reloaded.getRecentMessages("c1", 5).size());
        assertEquals(2L, reloaded.insertEvent(event("Next").build()).getId());
    }

    @Test
    void shouldReturnCopiesNotLiveState() {
        MemoryEvent inserted = store.insertEvent(event("Original").build());

        store.findEvent(inserted.getId()).orElseThrow().setTitle("Mutated");

        assertEquals("Original", store.findEvent(inserted.getId()).orElseThrow().getTitle());
    }

    @Test
    void shouldApplyPartialChanges() {
        MemoryEvent inserted = store.insertEvent(event("Standup").location("Room 1").build());

        Optional<MemoryEvent> updated = store.updateEvent(inserted.getId(),
                EventChanges.builder().location("Room 4").build());

        assertEquals("Room 4", updated.orElseThrow().getLocation());
        assertEquals("Standup", updated.get().getTitle());
        assertTrue(store.updateEvent(99L, EventChanges.builder().title("x").build()).isEmpty());
    }

    @Test
    void shouldDeleteEventWithTriggers() {
        MemoryEvent inserted = store.insertEvent(event("Cancel me").build());
        store.insertTrigger(Trigger.builder().eventId(inserted.getId()).type(TriggerType.KEYWORD).value("x").build());

        assertTrue(store.deleteEvent(inserted.getId()));
        assertFalse(store.deleteEvent(inserted.getId()));
        assertTrue(store.findEvent(inserted.getId()).isEmpty());
        assertTrue(store.getTriggers(inserted.getId()).isEmpty());
    }

    @Test
    void shouldClearSnoozeWhenStatusChanges() {
        MemoryEvent inserted = store.insertEvent(event("Pay bill").build());
        Instant until = NOW.plus(Duration.ofHours(1));

        store.snoozeEvent(inserted.getId(), until);
        assertEquals(EventStatus.SNOOZED, store.findEvent(inserted.getId()).orElseThrow().getStatus());
        assertEquals(until, store.findEvent(inserted.getId()).orElseThrow().getSnoozedUntil());

        store.updateStatus(inserted.getId(), EventStatus.SCHEDULED);
        assertNull(store.findEvent(inserted.getId()).orElseThrow().getSnoozedUntil());
        assertFalse(store.updateStatus(99L, EventStatus.COMPLETED));
    }

    @Test
    void shouldListActiveEventsNewestFirst() {
        store.insertEvent(event("Old").createdAt(NOW.minus(Duration.ofDays(2))).build());
        store.insertEvent(event("New").createdAt(NOW.minus(Duration.ofHours(1))).build());
        store.insertEvent(event("Done").status(EventStatus.COMPLETED).build());

        assertEquals(List.of("New", "Old"), store.getActiveEvents(10).stream().map(MemoryEvent::getTitle).toList());
        assertEquals(1, store.getActiveEvents(1).size());
    }

    @Test
    void shouldRankActiveEventsByKeywordHits() {
        store.insertEvent(event("Netflix renewal").keywords("netflix,subscription").build());
        store.insertEvent(event("Streaming budget").keywords("netflix").build());
        store.insertEvent(event("Old netflix").keywords("netflix,subscription").status(EventStatus.IGNORED).build());

        List<MemoryEvent> matches = store.findActiveEventsByKeywords(List.of("Netflix", "subscription"));

        assertEquals(List.of("Netflix renewal", "Streaming budget"),
                matches.stream().map(MemoryEvent::getTitle).toList());
        assertTrue(store.findActiveEventsByKeywords(List.of(" ")).isEmpty());
    }

    @Test
    void shouldFindDuplicateOnlyWithinWindow() {
        store.insertEvent(event("Dinner with Priya").createdAt(NOW.minus(Duration.ofHours(10))).build());
        store.insertEvent(event("Gym membership").createdAt(NOW.minus(Duration.ofDays(5))).build());

        assertTrue(store.findDuplicateEvent("dinner with priya!", 48).isPresent());
        assertTrue(store.findDuplicateEvent("Gym membership", 48).isEmpty());
        assertTrue(store.findDuplicateEvent("Dinner", 48).isEmpty());
    }

    @Test
    void shouldFindConflictsAmongScheduledEventsOnly() {
        Instant at = NOW.plus(Duration.ofDays(1));
        store.insertEvent(event("Dentist").status(EventStatus.SCHEDULED).eventTime(at.plusSeconds(1800)).build());
        store.insertEvent(event("Call").status(EventStatus.DISCOVERED).eventTime(at).build());
        store.insertEvent(event("Late").status(EventStatus.SCHEDULED).eventTime(at.plusSeconds(7200)).build());

        List<MemoryEvent> conflicts = store.findTimeConflicts(at, 60);

        assertEquals(List.of("Dentist"), conflicts.stream().map(MemoryEvent::getTitle).toList());
    }

    @Test
    void shouldSearchLiveEventsByLocationAndTag() {
        store.insertEvent(event("Goa trip").location("North Goa").build());
        store.insertEvent(event("Lipstick").contextUrl("nykaa").build());
        store.insertEvent(event("Stale Goa").location("Goa").createdAt(NOW.minus(Duration.ofDays(100))).build());

        assertEquals(List.of("Goa trip"), titles(store.searchByLocation("GOA", 90, 10)));
        assertEquals(List.of("Lipstick"), titles(store.searchByLocation("nykaa", 90, 10)));
        assertTrue(store.searchByLocation(" ", 90, 10).isEmpty());
    }

    @Test
    void shouldSearchLiveEventsByKeywordsWithLimit() {
        store.insertEvent(event("Cancel Netflix").keywords("netflix,subscription").build());
        store.insertEvent(event("Watch Dark").description("on netflix").build());
        store.insertEvent(event("Unrelated").keywords("gym").build());

        assertEquals(List.of("Cancel Netflix", "Watch Dark"),
                titles(store.searchByKeywords(List.of("netflix", "subscription"), 90, 10)));
        assertEquals(1, store.searchByKeywords(List.of("netflix"), 90, 1).size());
    }

    @Test
    void shouldKeepChatHistoryChronological() {
        store.insertMessage(message("m2", "c1", NOW.minusSeconds(60)));
        store.insertMessage(message("m1", "c1", NOW.minusSeconds(120)));
        store.insertMessage(message("m3", "c1", NOW));
        store.insertMessage(message("x1", "c2", NOW));

        List<ChatMessage> recent = store.getRecentMessages("c1", 2);

        assertEquals(List.of("m2", "m3"), recent.stream().map(ChatMessage::getId).toList());
    }

    @Test
    void shouldBoundRecentWindowPerChatButCountEveryMessage() {
        int total = LocalEventStoreAdapter.RECENT_MESSAGES_PER_CHAT + 10;
        for (int i = 0; i < total; i++) {
            store.insertMessage(message("m" + i, "c1", NOW.plusSeconds(i)));
        }

        List<ChatMessage> window = store.getRecentMessages("c1", 1000);

        assertEquals(LocalEventStoreAdapter.RECENT_MESSAGES_PER_CHAT, window.size());
        assertEquals("m10", window.get(0).getId());
        assertEquals("m" + (total - 1), window.get(window.size() - 1).getId());
        assertEquals(total, store.getStats().getTotalMessages());
        assertTrue(store.getRecentMessages("unknown", 5).isEmpty());

        LocalEventStoreAdapter reloaded = newStore();
        assertEquals(total, reloaded.getStats().getTotalMessages());
        assertEquals("m" + (total - 1), reloaded.getRecentMessages("c1", 1).get(0).getId());
    }

    @Test
    void shouldCountContactMessages() {
        store.upsertContact(Contact.builder().id("91999").name("Asha").firstSeen(NOW).lastSeen(NOW)
                .messageCount(1).build());
        Contact updated = store.upsertContact(Contact.builder().id("91999").lastSeen(NOW.plusSeconds(5))
                .messageCount(1).build());

        assertEquals(2, updated.getMessageCount());
        assertEquals("Asha", updated.getName());
        assertEquals(NOW.plusSeconds(5), updated.getLastSeen());
    }

    @Test
    void shouldReportStats() {
        MemoryEvent a = store.insertEvent(event("A").build());
        store.insertEvent(event("B").status(EventStatus.COMPLETED).build());
        store.insertTrigger(Trigger.builder().eventId(a.getId()).type(TriggerType.KEYWORD).value("a").build());
        store.insertMessage(message("m1", "c1", NOW));

        StoreStats stats = store.getStats();

        assertEquals(2, stats.getTotalEvents());
        assertEquals(1, stats.getActiveEvents());
        assertEquals(1, stats.getCompletedEvents());
        assertEquals(1, stats.getPendingTriggers());
        assertEquals(1, stats.getTotalMessages());
    }

    private LocalEventStoreAdapter newStore() {
        LocalEventStoreAdapter adapter = new LocalEventStoreAdapter(storage, objectMapper, clock);
        adapter.init();
        return adapter;
    }

    private static MemoryEvent.MemoryEventBuilder event(String title) {
        return MemoryEvent.builder().title(title).confidence(0.9);
    }

    private static ChatMessage message(String id, String chatId, Instant timestamp) {
        return ChatMessage.builder().id(id).chatId(chatId).sender("s").content("hello " + id)
                .timestamp(timestamp).build();
    }

    private static List<String> titles(List<MemoryEvent> events) {
        return events.stream().map(MemoryEvent::getTitle).toList();
    }
}
