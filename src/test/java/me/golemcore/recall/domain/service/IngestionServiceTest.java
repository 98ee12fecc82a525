package me.golemcore.recall.domain.service;

import me.golemcore.recall.domain.model.ActionDetection;
import me.golemcore.recall.domain.model.ActionOutcome;
import me.golemcore.recall.domain.model.ActionResult;
import me.golemcore.recall.domain.model.ActionType;
import me.golemcore.recall.domain.model.ChatMessage;
import me.golemcore.recall.domain.model.Contact;
import me.golemcore.recall.domain.model.EventCandidate;
import me.golemcore.recall.domain.model.EventOutcome;
import me.golemcore.recall.domain.model.InboundMessage;
import me.golemcore.recall.domain.model.IngestionResult;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.PendingAction;
import me.golemcore.recall.extraction.EventUpsertService;
import me.golemcore.recall.extraction.LlmEventExtractor;
import me.golemcore.recall.extraction.UpsertSummary;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.EventStorePort;
import me.golemcore.recall.port.outbound.MessageStorePort;
import me.golemcore.recall.routing.ActionRouter;
import me.golemcore.recall.routing.LlmActionDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final Instant SENT = Instant.parse("2026-01-01T11:59:00Z");
    private static final String CHAT_ID = "919876543210@s.whatsapp.net";

    private MessageStorePort messageStore;
    private EventStorePort eventStore;
    private LlmActionDetector actionDetector;
    private ActionRouter actionRouter;
    private LlmEventExtractor eventExtractor;
    private EventUpsertService upsertService;
    private RecallProperties properties;
    private IngestionService service;

    private final List<MemoryEvent> activeEvents = List.of(MemoryEvent.builder().id(1L).title("Netflix").build());

    @BeforeEach
    void setUp() {
        messageStore = mock(MessageStorePort.class);
        eventStore = mock(EventStorePort.class);
        actionDetector = mock(LlmActionDetector.class);
        actionRouter = mock(ActionRouter.class);
        eventExtractor = mock(LlmEventExtractor.class);
        upsertService = mock(EventUpsertService.class);
        properties = new RecallProperties();
        service = new IngestionService(messageStore, eventStore, new TrivialMessageFilter(), actionDetector,
                actionRouter, eventExtractor, upsertService, properties, Clock.fixed(NOW, ZoneOffset.UTC));

        when(eventStore.getActiveEvents(20)).thenReturn(activeEvents);
        when(actionDetector.detect(anyString(), anyList(), anyList(), any())).thenReturn(ActionDetection.none());
        when(actionRouter.route(any(), anyList())).thenReturn(ActionOutcome.notHandled());
    }

    // ===== skips =====

    @Test
    void shouldSkipEmptyContent() {
        IngestionResult result = service.ingest(inbound("m1", "   "));

        assertTrue(result.isSkipped());
        assertEquals(IngestionService.SKIP_NO_CONTENT, result.getSkipReason());
        verifyNoInteractions(messageStore);
    }

    @Test
    void shouldSkipOwnMessagesWhenDisabled() {
        properties.getIngestion().setProcessOwnMessages(false);
        InboundMessage own = inbound("m1", "meeting at 5pm");
        own.setFromMe(true);

        assertEquals(IngestionService.SKIP_OWN_MESSAGE, service.ingest(own).getSkipReason());
        verifyNoInteractions(messageStore);
    }

    @Test
    void shouldSkipGroupMessagesWhenEnabled() {
        properties.getIngestion().setSkipGroupMessages(true);
        InboundMessage group = inbound("m1", "party on friday");
        group.setChatId("12036302@g.us");

        assertEquals(IngestionService.SKIP_GROUP_MESSAGE, service.ingest(group).getSkipReason());
    }

    @Test
    void shouldStoreTrivialMessagesWithoutCallingModel() {
        IngestionResult result = service.ingest(inbound("m1", "ok 👍"));

        assertEquals(IngestionService.SKIP_TRIVIAL, result.getSkipReason());
        verify(messageStore).insertMessage(any(ChatMessage.class));
        verifyNoInteractions(actionDetector, eventExtractor);
    }

    // ===== persistence =====

    @Test
    void shouldStoreMessageAndContact() {
        when(eventExtractor.extract(anyString(), anyList(), any(), anyList(), any())).thenReturn(List.of());
        when(upsertService.upsert(anyList(), anyString(), any())).thenReturn(new UpsertSummary(0, 0, 0, List.of()));

        service.ingest(inbound("m1", "dinner with priya on saturday"));

        ArgumentCaptor<ChatMessage> message = ArgumentCaptor.forClass(ChatMessage.class);
        verify(messageStore).insertMessage(message.capture());
        assertEquals("919876543210", message.getValue().getSender());
        assertEquals(SENT, message.getValue().getTimestamp());
        ArgumentCaptor<Contact> contact = ArgumentCaptor.forClass(Contact.class);
        verify(messageStore).upsertContact(contact.capture());
        assertEquals("919876543210", contact.getValue().getId());
        assertEquals("Rahul", contact.getValue().getName());
    }

    @Test
    void shouldUseCurrentTimeWhenTimestampMissing() {
        when(upsertService.upsert(anyList(), anyString(), any())).thenReturn(new UpsertSummary(0, 0, 0, List.of()));
        InboundMessage inbound = inbound("m1", "dinner with priya on saturday");
        inbound.setTimestamp(null);

        service.ingest(inbound);

        ArgumentCaptor<ChatMessage> message = ArgumentCaptor.forClass(ChatMessage.class);
        verify(messageStore).insertMessage(message.capture());
        assertEquals(NOW, message.getValue().getTimestamp());
    }

    @Test
    void shouldPassPriorMessagesAsContext() {
        when(messageStore.getRecentMessages(CHAT_ID, 5)).thenReturn(List.of(
                ChatMessage.builder().id("m0").content("are you free saturday?").build(),
                ChatMessage.builder().id("m1").content("dinner with priya on saturday").build()));
        when(upsertService.upsert(anyList(), anyString(), any())).thenReturn(new UpsertSummary(0, 0, 0, List.of()));

        service.ingest(inbound("m1", "dinner with priya on saturday"));

        verify(actionDetector).detect("dinner with priya on saturday", List.of("are you free saturday?"),
                activeEvents, SENT);
        verify(eventExtractor).extract("dinner with priya on saturday", List.of("are you free saturday?"), NOW,
                activeEvents, SENT);
    }

    // ===== routing =====

    @Test
    void shouldShortCircuitWhenActionPerformed() {
        ActionResult performed = ActionResult.builder().action(ActionType.CANCEL).targetEventId(1L)
                .targetEventTitle("Netflix").message("Deleted: \"Netflix\"").build();
        when(actionRouter.route(any(), eq(activeEvents))).thenReturn(ActionOutcome.performed(performed));

        IngestionResult result = service.ingest(inbound("m2", "cancel netflix"));

        assertSame(performed, result.getActionPerformed());
        assertEquals(0, result.getEventsCreated());
        verifyNoInteractions(eventExtractor, upsertService);
    }

    @Test
    void shouldReturnPendingModification() {
        PendingAction pending = PendingAction.builder().targetEventId(1L).description("time -> Friday").build();
        when(actionRouter.route(any(), anyList())).thenReturn(ActionOutcome.pending(pending));

        IngestionResult result = service.ingest(inbound("m3", "meeting moved to friday"));

        assertSame(pending, result.getPendingAction());
        assertNull(result.getActionPerformed());
        verifyNoInteractions(eventExtractor);
    }

    @Test
    void shouldExtractWhenNoActionHandled() {
        List<EventCandidate> candidates = List.of(EventCandidate.builder().title("Dinner").confidence(0.9).build());
        EventOutcome outcome = EventOutcome.builder().event(MemoryEvent.builder().id(7L).title("Dinner").build())
                .build();
        when(eventExtractor.extract(anyString(), anyList(), any(), anyList(), any())).thenReturn(candidates);
        when(upsertService.upsert(candidates, "m4", "Rahul")).thenReturn(new UpsertSummary(1, 0, 2, List.of(outcome)));

        IngestionResult result = service.ingest(inbound("m4", "dinner with priya on saturday"));

        assertEquals(1, result.getEventsCreated());
        assertEquals(2, result.getTriggersCreated());
        assertEquals(List.of(outcome), result.getEvents());
        assertFalse(result.isFailed());
    }

    @Test
    void shouldReportFailureWhenModelUnavailable() {
        when(actionDetector.detect(anyString(), anyList(), anyList(), any()))
                .thenThrow(new LlmCallException("Action call timed out", null));

        IngestionResult result = service.ingest(inbound("m5", "dinner with priya on saturday"));

        assertTrue(result.isFailed());
        assertEquals("m5", result.getMessageId());
        verify(messageStore).insertMessage(any(ChatMessage.class));
        verifyNoInteractions(upsertService);
    }

    @Test
    void shouldReportFailureWhenStoreWriteFails() {
        when(eventExtractor.extract(anyString(), anyList(), any(), anyList(), any())).thenReturn(List.of());
        when(upsertService.upsert(anyList(), anyString(), any()))
                .thenThrow(new IllegalStateException("Failed to persist events.json"));

        IngestionResult result = service.ingest(inbound("m6", "dinner with priya on saturday"));

        assertTrue(result.isFailed());
        assertEquals(0, result.getEventsCreated());
        verify(messageStore).insertMessage(any(ChatMessage.class));
    }

    @Test
    void shouldReportFailureWhenContextLookupFails() {
        when(messageStore.getRecentMessages(CHAT_ID, 5)).thenThrow(new IllegalStateException("log unreadable"));

        IngestionResult result = service.ingest(inbound("m7", "dinner with priya on saturday"));

        assertTrue(result.isFailed());
        verifyNoInteractions(actionDetector, eventExtractor);
    }

    private static InboundMessage inbound(String id, String content) {
        return InboundMessage.builder()
                .id(id)
                .chatId(CHAT_ID)
                .senderName("Rahul")
                .content(content)
                .timestamp(SENT)
                .build();
    }
}
