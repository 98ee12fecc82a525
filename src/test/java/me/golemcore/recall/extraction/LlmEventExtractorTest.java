package me.golemcore.recall.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.recall.domain.model.EventAction;
import me.golemcore.recall.domain.model.EventCandidate;
import me.golemcore.recall.domain.model.EventType;
import me.golemcore.recall.domain.model.LlmRequest;
import me.golemcore.recall.domain.model.LlmResponse;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.service.ContextCompressionService;
import me.golemcore.recall.domain.service.StructuredLlmClient;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmEventExtractorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private LlmPort llmPort;
    private LlmEventExtractor extractor;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        RecallProperties properties = new RecallProperties();
        extractor = new LlmEventExtractor(
                new StructuredLlmClient(llmPort, new ObjectMapper(), properties),
                new ContextCompressionService(Clock.fixed(NOW, ZoneOffset.UTC), properties));
    }

    @Test
    void shouldParseCandidates() {
        answer("""
                {"events": [
                  {"type": "meeting", "title": "Meeting with Nityam", "event_time": "2026-01-02T17:00:00Z",
                   "participants": ["Nityam"], "keywords": ["Meeting", "NITYAM", ""], "confidence": 0.9,
                   "event_action": "create", "target_event_id": null},
                  {"type": "spaceship", "title": "Mystery", "confidence": 1.7},
                  {"type": "task", "title": null, "confidence": 0.9}
                ]}
                """);

        List<EventCandidate> candidates = extractor.extract("meeting with nityam tomorrow 5pm", List.of(), NOW,
                List.of(), NOW);

        assertEquals(2, candidates.size());
        EventCandidate meeting = candidates.get(0);
        assertEquals(EventType.MEETING, meeting.getType());
        assertEquals("2026-01-02T17:00:00Z", meeting.getEventTime());
        assertEquals(List.of("meeting", "nityam"), meeting.getKeywords());
        assertEquals(List.of("Nityam"), meeting.getParticipants());
        assertEquals(EventAction.CREATE, meeting.getEventAction());
        assertNull(meeting.getTargetEventId());
        assertEquals(EventType.OTHER, candidates.get(1).getType());
        assertEquals(1.0, candidates.get(1).getConfidence());
    }

    @Test
    void shouldParseUpdateTarget() {
        List<EventCandidate> candidates = extractor.parse(
                "{\"events\":[{\"title\":\"Standup\",\"event_action\":\"update\",\"target_event_id\":12,"
                        + "\"confidence\":0.8}]}");

        assertEquals(EventAction.UPDATE, candidates.get(0).getEventAction());
        assertEquals(12L, candidates.get(0).getTargetEventId());
    }

    @Test
    void shouldReturnEmptyForMalformedAnswers() {
        assertTrue(extractor.parse("no events here").isEmpty());
        assertTrue(extractor.parse("{\"events\": \"none\"}").isEmpty());
        assertTrue(extractor.parse("{\"events\": []}").isEmpty());
    }

    @Test
    void shouldIncludeExistingEventsAndContextInPrompt() {
        answer("{\"events\": []}");
        MemoryEvent existing = MemoryEvent.builder().id(3L).title("Netflix renewal").createdAt(NOW).build();

        extractor.extract("ok cancel it", List.of("Me: netflix is too costly"), NOW, List.of(existing), NOW);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        String prompt = captor.getValue().getMessages().get(0).getContent();
        assertTrue(prompt.startsWith("## Current time: 2026-01-01T12:00:00Z"));
        assertTrue(prompt.contains("#3|OTH|"));
        assertTrue(prompt.contains("- Me: netflix is too costly"));
        assertTrue(prompt.contains("## Message:\nok cancel it"));
    }

    @Test
    void shouldShowPlaceholderWhenNoEventsExist() {
        String prompt = extractor.buildPrompt("hello there", List.of(), NOW, List.of(), NOW);

        assertTrue(prompt.contains("## Existing events:\nNo events stored yet."));
        assertFalse(prompt.contains("## Previous messages:"));
    }

    private void answer(String json) {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(LlmResponse.builder().content(json).build()));
    }
}
