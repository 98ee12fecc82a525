package me.golemcore.recall.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.ActionDetection;
import me.golemcore.recall.domain.model.ActionOutcome;
import me.golemcore.recall.domain.model.ChatMessage;
import me.golemcore.recall.domain.model.Contact;
import me.golemcore.recall.domain.model.EventCandidate;
import me.golemcore.recall.domain.model.InboundMessage;
import me.golemcore.recall.domain.model.IngestionResult;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.extraction.EventUpsertService;
import me.golemcore.recall.extraction.LlmEventExtractor;
import me.golemcore.recall.extraction.UpsertSummary;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.EventStorePort;
import me.golemcore.recall.port.outbound.MessageStorePort;
import me.golemcore.recall.routing.ActionRouter;
import me.golemcore.recall.routing.LlmActionDetector;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Processes one inbound chat message end to end.
 *
 * <p>
 * Pipeline:
 * <ol>
 * <li>Skip messages without text, own messages and group messages as
 * configured</li>
 * <li>Store the raw message and update the sender contact</li>
 * <li>Skip trivial noise</li>
 * <li>Ask whether the message acts on an active event; if so apply it</li>
 * <li>Otherwise extract new events or updates and upsert them</li>
 * </ol>
 *
 * <p>
 * The message is stored before any LLM call. An LLM failure marks the result
 * as failed with zero events and never affects other messages.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private static final String TAG = "Ingestion";

    static final String SKIP_NO_CONTENT = "no_content";
    static final String SKIP_OWN_MESSAGE = "own_message";
    static final String SKIP_GROUP_MESSAGE = "group_message";
    static final String SKIP_TRIVIAL = "trivial_message";

    private final MessageStorePort messageStore;
    private final EventStorePort eventStore;
    private final TrivialMessageFilter trivialFilter;
    private final LlmActionDetector actionDetector;
    private final ActionRouter actionRouter;
    private final LlmEventExtractor eventExtractor;
    private final EventUpsertService upsertService;
    private final RecallProperties properties;
    private final Clock clock;

    public IngestionResult ingest(InboundMessage inbound) {
        RecallProperties.IngestionProperties config = properties.getIngestion();
        String messageId = inbound.getId();

        if (inbound.getContent() == null || inbound.getContent().isBlank()) {
            return IngestionResult.skipped(messageId, SKIP_NO_CONTENT);
        }
        if (inbound.isFromMe() && !config.isProcessOwnMessages()) {
            return IngestionResult.skipped(messageId, SKIP_OWN_MESSAGE);
        }
        if (inbound.isGroup() && config.isSkipGroupMessages()) {
            return IngestionResult.skipped(messageId, SKIP_GROUP_MESSAGE);
        }

        Instant timestamp = inbound.getTimestamp() != null ? inbound.getTimestamp() : clock.instant();
        ChatMessage message = ChatMessage.builder()
                .id(messageId)
                .chatId(inbound.getChatId())
                .sender(inbound.senderId())
                .content(inbound.getContent())
                .timestamp(timestamp)
                .build();
        messageStore.insertMessage(message);
        messageStore.upsertContact(Contact.builder()
                .id(message.getSender())
                .name(inbound.getSenderName())
                .firstSeen(timestamp)
                .lastSeen(timestamp)
                .messageCount(1)
                .build());

        if (trivialFilter.isTrivial(message.getContent())) {
            log.debug("[{}] Trivial message {} skipped", TAG, messageId);
            return IngestionResult.skipped(messageId, SKIP_TRIVIAL);
        }

        try {
            List<String> context = messageStore.getRecentMessages(message.getChatId(), config.getContextMessages())
                    .stream()
                    .filter(m -> !Objects.equals(m.getId(), messageId))
                    .map(ChatMessage::getContent)
                    .toList();
            List<MemoryEvent> activeEvents = eventStore.getActiveEvents(config.getActiveEventsLimit());

            ActionDetection detection = actionDetector.detect(message.getContent(), context, activeEvents,
                    timestamp);
            ActionOutcome outcome = actionRouter.route(detection, activeEvents);
            if (outcome.handled()) {
                return IngestionResult.builder()
                        .messageId(messageId)
                        .actionPerformed(outcome.performed())
                        .pendingAction(outcome.pending())
                        .build();
            }

            List<EventCandidate> candidates = eventExtractor.extract(message.getContent(), context, clock.instant(),
                    activeEvents, timestamp);
            UpsertSummary summary = upsertService.upsert(candidates, messageId, inbound.getSenderName());
            log.info("[{}] Message {}: {} created, {} updated, {} trigger(s)", TAG, messageId,
                    summary.eventsCreated(), summary.eventsUpdated(), summary.triggersCreated());
            return IngestionResult.builder()
                    .messageId(messageId)
                    .eventsCreated(summary.eventsCreated())
                    .eventsUpdated(summary.eventsUpdated())
                    .triggersCreated(summary.triggersCreated())
                    .events(summary.events())
                    .build();
        } catch (LlmCallException e) {
            log.error("[{}] Failed to process message {}: {}", TAG, messageId, e.getMessage());
            return IngestionResult.failed(messageId);
        } catch (RuntimeException e) {
            log.error("[{}] Failed to process message {}", TAG, messageId, e);
            return IngestionResult.failed(messageId);
        }
    }
}
