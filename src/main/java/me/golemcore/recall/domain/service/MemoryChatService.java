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
import me.golemcore.recall.domain.model.ChatAnswer;
import me.golemcore.recall.domain.model.ChatMemoryResult;
import me.golemcore.recall.domain.model.ChatTurn;
import me.golemcore.recall.domain.model.CompressedContext;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.Message;
import me.golemcore.recall.port.outbound.EventStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Answers questions about the user's memory. Stored events are sent in the
 * dense encoding and older chat turns are folded into a memory packet so the
 * prompt stays small.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryChatService {

    private static final String TAG = "Chat";
    private static final Pattern EVENT_REF = Pattern.compile("#(\\d+)");
    private static final int MAX_REFERENCED_EVENTS = 10;

    private static final String SYSTEM_PROMPT = """
            You are a personal memory assistant. You know the user's events, extracted from their chats.
            Answer briefly and concretely. Refer to events by their id, like #12.
            If nothing in memory answers the question, say so.

            Events are listed one per line as
            #id|TYPE|status|"title"|time|location|sender|keywords
            """;

    private final EventStorePort eventStore;
    private final ContextCompressionService compressionService;
    private final StructuredLlmClient llmClient;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException
     *             when the query is blank
     * @throws LlmCallException
     *             when the model cannot be reached
     */
    public ChatAnswer answer(String query, List<ChatTurn> history) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        CompressedContext events = compressionService.compressEvents(eventStore.getAllEvents());
        ChatMemoryResult memory = compressionService.compressChatHistory(history != null ? history : List.of());

        StringBuilder system = new StringBuilder(SYSTEM_PROMPT);
        system.append("\nCurrent time: ").append(clock.instant()).append("\n\n## Events\n").append(events.events());
        if (memory.memoryPacket() != null) {
            system.append("\n\n## Earlier in this conversation\n").append(memory.memoryPacket());
        }

        List<Message> messages = new ArrayList<>();
        for (ChatTurn turn : memory.recentHistory()) {
            if (turn.content() == null || turn.content().isBlank()) {
                continue;
            }
            messages.add(turn.isUser() ? Message.user(turn.content()) : Message.assistant(turn.content()));
        }
        messages.add(Message.user(query));

        String response = llmClient.converse(TAG, system.toString(), messages).trim();
        log.info("[{}] Answered with {} events in context, history compressed: {}", TAG, events.eventCount(),
                memory.memoryPacket() != null);

        return ChatAnswer.builder()
                .response(response)
                .events(referencedEvents(response))
                .eventsInContext(events.eventCount())
                .historyCompressed(memory.memoryPacket() != null)
                .build();
    }

    private List<MemoryEvent> referencedEvents(String response) {
        Set<Long> ids = new LinkedHashSet<>();
        Matcher matcher = EVENT_REF.matcher(response);
        while (matcher.find() && ids.size() < MAX_REFERENCED_EVENTS) {
            try {
                ids.add(Long.parseLong(matcher.group(1)));
            } catch (NumberFormatException e) {
                log.debug("[{}] Ignoring event reference {}", TAG, matcher.group());
            }
        }
        List<MemoryEvent> events = new ArrayList<>();
        for (Long id : ids) {
            Optional<MemoryEvent> event = eventStore.findEvent(id);
            event.ifPresent(events::add);
        }
        return events;
    }
}
