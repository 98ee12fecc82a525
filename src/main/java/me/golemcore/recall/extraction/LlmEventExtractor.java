package me.golemcore.recall.extraction;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.EventAction;
import me.golemcore.recall.domain.model.EventCandidate;
import me.golemcore.recall.domain.model.EventType;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.service.ContextCompressionService;
import me.golemcore.recall.domain.service.StructuredLlmClient;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Asks the LLM for the events contained in a message, with the user's current
 * events in the prompt so it can propose updates and merges instead of
 * duplicates.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmEventExtractor {

    private static final String TAG = "Extractor";

    private static final String SYSTEM_PROMPT = """
            You extract things the user may want to be reminded about from a chat message:
            meetings, deadlines, reminders, travel plans, tasks, subscriptions, recommendations.

            Existing events are listed one per line as
            #id|TYPE|status|"title"|time|location|sender|keywords
            If the message changes one of them, return it with "event_action": "update" and its
            "target_event_id". If it adds details to one of them, use "merge". Otherwise "create".

            Rules:
            - type is one of: meeting, deadline, reminder, travel, task, subscription, recommendation, other
            - event_time is ISO-8601 with offset, resolved against the message timestamp, or null
            - keywords are short lower-case words useful for matching web pages
            - confidence is 0.0-1.0; small talk yields no events
            Respond ONLY with valid JSON (no markdown, no explanation):

            {"events": [{"type": "meeting", "title": "Meeting with Nityam", "description": null,
              "event_time": "2026-03-06T17:00:00+05:30", "location": null, "participants": ["Nityam"],
              "keywords": ["meeting", "nityam"], "confidence": 0.9, "event_action": "create",
              "target_event_id": null}]}
            """;

    private final StructuredLlmClient llmClient;
    private final ContextCompressionService compressionService;

    /**
     * Extracts candidates.
     *
     * @return candidates in model order; empty when the answer cannot be parsed
     * @throws me.golemcore.recall.domain.service.LlmCallException
     *             when the model cannot be reached
     */
    public List<EventCandidate> extract(String text, List<String> context, Instant now,
            List<MemoryEvent> existingEvents, Instant timestamp) {
        String prompt = buildPrompt(text, context, now, existingEvents, timestamp);
        List<EventCandidate> candidates = parse(llmClient.complete(TAG, SYSTEM_PROMPT, prompt));
        log.info("[{}] Model proposed {} event(s)", TAG, candidates.size());
        return candidates;
    }

    String buildPrompt(String text, List<String> context, Instant now, List<MemoryEvent> existingEvents,
            Instant timestamp) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Current time: ").append(now).append('\n');
        sb.append("## Message timestamp: ").append(timestamp).append("\n\n");

        sb.append("## Existing events:\n");
        sb.append(compressionService.compressEvents(existingEvents).events()).append("\n\n");

        if (context != null && !context.isEmpty()) {
            sb.append("## Previous messages:\n");
            for (String line : context) {
                sb.append("- ").append(StructuredLlmClient.truncate(line, 200)).append('\n');
            }
            sb.append('\n');
        }

        sb.append("## Message:\n").append(StructuredLlmClient.truncate(text, 2000));
        sb.append("\n\nRespond with JSON only.");
        return sb.toString();
    }

    List<EventCandidate> parse(String response) {
        Optional<JsonNode> parsed = llmClient.parseJson(TAG, response);
        if (parsed.isEmpty()) {
            return List.of();
        }
        JsonNode events = parsed.get().get("events");
        if (events == null || !events.isArray()) {
            return List.of();
        }
        List<EventCandidate> candidates = new ArrayList<>();
        for (JsonNode node : events) {
            String title = StructuredLlmClient.text(node, "title");
            if (title == null) {
                log.debug("[{}] Dropping candidate without title", TAG);
                continue;
            }
            JsonNode target = node.get("target_event_id");
            candidates.add(EventCandidate.builder()
                    .type(EventType.fromValue(StructuredLlmClient.text(node, "type")))
                    .title(title)
                    .description(StructuredLlmClient.text(node, "description"))
                    .eventTime(StructuredLlmClient.text(node, "event_time"))
                    .location(StructuredLlmClient.text(node, "location"))
                    .participants(strings(node.get("participants"), false))
                    .keywords(strings(node.get("keywords"), true))
                    .confidence(MemoryEvent.clampConfidence(node.path("confidence").asDouble(0.0)))
                    .eventAction(EventAction.fromValue(StructuredLlmClient.text(node, "event_action")))
                    .targetEventId(target != null && target.canConvertToLong() ? target.asLong() : null)
                    .build());
        }
        return candidates;
    }

    private static List<String> strings(JsonNode array, boolean lowerCase) {
        List<String> values = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode item : array) {
            String value = item.asText().trim();
            if (!value.isEmpty()) {
                values.add(lowerCase ? value.toLowerCase(Locale.ROOT) : value);
            }
        }
        return values;
    }
}
