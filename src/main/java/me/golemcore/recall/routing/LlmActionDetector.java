package me.golemcore.recall.routing;

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
import me.golemcore.recall.domain.model.ActionDetection;
import me.golemcore.recall.domain.model.ActionType;
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
 * Asks the LLM whether a message acts on one of the active events (cancel,
 * complete, snooze, modify...) rather than describing something new.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmActionDetector {

    private static final String TAG = "Action";

    private static final String SYSTEM_PROMPT = """
            You decide whether a chat message is an ACTION on an event the user already has,
            or something else (new information, small talk).

            Actions:
            - cancel / delete: the event is off ("cancel netflix", "not going anymore")
            - complete: it is done ("bought the gift", "paid the bill")
            - ignore: stop reminding ("forget it", "don't remind me")
            - snooze / postpone: remind later ("remind me tomorrow", "later")
            - modify: details changed ("meeting moved to 6pm", "venue is now Cafe X")
            - none: not an action

            Only pick an action when the message clearly refers to one of the listed events.
            Times must be ISO-8601 with offset, resolved against the message timestamp.
            Respond ONLY with valid JSON (no markdown, no explanation):

            {"is_action": true, "action": "snooze", "confidence": 0.9, "target_description": "netflix subscription",
             "target_keywords": ["netflix"], "snooze_minutes": 60, "new_time": null, "new_title": null,
             "new_location": null, "new_description": null}
            """;

    private final StructuredLlmClient llmClient;
    private final ContextCompressionService compressionService;

    /**
     * Classifies one message.
     *
     * @return the verdict; {@link ActionDetection#none()} when the answer cannot
     *         be parsed
     * @throws me.golemcore.recall.domain.service.LlmCallException
     *             when the model cannot be reached
     */
    public ActionDetection detect(String text, List<String> context, List<MemoryEvent> activeEvents,
            Instant timestamp) {
        if (activeEvents == null || activeEvents.isEmpty()) {
            log.debug("[{}] No active events, skipping action detection", TAG);
            return ActionDetection.none();
        }
        String response = llmClient.complete(TAG, SYSTEM_PROMPT, buildPrompt(text, context, activeEvents, timestamp));
        ActionDetection detection = parse(response);
        log.info("[{}] Detected: action={}, confidence={}, target={}", TAG, detection.getType().getValue(),
                String.format(Locale.ROOT, "%.2f", detection.getConfidence()), detection.getTargetDescription());
        return detection;
    }

    String buildPrompt(String text, List<String> context, List<MemoryEvent> activeEvents, Instant timestamp) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Active events:\n");
        sb.append(compressionService.compressEventsLight(activeEvents)).append("\n\n");

        if (context != null && !context.isEmpty()) {
            sb.append("## Previous messages:\n");
            for (String line : context) {
                sb.append("- ").append(StructuredLlmClient.truncate(line, 200)).append('\n');
            }
            sb.append('\n');
        }

        sb.append("## Message timestamp: ").append(timestamp).append("\n\n");
        sb.append("## Message:\n").append(StructuredLlmClient.truncate(text, 1000));
        sb.append("\n\nRespond with JSON only.");
        return sb.toString();
    }

    ActionDetection parse(String response) {
        Optional<JsonNode> parsed = llmClient.parseJson(TAG, response);
        if (parsed.isEmpty()) {
            return ActionDetection.none();
        }
        JsonNode node = parsed.get();
        JsonNode flag = node.has("is_action") ? node.get("is_action") : node.get("isAction");

        List<String> keywords = new ArrayList<>();
        JsonNode keywordNode = node.has("target_keywords") ? node.get("target_keywords") : node.get("targetKeywords");
        if (keywordNode != null && keywordNode.isArray()) {
            keywordNode.forEach(k -> {
                String keyword = k.asText().trim().toLowerCase(Locale.ROOT);
                if (!keyword.isEmpty()) {
                    keywords.add(keyword);
                }
            });
        }

        JsonNode snooze = node.get("snooze_minutes");
        Integer snoozeMinutes = snooze != null && snooze.canConvertToInt() && snooze.asInt() > 0 ? snooze.asInt()
                : null;

        return ActionDetection.builder()
                .action(flag != null && flag.asBoolean(false))
                .type(ActionType.fromValue(StructuredLlmClient.text(node, "action")))
                .confidence(MemoryEvent.clampConfidence(node.path("confidence").asDouble(0.0)))
                .targetDescription(StructuredLlmClient.text(node, "target_description"))
                .targetKeywords(keywords)
                .snoozeMinutes(snoozeMinutes)
                .newTime(StructuredLlmClient.text(node, "new_time"))
                .newTitle(StructuredLlmClient.text(node, "new_title"))
                .newLocation(StructuredLlmClient.text(node, "new_location"))
                .newDescription(StructuredLlmClient.text(node, "new_description"))
                .build();
    }
}
