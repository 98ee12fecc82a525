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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.LlmRequest;
import me.golemcore.recall.domain.model.LlmResponse;
import me.golemcore.recall.domain.model.Message;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sends a system/user prompt pair to the LLM and extracts the JSON object from
 * the answer. The answer may be bare JSON or fenced in a markdown block.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StructuredLlmClient {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final RecallProperties properties;

    /**
     * Runs one completion.
     *
     * @throws LlmCallException
     *             when the provider fails or exceeds {@code recall.llm.timeout-ms}
     */
    public String complete(String tag, String systemPrompt, String userPrompt) {
        log.debug("[{}] Prompt:\n{}", tag, userPrompt);
        return converse(tag, systemPrompt, List.of(Message.user(userPrompt)));
    }

    /**
     * Runs one completion over a multi-turn conversation.
     *
     * @throws LlmCallException
     *             when the provider fails or exceeds {@code recall.llm.timeout-ms}
     */
    public String converse(String tag, String systemPrompt, List<Message> messages) {
        long timeoutMs = properties.getLlm().getTimeoutMs();
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(systemPrompt)
                .messages(messages)
                .temperature(properties.getLlm().getTemperature())
                .maxTokens(properties.getLlm().getMaxTokens())
                .build();

        long startMs = System.currentTimeMillis();
        try {
            LlmResponse response = llmPort.chat(request).get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("[{}] LLM responded in {}ms: {}", tag, System.currentTimeMillis() - startMs,
                    response.getContent());
            return response.getContent() != null ? response.getContent() : "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmCallException(tag + " call interrupted", e);
        } catch (ExecutionException e) {
            throw new LlmCallException(tag + " call failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new LlmCallException(tag + " call timed out after " + timeoutMs + "ms", e);
        }
    }

    /**
     * Parses the first JSON object of a model answer; empty when none parses.
     */
    public Optional<JsonNode> parseJson(String tag, String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        String json = extractJson(response);
        try {
            JsonNode node = objectMapper.readTree(json);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("[{}] Failed to parse LLM response: {}", tag, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    String extractJson(String response) {
        Matcher fenced = FENCED_JSON.matcher(response);
        if (fenced.find()) {
            return fenced.group(1);
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return response.substring(start, end + 1);
        }
        return response.trim();
    }

    public static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen) + "...";
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() || "null".equalsIgnoreCase(text) ? null : text;
    }
}
