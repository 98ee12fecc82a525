package me.golemcore.recall.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.LlmRequest;
import me.golemcore.recall.domain.model.LlmResponse;
import me.golemcore.recall.domain.model.LlmUsage;
import me.golemcore.recall.domain.model.Message;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM provider backed by langchain4j chat models. Models are addressed as
 * {@code provider/name}; {@code anthropic} uses the Anthropic API, every other
 * provider is treated as OpenAI-compatible.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    /**
     * Max retry attempts for rate limit / transient errors (exponential backoff).
     */
    private static final int MAX_RETRIES = 5;
    private static final long INITIAL_BACKOFF_MS = 5_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String DEFAULT_PROVIDER = "openai";
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");

    private final RecallProperties properties;

    private final Map<String, ChatModel> modelCache = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            String model = request.getModel() != null ? request.getModel() : properties.getLlm().getModel();
            ChatModel chatModel = modelCache.computeIfAbsent(model, this::createModel);
            List<ChatMessage> messages = convertMessages(request);

            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    return convertResponse(chatModel.chat(messages), model);
                } catch (Exception e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long exponentialBackoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        long resetSeconds = extractResetSeconds(e);
                        long backoffMs = resetSeconds > 0
                                ? Math.max(resetSeconds * 1000 + 1000, exponentialBackoffMs)
                                : exponentialBackoffMs;
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("[LLM] Chat failed", e);
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    private void sleep(long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    ChatModel createModel(String model) {
        String provider = providerOf(model);
        RecallProperties.ProviderProperties config = properties.getLlm().getProviders().get(provider);
        if (config == null || config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("Provider not configured: " + provider
                    + ". Add recall.llm.providers." + provider + ".api-key");
        }
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(properties.getLlm().getTimeoutMs());
        log.info("[LLM] Creating {} model: {}", provider, modelName);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // Retry handled by our backoff logic
                    .maxTokens(properties.getLlm().getMaxTokens())
                    .temperature(properties.getLlm().getTemperature())
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by our backoff logic
                .temperature(properties.getLlm().getTemperature())
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    static String providerOf(String model) {
        return model != null && model.contains("/") ? model.substring(0, model.indexOf('/')) : DEFAULT_PROVIDER;
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("token_quota_exceeded")
                    || msg.contains("Too Many Requests") || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Returns the {@code reset_seconds} hint of a rate limit body, or -1.
     */
    long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        for (Message msg : request.getMessages()) {
            switch (msg.getRole()) {
            case "assistant" -> messages.add(AiMessage.from(msg.getContent()));
            case "system" -> messages.add(SystemMessage.from(msg.getContent()));
            case "user" -> messages.add(UserMessage.from(msg.getContent()));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(msg.getContent()));
            }
            }
        }
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response, String model) {
        LlmUsage usage = null;
        TokenUsage tokenUsage = response.tokenUsage();
        if (tokenUsage != null) {
            usage = LlmUsage.builder()
                    .inputTokens(tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0)
                    .outputTokens(tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0)
                    .totalTokens(tokenUsage.totalTokenCount() != null ? tokenUsage.totalTokenCount() : 0)
                    .build();
        }
        return LlmResponse.builder()
                .content(response.aiMessage() != null ? response.aiMessage().text() : null)
                .model(model)
                .finishReason(response.finishReason() != null ? response.finishReason().name().toLowerCase(Locale.ROOT) : "stop")
                .usage(usage)
                .build();
    }

    @Override
    public List<String> getSupportedModels() {
        return List.of(properties.getLlm().getModel());
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        return properties.getLlm().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }
}
