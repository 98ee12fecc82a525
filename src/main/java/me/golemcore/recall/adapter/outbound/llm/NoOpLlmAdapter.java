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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.LlmRequest;
import me.golemcore.recall.domain.model.LlmResponse;
import me.golemcore.recall.domain.model.LlmUsage;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fallback provider used when no LLM is configured. Answers with an empty JSON
 * object so every structured call degrades to its "nothing found" result.
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String EMPTY_ANSWER = "{}";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(EMPTY_ANSWER)
                .model("none")
                .finishReason("stop")
                .usage(LlmUsage.builder()
                        .inputTokens(0)
                        .outputTokens(0)
                        .totalTokens(0)
                        .build())
                .build());
    }

    @Override
    public List<String> getSupportedModels() {
        return Collections.emptyList();
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
