package me.golemcore.recall.matching;

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
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.RelevanceVerdict;
import me.golemcore.recall.domain.service.LlmCallException;
import me.golemcore.recall.domain.service.StructuredLlmClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Asks the LLM which of the retrieved candidate events matter for the page the
 * user is looking at. Any failure yields an empty verdict so the page simply
 * gets no overlay.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmRelevanceValidator {

    private static final String TAG = "Matcher";

    private static final String SYSTEM_PROMPT = """
            The user is browsing a web page. Decide which of their remembered events are
            genuinely relevant to this page right now, e.g. a gift idea on a shopping site
            or a trip on a hotel booking page. Loose keyword overlap is not enough.
            Candidates are numbered from 0.
            Respond ONLY with valid JSON (no markdown, no explanation):

            {"relevant": [0, 2], "confidence": 0.85}
            """;

    private final StructuredLlmClient llmClient;

    public RelevanceVerdict validate(String url, String title, List<MemoryEvent> candidates) {
        if (candidates.isEmpty()) {
            return RelevanceVerdict.empty();
        }
        String answer;
        try {
            answer = llmClient.complete(TAG, SYSTEM_PROMPT, buildPrompt(url, title, candidates));
        } catch (LlmCallException e) {
            log.warn("[{}] Relevance validation unavailable: {}", TAG, e.getMessage());
            return RelevanceVerdict.empty();
        }
        return parse(answer);
    }

    String buildPrompt(String url, String title, List<MemoryEvent> candidates) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Page\nURL: ").append(url).append('\n');
        sb.append("Title: ").append(title != null && !title.isBlank() ? title : "-").append("\n\n");
        sb.append("## Candidates\n");
        for (int i = 0; i < candidates.size(); i++) {
            MemoryEvent event = candidates.get(i);
            sb.append(i).append(". [").append(event.getType().getValue()).append("] ")
                    .append(event.getTitle());
            if (event.getDescription() != null) {
                sb.append(" - ").append(StructuredLlmClient.truncate(event.getDescription(), 150));
            }
            if (event.getLocation() != null) {
                sb.append(" @ ").append(event.getLocation());
            }
            sb.append(" (keywords: ").append(event.getKeywords()).append(")\n");
        }
        return sb.toString();
    }

    RelevanceVerdict parse(String answer) {
        Optional<JsonNode> parsed = llmClient.parseJson(TAG, answer);
        if (parsed.isEmpty()) {
            return RelevanceVerdict.empty();
        }
        List<Integer> relevant = new ArrayList<>();
        JsonNode indices = parsed.get().get("relevant");
        if (indices != null && indices.isArray()) {
            for (JsonNode index : indices) {
                if (index.canConvertToInt()) {
                    relevant.add(index.asInt());
                }
            }
        }
        double confidence = parsed.get().path("confidence").asDouble(0.0);
        return new RelevanceVerdict(relevant, Math.max(0.0, Math.min(1.0, confidence)));
    }
}
