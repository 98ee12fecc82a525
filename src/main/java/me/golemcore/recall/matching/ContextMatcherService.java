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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.ContextCheckResult;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.RelevanceVerdict;
import me.golemcore.recall.domain.model.UrlContext;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.EventStorePort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds remembered events relevant to the page the user is visiting.
 *
 * <p>
 * Keywords come from {@link UrlContextExtractor}. Candidates are looked up by
 * location one keyword at a time, first hit wins, then by full-text keyword
 * search. The full check lets the LLM confirm which candidates matter; the
 * quick check returns the keyword hits unvalidated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextMatcherService {

    private static final String TAG = "Matcher";

    private final UrlContextExtractor extractor;
    private final EventStorePort eventStore;
    private final LlmRelevanceValidator validator;
    private final RecallProperties properties;

    public UrlContext extractContext(String url, String title) {
        return extractor.extract(url, title);
    }

    public ContextCheckResult check(String url, String title) {
        return check(url, title, properties.getMatcher().getHotWindowDays());
    }

    public ContextCheckResult check(String url, String title, int hotWindowDays) {
        long startMs = System.currentTimeMillis();
        UrlContext context = extractor.extract(url, title);
        if (context.isEmpty()) {
            return ContextCheckResult.noMatch(context, 0.0);
        }
        log.info("[{}] Context check {} keywords={}", TAG, url, context.keywords());

        List<MemoryEvent> candidates = findCandidates(context.keywords(), hotWindowDays);
        if (candidates.isEmpty()) {
            log.info("[{}] No candidates ({}ms)", TAG, System.currentTimeMillis() - startMs);
            return ContextCheckResult.noMatch(context, 0.0);
        }
        log.debug("[{}] {} candidate(s)", TAG, candidates.size());

        RelevanceVerdict verdict = validator.validate(url, title, candidates);
        List<MemoryEvent> matched = new ArrayList<>();
        for (Integer index : verdict.relevant()) {
            if (index != null && index >= 0 && index < candidates.size()) {
                matched.add(candidates.get(index));
            }
        }
        if (matched.isEmpty()) {
            log.info("[{}] No relevant events ({}ms)", TAG, System.currentTimeMillis() - startMs);
            return ContextCheckResult.noMatch(context, verdict.confidence());
        }

        log.info("[{}] Matched {} event(s) ({}ms)", TAG, matched.size(), System.currentTimeMillis() - startMs);
        return ContextCheckResult.builder()
                .matched(true)
                .events(matched)
                .confidence(verdict.confidence())
                .activity(context.activity())
                .keywords(context.keywords())
                .build();
    }

    /**
     * Unvalidated keyword lookup for real-time checks.
     */
    public List<MemoryEvent> quickCheck(String url) {
        UrlContext context = extractor.extract(url, null);
        if (context.isEmpty()) {
            return List.of();
        }
        RecallProperties.MatcherProperties matcher = properties.getMatcher();
        List<String> keywords = context.keywords().subList(0,
                Math.min(matcher.getQuickKeywordLimit(), context.keywords().size()));
        return eventStore.searchByKeywords(keywords, matcher.getHotWindowDays(), matcher.getQuickResultLimit());
    }

    private List<MemoryEvent> findCandidates(List<String> keywords, int hotWindowDays) {
        int limit = properties.getMatcher().getCandidateLimit();
        for (String keyword : keywords) {
            List<MemoryEvent> byLocation = eventStore.searchByLocation(keyword, hotWindowDays, limit);
            if (!byLocation.isEmpty()) {
                log.debug("[{}] Location hit on '{}'", TAG, keyword);
                return byLocation;
            }
        }
        return eventStore.searchByKeywords(keywords, hotWindowDays, limit);
    }
}
