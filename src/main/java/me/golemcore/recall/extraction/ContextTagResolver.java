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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.EventCandidate;
import me.golemcore.recall.domain.model.EventType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves the context tag of a candidate: the first vocabulary bucket with a
 * hit wins.
 */
@Component
@Slf4j
public class ContextTagResolver {

    private final List<ContextVocabulary.TagBucket> buckets;

    public ContextTagResolver() {
        this(ContextVocabulary.BUCKETS);
    }

    ContextTagResolver(List<ContextVocabulary.TagBucket> buckets) {
        this.buckets = buckets;
    }

    public Optional<String> resolve(EventCandidate candidate) {
        String allFields = String.join(" ",
                nullToEmpty(candidate.getLocation()),
                String.join(" ", candidate.getKeywords() != null ? candidate.getKeywords() : List.of()),
                nullToEmpty(candidate.getTitle()),
                nullToEmpty(candidate.getDescription()))
                .toLowerCase(Locale.ROOT);
        String location = nullToEmpty(candidate.getLocation()).toLowerCase(Locale.ROOT);
        EventType type = candidate.getType() != null ? candidate.getType() : EventType.OTHER;

        for (ContextVocabulary.TagBucket bucket : buckets) {
            if (!bucket.appliesTo(type)) {
                continue;
            }
            String text = bucket.scope() == ContextVocabulary.Scope.LOCATION ? location : allFields;
            Optional<String> hit = firstHit(text, bucket);
            if (hit.isPresent()) {
                String tag = bucket.tagFor(hit.get());
                log.debug("[Extractor] Context tag \"{}\" ({} bucket) for \"{}\"", tag, bucket.name(),
                        candidate.getTitle());
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    static Optional<String> firstHit(String text, ContextVocabulary.TagBucket bucket) {
        if (text.isBlank()) {
            return Optional.empty();
        }
        List<Pattern> patterns = bucket.termPatterns();
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(text).find()) {
                return Optional.of(bucket.terms().get(i));
            }
        }
        return Optional.empty();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
