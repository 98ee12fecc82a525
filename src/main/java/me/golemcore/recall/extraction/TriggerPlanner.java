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

import lombok.RequiredArgsConstructor;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.Trigger;
import me.golemcore.recall.domain.model.TriggerType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Derives the delivery triggers of a freshly created event.
 *
 * <ul>
 * <li>time: 24h, 1h and 15m before the event, only if still in the future</li>
 * <li>url: the lower-cased location, else the context tag</li>
 * <li>keyword: up to three keywords containing an interest term</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class TriggerPlanner {

    static final int MAX_KEYWORD_TRIGGERS = 3;

    private final Clock clock;

    public List<Trigger> plan(MemoryEvent event) {
        List<Trigger> triggers = new ArrayList<>();
        Instant now = clock.instant();

        if (event.getEventTime() != null) {
            for (TriggerType type : TriggerType.TIME_TRIGGERS) {
                Instant fireAt = event.getEventTime().minus(type.getLeadTime());
                if (fireAt.isAfter(now)) {
                    triggers.add(trigger(event, type, fireAt.toString()));
                }
            }
        }

        String urlValue = urlTriggerValue(event);
        if (urlValue != null) {
            triggers.add(trigger(event, TriggerType.URL, urlValue));
        }

        event.keywordList().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .filter(k -> ContextVocabulary.INTEREST_TERMS.stream().anyMatch(k::contains))
                .distinct()
                .limit(MAX_KEYWORD_TRIGGERS)
                .forEach(k -> triggers.add(trigger(event, TriggerType.KEYWORD, k)));

        return triggers;
    }

    private static String urlTriggerValue(MemoryEvent event) {
        if (event.getLocation() != null && !event.getLocation().isBlank()) {
            return event.getLocation().trim().toLowerCase(Locale.ROOT);
        }
        if (event.getContextUrl() != null && !event.getContextUrl().isBlank()) {
            return event.getContextUrl();
        }
        return null;
    }

    private static Trigger trigger(MemoryEvent event, TriggerType type, String value) {
        return Trigger.builder()
                .eventId(event.getId())
                .type(type)
                .value(value)
                .fired(false)
                .build();
    }
}
