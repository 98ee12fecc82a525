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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.ChatMemoryResult;
import me.golemcore.recall.domain.model.ChatTurn;
import me.golemcore.recall.domain.model.CompressedContext;
import me.golemcore.recall.domain.model.EventEdge;
import me.golemcore.recall.domain.model.EventStatus;
import me.golemcore.recall.domain.model.EventType;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.ScoredEvent;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Prepares events and chat history for prompts: ranks events by signal,
 * encodes them one per line, detects relationships between them and folds old
 * chat turns into a memory packet.
 *
 * <p>
 * Dense line layout, always 8 {@code |}-separated fields:
 *
 * <pre>
 * #id|TYPE|glyph|"title"|EEE, MMM d h:mm a[ [PAST]]|location|sender|keywords
 * </pre>
 *
 * Absent time and location render as {@code -}, an absent sender as
 * {@code ?}. The field order is relied upon by every prompt that embeds it.
 */
@Service
@Slf4j
public class ContextCompressionService {

    static final String EMPTY_EVENTS = "No events stored yet.";
    static final String NO_VALUE = "-";
    static final String NO_SENDER = "?";
    static final String PAST_MARKER = " [PAST]";
    static final String ELLIPSIS = "...";

    private static final int BASELINE_PRIORITY = 5;
    private static final int MAX_PRIORITY = 10;
    private static final int MIN_KEYWORD_LENGTH = 3;
    private static final long CONFLICT_WINDOW_SECONDS = 3600;
    private static final int MAX_USER_SUMMARIES = 5;
    private static final int MAX_KEY_FACTS = 5;
    private static final int MAX_EVENT_REFS = 10;
    private static final int USER_SUMMARY_LENGTH = 100;
    private static final int KEY_FACT_LENGTH = 120;
    private static final int SENTENCES_PER_TURN = 3;

    private static final List<String> CANCEL_TERMS = List.of("cancel", "unsubscribe");
    private static final List<String> RESCHEDULE_TERMS = List.of("reschedul", "moved", "postpon", "updated");
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!]\\s+");
    private static final Pattern EVENT_REF = Pattern.compile("#(\\d+)");
    private static final Pattern KEY_FACT_VOCABULARY = Pattern.compile(
            "\\b(event|meeting|reminder|deadline|scheduled|cancel|done|recommend|gift|travel|subscription"
                    + "|tomorrow|today|next week)\\b",
            Pattern.CASE_INSENSITIVE);

    private final Clock clock;
    private final RecallProperties properties;
    private final ZoneId zone;
    private final DateTimeFormatter timeFormat;

    public ContextCompressionService(Clock clock, RecallProperties properties) {
        this.clock = clock;
        this.properties = properties;
        this.zone = ZoneId.of(properties.getIngestion().getZoneId());
        this.timeFormat = DateTimeFormatter.ofPattern("EEE, MMM d h:mm a", Locale.US).withZone(zone);
    }

    // ==================== Signal filter ====================

    /**
     * Scores one event on a 0-10 scale. Imminent, scheduled and context-tagged
     * events score high; finished, past and stale ones score low.
     */
    public int priority(MemoryEvent event) {
        Instant now = clock.instant();
        int priority = BASELINE_PRIORITY;

        if (event.getEventTime() != null) {
            double hoursUntil = Duration.between(now, event.getEventTime()).getSeconds() / 3600.0;
            if (hoursUntil > 0 && hoursUntil <= 2) {
                priority += 4;
            } else if (hoursUntil > 0 && hoursUntil <= 24) {
                priority += 3;
            } else if (hoursUntil > 0 && hoursUntil <= 168) {
                priority += 2;
            } else if (hoursUntil > 168 && hoursUntil <= 720) {
                priority += 1;
            } else if (hoursUntil < 0) {
                priority -= 2;
            }
        }

        EventStatus status = event.getStatus();
        if (status == EventStatus.COMPLETED || status == EventStatus.IGNORED) {
            priority -= 3;
        } else if (status == EventStatus.SCHEDULED || status == EventStatus.SNOOZED) {
            priority += 1;
        }

        boolean tagged = hasText(event.getContextUrl());
        if (tagged) {
            priority += 1;
        }

        if (event.getCreatedAt() != null) {
            double daysOld = Duration.between(event.getCreatedAt(), now).getSeconds() / 86400.0;
            if (daysOld > 30) {
                priority -= 1;
            }
            if (daysOld > 90) {
                priority -= 2;
            }
        }

        if (event.getType() == EventType.RECOMMENDATION && tagged) {
            priority += 1;
        }

        return Math.max(0, Math.min(MAX_PRIORITY, priority));
    }

    /**
     * Orders events by priority, highest first. Equal priorities keep their
     * input order.
     */
    public List<ScoredEvent> rank(List<MemoryEvent> events) {
        List<ScoredEvent> scored = new ArrayList<>(events.size());
        for (MemoryEvent event : events) {
            scored.add(new ScoredEvent(event, priority(event)));
        }
        scored.sort((a, b) -> Integer.compare(b.priority(), a.priority()));
        return scored;
    }

    // ==================== Dense encoding ====================

    public CompressedContext compressEvents(List<MemoryEvent> events) {
        return compressEvents(events, properties.getCompression().getMaxEvents());
    }

    public CompressedContext compressEvents(List<MemoryEvent> events, int maxEvents) {
        if (events == null || events.isEmpty()) {
            return new CompressedContext(EMPTY_EVENTS, 0, 5, List.of(), 1.0);
        }

        List<MemoryEvent> selected = rank(events).stream()
                .limit(maxEvents)
                .map(ScoredEvent::event)
                .toList();
        int verboseSize = selected.stream().mapToInt(e -> verboseLine(e).length()).sum();

        Instant now = clock.instant();
        String compressed = selected.stream()
                .map(e -> encodeLine(e, now))
                .collect(Collectors.joining("\n"));

        List<EventEdge> edges = detectEdges(selected);
        String edgeSuffix = "";
        if (!edges.isEmpty()) {
            edgeSuffix = "\nRelationships: " + edges.stream()
                    .limit(properties.getCompression().getMaxEdgesShown())
                    .map(EventEdge::render)
                    .collect(Collectors.joining(", "));
        }

        int tokenEstimate = (int) Math.ceil((compressed.length() + edgeSuffix.length()) / 4.0);
        double ratio = (double) verboseSize / compressed.length();
        log.debug("[Compressor] {} of {} events encoded, {} edges, ratio {}", selected.size(), events.size(),
                edges.size(), String.format(Locale.ROOT, "%.2f", ratio));

        return new CompressedContext(compressed + edgeSuffix, selected.size(), tokenEstimate, edges, ratio);
    }

    String encodeLine(MemoryEvent event, Instant now) {
        String time = NO_VALUE;
        if (event.getEventTime() != null) {
            time = timeFormat.format(event.getEventTime());
            if (event.getEventTime().isBefore(now)) {
                time += PAST_MARKER;
            }
        }
        return String.join("|",
                "#" + event.getId(),
                typeCode(event.getType()),
                event.isExpiredAt(now) ? EventStatus.EXPIRED_MARKER : statusMarker(event.getStatus()),
                "\"" + sanitize(event.getTitle()) + "\"",
                time,
                hasText(event.getLocation()) ? sanitize(event.getLocation()) : NO_VALUE,
                hasText(event.getSenderName()) ? sanitize(event.getSenderName()) : NO_SENDER,
                sanitize(event.getKeywords()));
    }

    /**
     * Verbose per-event form the dense encoding is measured against.
     */
    String verboseLine(MemoryEvent event) {
        String line = "[x] ID#" + event.getId()
                + " | \"" + event.getTitle() + "\""
                + " | type: " + (event.getType() != null ? event.getType().getValue() : EventType.OTHER.getValue())
                + " | time: x"
                + " | location: " + (hasText(event.getLocation()) ? event.getLocation() : "none")
                + " | status: " + (event.getStatus() != null ? event.getStatus().getValue() : "unknown")
                + " | sender: " + (hasText(event.getSenderName()) ? event.getSenderName() : "unknown")
                + " | keywords: " + nullToEmpty(event.getKeywords());
        if (hasText(event.getDescription())) {
            line += " | desc: " + event.getDescription();
        }
        return line;
    }

    /**
     * One-line-per-event summary for the smaller classification and extraction
     * prompts.
     */
    public String compressEventsLight(List<MemoryEvent> events) {
        if (events == null || events.isEmpty()) {
            return "";
        }
        return events.stream()
                .map(e -> "  [#" + e.getId() + "] " + typeCode(e.getType())
                        + " \"" + sanitize(e.getTitle()) + "\""
                        + " | " + (e.getEventTime() != null ? timeFormat.format(e.getEventTime()) : "no date")
                        + " | " + (hasText(e.getLocation()) ? sanitize(e.getLocation()) : NO_VALUE)
                        + " | kw: " + sanitize(e.getKeywords())
                        + " | from: " + (hasText(e.getSenderName()) ? sanitize(e.getSenderName()) : NO_SENDER))
                .collect(Collectors.joining("\n"));
    }

    static String typeCode(EventType type) {
        return type != null ? type.getCode() : EventType.OTHER.getCode();
    }

    static String statusMarker(EventStatus status) {
        return status != null ? status.getMarker() : EventStatus.UNKNOWN_MARKER;
    }

    // ==================== Edges ====================

    /**
     * Computes every pairwise relationship in the given working set.
     */
    public List<EventEdge> detectEdges(List<MemoryEvent> events) {
        List<EventEdge> edges = new ArrayList<>();
        if (events.size() < 2) {
            return edges;
        }
        List<Set<String>> keywordSets = events.stream().map(ContextCompressionService::keywordSet).toList();

        for (int i = 0; i < events.size(); i++) {
            for (int j = i + 1; j < events.size(); j++) {
                MemoryEvent a = events.get(i);
                MemoryEvent b = events.get(j);

                Set<String> overlap = new HashSet<>(keywordSets.get(i));
                overlap.retainAll(keywordSets.get(j));
                if (overlap.size() >= 2) {
                    edges.add(new EventEdge(a.getId(), b.getId(), topicRelation(a, b, overlap.size())));
                }

                if (a.getEventTime() != null && b.getEventTime() != null) {
                    long diff = Math.abs(Duration.between(a.getEventTime(), b.getEventTime()).getSeconds());
                    if (diff > 0 && diff <= CONFLICT_WINDOW_SECONDS) {
                        edges.add(new EventEdge(a.getId(), b.getId(), EventEdge.Relation.CONFLICTS));
                    }
                }
            }
        }
        return edges;
    }

    private EventEdge.Relation topicRelation(MemoryEvent a, MemoryEvent b, int overlap) {
        boolean aCancels = titleMentions(a, CANCEL_TERMS);
        boolean bCancels = titleMentions(b, CANCEL_TERMS);
        if ((a.getType() == EventType.SUBSCRIPTION && bCancels) || (b.getType() == EventType.SUBSCRIPTION && aCancels)) {
            return EventEdge.Relation.CANCELS;
        }
        if (titleMentions(a, RESCHEDULE_TERMS) || titleMentions(b, RESCHEDULE_TERMS)) {
            return EventEdge.Relation.UPDATES;
        }
        return overlap >= 3 ? EventEdge.Relation.SAME_TOPIC : EventEdge.Relation.RELATED;
    }

    private static boolean titleMentions(MemoryEvent event, List<String> terms) {
        String title = nullToEmpty(event.getTitle()).toLowerCase(Locale.ROOT);
        return terms.stream().anyMatch(title::contains);
    }

    private static Set<String> keywordSet(MemoryEvent event) {
        return Arrays.stream(nullToEmpty(event.getKeywords()).toLowerCase(Locale.ROOT).split(","))
                .map(String::trim)
                .filter(k -> k.length() >= MIN_KEYWORD_LENGTH)
                .collect(Collectors.toSet());
    }

    // ==================== Chat memory ====================

    public ChatMemoryResult compressChatHistory(List<ChatTurn> history) {
        return compressChatHistory(history, properties.getCompression().getRecentTurns());
    }

    /**
     * Keeps the last {@code maxRecentTurns} turns verbatim and folds the older
     * prefix into a memory packet of user questions, assistant key facts and
     * referenced event ids.
     */
    public ChatMemoryResult compressChatHistory(List<ChatTurn> history, int maxRecentTurns) {
        if (history == null || history.isEmpty()) {
            return new ChatMemoryResult(List.of(), null);
        }
        if (history.size() <= maxRecentTurns) {
            return new ChatMemoryResult(List.copyOf(history), null);
        }

        List<ChatTurn> older = history.subList(0, history.size() - maxRecentTurns);
        List<ChatTurn> recent = List.copyOf(history.subList(history.size() - maxRecentTurns, history.size()));

        List<String> userQueries = new ArrayList<>();
        List<String> keyFacts = new ArrayList<>();
        Set<String> eventRefs = new LinkedHashSet<>();

        for (ChatTurn turn : older) {
            String content = nullToEmpty(turn.content()).trim();
            if (content.length() < 5) {
                continue;
            }
            if (turn.isUser()) {
                userQueries.add(clip(content, USER_SUMMARY_LENGTH));
                continue;
            }
            List<String> sentences = Arrays.stream(SENTENCE_SPLIT.split(content))
                    .filter(s -> s.length() > 15)
                    .limit(SENTENCES_PER_TURN)
                    .toList();
            for (String sentence : sentences) {
                if (KEY_FACT_VOCABULARY.matcher(sentence).find()) {
                    keyFacts.add(clip(sentence, KEY_FACT_LENGTH));
                }
                Matcher refs = EVENT_REF.matcher(sentence);
                while (refs.find()) {
                    eventRefs.add(refs.group());
                }
            }
        }

        List<String> packet = new ArrayList<>();
        packet.add("[Prior conversation: " + older.size() + " turns compressed]");
        if (!userQueries.isEmpty()) {
            packet.add("User asked: " + String.join(" -> ", lastN(userQueries, MAX_USER_SUMMARIES)));
        }
        if (!keyFacts.isEmpty()) {
            packet.add("Key facts: " + String.join(" | ", lastN(keyFacts, MAX_KEY_FACTS)));
        }
        if (!eventRefs.isEmpty()) {
            packet.add("Events discussed: " + eventRefs.stream().limit(MAX_EVENT_REFS)
                    .collect(Collectors.joining(", ")));
        }
        log.debug("[Compressor] Folded {} chat turns into memory packet", older.size());
        return new ChatMemoryResult(recent, String.join("\n", packet));
    }

    // ==================== Helpers ====================

    private static List<String> lastN(List<String> items, int n) {
        return items.subList(Math.max(0, items.size() - n), items.size());
    }

    private static String clip(String text, int maxLength) {
        return text.length() > maxLength ? text.substring(0, maxLength) + ELLIPSIS : text;
    }

    private static String sanitize(String text) {
        return nullToEmpty(text).replace('|', '/').replace('\n', ' ').replace('\r', ' ');
    }

    private static String nullToEmpty(String text) {
        return text != null ? text : "";
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
