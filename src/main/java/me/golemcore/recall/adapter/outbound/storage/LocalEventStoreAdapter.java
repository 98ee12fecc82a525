package me.golemcore.recall.adapter.outbound.storage;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.ChatMessage;
import me.golemcore.recall.domain.model.Contact;
import me.golemcore.recall.domain.model.EventChanges;
import me.golemcore.recall.domain.model.EventStatus;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.StoreStats;
import me.golemcore.recall.domain.model.Trigger;
import me.golemcore.recall.domain.service.EventTitleSupport;
import me.golemcore.recall.port.outbound.EventStorePort;
import me.golemcore.recall.port.outbound.MessageStorePort;
import me.golemcore.recall.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * In-memory event, trigger, message and contact store persisted as JSON
 * snapshots through {@link StoragePort}.
 *
 * <p>
 * Every public method is {@code synchronized}, so each single mutation is
 * atomic and every read sees a consistent snapshot. Events and triggers are
 * rewritten atomically after each mutation; messages are appended to a JSONL
 * log. Returned events are copies.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalEventStoreAdapter implements EventStorePort, MessageStorePort {

    static final String DIRECTORY = "recall";
    static final String EVENTS_FILE = "events.json";
    static final String TRIGGERS_FILE = "triggers.json";
    static final String CONTACTS_FILE = "contacts.json";
    static final String MESSAGES_FILE = "messages.jsonl";

    /** Messages kept in memory per chat for context lookups; the JSONL log keeps them all. */
    static final int RECENT_MESSAGES_PER_CHAT = 50;

    private static final Comparator<ChatMessage> OLDEST_FIRST = Comparator.comparing(ChatMessage::getTimestamp,
            Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final Comparator<MemoryEvent> NEWEST_FIRST = Comparator
            .comparing(MemoryEvent::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(MemoryEvent::getId, Comparator.reverseOrder());

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<Long, MemoryEvent> events = new LinkedHashMap<>();
    private final Map<Long, Trigger> triggers = new LinkedHashMap<>();
    private final Map<String, Contact> contacts = new LinkedHashMap<>();
    private final Map<String, Deque<ChatMessage>> recentMessages = new HashMap<>();
    private long messageCount;
    private final AtomicLong eventSequence = new AtomicLong();
    private final AtomicLong triggerSequence = new AtomicLong();

    @PostConstruct
    public synchronized void init() {
        readList(EVENTS_FILE, new TypeReference<List<MemoryEvent>>() {
        }).forEach(e -> events.put(e.getId(), e));
        readList(TRIGGERS_FILE, new TypeReference<List<Trigger>>() {
        }).forEach(t -> triggers.put(t.getId(), t));
        readList(CONTACTS_FILE, new TypeReference<List<Contact>>() {
        }).forEach(c -> contacts.put(c.getId(), c));
        readMessageLog();

        eventSequence.set(events.keySet().stream().mapToLong(Long::longValue).max().orElse(0));
        triggerSequence.set(triggers.keySet().stream().mapToLong(Long::longValue).max().orElse(0));
        log.info("[Store] Loaded {} events, {} triggers, {} contacts, {} messages",
                events.size(), triggers.size(), contacts.size(), messageCount);
    }

    // ==================== Events ====================

    @Override
    public synchronized MemoryEvent insertEvent(MemoryEvent event) {
        MemoryEvent stored = copy(event);
        stored.setId(eventSequence.incrementAndGet());
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(clock.instant());
        }
        stored.setConfidence(MemoryEvent.clampConfidence(stored.getConfidence()));
        if (stored.getStatus() == null) {
            stored.setStatus(EventStatus.DISCOVERED);
        }
        events.put(stored.getId(), stored);
        persistEvents();
        log.debug("[Store] Inserted event #{}: \"{}\"", stored.getId(), stored.getTitle());
        return copy(stored);
    }

    @Override
    public synchronized Optional<MemoryEvent> findEvent(long id) {
        return Optional.ofNullable(events.get(id)).map(this::copy);
    }

    @Override
    public synchronized Optional<MemoryEvent> updateEvent(long id, EventChanges changes) {
        MemoryEvent event = events.get(id);
        if (event == null) {
            return Optional.empty();
        }
        changes.applyTo(event);
        persistEvents();
        return Optional.of(copy(event));
    }

    @Override
    public synchronized boolean deleteEvent(long id) {
        if (events.remove(id) == null) {
            return false;
        }
        boolean triggersRemoved = triggers.values().removeIf(t -> t.getEventId() == id);
        persistEvents();
        if (triggersRemoved) {
            persistTriggers();
        }
        return true;
    }

    @Override
    public synchronized boolean updateStatus(long id, EventStatus status) {
        MemoryEvent event = events.get(id);
        if (event == null) {
            return false;
        }
        event.setStatus(status);
        if (status != EventStatus.SNOOZED) {
            event.setSnoozedUntil(null);
        }
        persistEvents();
        return true;
    }

    @Override
    public synchronized boolean snoozeEvent(long id, Instant until) {
        MemoryEvent event = events.get(id);
        if (event == null) {
            return false;
        }
        event.setStatus(EventStatus.SNOOZED);
        event.setSnoozedUntil(until);
        persistEvents();
        return true;
    }

    @Override
    public synchronized List<MemoryEvent> getActiveEvents(int limit) {
        return events.values().stream()
                .filter(e -> e.getStatus().isActive())
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized List<MemoryEvent> findActiveEventsByKeywords(List<String> keywords) {
        List<String> terms = normalizeTerms(keywords);
        if (terms.isEmpty()) {
            return List.of();
        }
        return rank(events.values().stream().filter(e -> e.getStatus().isActive()), terms,
                e -> joinFields(e.getTitle(), e.getKeywords(), e.getDescription()), Integer.MAX_VALUE);
    }

    @Override
    public synchronized Optional<MemoryEvent> findDuplicateEvent(String title, int withinHours) {
        Instant since = clock.instant().minus(Duration.ofHours(withinHours));
        return events.values().stream()
                .filter(e -> e.getCreatedAt() != null && !e.getCreatedAt().isBefore(since))
                .filter(e -> EventTitleSupport.isDuplicate(e.getTitle(), title))
                .sorted(NEWEST_FIRST)
                .findFirst()
                .map(this::copy);
    }

    @Override
    public synchronized List<MemoryEvent> findTimeConflicts(Instant eventTime, int windowMinutes) {
        long windowSeconds = windowMinutes * 60L;
        return events.values().stream()
                .filter(e -> e.getStatus() == EventStatus.SCHEDULED && e.getEventTime() != null)
                .filter(e -> Math.abs(Duration.between(e.getEventTime(), eventTime).getSeconds()) <= windowSeconds)
                .sorted(Comparator.comparing(MemoryEvent::getEventTime))
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized Trigger insertTrigger(Trigger trigger) {
        Trigger stored = Trigger.builder()
                .id(triggerSequence.incrementAndGet())
                .eventId(trigger.getEventId())
                .type(trigger.getType())
                .value(trigger.getValue())
                .fired(trigger.isFired())
                .createdAt(trigger.getCreatedAt() != null ? trigger.getCreatedAt() : clock.instant())
                .build();
        triggers.put(stored.getId(), stored);
        persistTriggers();
        return stored;
    }

    @Override
    public synchronized List<Trigger> getTriggers(long eventId) {
        return triggers.values().stream()
                .filter(t -> t.getEventId() == eventId)
                .toList();
    }

    @Override
    public synchronized List<MemoryEvent> searchByLocation(String keyword, int hotWindowDays, int limit) {
        if (keyword == null || keyword.isBlank()) {
            return List.of();
        }
        String term = keyword.trim().toLowerCase(Locale.ROOT);
        return liveWithin(hotWindowDays)
                .filter(e -> contains(e.getLocation(), term) || contains(e.getContextUrl(), term))
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized List<MemoryEvent> searchByKeywords(List<String> keywords, int hotWindowDays, int limit) {
        List<String> terms = normalizeTerms(keywords);
        if (terms.isEmpty()) {
            return List.of();
        }
        return rank(liveWithin(hotWindowDays), terms,
                e -> joinFields(e.getTitle(), e.getDescription(), e.getKeywords(), e.getLocation(), e.getContextUrl()),
                limit);
    }

    @Override
    public synchronized List<MemoryEvent> getAllEvents() {
        return events.values().stream().sorted(NEWEST_FIRST).map(this::copy).toList();
    }

    @Override
    public synchronized StoreStats getStats() {
        return StoreStats.builder()
                .totalMessages(messageCount)
                .totalEvents(events.size())
                .activeEvents(events.values().stream().filter(e -> e.getStatus().isActive()).count())
                .completedEvents(events.values().stream().filter(e -> e.getStatus() == EventStatus.COMPLETED).count())
                .totalTriggers(triggers.size())
                .pendingTriggers(triggers.values().stream().filter(t -> !t.isFired()).count())
                .contacts(contacts.size())
                .build();
    }

    // ==================== Messages ====================

    @Override
    public synchronized void insertMessage(ChatMessage message) {
        remember(message);
        try {
            storagePort.appendText(DIRECTORY, MESSAGES_FILE, objectMapper.writeValueAsString(message) + "\n").join();
        } catch (JsonProcessingException | CompletionException e) {
            throw new IllegalStateException("Failed to store message " + message.getId(), e);
        }
    }

    @Override
    public synchronized Contact upsertContact(Contact contact) {
        Contact existing = contacts.get(contact.getId());
        if (existing == null) {
            existing = Contact.builder()
                    .id(contact.getId())
                    .name(contact.getName())
                    .firstSeen(contact.getFirstSeen())
                    .lastSeen(contact.getLastSeen())
                    .messageCount(Math.max(1, contact.getMessageCount()))
                    .build();
            contacts.put(existing.getId(), existing);
        } else {
            if (contact.getName() != null) {
                existing.setName(contact.getName());
            }
            existing.setLastSeen(contact.getLastSeen());
            existing.setMessageCount(existing.getMessageCount() + 1);
        }
        writeSnapshot(CONTACTS_FILE, new ArrayList<>(contacts.values()));
        return existing;
    }

    @Override
    public synchronized List<ChatMessage> getRecentMessages(String chatId, int limit) {
        Deque<ChatMessage> ofChat = recentMessages.get(chatId);
        if (ofChat == null || limit <= 0) {
            return List.of();
        }
        List<ChatMessage> ordered = new ArrayList<>(ofChat);
        return List.copyOf(ordered.subList(Math.max(0, ordered.size() - limit), ordered.size()));
    }

    private void remember(ChatMessage message) {
        Deque<ChatMessage> ofChat = recentMessages.computeIfAbsent(message.getChatId(), k -> new ArrayDeque<>());
        ChatMessage last = ofChat.peekLast();
        if (last == null || OLDEST_FIRST.compare(last, message) <= 0) {
            ofChat.addLast(message);
        } else {
            // late delivery: keep the window ordered by timestamp
            List<ChatMessage> ordered = new ArrayList<>(ofChat);
            ordered.add(message);
            ordered.sort(OLDEST_FIRST);
            ofChat.clear();
            ofChat.addAll(ordered);
        }
        while (ofChat.size() > RECENT_MESSAGES_PER_CHAT) {
            ofChat.removeFirst();
        }
        messageCount++;
    }

    // ==================== Internals ====================

    private Stream<MemoryEvent> liveWithin(int hotWindowDays) {
        Instant since = clock.instant().minus(Duration.ofDays(hotWindowDays));
        return events.values().stream()
                .filter(e -> e.getStatus().isActive())
                .filter(e -> e.getCreatedAt() != null && !e.getCreatedAt().isBefore(since));
    }

    private List<MemoryEvent> rank(Stream<MemoryEvent> candidates, List<String> terms,
            Function<MemoryEvent, String> haystack, int limit) {
        record Hit(MemoryEvent event, long score) {
        }
        return candidates
                .map(e -> {
                    String text = haystack.apply(e);
                    return new Hit(e, terms.stream().filter(text::contains).count());
                })
                .filter(hit -> hit.score() > 0)
                .sorted(Comparator.comparingLong(Hit::score).reversed()
                        .thenComparing(Hit::event, NEWEST_FIRST))
                .limit(limit)
                .map(hit -> copy(hit.event()))
                .toList();
    }

    private static List<String> normalizeTerms(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
                .filter(Objects::nonNull)
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .distinct()
                .toList();
    }

    private static String joinFields(String... fields) {
        StringBuilder sb = new StringBuilder();
        for (String field : fields) {
            if (field != null) {
                sb.append(field.toLowerCase(Locale.ROOT)).append(' ');
            }
        }
        return sb.toString();
    }

    private static boolean contains(String field, String term) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(term);
    }

    private MemoryEvent copy(MemoryEvent event) {
        return event.toBuilder()
                .participants(event.getParticipants() != null ? new ArrayList<>(event.getParticipants())
                        : new ArrayList<>())
                .build();
    }

    private void persistEvents() {
        writeSnapshot(EVENTS_FILE, new ArrayList<>(events.values()));
    }

    private void persistTriggers() {
        writeSnapshot(TRIGGERS_FILE, new ArrayList<>(triggers.values()));
    }

    private void writeSnapshot(String file, Object snapshot) {
        try {
            storagePort.putTextAtomic(DIRECTORY, file, objectMapper.writeValueAsString(snapshot), false).join();
        } catch (JsonProcessingException | CompletionException e) {
            throw new IllegalStateException("Failed to persist " + file, e);
        }
    }

    private <T> List<T> readList(String file, TypeReference<List<T>> type) {
        try {
            String json = storagePort.getText(DIRECTORY, file).join();
            if (json == null || json.isBlank()) {
                return List.of();
            }
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException | CompletionException e) {
            log.warn("[Store] Could not read {}, starting empty: {}", file, e.getMessage());
            return List.of();
        }
    }

    private void readMessageLog() {
        String jsonl;
        try {
            jsonl = storagePort.getText(DIRECTORY, MESSAGES_FILE).join();
        } catch (CompletionException e) {
            log.warn("[Store] Could not read {}: {}", MESSAGES_FILE, e.getMessage());
            return;
        }
        if (jsonl == null) {
            return;
        }
        for (String line : jsonl.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                remember(objectMapper.readValue(line, ChatMessage.class));
            } catch (JsonProcessingException e) {
                log.warn("[Store] Skipping corrupt message line: {}", e.getOriginalMessage());
            }
        }
    }
}
