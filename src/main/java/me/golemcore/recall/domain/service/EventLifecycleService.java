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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.EventDetails;
import me.golemcore.recall.domain.model.EventStatus;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.PendingAction;
import me.golemcore.recall.domain.model.StoreStats;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.EventStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * Manual event management behind the HTTP API: listing, status changes,
 * snoozing, deletion and confirmation of pending modifications.
 *
 * <p>
 * Status changes here follow {@link EventStatus#canTransitionTo}; an illegal
 * change is rejected with {@link IllegalStateException}. Unknown ids raise
 * {@link NoSuchElementException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventLifecycleService {

    private static final String TAG = "Events";

    public static final String FILTER_ALL = "all";
    public static final String FILTER_EXPIRED = "expired";

    private final EventStorePort eventStore;
    private final RecallProperties properties;
    private final Clock clock;

    /**
     * Lists events newest first.
     *
     * @param status
     *            {@code all}, {@code expired} or a stored status value
     * @throws IllegalArgumentException
     *             for an unknown status filter or negative paging values
     */
    public List<MemoryEvent> listEvents(String status, int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
        Predicate<MemoryEvent> filter = statusFilter(status);
        return eventStore.getAllEvents().stream()
                .filter(filter)
                .skip(offset)
                .limit(limit)
                .toList();
    }

    public EventDetails getEvent(long id) {
        MemoryEvent event = require(id);
        return new EventDetails(event, eventStore.getTriggers(id), event.isExpiredAt(clock.instant()));
    }

    public MemoryEvent complete(long id) {
        return transition(id, EventStatus.COMPLETED);
    }

    public MemoryEvent ignore(long id) {
        return transition(id, EventStatus.IGNORED);
    }

    /**
     * Approves a discovered (or wakes a snoozed) event so its triggers fire.
     * Already scheduled events are returned unchanged.
     */
    public MemoryEvent schedule(long id) {
        MemoryEvent event = require(id);
        if (event.getStatus() == EventStatus.SCHEDULED) {
            return event;
        }
        return transition(id, EventStatus.SCHEDULED);
    }

    /**
     * Snoozes for the given minutes, or the configured default when not
     * positive. An already snoozed event gets a new wake-up time.
     */
    public MemoryEvent snooze(long id, Integer minutes) {
        MemoryEvent event = require(id);
        if (event.getStatus() != EventStatus.SNOOZED) {
            checkTransition(event, EventStatus.SNOOZED);
        }
        int effective = minutes != null && minutes > 0 ? minutes
                : properties.getIngestion().getDefaultSnoozeMinutes();
        Instant until = clock.instant().plus(Duration.ofMinutes(effective));
        eventStore.snoozeEvent(id, until);
        log.info("[{}] Event #{} snoozed until {}", TAG, id, until);
        return require(id);
    }

    public void delete(long id) {
        if (!eventStore.deleteEvent(id)) {
            throw new NoSuchElementException("Event not found: " + id);
        }
        log.info("[{}] Event #{} deleted", TAG, id);
    }

    /**
     * Applies a resubmitted {@link PendingAction}.
     *
     * @throws IllegalArgumentException
     *             when the payload targets another event or carries no changes
     * @throws IllegalStateException
     *             when the event is already completed or ignored
     */
    public MemoryEvent confirm(long id, PendingAction pendingAction) {
        if (pendingAction == null || pendingAction.getChanges() == null || pendingAction.getChanges().isEmpty()) {
            throw new IllegalArgumentException("Pending action carries no changes");
        }
        if (pendingAction.getTargetEventId() != null && pendingAction.getTargetEventId() != id) {
            throw new IllegalArgumentException("Pending action targets event #" + pendingAction.getTargetEventId());
        }
        MemoryEvent event = require(id);
        if (event.getStatus() != null && event.getStatus().isTerminal()) {
            throw new IllegalStateException("Event #" + id + " is " + event.getStatus().getValue());
        }
        MemoryEvent updated = eventStore.updateEvent(id, pendingAction.getChanges())
                .orElseThrow(() -> new NoSuchElementException("Event not found: " + id));
        log.info("[{}] Confirmed modification of event #{}: {}", TAG, id, pendingAction.getDescription());
        return updated;
    }

    public StoreStats stats() {
        return eventStore.getStats();
    }

    private MemoryEvent transition(long id, EventStatus target) {
        MemoryEvent event = require(id);
        checkTransition(event, target);
        eventStore.updateStatus(id, target);
        log.info("[{}] Event #{} {} -> {}", TAG, id, event.getStatus().getValue(), target.getValue());
        return require(id);
    }

    private static void checkTransition(MemoryEvent event, EventStatus target) {
        if (event.getStatus() == null || !event.getStatus().canTransitionTo(target)) {
            throw new IllegalStateException("Cannot move event #" + event.getId() + " from "
                    + (event.getStatus() != null ? event.getStatus().getValue() : "unknown") + " to "
                    + target.getValue());
        }
    }

    private MemoryEvent require(long id) {
        return eventStore.findEvent(id).orElseThrow(() -> new NoSuchElementException("Event not found: " + id));
    }

    private Predicate<MemoryEvent> statusFilter(String status) {
        String value = status == null || status.isBlank() ? FILTER_ALL : status.trim().toLowerCase(Locale.ROOT);
        if (FILTER_ALL.equals(value)) {
            return event -> true;
        }
        if (FILTER_EXPIRED.equals(value)) {
            Instant now = clock.instant();
            return event -> event.isExpiredAt(now);
        }
        EventStatus wanted = EventStatus.fromValue(value);
        return event -> event.getStatus() == wanted;
    }
}
