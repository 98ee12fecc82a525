package me.golemcore.recall.port.outbound;

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

import me.golemcore.recall.domain.model.EventChanges;
import me.golemcore.recall.domain.model.EventStatus;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.StoreStats;
import me.golemcore.recall.domain.model.Trigger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Event and trigger storage primitives. Every single mutation is atomic;
 * read-then-write sequences spanning several calls are not.
 */
public interface EventStorePort {

    /**
     * Inserts the event, assigning id and creation time.
     */
    MemoryEvent insertEvent(MemoryEvent event);

    Optional<MemoryEvent> findEvent(long id);

    /**
     * Applies the non-null fields of {@code changes}.
     *
     * @return the updated event, empty when the id is unknown
     */
    Optional<MemoryEvent> updateEvent(long id, EventChanges changes);

    /**
     * Deletes the event together with its triggers.
     */
    boolean deleteEvent(long id);

    boolean updateStatus(long id, EventStatus status);

    /**
     * Moves the event to {@code snoozed} until the given instant.
     */
    boolean snoozeEvent(long id, Instant until);

    /**
     * Events in a non-terminal status, most recently created first.
     */
    List<MemoryEvent> getActiveEvents(int limit);

    /**
     * Active events ranked by how many of the keywords hit title, keywords or
     * description. Events without any hit are not returned.
     */
    List<MemoryEvent> findActiveEventsByKeywords(List<String> keywords);

    /**
     * Event created within the window whose title is a near duplicate.
     */
    Optional<MemoryEvent> findDuplicateEvent(String title, int withinHours);

    /**
     * Scheduled events whose time lies within +/- {@code windowMinutes}.
     */
    List<MemoryEvent> findTimeConflicts(Instant eventTime, int windowMinutes);

    Trigger insertTrigger(Trigger trigger);

    List<Trigger> getTriggers(long eventId);

    /**
     * Live events created within the hot window whose location or context tag
     * contains the keyword.
     */
    List<MemoryEvent> searchByLocation(String keyword, int hotWindowDays, int limit);

    /**
     * Relevance-ranked search of live events created within the hot window.
     */
    List<MemoryEvent> searchByKeywords(List<String> keywords, int hotWindowDays, int limit);

    /**
     * Every stored event, most recently created first.
     */
    List<MemoryEvent> getAllEvents();

    StoreStats getStats();
}
