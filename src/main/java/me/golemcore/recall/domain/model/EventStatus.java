package me.golemcore.recall.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Stored lifecycle state of a memory event.
 *
 * <p>
 * Allowed manual transitions:
 *
 * <pre>
 * discovered -> scheduled | ignored | snoozed
 * scheduled  -> reminded | snoozed | completed | ignored
 * snoozed    -> scheduled | ignored | completed
 * reminded   -> completed | snoozed
 * </pre>
 *
 * {@code completed} and {@code ignored} are terminal. Deletion is allowed from
 * every state and is not modelled here. "Expired" is a read-time label derived
 * from the event time, never a stored status.
 */
public enum EventStatus {

    DISCOVERED("discovered", "🆕"),
    SCHEDULED("scheduled", "⏰"),
    SNOOZED("snoozed", "💤"),
    REMINDED("reminded", "🔔"),
    COMPLETED("completed", "✅"),
    IGNORED("ignored", "🚫");

    /** Marker for the derived "expired" label. */
    public static final String EXPIRED_MARKER = "⌛";

    /** Marker used when the status is unknown. */
    public static final String UNKNOWN_MARKER = "❓";

    private final String value;
    private final String marker;

    EventStatus(String value, String marker) {
        this.value = value;
        this.marker = marker;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getMarker() {
        return marker;
    }

    public boolean isActive() {
        return this != COMPLETED && this != IGNORED;
    }

    public boolean isTerminal() {
        return !isActive();
    }

    public boolean canTransitionTo(EventStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<EventStatus> allowedTargets() {
        return switch (this) {
        case DISCOVERED -> EnumSet.of(SCHEDULED, IGNORED, SNOOZED);
        case SCHEDULED -> EnumSet.of(REMINDED, SNOOZED, COMPLETED, IGNORED);
        case SNOOZED -> EnumSet.of(SCHEDULED, IGNORED, COMPLETED);
        case REMINDED -> EnumSet.of(COMPLETED, SNOOZED);
        case COMPLETED, IGNORED -> EnumSet.noneOf(EventStatus.class);
        };
    }

    public static Optional<EventStatus> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EventStatus status : values()) {
            if (status.value.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static EventStatus fromValue(String value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown event status: " + value));
    }
}
