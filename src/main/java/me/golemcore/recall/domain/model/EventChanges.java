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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Partial field update for an event. Only non-null fields are applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventChanges {

    private String title;
    private String description;
    private String location;
    private Instant eventTime;
    private String keywords;
    private List<String> participants;

    @JsonIgnore
    public boolean isEmpty() {
        return title == null && description == null && location == null && eventTime == null
                && keywords == null && participants == null;
    }

    /**
     * Applies the non-null fields onto the given event in place.
     */
    public void applyTo(MemoryEvent event) {
        if (title != null) {
            event.setTitle(title);
        }
        if (description != null) {
            event.setDescription(description);
        }
        if (location != null) {
            event.setLocation(location);
        }
        if (eventTime != null) {
            event.setEventTime(eventTime);
        }
        if (keywords != null) {
            event.setKeywords(keywords);
        }
        if (participants != null) {
            event.setParticipants(List.copyOf(participants));
        }
    }
}
