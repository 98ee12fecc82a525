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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Event proposed by the model for one message, before the upsert policy runs.
 * The time is kept as the raw model string until normalized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventCandidate {

    @Builder.Default
    private EventType type = EventType.OTHER;

    private String title;
    private String description;
    private String eventTime;
    private String location;

    @Builder.Default
    private List<String> participants = new ArrayList<>();

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private double confidence;

    @Builder.Default
    private EventAction eventAction = EventAction.CREATE;

    private Long targetEventId;

    public String joinedKeywords() {
        return String.join(",", keywords != null ? keywords : List.of());
    }
}
