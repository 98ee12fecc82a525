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

import java.time.Instant;

/**
 * Scheduled delivery condition owned by exactly one {@link MemoryEvent}. Time
 * triggers hold an ISO-8601 fire instant as value; url and keyword triggers
 * hold a lower-cased match term.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trigger {

    private Long id;
    private Long eventId;
    private TriggerType type;
    private String value;
    private boolean fired;
    private Instant createdAt;
}
