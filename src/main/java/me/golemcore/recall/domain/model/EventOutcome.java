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
 * Per-event entry of an ingestion result: the created or updated event and the
 * scheduled events it collides with.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventOutcome {

    private MemoryEvent event;
    private boolean updated;

    @Builder.Default
    private List<ConflictInfo> conflicts = new ArrayList<>();

    public boolean hasConflicts() {
        return conflicts != null && !conflicts.isEmpty();
    }
}
