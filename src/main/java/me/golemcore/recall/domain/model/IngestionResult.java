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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of processing one inbound chat message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionResult {

    private String messageId;
    private int eventsCreated;
    private int eventsUpdated;
    private int triggersCreated;
    private boolean skipped;
    private String skipReason;
    private boolean failed;

    @Builder.Default
    private List<EventOutcome> events = new ArrayList<>();

    private ActionResult actionPerformed;
    private PendingAction pendingAction;

    public static IngestionResult skipped(String messageId, String reason) {
        return IngestionResult.builder().messageId(messageId).skipped(true).skipReason(reason).build();
    }

    public static IngestionResult failed(String messageId) {
        return IngestionResult.builder().messageId(messageId).failed(true).build();
    }
}
