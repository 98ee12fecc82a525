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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Structured memory unit extracted from a chat message.
 *
 * <p>
 * Keywords are stored as a comma-joined string of lower-case tokens, the same
 * representation the dense prompt encoding emits verbatim.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemoryEvent {

    private Long id;
    private String messageId;
    private EventType type;
    private String title;
    private String description;
    private Instant eventTime;
    private String location;

    @Builder.Default
    private List<String> participants = new ArrayList<>();

    @Builder.Default
    private String keywords = "";

    private double confidence;
    private EventStatus status;
    private String contextUrl;
    private String senderName;
    private Instant createdAt;
    private Instant snoozedUntil;

    /**
     * Splits the keyword string into trimmed, non-empty tokens.
     */
    public List<String> keywordList() {
        if (keywords == null || keywords.isBlank()) {
            return List.of();
        }
        return Arrays.stream(keywords.split(","))
                .map(String::trim)
                .filter(k -> !k.isEmpty())
                .toList();
    }

    /**
     * Derived read-time label: an active event whose time has already passed.
     */
    public boolean isExpiredAt(Instant now) {
        return eventTime != null && eventTime.isBefore(now) && (status == null || status.isActive());
    }

    public static double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
