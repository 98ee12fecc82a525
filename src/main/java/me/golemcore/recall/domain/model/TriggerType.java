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

import java.time.Duration;
import java.util.List;

/**
 * Delivery condition kinds. Time triggers carry their lead offset before the
 * event time.
 */
public enum TriggerType {

    TIME_24H("time_24h", Duration.ofHours(24)),
    TIME_1H("time_1h", Duration.ofHours(1)),
    TIME_15M("time_15m", Duration.ofMinutes(15)),
    URL("url", null),
    KEYWORD("keyword", null);

    /** Time-based trigger kinds, longest lead first. */
    public static final List<TriggerType> TIME_TRIGGERS = List.of(TIME_24H, TIME_1H, TIME_15M);

    private final String value;
    private final Duration leadTime;

    TriggerType(String value, Duration leadTime) {
        this.value = value;
        this.leadTime = leadTime;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Duration getLeadTime() {
        return leadTime;
    }

    public boolean isTimeBased() {
        return leadTime != null;
    }

    @JsonCreator
    public static TriggerType fromValue(String value) {
        for (TriggerType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trigger type: " + value);
    }
}
