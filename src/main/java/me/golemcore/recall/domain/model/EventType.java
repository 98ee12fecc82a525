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

import java.util.Locale;

/**
 * Kind of a memory event. Each type carries the fixed three-letter code used by
 * the dense prompt encoding.
 */
public enum EventType {

    MEETING("meeting", "MTG"),
    DEADLINE("deadline", "DLN"),
    REMINDER("reminder", "RMD"),
    TRAVEL("travel", "TRV"),
    TASK("task", "TSK"),
    SUBSCRIPTION("subscription", "SUB"),
    RECOMMENDATION("recommendation", "REC"),
    OTHER("other", "OTH");

    private final String value;
    private final String code;

    EventType(String value, String code) {
        this.value = value;
        this.code = code;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolves a model-supplied type name. Unknown or missing names map to
     * {@link #OTHER}.
     */
    @JsonCreator
    public static EventType fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EventType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
