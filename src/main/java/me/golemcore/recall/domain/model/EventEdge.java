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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derived pairwise relationship between two events. Recomputed from the
 * working set on every compression pass.
 */
public record EventEdge(long sourceId, long targetId, Relation relation) {

    public enum Relation {
        CANCELS("cancels"), UPDATES("updates"), CONFLICTS("conflicts"), RELATED("related"), SAME_TOPIC("same_topic");

        private final String value;

        Relation(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }

    public String render() {
        return "#" + sourceId + "->#" + targetId + "(" + relation.getValue() + ")";
    }
}
