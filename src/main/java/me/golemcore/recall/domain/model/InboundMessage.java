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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Transport-neutral view of an incoming chat message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {

    private String id;
    private String chatId;
    private boolean fromMe;
    private String senderName;
    private String content;
    private Instant timestamp;

    @JsonIgnore
    public boolean isGroup() {
        return chatId != null && chatId.contains("@g.us");
    }

    /**
     * Sender id: {@code self} for own messages, else the chat id before the
     * {@code @}.
     */
    public String senderId() {
        if (fromMe) {
            return "self";
        }
        if (chatId == null) {
            return "unknown";
        }
        int at = chatId.indexOf('@');
        return at >= 0 ? chatId.substring(0, at) : chatId;
    }
}
