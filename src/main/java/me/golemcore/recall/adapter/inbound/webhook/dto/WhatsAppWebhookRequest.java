package me.golemcore.recall.adapter.inbound.webhook.dto;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for {@code POST /api/webhook/whatsapp}. Accepts the Evolution
 * API envelope ({@code {event, instance, data: {...}}}) as well as the bare
 * message shape.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WhatsAppWebhookRequest {

    private String event;
    private String instance;
    private WhatsAppMessageData data;

    private WhatsAppKey key;
    private String pushName;
    private WhatsAppMessageContent message;
    private JsonNode messageTimestamp;

    /**
     * The enveloped message when present, else the bare fields.
     */
    public WhatsAppMessageData resolveData() {
        if (data != null) {
            return data;
        }
        return WhatsAppMessageData.builder()
                .key(key)
                .pushName(pushName)
                .message(message)
                .messageTimestamp(messageTimestamp)
                .build();
    }
}
