package me.golemcore.recall.adapter.inbound.webhook;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.adapter.inbound.webhook.dto.WhatsAppMessageData;
import me.golemcore.recall.adapter.inbound.webhook.dto.WhatsAppWebhookRequest;
import me.golemcore.recall.domain.model.InboundMessage;
import me.golemcore.recall.domain.model.IngestionResult;
import me.golemcore.recall.domain.service.IngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Receives WhatsApp messages from the gateway and runs them through ingestion.
 * The response is the ingestion result, including skips and failures.
 */
@RestController
@RequestMapping("/api/webhook")
@RequiredArgsConstructor
@Slf4j
public class WhatsAppWebhookController {

    private final IngestionService ingestionService;
    private final Clock clock;

    @PostMapping("/whatsapp")
    public Mono<ResponseEntity<IngestionResult>> whatsapp(@RequestBody WhatsAppWebhookRequest request) {
        return Mono.fromCallable(() -> {
            InboundMessage message = toInboundMessage(request);
            log.debug("[Webhook] Message {} from {}", message.getId(), message.getChatId());
            return ResponseEntity.ok(ingestionService.ingest(message));
        });
    }

    InboundMessage toInboundMessage(WhatsAppWebhookRequest request) {
        WhatsAppMessageData data = request != null ? request.resolveData() : null;
        if (data == null || data.getKey() == null || isBlank(data.getKey().getRemoteJid())
                || isBlank(data.getKey().getId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Invalid payload: key.remoteJid and key.id required");
        }
        return InboundMessage.builder()
                .id(data.getKey().getId())
                .chatId(data.getKey().getRemoteJid())
                .fromMe(data.getKey().isFromMe())
                .senderName(isBlank(data.getPushName()) ? null : data.getPushName())
                .content(data.getMessage() != null ? data.getMessage().text() : null)
                .timestamp(parseTimestamp(data.getMessageTimestamp()))
                .build();
    }

    /**
     * Epoch seconds as number or numeric string; anything else means now.
     */
    Instant parseTimestamp(JsonNode value) {
        if (value != null && value.isNumber()) {
            return Instant.ofEpochSecond(value.asLong());
        }
        if (value != null && value.isTextual()) {
            try {
                return Instant.ofEpochSecond(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException e) {
                log.warn("[Webhook] Unparseable messageTimestamp '{}', using now", value.asText());
            }
        }
        return clock.instant();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
