package me.golemcore.recall.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.recall.domain.model.StoreStats;
import me.golemcore.recall.domain.service.EventLifecycleService;
import me.golemcore.recall.port.outbound.LlmPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;

/**
 * Health and store counters.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SystemController {

    private static final String VERSION = "1.0.0";

    private final LlmPort llmPort;
    private final EventLifecycleService lifecycleService;
    private final Clock clock;

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        HealthResponse response = new HealthResponse(
                "ok",
                clock.instant(),
                llmPort.getCurrentModel(),
                llmPort.isAvailable(),
                VERSION,
                ManagementFactory.getRuntimeMXBean().getUptime());
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<StoreStats>> stats() {
        return Mono.fromCallable(() -> ResponseEntity.ok(lifecycleService.stats()));
    }

    record HealthResponse(String status, Instant timestamp, String model, boolean llmAvailable, String version,
            long uptimeMs) {
    }
}
