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
import me.golemcore.recall.adapter.inbound.web.dto.ContextCheckRequest;
import me.golemcore.recall.domain.model.ContextCheckResult;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.UrlContext;
import me.golemcore.recall.matching.ContextMatcherService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Context checks for the page the browser extension is showing.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ContextController {

    private final ContextMatcherService matcherService;

    @PostMapping("/context-check")
    public Mono<ResponseEntity<ContextCheckResult>> check(@RequestBody ContextCheckRequest request) {
        return Mono.fromCallable(() -> {
            requireUrl(request);
            return ResponseEntity.ok(matcherService.check(request.getUrl(), request.getTitle()));
        });
    }

    @PostMapping("/context-check/quick")
    public Mono<ResponseEntity<QuickCheckResponse>> quickCheck(@RequestBody ContextCheckRequest request) {
        return Mono.fromCallable(() -> {
            requireUrl(request);
            List<MemoryEvent> events = matcherService.quickCheck(request.getUrl());
            return ResponseEntity.ok(new QuickCheckResponse(!events.isEmpty(), events));
        });
    }

    @PostMapping("/extract-context")
    public Mono<ResponseEntity<UrlContext>> extractContext(@RequestBody ContextCheckRequest request) {
        return Mono.fromCallable(() -> {
            requireUrl(request);
            return ResponseEntity.ok(matcherService.extractContext(request.getUrl(), request.getTitle()));
        });
    }

    private static void requireUrl(ContextCheckRequest request) {
        if (request == null || request.getUrl() == null || request.getUrl().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "URL required");
        }
    }

    record QuickCheckResponse(boolean matched, List<MemoryEvent> events) {
    }
}
