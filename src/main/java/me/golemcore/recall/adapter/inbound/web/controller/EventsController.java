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
import me.golemcore.recall.adapter.inbound.web.dto.SnoozeRequest;
import me.golemcore.recall.domain.model.EventDetails;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.PendingAction;
import me.golemcore.recall.domain.service.EventLifecycleService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Event listing and manual lifecycle actions used by the extension popup.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventsController {

    private final EventLifecycleService lifecycleService;

    @GetMapping
    public Mono<ResponseEntity<List<MemoryEvent>>> listEvents(
            @RequestParam(defaultValue = "all") String status,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return Mono.fromCallable(() -> ResponseEntity.ok(lifecycleService.listEvents(status, limit, offset)));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<EventDetails>> getEvent(@PathVariable long id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(lifecycleService.getEvent(id)));
    }

    @PostMapping("/{id}/complete")
    public Mono<ResponseEntity<MemoryEvent>> complete(@PathVariable long id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(lifecycleService.complete(id)));
    }

    @PostMapping("/{id}/ignore")
    public Mono<ResponseEntity<MemoryEvent>> ignore(@PathVariable long id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(lifecycleService.ignore(id)));
    }

    @PostMapping("/{id}/set-reminder")
    public Mono<ResponseEntity<MemoryEvent>> setReminder(@PathVariable long id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(lifecycleService.schedule(id)));
    }

    @PostMapping("/{id}/snooze")
    public Mono<ResponseEntity<MemoryEvent>> snooze(@PathVariable long id,
            @RequestBody(required = false) SnoozeRequest request) {
        Integer minutes = request != null ? request.getMinutes() : null;
        return Mono.fromCallable(() -> ResponseEntity.ok(lifecycleService.snooze(id, minutes)));
    }

    @PostMapping("/{id}/confirm")
    public Mono<ResponseEntity<MemoryEvent>> confirm(@PathVariable long id, @RequestBody PendingAction pendingAction) {
        return Mono.fromCallable(() -> ResponseEntity.ok(lifecycleService.confirm(id, pendingAction)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<DeleteResponse>> delete(@PathVariable long id) {
        return Mono.fromCallable(() -> {
            lifecycleService.delete(id);
            return ResponseEntity.ok(new DeleteResponse(true, id));
        });
    }

    record DeleteResponse(boolean success, long id) {
    }
}
