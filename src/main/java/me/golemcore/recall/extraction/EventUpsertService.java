package me.golemcore.recall.extraction;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.ConflictInfo;
import me.golemcore.recall.domain.model.EventAction;
import me.golemcore.recall.domain.model.EventCandidate;
import me.golemcore.recall.domain.model.EventChanges;
import me.golemcore.recall.domain.model.EventOutcome;
import me.golemcore.recall.domain.model.EventStatus;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.Trigger;
import me.golemcore.recall.domain.service.EventTimeNormalizer;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.EventStorePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns extracted candidates into stored events.
 *
 * <p>
 * Per candidate: low confidence is dropped; {@code update} overwrites the
 * supplied fields of its target; {@code merge} appends the description and
 * unions participants; anything else is created unless a near-duplicate title
 * was stored in the duplicate window. Created events get a context tag,
 * conflict annotations and triggers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventUpsertService {

    private static final String TAG = "Extractor";

    private final EventStorePort eventStore;
    private final EventTimeNormalizer timeNormalizer;
    private final ContextTagResolver tagResolver;
    private final TriggerPlanner triggerPlanner;
    private final RecallProperties properties;

    public UpsertSummary upsert(List<EventCandidate> candidates, String messageId, String senderName) {
        int created = 0;
        int updated = 0;
        int triggersCreated = 0;
        List<EventOutcome> outcomes = new ArrayList<>();
        double threshold = properties.getIngestion().getExtractionConfidenceThreshold();

        for (EventCandidate candidate : candidates) {
            if (candidate.getConfidence() < threshold) {
                log.info("[{}] Skipping low-confidence event \"{}\" ({})", TAG, candidate.getTitle(),
                        candidate.getConfidence());
                continue;
            }

            Optional<MemoryEvent> target = resolveTarget(candidate);
            if (target.isPresent()) {
                Optional<EventOutcome> outcome = applyToExisting(candidate, target.get());
                if (outcome.isPresent()) {
                    outcomes.add(outcome.get());
                    updated++;
                }
                continue;
            }

            Optional<MemoryEvent> duplicate = eventStore.findDuplicateEvent(candidate.getTitle(),
                    properties.getIngestion().getDuplicateWindowHours());
            if (duplicate.isPresent()) {
                log.info("[{}] Skipping duplicate \"{}\" (matches #{} \"{}\")", TAG, candidate.getTitle(),
                        duplicate.get().getId(), duplicate.get().getTitle());
                continue;
            }

            MemoryEvent event = eventStore.insertEvent(toNewEvent(candidate, messageId, senderName));
            created++;

            List<ConflictInfo> conflicts = findConflicts(event);
            if (!conflicts.isEmpty()) {
                log.warn("[{}] Event \"{}\" conflicts with {} scheduled event(s)", TAG, event.getTitle(),
                        conflicts.size());
            }

            for (Trigger trigger : triggerPlanner.plan(event)) {
                eventStore.insertTrigger(trigger);
                triggersCreated++;
            }

            outcomes.add(EventOutcome.builder().event(event).updated(false).conflicts(conflicts).build());
        }

        return new UpsertSummary(created, updated, triggersCreated, outcomes);
    }

    /**
     * Target of an update or merge; empty for creates and for unknown targets,
     * which are then treated as creates.
     */
    private Optional<MemoryEvent> resolveTarget(EventCandidate candidate) {
        if (candidate.getEventAction() == EventAction.CREATE || candidate.getTargetEventId() == null) {
            return Optional.empty();
        }
        Optional<MemoryEvent> target = eventStore.findEvent(candidate.getTargetEventId());
        if (target.isEmpty()) {
            log.warn("[{}] {} target #{} not found, treating \"{}\" as new", TAG,
                    candidate.getEventAction().getValue(), candidate.getTargetEventId(), candidate.getTitle());
        } else if (target.get().getStatus() != null && target.get().getStatus().isTerminal()) {
            log.warn("[{}] {} applied to {} event #{}", TAG, candidate.getEventAction().getValue(),
                    target.get().getStatus().getValue(), target.get().getId());
        }
        return target;
    }

    private Optional<EventOutcome> applyToExisting(EventCandidate candidate, MemoryEvent target) {
        EventChanges changes = candidate.getEventAction() == EventAction.UPDATE
                ? updateChanges(candidate)
                : mergeChanges(candidate, target);
        if (changes.isEmpty()) {
            log.debug("[{}] {} on #{} carried no changes", TAG, candidate.getEventAction().getValue(), target.getId());
            return Optional.empty();
        }
        return eventStore.updateEvent(target.getId(), changes).map(event -> {
            log.info("[{}] Event #{} {}d", TAG, event.getId(), candidate.getEventAction().getValue());
            return EventOutcome.builder().event(event).updated(true).build();
        });
    }

    EventChanges updateChanges(EventCandidate candidate) {
        return EventChanges.builder()
                .title(blankToNull(candidate.getTitle()))
                .description(blankToNull(candidate.getDescription()))
                .location(blankToNull(candidate.getLocation()))
                .eventTime(timeNormalizer.normalize(candidate.getEventTime()).orElse(null))
                .keywords(candidate.getKeywords().isEmpty() ? null : candidate.joinedKeywords())
                .participants(candidate.getParticipants().isEmpty() ? null : candidate.getParticipants())
                .build();
    }

    EventChanges mergeChanges(EventCandidate candidate, MemoryEvent target) {
        EventChanges.EventChangesBuilder changes = EventChanges.builder();
        String addition = blankToNull(candidate.getDescription());
        if (addition != null) {
            String existing = blankToNull(target.getDescription());
            changes.description(existing != null ? existing + ". " + addition : addition);
        }
        if (!candidate.getParticipants().isEmpty()) {
            Set<String> union = new LinkedHashSet<>(target.getParticipants() != null ? target.getParticipants()
                    : List.of());
            union.addAll(candidate.getParticipants());
            changes.participants(new ArrayList<>(union));
        }
        return changes.build();
    }

    private MemoryEvent toNewEvent(EventCandidate candidate, String messageId, String senderName) {
        Instant eventTime = timeNormalizer.normalize(candidate.getEventTime()).orElse(null);
        String contextTag = tagResolver.resolve(candidate).orElse(null);
        return MemoryEvent.builder()
                .messageId(messageId)
                .type(candidate.getType())
                .title(candidate.getTitle())
                .description(candidate.getDescription())
                .eventTime(eventTime)
                .location(candidate.getLocation())
                .participants(new ArrayList<>(candidate.getParticipants()))
                .keywords(candidate.joinedKeywords())
                .confidence(MemoryEvent.clampConfidence(candidate.getConfidence()))
                .status(contextTag != null ? EventStatus.SCHEDULED : EventStatus.DISCOVERED)
                .contextUrl(contextTag)
                .senderName(senderName)
                .build();
    }

    private List<ConflictInfo> findConflicts(MemoryEvent event) {
        if (event.getEventTime() == null) {
            return List.of();
        }
        return eventStore.findTimeConflicts(event.getEventTime(), properties.getIngestion().getConflictWindowMinutes())
                .stream()
                .filter(other -> !Objects.equals(other.getId(), event.getId()))
                .map(ConflictInfo::of)
                .toList();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
