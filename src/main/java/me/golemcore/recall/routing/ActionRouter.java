package me.golemcore.recall.routing;

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
import me.golemcore.recall.domain.model.ActionDetection;
import me.golemcore.recall.domain.model.ActionOutcome;
import me.golemcore.recall.domain.model.ActionResult;
import me.golemcore.recall.domain.model.ActionType;
import me.golemcore.recall.domain.model.EventChanges;
import me.golemcore.recall.domain.model.EventStatus;
import me.golemcore.recall.domain.model.MemoryEvent;
import me.golemcore.recall.domain.model.PendingAction;
import me.golemcore.recall.domain.service.EventTimeNormalizer;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.EventStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies a detected action to its target event.
 *
 * <p>
 * Status changes and deletions are applied immediately. A {@code modify} is
 * never applied here: it comes back as a {@link PendingAction} that the user
 * confirms separately.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionRouter {

    private static final String TAG = "Action";

    private final EventStorePort eventStore;
    private final EventTimeNormalizer timeNormalizer;
    private final RecallProperties properties;
    private final Clock clock;

    public boolean isActionable(ActionDetection detection) {
        return detection != null
                && detection.isAction()
                && detection.getType() != ActionType.NONE
                && detection.getConfidence() >= properties.getIngestion().getActionConfidenceThreshold();
    }

    /**
     * Routes the verdict. Not handled when it is below threshold or no target
     * can be resolved, in which case extraction runs instead.
     */
    public ActionOutcome route(ActionDetection detection, List<MemoryEvent> activeEvents) {
        if (!isActionable(detection)) {
            return ActionOutcome.notHandled();
        }
        Optional<MemoryEvent> target = resolveTarget(detection, activeEvents);
        if (target.isEmpty()) {
            log.info("[{}] \"{}\" detected but no target event found", TAG, detection.getType().getValue());
            return ActionOutcome.notHandled();
        }
        MemoryEvent event = target.get();
        long id = event.getId();
        log.info("[{}] Applying {} to event #{} \"{}\" (confidence {})", TAG, detection.getType().getValue(), id,
                event.getTitle(), detection.getConfidence());

        // Applied directly; only manual API transitions are checked against EventStatus.
        return switch (detection.getType()) {
        case CANCEL, DELETE -> {
            eventStore.deleteEvent(id);
            yield performed(detection, event, "Deleted: \"" + event.getTitle() + "\"");
        }
        case COMPLETE -> {
            eventStore.updateStatus(id, EventStatus.COMPLETED);
            yield performed(detection, event, "Completed: \"" + event.getTitle() + "\"");
        }
        case IGNORE -> {
            eventStore.updateStatus(id, EventStatus.IGNORED);
            yield performed(detection, event, "Ignored: \"" + event.getTitle() + "\" - won't remind again");
        }
        case SNOOZE, POSTPONE -> {
            int minutes = detection.getSnoozeMinutes() != null && detection.getSnoozeMinutes() > 0
                    ? detection.getSnoozeMinutes()
                    : properties.getIngestion().getDefaultSnoozeMinutes();
            eventStore.snoozeEvent(id, clock.instant().plus(Duration.ofMinutes(minutes)));
            yield performed(detection, event,
                    "Snoozed: \"" + event.getTitle() + "\" -> will remind " + describeDuration(minutes));
        }
        case MODIFY -> proposeModification(detection, event);
        case NONE -> ActionOutcome.notHandled();
        };
    }

    /**
     * Best keyword match among active events, else the most recently active
     * event.
     */
    Optional<MemoryEvent> resolveTarget(ActionDetection detection, List<MemoryEvent> activeEvents) {
        if (detection.getTargetKeywords() != null && !detection.getTargetKeywords().isEmpty()) {
            List<MemoryEvent> matches = eventStore.findActiveEventsByKeywords(detection.getTargetKeywords());
            if (!matches.isEmpty()) {
                return Optional.of(matches.get(0));
            }
        }
        if (activeEvents != null && !activeEvents.isEmpty()) {
            return Optional.of(activeEvents.get(0));
        }
        return Optional.empty();
    }

    private ActionOutcome proposeModification(ActionDetection detection, MemoryEvent event) {
        EventChanges changes = EventChanges.builder()
                .eventTime(timeNormalizer.normalize(detection.getNewTime()).orElse(null))
                .title(detection.getNewTitle())
                .location(detection.getNewLocation())
                .description(detection.getNewDescription())
                .build();
        if (changes.isEmpty()) {
            return performed(detection, event, "Modify requested but no changes specified");
        }
        String summary = describeChanges(changes);
        log.info("[{}] Modify proposed for event #{} \"{}\": {} - waiting for confirmation", TAG, event.getId(),
                event.getTitle(), summary);
        return ActionOutcome.pending(PendingAction.builder()
                .targetEventId(event.getId())
                .targetEventTitle(event.getTitle())
                .changes(changes)
                .description(summary)
                .build());
    }

    /**
     * Human readable diff, e.g. {@code title -> "Standup", time -> Friday, Mar 6
     * 5:00 PM}.
     */
    public String describeChanges(EventChanges changes) {
        List<String> parts = new ArrayList<>();
        if (changes.getTitle() != null) {
            parts.add("title -> \"" + changes.getTitle() + "\"");
        }
        if (changes.getEventTime() != null) {
            parts.add("time -> " + timeNormalizer.describe(changes.getEventTime()));
        }
        if (changes.getLocation() != null) {
            parts.add("location -> \"" + changes.getLocation() + "\"");
        }
        if (changes.getDescription() != null) {
            parts.add("description updated");
        }
        return String.join(", ", parts);
    }

    static String describeDuration(int minutes) {
        if (minutes >= 10080) {
            return "next week";
        }
        if (minutes >= 1440) {
            return "tomorrow";
        }
        if (minutes >= 60) {
            return Math.round(minutes / 60.0) + " hours";
        }
        return minutes + " minutes";
    }

    private static ActionOutcome performed(ActionDetection detection, MemoryEvent event, String message) {
        return ActionOutcome.performed(ActionResult.builder()
                .action(detection.getType())
                .targetEventId(event.getId())
                .targetEventTitle(event.getTitle())
                .message(message)
                .build());
    }
}
