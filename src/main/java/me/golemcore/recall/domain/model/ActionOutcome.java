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

/**
 * Routing decision for one message: either the message was handled as an
 * action (performed or pending confirmation) or it falls through to
 * extraction.
 */
public record ActionOutcome(boolean handled, ActionResult performed, PendingAction pending) {

    public static ActionOutcome notHandled() {
        return new ActionOutcome(false, null, null);
    }

    public static ActionOutcome performed(ActionResult result) {
        return new ActionOutcome(true, result, null);
    }

    public static ActionOutcome pending(PendingAction pendingAction) {
        return new ActionOutcome(true, null, pendingAction);
    }
}
