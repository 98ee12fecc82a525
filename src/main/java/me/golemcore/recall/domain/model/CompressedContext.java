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

import java.util.List;

/**
 * Dense event block ready to be placed into a prompt.
 *
 * @param events
 *            encoded lines plus an optional trailing relationship line
 * @param eventCount
 *            number of events represented
 * @param tokenEstimate
 *            rough token count (characters / 4)
 * @param edges
 *            every detected relationship, not only the rendered ones
 * @param compressionRatio
 *            verbose size divided by encoded size
 */
public record CompressedContext(String events, int eventCount, int tokenEstimate, List<EventEdge> edges,
        double compressionRatio) {
}
