package me.golemcore.recall.domain.service;

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

import java.util.Locale;

/**
 * Title normalization and near-duplicate detection.
 *
 * <p>
 * Two titles are duplicates when their normalized forms are equal, or when one
 * contains the other and the shorter covers at least {@value #MIN_COVERAGE} of
 * the longer's length. "Meeting" is therefore not a duplicate of "Meeting with
 * Nityam at 5pm".
 */
public final class EventTitleSupport {

    static final double MIN_COVERAGE = 0.8;

    private EventTitleSupport() {
    }

    public static String normalize(String title) {
        if (title == null) {
            return "";
        }
        return title.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    public static boolean isDuplicate(String first, String second) {
        String a = normalize(first);
        String b = normalize(second);
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        if (a.equals(b)) {
            return true;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        if (!longer.contains(shorter)) {
            return false;
        }
        return (double) shorter.length() / longer.length() >= MIN_COVERAGE;
    }
}
