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

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Cheap pre-filter for pure noise: empty text, emoji or punctuation only, and
 * bare acknowledgements. Everything else goes to the model.
 */
@Component
public class TrivialMessageFilter {

    private static final Set<String> ACKNOWLEDGEMENTS = Set.of(
            "ok", "okay", "okk", "k", "kk", "lol", "lmao", "haha", "hahaha", "hehe", "hmm", "hmmm",
            "thanks", "thank you", "thanku", "thx", "ty", "yes", "yeah", "yep", "ya", "no", "nope",
            "sure", "cool", "nice", "great", "done", "gm", "gn", "good morning", "good night", "bye");

    public boolean isTrivial(String text) {
        if (text == null) {
            return true;
        }
        String trimmed = text.trim();
        if (trimmed.length() < 2) {
            return true;
        }
        if (trimmed.codePoints().noneMatch(Character::isLetterOrDigit)) {
            return true;
        }
        String normalized = trimmed.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", "")
                .replaceAll("\\s+", " ")
                .trim();
        return ACKNOWLEDGEMENTS.contains(normalized);
    }
}
