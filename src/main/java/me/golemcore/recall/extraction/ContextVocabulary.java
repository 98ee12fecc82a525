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

import me.golemcore.recall.domain.model.EventType;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hand-curated vocabularies that map event text to the context tag used for
 * URL-based re-surfacing. Bucket order is the resolution priority.
 */
public final class ContextVocabulary {

    /**
     * Which event text a bucket looks at.
     */
    public enum Scope {
        ALL_FIELDS, LOCATION
    }

    /**
     * One vocabulary bucket.
     *
     * @param name
     *            bucket name for logging
     * @param types
     *            event types the bucket applies to, empty for all
     * @param terms
     *            terms matched at a word start
     * @param fixedTag
     *            tag assigned on a hit, or {@code null} to use the matched term
     * @param scope
     *            text the bucket searches
     */
    public record TagBucket(String name, Set<EventType> types, List<String> terms, String fixedTag, Scope scope,
            List<Pattern> termPatterns) {

        public TagBucket(String name, Set<EventType> types, List<String> terms, String fixedTag, Scope scope) {
            this(name, types, terms, fixedTag, scope, terms.stream().map(TagBucket::wordStart).toList());
        }

        /** Terms match at the start of a word, so "gym" hits "gymnasium" but "mpt" misses "prompt". */
        static Pattern wordStart(String term) {
            return Pattern.compile("\\b" + Pattern.quote(term));
        }

        public boolean appliesTo(EventType type) {
            return types.isEmpty() || types.contains(type);
        }

        public String tagFor(String matchedTerm) {
            return fixedTag != null ? fixedTag : matchedTerm;
        }
    }

    public static final List<String> SERVICES = List.of(
            "netflix", "hotstar", "amazon", "prime", "disney", "spotify",
            "youtube", "hulu", "hbo", "zee5", "sonyliv", "jiocinema",
            "canva", "figma", "notion", "slack", "zoom",
            "gym", "domain", "hosting", "hostinger", "aws", "azure", "vercel", "heroku");

    public static final List<String> TRAVEL_DESTINATIONS = List.of(
            "goa", "mumbai", "delhi", "bangalore", "chennai", "kolkata", "hyderabad",
            "jaipur", "udaipur", "kerala", "manali", "shimla", "ladakh", "kashmir",
            "thailand", "bali", "singapore", "dubai", "maldives", "europe");

    public static final List<String> BEAUTY = List.of(
            "makeup", "beauty", "cosmetic", "skincare", "lipstick", "foundation", "perfume", "fragrance", "nykaa");

    public static final List<String> FASHION = List.of(
            "sneakers", "shoes", "clothes", "dress", "fashion", "shirt", "jeans", "kurta", "saree",
            "myntra", "nike", "adidas", "puma");

    public static final List<String> GIFT = List.of("gift", "birthday", "anniversary", "present");

    public static final List<String> LOCATION_CITIES = List.of(
            "goa", "mumbai", "delhi", "bangalore", "chennai", "kolkata");

    /** Keywords containing one of these terms become keyword triggers. */
    public static final List<String> INTEREST_TERMS = List.of(
            "travel", "flight", "hotel", "buy", "gift", "birthday", "meeting", "deadline", "dinner", "lunch",
            "coffee");

    public static final List<TagBucket> BUCKETS = List.of(
            new TagBucket("services", Set.of(), SERVICES, null, Scope.ALL_FIELDS),
            new TagBucket("travel", Set.of(EventType.TRAVEL, EventType.RECOMMENDATION), TRAVEL_DESTINATIONS, null,
                    Scope.ALL_FIELDS),
            new TagBucket("beauty", Set.of(), BEAUTY, "nykaa", Scope.ALL_FIELDS),
            new TagBucket("fashion", Set.of(), FASHION, "myntra", Scope.ALL_FIELDS),
            new TagBucket("gift", Set.of(), GIFT, "amazon", Scope.ALL_FIELDS),
            new TagBucket("location", Set.of(), LOCATION_CITIES, null, Scope.LOCATION));

    private ContextVocabulary() {
    }
}
