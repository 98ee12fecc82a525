package me.golemcore.recall.matching;

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
import java.util.regex.MatchResult;

/**
 * Ordered URL table. The first matching rule wins, so site-specific rules
 * (search, product page) must stay ahead of the bare domain rule of the same
 * site.
 */
public final class UrlPatternRules {

    public static final List<UrlPatternRule> DEFAULT = List.of(
            // Travel
            UrlPatternRule.of("makemytrip\\.com.*/(flights?|hotels?|trains?)/?(.*)$", "travel_booking",
                    m -> UrlContextExtractor.pathTokens(m.group(2))),
            UrlPatternRule.of("goibibo\\.com.*/(flights?|hotels?)/?(.*)$", "travel_booking",
                    m -> UrlContextExtractor.pathTokens(m.group(2))),
            UrlPatternRule.of("booking\\.com.*/(.*)$", "hotel_booking",
                    m -> UrlContextExtractor.pathTokens(m.group(1))),
            UrlPatternRule.of("airbnb\\.(com|co\\.in).*/(.*)$", "accommodation",
                    m -> UrlContextExtractor.pathTokens(m.group(2))),
            UrlPatternRule.of("skyscanner\\.(com|co\\.in).*/(.*)$", "flight_search",
                    m -> UrlContextExtractor.pathTokens(m.group(2))),
            UrlPatternRule.of("tripadvisor\\.(com|in).*/(.*)$", "travel_research",
                    m -> UrlContextExtractor.pathTokens(m.group(2))),

            // Shopping
            UrlPatternRule.of("amazon\\.(com|in).*/s\\?.*k=([^&]+)", "shopping_search",
                    m -> List.of(UrlContextExtractor.decodeQueryValue(m.group(2)))),
            UrlPatternRule.fixed("amazon\\.(com|in).*/dp/\\w+", "shopping_product"),
            UrlPatternRule.fixed("amazon\\.(com|in)", "shopping", "amazon", "shopping", "gift", "buy"),
            UrlPatternRule.of("flipkart\\.com.*/search\\?q=([^&]+)", "shopping_search",
                    m -> List.of(UrlContextExtractor.decodeComponent(m.group(1)))),
            UrlPatternRule.fixed("flipkart\\.com", "shopping", "flipkart", "shopping", "gift", "buy"),
            UrlPatternRule.of("myntra\\.com.*/(.*)$", "fashion_shopping",
                    m -> UrlContextExtractor.pathTokens(m.group(1))),
            UrlPatternRule.fixed("myntra\\.com", "fashion_shopping",
                    "myntra", "fashion", "shoes", "sneakers", "clothes", "gift"),
            UrlPatternRule.fixed("nykaa\\.com", "beauty_shopping",
                    "nykaa", "beauty", "makeup", "cosmetics", "skincare", "gift"),
            UrlPatternRule.fixed("ajio\\.com", "fashion_shopping", "ajio", "fashion", "clothes", "shoes", "gift"),
            UrlPatternRule.fixed("tatacliq\\.com", "shopping",
                    "tatacliq", "shopping", "electronics", "fashion", "gift"),

            // Subscriptions
            UrlPatternRule.fixed("netflix\\.com", "streaming", "netflix", "subscription", "streaming"),
            UrlPatternRule.fixed("spotify\\.com", "music", "spotify", "subscription", "music"),
            UrlPatternRule.fixed("primevideo\\.com", "streaming", "prime", "amazon", "subscription"),
            UrlPatternRule.fixed("hotstar\\.com|disney\\+", "streaming", "hotstar", "disney", "subscription"),
            UrlPatternRule.fixed("canva\\.com", "design", "canva", "design", "subscription"),

            // Finance
            UrlPatternRule.of("policybazaar\\.com.*/(car|bike|health|life)", "insurance",
                    UrlPatternRules::insuranceKeywords),
            UrlPatternRule.fixed("bankbazaar\\.com", "finance", "loan", "credit", "bank"),

            // Calendar and mail
            UrlPatternRule.fixed("calendar\\.google\\.com", "calendar", "meeting", "event", "schedule"),
            UrlPatternRule.fixed("outlook\\.(com|office)", "email", "email", "meeting"));

    private UrlPatternRules() {
    }

    private static List<String> insuranceKeywords(MatchResult match) {
        return List.of(match.group(1), "insurance");
    }
}
