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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.UrlContext;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deterministic step of context matching: derives an activity label and
 * search keywords from a URL and optional page title without any LLM call.
 */
@Component
@Slf4j
public class UrlContextExtractor {

    static final String FALLBACK_ACTIVITY = "browsing";

    private static final Pattern PATH_SEPARATORS = Pattern.compile("[/\\-_?&=]+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_PATH_TOKENS = 5;
    private static final int MAX_TITLE_WORDS = 5;

    private final List<UrlPatternRule> rules;

    public UrlContextExtractor() {
        this(UrlPatternRules.DEFAULT);
    }

    UrlContextExtractor(List<UrlPatternRule> rules) {
        this.rules = rules;
    }

    /**
     * @throws IllegalArgumentException
     *             when the URL is not absolute
     */
    public UrlContext extract(String url, String title) {
        List<String> pathKeywords = pathTokens(parsePath(url));

        for (UrlPatternRule rule : rules) {
            Optional<List<String>> ruleKeywords = rule.apply(url);
            if (ruleKeywords.isPresent()) {
                log.debug("[Matcher] {} matched rule {}", url, rule.activity());
                return new UrlContext(rule.activity(), union(ruleKeywords.get(), pathKeywords));
            }
        }

        List<String> titleKeywords = title == null ? List.of()
                : Arrays.stream(WHITESPACE.split(title.toLowerCase(Locale.ROOT)))
                        .filter(word -> word.length() > 3)
                        .limit(MAX_TITLE_WORDS)
                        .toList();
        return new UrlContext(FALLBACK_ACTIVITY, union(pathKeywords, titleKeywords));
    }

    /**
     * Splits a URL path (or path fragment) into search tokens: longer than two
     * characters, not purely numeric, decoded and lower-cased, at most five.
     */
    static List<String> pathTokens(String path) {
        if (path == null || path.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(PATH_SEPARATORS.split(path))
                .filter(token -> token.length() > 2 && !DIGITS.matcher(token).matches())
                .map(token -> decodeComponent(token).toLowerCase(Locale.ROOT))
                .limit(MAX_PATH_TOKENS)
                .toList();
    }

    /**
     * Percent-decodes a URL component, keeping {@code +} literal. Malformed
     * escapes leave the value as is.
     */
    static String decodeComponent(String value) {
        try {
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("[Matcher] Keeping undecodable component '{}'", value);
            return value;
        }
    }

    /**
     * Decodes a form-encoded query value where {@code +} stands for a space.
     */
    static String decodeQueryValue(String value) {
        return decodeComponent(value).replace('+', ' ');
    }

    private static String parsePath(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        try {
            URI uri = new URI(url.trim());
            if (!uri.isAbsolute() || uri.getRawSchemeSpecificPart() == null || uri.isOpaque()) {
                throw new IllegalArgumentException("Invalid URL: " + url);
            }
            return uri.getRawPath();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + url, e);
        }
    }

    private static List<String> union(List<String> first, List<String> second) {
        Set<String> merged = new LinkedHashSet<>();
        for (List<String> part : List.of(first, second)) {
            for (String keyword : part) {
                if (keyword != null && !keyword.isBlank()) {
                    merged.add(keyword);
                }
            }
        }
        return new ArrayList<>(merged);
    }
}
