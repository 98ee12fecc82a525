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
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One row of the URL table: a case-insensitive pattern searched anywhere in
 * the URL, the activity it stands for and how keywords are read from the
 * match.
 */
public record UrlPatternRule(Pattern pattern, String activity, Function<MatchResult, List<String>> keywords) {

    public static UrlPatternRule of(String regex, String activity, Function<MatchResult, List<String>> keywords) {
        return new UrlPatternRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), activity, keywords);
    }

    public static UrlPatternRule fixed(String regex, String activity, String... keywords) {
        List<String> values = List.of(keywords);
        return of(regex, activity, match -> values);
    }

    /**
     * Keywords of this rule for the URL, or empty when the pattern does not
     * match.
     */
    public Optional<List<String>> apply(String url) {
        Matcher matcher = pattern.matcher(url);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(keywords.apply(matcher.toMatchResult()));
    }
}
