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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses model-supplied event times and applies the stale-date heuristic: a
 * time more than one hour in the past is assumed to be a weekly recurrence
 * and is advanced in 7-day steps until it is no longer in the past.
 */
@Component
@Slf4j
public class EventTimeNormalizer {

    static final Duration STALE_TOLERANCE = Duration.ofHours(1);
    static final Duration RECURRENCE_STEP = Duration.ofDays(7);

    private static final Pattern EPOCH_SECONDS = Pattern.compile("^\\d{9,11}$");
    private static final Pattern SPACED_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}.*");
    private static final DateTimeFormatter CHANGE_FORMAT = DateTimeFormatter.ofPattern("EEEE, MMM d h:mm a",
            Locale.US);

    private final Clock clock;
    private final ZoneId zone;

    public EventTimeNormalizer(Clock clock, RecallProperties properties) {
        this.clock = clock;
        this.zone = ZoneId.of(properties.getIngestion().getZoneId());
    }

    /**
     * Parses and rolls forward; empty when the value is absent or unparseable.
     */
    public Optional<Instant> normalize(String raw) {
        return parse(raw).map(this::rollForward);
    }

    public Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank() || "null".equalsIgnoreCase(raw.trim())) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (EPOCH_SECONDS.matcher(value).matches()) {
            return Optional.of(Instant.ofEpochSecond(Long.parseLong(value)));
        }
        if (SPACED_DATE_TIME.matcher(value).matches()) {
            value = value.replaceFirst(" ", "T");
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ignored) {
            // try the next shape
        }
        try {
            return Optional.of(ZonedDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ignored) {
            // try the next shape
        }
        try {
            return Optional.of(LocalDateTime.parse(value).atZone(zone).toInstant());
        } catch (DateTimeParseException ignored) {
            // try the next shape
        }
        try {
            return Optional.of(LocalDate.parse(value).atStartOfDay(zone).toInstant());
        } catch (DateTimeParseException e) {
            log.warn("[Date] Unparseable event time \"{}\", treating as absent", raw);
            return Optional.empty();
        }
    }

    public Instant rollForward(Instant time) {
        Instant now = clock.instant();
        if (!time.isBefore(now.minus(STALE_TOLERANCE))) {
            return time;
        }
        Instant shifted = time;
        while (shifted.isBefore(now)) {
            shifted = shifted.plus(RECURRENCE_STEP);
        }
        log.info("[Date] Past event time {} moved forward to {}", time, shifted);
        return shifted;
    }

    /**
     * Human form used in change summaries, e.g. {@code Friday, Mar 6 5:00 PM}.
     */
    public String describe(Instant time) {
        return CHANGE_FORMAT.format(time.atZone(zone));
    }

    public ZoneId getZone() {
        return zone;
    }
}
