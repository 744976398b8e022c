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

package me.golemcore.mscbot.domain.service;

import me.golemcore.mscbot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the free-form time expressions operators type into chat.
 *
 * <p>
 * Instants: {@code now}, {@code today}, {@code yesterday}, {@code tomorrow},
 * {@code 3 days ago}, {@code an hour ago}, {@code last week},
 * {@code last friday}, {@code friday}, {@code 2024-01-31},
 * {@code 2024-01-31 12:00} and ISO-8601 date-times. Day-level expressions
 * resolve to the current time of day on that day.
 *
 * <p>
 * Times of day: {@code 8am}, {@code 8:15pm}, {@code 08:00}, {@code 20:30},
 * {@code noon}, {@code midnight}.
 *
 * <p>
 * Unparseable input raises {@link IllegalArgumentException}.
 */
@Service
public class NaturalTimeParser {

    private static final Pattern AGO_PATTERN = Pattern.compile(
            "^(\\d+|an?)\\s*(second|sec|minute|min|hour|hr|day|week|month|year)s?\\s+ago$");
    private static final Pattern LAST_UNIT_PATTERN = Pattern.compile("^last\\s+(hour|day|week|month|year)$");
    private static final Pattern WEEKDAY_PATTERN = Pattern.compile("^(?:last\\s+)?([a-z]+)$");
    private static final Pattern TWELVE_HOUR_PATTERN = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?\\s*([ap])\\.?m\\.?$");
    private static final Pattern TWENTY_FOUR_HOUR_PATTERN = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final DateTimeFormatter ABSOLUTE = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendPattern("['T'][' ']")
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");
    private static final int HOURS_PER_HALF_DAY = 12;

    private static final Map<String, ChronoUnit> UNITS = Map.ofEntries(
            Map.entry("second", ChronoUnit.SECONDS),
            Map.entry("sec", ChronoUnit.SECONDS),
            Map.entry("minute", ChronoUnit.MINUTES),
            Map.entry("min", ChronoUnit.MINUTES),
            Map.entry("hour", ChronoUnit.HOURS),
            Map.entry("hr", ChronoUnit.HOURS),
            Map.entry("day", ChronoUnit.DAYS),
            Map.entry("week", ChronoUnit.WEEKS),
            Map.entry("month", ChronoUnit.MONTHS),
            Map.entry("year", ChronoUnit.YEARS));

    private final Clock clock;
    private final ZoneId zone;

    public NaturalTimeParser(Clock clock, BotProperties properties) {
        this.clock = clock;
        this.zone = ZoneId.of(properties.getSummary().getZone());
    }

    /**
     * Resolve a time expression to an absolute instant relative to now.
     */
    public Instant parseInstant(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Empty time expression");
        }
        String text = expression.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone);

        switch (text) {
        case "now":
            return now.toInstant();
        case "today":
            return now.toInstant();
        case "yesterday":
            return now.minusDays(1).toInstant();
        case "tomorrow":
            return now.plusDays(1).toInstant();
        default:
            break;
        }

        Matcher ago = AGO_PATTERN.matcher(text);
        if (ago.matches()) {
            long amount = ago.group(1).startsWith("a") ? 1 : Long.parseLong(ago.group(1));
            return now.minus(amount, UNITS.get(ago.group(2))).toInstant();
        }

        Matcher lastUnit = LAST_UNIT_PATTERN.matcher(text);
        if (lastUnit.matches()) {
            return now.minus(1, UNITS.get(lastUnit.group(1))).toInstant();
        }

        Matcher weekday = WEEKDAY_PATTERN.matcher(text);
        if (weekday.matches()) {
            DayOfWeek day = parseDayOfWeek(weekday.group(1));
            if (day != null) {
                return now.with(TemporalAdjusters.previous(day)).toInstant();
            }
        }

        return parseAbsolute(expression.trim());
    }

    /**
     * Parse a time of day.
     */
    public LocalTime parseTimeOfDay(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Empty time of day");
        }
        String text = expression.trim().toLowerCase(Locale.ROOT);
        if ("noon".equals(text) || "midday".equals(text)) {
            return LocalTime.NOON;
        }
        if ("midnight".equals(text)) {
            return LocalTime.MIDNIGHT;
        }

        Matcher twelveHour = TWELVE_HOUR_PATTERN.matcher(text);
        if (twelveHour.matches()) {
            int hour = Integer.parseInt(twelveHour.group(1));
            int minute = twelveHour.group(2) != null ? Integer.parseInt(twelveHour.group(2)) : 0;
            if (hour < 1 || hour > HOURS_PER_HALF_DAY) {
                throw new IllegalArgumentException("Hour out of range: " + expression);
            }
            hour = hour % HOURS_PER_HALF_DAY;
            if ("p".equals(twelveHour.group(3))) {
                hour += HOURS_PER_HALF_DAY;
            }
            return toLocalTime(hour, minute, expression);
        }

        Matcher twentyFourHour = TWENTY_FOUR_HOUR_PATTERN.matcher(text);
        if (twentyFourHour.matches()) {
            return toLocalTime(Integer.parseInt(twentyFourHour.group(1)),
                    Integer.parseInt(twentyFourHour.group(2)), expression);
        }

        throw new IllegalArgumentException("Unknown time of day: " + expression);
    }

    /**
     * Zero-padded 24-hour {@code HH:MM}.
     */
    public static String formatTimeOfDay(LocalTime time) {
        return time.format(HH_MM);
    }

    public ZoneId getZone() {
        return zone;
    }

    private Instant parseAbsolute(String text) {
        try {
            TemporalAccessor parsed = ABSOLUTE.parseBest(text, OffsetDateTime::from, LocalDateTime::from,
                    LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return localDateTime.atZone(zone).toInstant();
            }
            return ((LocalDate) parsed).atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unknown time expression: " + text, e);
        }
    }

    private static DayOfWeek parseDayOfWeek(String name) {
        for (DayOfWeek day : DayOfWeek.values()) {
            String full = day.name().toLowerCase(Locale.ROOT);
            if (full.equals(name) || full.substring(0, 3).equals(name)) {
                return day;
            }
        }
        return null;
    }

    private static LocalTime toLocalTime(int hour, int minute, String expression) {
        if (hour > 23 || minute > 59) {
            throw new IllegalArgumentException("Time out of range: " + expression);
        }
        return LocalTime.of(hour, minute);
    }
}
