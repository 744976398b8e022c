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

import me.golemcore.mscbot.domain.model.RoomSettings;
import me.golemcore.mscbot.domain.model.ScheduleEntry;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the daily summary triggers, at most one per room.
 *
 * <p>
 * Triggers live in memory only. They are rebuilt from the room settings at
 * startup by {@link #armAtStartup(Map)}.
 */
@Service
@Slf4j
public class SummaryScheduleService {

    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime defaultTime;
    private final Map<String, ScheduleEntry> entries = new LinkedHashMap<>();

    public SummaryScheduleService(Clock clock, NaturalTimeParser timeParser, BotProperties properties) {
        this.clock = clock;
        this.zone = ZoneId.of(properties.getSummary().getZone());
        this.defaultTime = timeParser.parseTimeOfDay(properties.getSummary().getDefaultTime());
    }

    /**
     * Replace the room's trigger with one firing daily at {@code timeOfDay}.
     */
    public synchronized ScheduleEntry arm(String roomId, LocalTime timeOfDay) {
        cancel(roomId);
        ScheduleEntry entry = ScheduleEntry.builder()
                .roomId(roomId)
                .timeOfDay(timeOfDay)
                .nextExecutionAt(computeNextExecution(timeOfDay, clock.instant()))
                .build();
        entries.put(roomId, entry);
        log.info("[Scheduler] Armed summary for {} at {}", roomId, NaturalTimeParser.formatTimeOfDay(timeOfDay));
        return entry;
    }

    /**
     * Arm the room at the default time.
     */
    public ScheduleEntry armDefault(String roomId) {
        return arm(roomId, defaultTime);
    }

    public synchronized boolean cancel(String roomId) {
        ScheduleEntry removed = entries.remove(roomId);
        if (removed != null) {
            log.debug("[Scheduler] Cancelled summary for {}", roomId);
        }
        return removed != null;
    }

    public synchronized Optional<ScheduleEntry> findEntry(String roomId) {
        return Optional.ofNullable(entries.get(roomId));
    }

    public synchronized List<ScheduleEntry> getEntries() {
        return new ArrayList<>(entries.values());
    }

    /**
     * Triggers whose next execution is at or before now, earliest first.
     */
    public synchronized List<ScheduleEntry> getDueEntries() {
        Instant now = clock.instant();
        return entries.values().stream()
                .filter(entry -> entry.getNextExecutionAt() != null && !entry.getNextExecutionAt().isAfter(now))
                .sorted(Comparator.comparing(ScheduleEntry::getNextExecutionAt))
                .toList();
    }

    /**
     * Record an execution and move the trigger to its next daily occurrence. A
     * trigger that was cancelled in the meantime is left alone.
     */
    public synchronized void recordExecution(String roomId) {
        ScheduleEntry entry = entries.get(roomId);
        if (entry == null) {
            log.debug("[Scheduler] No trigger left for {}", roomId);
            return;
        }
        Instant now = clock.instant();
        entry.setExecutionCount(entry.getExecutionCount() + 1);
        entry.setLastExecutedAt(now);
        entry.setNextExecutionAt(computeNextExecution(entry.getTimeOfDay(), now));
    }

    /**
     * Arm every room whose summaries are not disabled: rooms with a custom time
     * first, then the remaining rooms at the default time.
     *
     * @return number of armed rooms
     */
    public int armAtStartup(Map<String, RoomSettings> rooms) {
        List<String> defaultRooms = new ArrayList<>();
        int armed = 0;
        for (Map.Entry<String, RoomSettings> room : rooms.entrySet()) {
            RoomSettings settings = room.getValue();
            if (!settings.summariesEnabled()) {
                continue;
            }
            if (settings.getSummaryTime() == null) {
                defaultRooms.add(room.getKey());
                continue;
            }
            try {
                arm(room.getKey(), LocalTime.parse(settings.getSummaryTime()));
                armed++;
            } catch (RuntimeException e) {
                log.warn("[Scheduler] Invalid stored summary time '{}' for {}, using default",
                        settings.getSummaryTime(), room.getKey());
                defaultRooms.add(room.getKey());
            }
        }
        for (String roomId : defaultRooms) {
            armDefault(roomId);
            armed++;
        }
        log.info("[Scheduler] Armed {} room(s), {} at the default time {}", armed, defaultRooms.size(),
                NaturalTimeParser.formatTimeOfDay(defaultTime));
        return armed;
    }

    public LocalTime getDefaultTime() {
        return defaultTime;
    }

    /**
     * Next occurrence of {@code timeOfDay} strictly after {@code after}.
     */
    Instant computeNextExecution(LocalTime timeOfDay, Instant after) {
        ZonedDateTime now = after.atZone(zone);
        LocalDate today = now.toLocalDate();
        ZonedDateTime candidate = today.atTime(timeOfDay).atZone(zone);
        if (!candidate.isAfter(now)) {
            candidate = today.plusDays(1).atTime(timeOfDay).atZone(zone);
        }
        return candidate.toInstant();
    }
}
