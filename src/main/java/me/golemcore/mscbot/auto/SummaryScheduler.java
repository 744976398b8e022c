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

package me.golemcore.mscbot.auto;

import me.golemcore.mscbot.domain.model.ScheduleEntry;
import me.golemcore.mscbot.domain.service.RoomSettingsService;
import me.golemcore.mscbot.domain.service.SummaryScheduleService;
import me.golemcore.mscbot.domain.service.SummaryService;
import me.golemcore.mscbot.port.inbound.ChannelPort;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Posts the daily room summaries.
 *
 * <p>
 * Triggers are armed from the room settings at startup. {@link #runPending()}
 * is called from the bot loop between two syncs, so a summary never runs
 * concurrently with a command.
 *
 * @since 1.0
 * @see SummaryScheduleService
 * @see SummaryService
 */
@Component
@Slf4j
public class SummaryScheduler {

    private final SummaryScheduleService summaryScheduleService;
    private final SummaryService summaryService;
    private final RoomSettingsService roomSettingsService;
    private final List<ChannelPort> channels;

    public SummaryScheduler(SummaryScheduleService summaryScheduleService, SummaryService summaryService,
            RoomSettingsService roomSettingsService, List<ChannelPort> channels) {
        this.summaryScheduleService = summaryScheduleService;
        this.summaryService = summaryService;
        this.roomSettingsService = roomSettingsService;
        this.channels = channels;
    }

    @PostConstruct
    public void init() {
        int armed = summaryScheduleService.armAtStartup(roomSettingsService.getAllRooms());
        log.info("[Scheduler] Started with {} daily summaries", armed);
    }

    /**
     * Send every due summary. A failing summary is skipped until its next day.
     *
     * @return number of summaries sent
     */
    public int runPending() {
        List<ScheduleEntry> due = summaryScheduleService.getDueEntries();
        if (due.isEmpty()) {
            return 0;
        }

        log.info("[Scheduler] {} summaries due", due.size());
        int sent = 0;
        for (ScheduleEntry entry : due) {
            try {
                if (sendSummary(entry.getRoomId())) {
                    sent++;
                }
            } catch (RuntimeException e) {
                log.error("[Scheduler] Summary for {} failed, skipping this cycle: {}",
                        entry.getRoomId(), e.getMessage(), e);
            } finally {
                summaryScheduleService.recordExecution(entry.getRoomId());
            }
        }
        return sent;
    }

    private boolean sendSummary(String roomId) {
        if (!roomSettingsService.getSettings(roomId).summariesEnabled()) {
            log.debug("[Scheduler] Summaries disabled for {}, skipping", roomId);
            return false;
        }

        String summary = summaryService.buildSummary(roomId);
        for (ChannelPort channel : channels) {
            if (channel.isRunning()) {
                channel.sendMessage(roomId, summary);
                log.info("[Scheduler] Sent summary to {} via {}", roomId, channel.getChannelType());
                return true;
            }
        }
        log.warn("[Scheduler] No running channel for summary in {}", roomId);
        return false;
    }
}
