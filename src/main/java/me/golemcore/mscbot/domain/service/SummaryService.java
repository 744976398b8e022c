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
import me.golemcore.mscbot.domain.model.StatusEntry;
import me.golemcore.mscbot.domain.model.SummaryContentMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds the daily summary of a room, used by the scheduler and by
 * {@code show summary}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SummaryService {

    private final StatusAggregationService statusAggregationService;
    private final StageReportRenderer stageReportRenderer;
    private final RoomSettingsService roomSettingsService;

    /**
     * Aggregate the room's proposals and render them in the room's summary
     * content mode. Rooms with priority MSCs get a progress line appended.
     *
     * @throws me.golemcore.mscbot.domain.model.ExternalServiceException
     *             if the tracker or the review feed cannot be reached
     */
    public String buildSummary(String roomId) {
        RoomSettings settings = roomSettingsService.getSettings(roomId);
        List<StatusEntry> entries = statusAggregationService.aggregate(roomId);

        String summary = stageReportRenderer.render(contentMode(roomId, settings), entries).strip();
        if (settings.hasPriorityMscs()) {
            summary = summary + "\n\n" + stageReportRenderer.renderPriorityProgress(entries,
                    settings.getPriorityMscs());
        }
        return summary;
    }

    private static SummaryContentMode contentMode(String roomId, RoomSettings settings) {
        String configured = settings.getSummaryContent();
        if (configured == null) {
            return SummaryContentMode.ALL;
        }
        return SummaryContentMode.fromValue(configured).orElseGet(() -> {
            log.warn("[Summary] Unknown summary content '{}' for {}, using all", configured, roomId);
            return SummaryContentMode.ALL;
        });
    }
}
