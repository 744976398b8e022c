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

package me.golemcore.mscbot.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-room options persisted in the room data file. Every field is optional: a
 * {@code null} value means the room never set it and the global default
 * applies. Field names on disk are kept snake_case so existing data files load
 * unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoomSettings {

    @JsonProperty("summary_enabled")
    private Boolean summaryEnabled;

    /** Zero-padded 24-hour {@code HH:MM}. */
    @JsonProperty("summary_time")
    private String summaryTime;

    @JsonProperty("summary_content")
    private String summaryContent;

    @JsonProperty("priority_mscs")
    private List<Integer> priorityMscs;

    /**
     * Summaries are on unless explicitly disabled.
     */
    public boolean summariesEnabled() {
        return !Boolean.FALSE.equals(summaryEnabled);
    }

    public boolean hasPriorityMscs() {
        return priorityMscs != null && !priorityMscs.isEmpty();
    }

    /**
     * Copies every non-null field of {@code patch} onto this instance.
     */
    public void merge(RoomSettings patch) {
        if (patch.summaryEnabled != null) {
            summaryEnabled = patch.summaryEnabled;
        }
        if (patch.summaryTime != null) {
            summaryTime = patch.summaryTime;
        }
        if (patch.summaryContent != null) {
            summaryContent = patch.summaryContent;
        }
        if (patch.priorityMscs != null) {
            priorityMscs = new ArrayList<>(patch.priorityMscs);
        }
    }

    public RoomSettings copy() {
        return RoomSettings.builder()
                .summaryEnabled(summaryEnabled)
                .summaryTime(summaryTime)
                .summaryContent(summaryContent)
                .priorityMscs(priorityMscs != null ? new ArrayList<>(priorityMscs) : null)
                .build();
    }
}
