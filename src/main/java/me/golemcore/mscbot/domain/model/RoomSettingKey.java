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

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Individually clearable keys of {@link RoomSettings}.
 */
public enum RoomSettingKey {

    SUMMARY_ENABLED(RoomSettings::getSummaryEnabled, s -> s.setSummaryEnabled(null)),
    SUMMARY_TIME(RoomSettings::getSummaryTime, s -> s.setSummaryTime(null)),
    SUMMARY_CONTENT(RoomSettings::getSummaryContent, s -> s.setSummaryContent(null)),
    PRIORITY_MSCS(RoomSettings::getPriorityMscs, s -> s.setPriorityMscs(null));

    private final Function<RoomSettings, Object> reader;
    private final Consumer<RoomSettings> eraser;

    RoomSettingKey(Function<RoomSettings, Object> reader, Consumer<RoomSettings> eraser) {
        this.reader = reader;
        this.eraser = eraser;
    }

    public Object read(RoomSettings settings) {
        return reader.apply(settings);
    }

    public void clear(RoomSettings settings) {
        eraser.accept(settings);
    }
}
