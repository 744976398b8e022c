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

import java.util.List;

/**
 * Closed set of bot commands with their literal phrase variants.
 *
 * <p>
 * Declaration order is matching precedence: the first kind with a variant that
 * prefixes the input wins.
 */
public enum CommandKind {

    SHOW_IN_PROGRESS(true, "show in-progress"),
    SHOW_PENDING(true, "show pending"),
    SHOW_FCP(true, "show fcp", "show in fcp"),
    SHOW_ALL(true, "show all", "show active"),
    SHOW_SUMMARY(false, "show summary", "summarize", "summarise"),
    SHOW_NEWS(true, "show news"),
    SHOW_TASKS(true, "show tasks"),
    HELP(false, "help", "show help"),

    ROOM_SUMMARY_CONTENT(false, "set summary content", "set summary mode"),
    ROOM_SUMMARY_ENABLE(false, "set enable summary", "set summary enable", "set summary enabled"),
    ROOM_SUMMARY_DISABLE(false, "set disable summary", "set summary disable", "set summary disabled"),
    ROOM_SUMMARY_TIME(false, "set time summary", "set summary time", "set summary time to"),
    ROOM_SUMMARY_TIME_INFO(false, "summary time", "get summary time"),
    ROOM_SHOW_PRIORITY(false, "show priority", "priority", "priorities"),
    ROOM_PRIORITY_MSCS(false, "set priority mscs", "set priority");

    private final boolean requiresStatus;
    private final List<String> variants;

    CommandKind(boolean requiresStatus, String... variants) {
        this.requiresStatus = requiresStatus;
        this.variants = List.of(variants);
    }

    public List<String> variants() {
        return variants;
    }

    /**
     * Whether the handler needs a freshly aggregated status list.
     */
    public boolean requiresStatus() {
        return requiresStatus;
    }
}
