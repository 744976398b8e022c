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

package me.golemcore.mscbot.adapter.inbound.command;

import me.golemcore.mscbot.domain.model.CommandKind;
import me.golemcore.mscbot.domain.model.ExternalServiceException;
import me.golemcore.mscbot.domain.model.NewsWindow;
import me.golemcore.mscbot.domain.model.ParsedCommand;
import me.golemcore.mscbot.domain.model.RoomSettingKey;
import me.golemcore.mscbot.domain.model.RoomSettings;
import me.golemcore.mscbot.domain.model.StatusEntry;
import me.golemcore.mscbot.domain.model.SummaryContentMode;
import me.golemcore.mscbot.domain.model.TrackedIssue;
import me.golemcore.mscbot.domain.service.CommandInterpreter;
import me.golemcore.mscbot.domain.service.NaturalTimeParser;
import me.golemcore.mscbot.domain.service.NewsDigestService;
import me.golemcore.mscbot.domain.service.RoomSettingsService;
import me.golemcore.mscbot.domain.service.StageReportRenderer;
import me.golemcore.mscbot.domain.service.StatusAggregationService;
import me.golemcore.mscbot.domain.service.SummaryScheduleService;
import me.golemcore.mscbot.domain.service.SummaryService;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.infrastructure.i18n.MessageService;
import me.golemcore.mscbot.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Routes chat commands to their handlers.
 *
 * <p>
 * Handlers for report commands receive a freshly aggregated status list;
 * settings handlers work on the room settings alone. A tracker or feed outage
 * turns into a short failure notice for the room.
 *
 * @see CommandInterpreter
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String SUBCMD_CLEAR = "clear";
    private static final String LIST_SEPARATOR = ", ";
    private static final String MSG_UNAVAILABLE = "command.status.unavailable";

    private final CommandInterpreter commandInterpreter;
    private final StatusAggregationService statusAggregationService;
    private final StageReportRenderer stageReportRenderer;
    private final NewsDigestService newsDigestService;
    private final SummaryService summaryService;
    private final RoomSettingsService roomSettingsService;
    private final SummaryScheduleService summaryScheduleService;
    private final NaturalTimeParser timeParser;
    private final MessageService messageService;
    private final BotProperties properties;

    public CommandRouter(
            CommandInterpreter commandInterpreter,
            StatusAggregationService statusAggregationService,
            StageReportRenderer stageReportRenderer,
            NewsDigestService newsDigestService,
            SummaryService summaryService,
            RoomSettingsService roomSettingsService,
            SummaryScheduleService summaryScheduleService,
            NaturalTimeParser timeParser,
            MessageService messageService,
            BotProperties properties) {
        this.commandInterpreter = commandInterpreter;
        this.statusAggregationService = statusAggregationService;
        this.stageReportRenderer = stageReportRenderer;
        this.newsDigestService = newsDigestService;
        this.summaryService = summaryService;
        this.roomSettingsService = roomSettingsService;
        this.summaryScheduleService = summaryScheduleService;
        this.timeParser = timeParser;
        this.messageService = messageService;
        this.properties = properties;
    }

    @Override
    public CommandResult execute(String roomId, String text) {
        Optional<ParsedCommand> parsed = commandInterpreter.interpret(text);
        if (parsed.isEmpty()) {
            log.debug("[Command] No command matches '{}'", text);
            return CommandResult.failure(msg("command.unknown"));
        }

        ParsedCommand command = parsed.get();
        log.info("[Command] {} in {} with arguments {}", command.kind(), roomId, command.arguments());

        try {
            List<StatusEntry> entries = command.kind().requiresStatus()
                    ? statusAggregationService.aggregate(roomId)
                    : List.of();
            return dispatch(roomId, command, entries);
        } catch (ExternalServiceException e) {
            log.warn("[Command] {} failed in {}: {}", command.kind(), roomId, e.getMessage());
            return CommandResult.failure(msg(MSG_UNAVAILABLE));
        }
    }

    private CommandResult dispatch(String roomId, ParsedCommand command, List<StatusEntry> entries) {
        List<String> args = command.arguments();
        CommandKind kind = command.kind();
        return switch (kind) {
        case SHOW_IN_PROGRESS -> report(stageReportRenderer.renderInProgress(entries));
        case SHOW_PENDING -> report(stageReportRenderer.renderPending(entries, command.firstArgument()));
        case SHOW_FCP -> report(stageReportRenderer.renderFcp(entries));
        case SHOW_ALL -> report(stageReportRenderer.renderAll(entries));
        case SHOW_SUMMARY -> CommandResult.success(summaryService.buildSummary(roomId));
        case SHOW_NEWS -> handleNews(roomId, args, entries);
        case SHOW_TASKS -> handleTasks(command, entries);
        case HELP -> handleHelp(roomId);
        case ROOM_SUMMARY_CONTENT -> handleSummaryContent(roomId, args);
        case ROOM_SUMMARY_ENABLE -> handleSummaryEnable(roomId);
        case ROOM_SUMMARY_DISABLE -> handleSummaryDisable(roomId);
        case ROOM_SUMMARY_TIME -> handleSummaryTime(roomId, args);
        case ROOM_SUMMARY_TIME_INFO -> handleSummaryTimeInfo(roomId);
        case ROOM_SHOW_PRIORITY -> handleShowPriority(roomId);
        case ROOM_PRIORITY_MSCS -> handlePriorityMscs(roomId, args);
        };
    }

    // ==================== REPORTS ====================

    private CommandResult handleTasks(ParsedCommand command, List<StatusEntry> entries) {
        return report(stageReportRenderer.renderInProgress(entries)
                + stageReportRenderer.renderPending(entries, command.firstArgument()));
    }

    private CommandResult handleNews(String roomId, List<String> args, List<StatusEntry> entries) {
        NewsWindow window;
        try {
            window = newsDigestService.resolveWindow(args);
        } catch (IllegalArgumentException e) {
            return CommandResult.failure(e.getMessage());
        } catch (ExternalServiceException e) {
            log.warn("[Command] Announcement feed unavailable: {}", e.getMessage());
            return CommandResult.failure(msg("command.news.feed.unavailable",
                    properties.getNews().getAnnouncementKeyword().toUpperCase(Locale.ROOT)));
        }

        List<TrackedIssue> issues = entries.stream()
                .map(StatusEntry::issue)
                .toList();
        boolean priorityScoped = roomSettingsService.getSettings(roomId).hasPriorityMscs();
        return CommandResult.success(newsDigestService.renderNews(window, issues, priorityScoped));
    }

    private CommandResult handleHelp(String roomId) {
        RoomSettings settings = roomSettingsService.getSettings(roomId);
        String status = settings.summariesEnabled()
                ? msg("command.help.status.enabled", effectiveSummaryTime(settings), zoneName())
                : msg("command.help.status.disabled");
        return CommandResult.success(msg("command.help.text") + status);
    }

    // ==================== ROOM SETTINGS ====================

    private CommandResult handleSummaryContent(String roomId, List<String> args) {
        Optional<SummaryContentMode> mode = args.isEmpty()
                ? Optional.empty()
                : SummaryContentMode.fromValue(args.get(0));
        if (mode.isEmpty()) {
            return CommandResult.failure(msg("command.summary.content.usage"));
        }
        String value = mode.get().value();
        roomSettingsService.update(roomId, RoomSettings.builder().summaryContent(value).build());
        return CommandResult.success(msg("command.summary.content.updated", value));
    }

    private CommandResult handleSummaryEnable(String roomId) {
        roomSettingsService.update(roomId, RoomSettings.builder().summaryEnabled(true).build());
        if (summaryScheduleService.findEntry(roomId).isEmpty()) {
            summaryScheduleService.arm(roomId, effectiveTimeOfDay(roomSettingsService.getSettings(roomId)));
        }
        return CommandResult.success(msg("command.summary.enabled"));
    }

    private CommandResult handleSummaryDisable(String roomId) {
        roomSettingsService.update(roomId, RoomSettings.builder().summaryEnabled(false).build());
        summaryScheduleService.cancel(roomId);
        return CommandResult.success(msg("command.summary.disabled"));
    }

    private CommandResult handleSummaryTime(String roomId, List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure(msg("command.summary.time.usage"));
        }
        String expression = String.join(" ", args);
        LocalTime time;
        try {
            time = timeParser.parseTimeOfDay(expression);
        } catch (IllegalArgumentException e) {
            log.warn("[Command] Unable to parse time '{}'", expression);
            return CommandResult.failure(msg("command.summary.time.invalid", expression));
        }

        String formatted = NaturalTimeParser.formatTimeOfDay(time);
        roomSettingsService.update(roomId, RoomSettings.builder().summaryTime(formatted).build());
        if (roomSettingsService.getSettings(roomId).summariesEnabled()) {
            summaryScheduleService.arm(roomId, time);
        } else {
            summaryScheduleService.cancel(roomId);
        }
        return CommandResult.success(msg("command.summary.time.set", formatted));
    }

    private CommandResult handleSummaryTimeInfo(String roomId) {
        RoomSettings settings = roomSettingsService.getSettings(roomId);
        String response = msg("command.summary.time.info", effectiveSummaryTime(settings), zoneName());
        if (!settings.summariesEnabled()) {
            response += msg("command.summary.time.info.disabled");
        }
        return CommandResult.success(response);
    }

    private CommandResult handleShowPriority(String roomId) {
        RoomSettings settings = roomSettingsService.getSettings(roomId);
        if (!settings.hasPriorityMscs()) {
            return CommandResult.success(msg("command.priority.none"));
        }
        String links = settings.getPriorityMscs().stream()
                .map(number -> "[" + number + "](https://github.com/" + properties.getGithub().getRepo()
                        + "/pull/" + number + ")")
                .collect(Collectors.joining(LIST_SEPARATOR));
        return CommandResult.success(msg("command.priority.current", links));
    }

    private CommandResult handlePriorityMscs(String roomId, List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure(msg("command.priority.usage"));
        }

        if (SUBCMD_CLEAR.equalsIgnoreCase(args.get(0))) {
            Optional<Object> previous = roomSettingsService.get(roomId, RoomSettingKey.PRIORITY_MSCS);
            roomSettingsService.delete(roomId, RoomSettingKey.PRIORITY_MSCS);
            return CommandResult.success(msg("command.priority.cleared",
                    previous.map(Object::toString).orElse("none")));
        }

        List<Integer> numbers;
        try {
            numbers = parsePriorityNumbers(args);
        } catch (IllegalArgumentException e) {
            log.warn("[Command] Unable to parse {} as an int", e.getMessage());
            return CommandResult.failure(msg("command.priority.invalid", e.getMessage()));
        }
        if (numbers.isEmpty()) {
            return CommandResult.failure(msg("command.priority.usage"));
        }

        roomSettingsService.update(roomId, RoomSettings.builder().priorityMscs(numbers).build());
        return CommandResult.success(msg("command.priority.set", numbers.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(LIST_SEPARATOR))));
    }

    /**
     * Comma separators may be attached to tokens ({@code 123,}) or between them.
     *
     * @throws IllegalArgumentException
     *             carrying the offending token as its message
     */
    static List<Integer> parsePriorityNumbers(List<String> args) {
        List<Integer> numbers = new ArrayList<>();
        for (String arg : args) {
            for (String token : arg.split(",")) {
                String trimmed = token.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    numbers.add(Integer.parseInt(trimmed));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(trimmed, e);
                }
            }
        }
        return numbers;
    }

    // ==================== HELPERS ====================

    private LocalTime effectiveTimeOfDay(RoomSettings settings) {
        if (settings.getSummaryTime() != null) {
            return LocalTime.parse(settings.getSummaryTime());
        }
        return summaryScheduleService.getDefaultTime();
    }

    private String effectiveSummaryTime(RoomSettings settings) {
        return settings.getSummaryTime() != null
                ? settings.getSummaryTime()
                : NaturalTimeParser.formatTimeOfDay(summaryScheduleService.getDefaultTime());
    }

    private String zoneName() {
        return timeParser.getZone().getId();
    }

    private static CommandResult report(String text) {
        return CommandResult.success(text.strip());
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
