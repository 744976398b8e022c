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

import me.golemcore.mscbot.domain.model.LabelEvent;
import me.golemcore.mscbot.domain.model.MscLabels;
import me.golemcore.mscbot.domain.model.NewsWindow;
import me.golemcore.mscbot.domain.model.TrackedIssue;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.port.outbound.AnnouncementFeedPort;
import me.golemcore.mscbot.port.outbound.IssueTrackerPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the news digest: which proposals were approved, entered FCP or were
 * started during a time window.
 *
 * <p>
 * For every issue the label timeline is scanned once and only the latest
 * watched label addition inside {@code [from, until)} is kept, so an issue is
 * reported in at most one bucket.
 */
@Service
@Slf4j
public class NewsDigestService {

    static final String USAGE = "Unknown news time range. "
            + "Usage: `show news`, `show news since (time)`, `show news from (time) to (time)`";
    private static final String ARG_FROM = "from";
    private static final String ARG_TO = "to";
    private static final String ARG_SINCE = "since";
    private static final String NOW = "now";
    private static final int MIN_RANGE_ARGS = 4;
    private static final String LINE_SEPARATOR = "\n\n";
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm z",
            Locale.ROOT);

    private final IssueTrackerPort issueTrackerPort;
    private final AnnouncementFeedPort announcementFeedPort;
    private final NaturalTimeParser timeParser;
    private final Clock clock;
    private final Set<String> watchedLabels;
    private final String announcementKeyword;
    private final String defaultSince;
    private final ZoneId zone;

    public NewsDigestService(IssueTrackerPort issueTrackerPort, AnnouncementFeedPort announcementFeedPort,
            NaturalTimeParser timeParser, Clock clock, BotProperties properties) {
        this.issueTrackerPort = issueTrackerPort;
        this.announcementFeedPort = announcementFeedPort;
        this.timeParser = timeParser;
        this.clock = clock;
        this.watchedLabels = Set.copyOf(properties.getGithub().getLabels());
        this.announcementKeyword = properties.getNews().getAnnouncementKeyword();
        this.defaultSince = properties.getNews().getDefaultSince();
        this.zone = ZoneId.of(properties.getSummary().getZone());
    }

    /**
     * Resolve command arguments to a time window.
     *
     * <ul>
     * <li>no arguments - the configured default ({@code 1 week ago}) until
     * now</li>
     * <li>{@code <keyword>} - since the newest announcement feed entry</li>
     * <li>{@code from <time> to <time>}</li>
     * <li>{@code since <time>}</li>
     * </ul>
     *
     * @throws IllegalArgumentException
     *             with a user-facing message if the arguments or times cannot be
     *             parsed
     * @throws me.golemcore.mscbot.domain.model.ExternalServiceException
     *             if the announcement feed cannot be read
     */
    public NewsWindow resolveWindow(List<String> arguments) {
        Instant now = clock.instant();
        if (arguments.isEmpty()) {
            return new NewsWindow(parseTime(defaultSince, NOW), now, false);
        }

        String first = arguments.get(0).toLowerCase(Locale.ROOT);
        if (first.equals(announcementKeyword)) {
            Instant published = announcementFeedPort.latestPublishedAt();
            return new NewsWindow(published, now, true);
        }

        String fromExpression;
        String untilExpression;
        if (first.equals(ARG_FROM) && arguments.size() >= MIN_RANGE_ARGS) {
            int toIndex = indexOfIgnoreCase(arguments, ARG_TO);
            if (toIndex < 2 || toIndex == arguments.size() - 1) {
                throw new IllegalArgumentException(USAGE);
            }
            fromExpression = String.join(" ", arguments.subList(1, toIndex));
            untilExpression = String.join(" ", arguments.subList(toIndex + 1, arguments.size()));
        } else if (first.equals(ARG_SINCE) && arguments.size() > 1) {
            fromExpression = String.join(" ", arguments.subList(1, arguments.size()));
            untilExpression = NOW;
        } else {
            throw new IllegalArgumentException(USAGE);
        }

        Instant from = parseTime(fromExpression, untilExpression);
        Instant until = parseTime(untilExpression, fromExpression);
        if (from.isAfter(until)) {
            throw new IllegalArgumentException("The start of the range ('" + fromExpression
                    + "') is after its end ('" + untilExpression + "').");
        }
        return new NewsWindow(from, until, false);
    }

    /**
     * Render the full news reply for a window.
     *
     * @param priorityScoped
     *            whether the issues were narrowed to the room's priority MSCs
     */
    public String renderNews(NewsWindow window, List<TrackedIssue> issues, boolean priorityScoped) {
        String banner = window.sinceAnnouncement() ? "(last " + announcementKeyword.toUpperCase(Locale.ROOT) + ") "
                : "";
        StringBuilder response = new StringBuilder()
                .append("News from **").append(format(window.from())).append("** ")
                .append(banner)
                .append("until **").append(format(window.until())).append("**.")
                .append(LINE_SEPARATOR)
                .append(digest(window.from(), window.until(), issues));
        if (priorityScoped) {
            response.append(LINE_SEPARATOR)
                    .append("Be aware that there are priority MSCs enabled in this room, "
                            + "and that you may not be seeing all available MSC news.");
        }
        return response.toString();
    }

    /**
     * Bucket the label changes of {@code issues} within {@code [from, until)}.
     */
    public String digest(Instant from, Instant until, List<TrackedIssue> issues) {
        NewsWindow window = new NewsWindow(from, until, false);
        Map<TrackedIssue, LabelEvent> latest = latestEvents(window, issues);

        List<TrackedIssue> approved = new ArrayList<>();
        List<TrackedIssue> fcp = new ArrayList<>();
        List<TrackedIssue> started = new ArrayList<>();
        latest.forEach((issue, event) -> {
            String label = event.label();
            if (MscLabels.APPROVED.contains(label)) {
                approved.add(issue);
            } else if (MscLabels.FCP.equals(label)) {
                fcp.add(issue);
            } else if (MscLabels.STARTED.contains(label)) {
                started.add(issue);
            }
        });
        log.debug("[News] {} approved, {} FCP, {} started", approved.size(), fcp.size(), started.size());

        return "**Approved MSCs**" + LINE_SEPARATOR + bucket(approved, "*No MSCs have been approved.*")
                + LINE_SEPARATOR + "**Final Comment Period**" + LINE_SEPARATOR
                + bucket(fcp, "*No MSCs have entered FCP.*")
                + LINE_SEPARATOR + "**In Progress MSCs**" + LINE_SEPARATOR
                + bucket(started, "*No MSCs have been started.*");
    }

    Map<TrackedIssue, LabelEvent> latestEvents(NewsWindow window, List<TrackedIssue> issues) {
        List<TrackedIssue> ordered = issues.stream()
                .sorted(Comparator.comparingInt(TrackedIssue::number))
                .toList();

        Map<TrackedIssue, LabelEvent> latest = new LinkedHashMap<>();
        for (TrackedIssue issue : ordered) {
            LabelEvent retained = null;
            for (LabelEvent event : issueTrackerPort.listLabelEvents(issue.number())) {
                if (!event.added() || !watchedLabels.contains(event.label())) {
                    continue;
                }
                if (!window.contains(event.createdAt())) {
                    continue;
                }
                if (retained == null || !event.createdAt().isBefore(retained.createdAt())) {
                    retained = event;
                }
            }
            if (retained != null) {
                latest.put(issue, retained);
            }
        }
        return latest;
    }

    /**
     * Title without a leading {@code MSC1234:} or {@code MSC 1234:} prefix.
     */
    static String displayTitle(TrackedIssue issue) {
        String title = issue.title() == null ? "" : issue.title().strip();
        String number = String.valueOf(issue.number());
        for (String prefix : List.of("MSC" + number, "MSC " + number)) {
            if (title.startsWith(prefix)) {
                title = title.substring(prefix.length()).strip();
                break;
            }
        }
        if (title.startsWith(":")) {
            title = title.substring(1);
        }
        return title.strip();
    }

    private static String bucket(List<TrackedIssue> issues, String emptyText) {
        if (issues.isEmpty()) {
            return emptyText;
        }
        return String.join(LINE_SEPARATOR, issues.stream()
                .map(issue -> "[[MSC " + issue.number() + "]: " + displayTitle(issue) + "](" + issue.htmlUrl() + ")")
                .toList());
    }

    private Instant parseTime(String expression, String other) {
        try {
            return timeParser.parseInstant(expression);
        } catch (IllegalArgumentException e) {
            log.warn("[News] Unable to parse time '{}': {}", expression, e.getMessage());
            throw new IllegalArgumentException(
                    "Unable to parse '" + expression + "' and/or '" + other + "' as time", e);
        }
    }

    private String format(Instant instant) {
        return DISPLAY_FORMAT.format(instant.atZone(zone));
    }

    private static int indexOfIgnoreCase(List<String> values, String needle) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i).equalsIgnoreCase(needle)) {
                return i;
            }
        }
        return -1;
    }
}
