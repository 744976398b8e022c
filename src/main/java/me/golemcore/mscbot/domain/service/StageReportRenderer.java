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

import me.golemcore.mscbot.domain.model.IssueComment;
import me.golemcore.mscbot.domain.model.MscLabels;
import me.golemcore.mscbot.domain.model.ReviewRecord;
import me.golemcore.mscbot.domain.model.StatusEntry;
import me.golemcore.mscbot.domain.model.SummaryContentMode;
import me.golemcore.mscbot.domain.model.TrackedIssue;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.port.outbound.IssueTrackerPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies status entries into lifecycle stages and renders them as markdown
 * sections.
 *
 * <p>
 * Stages are decided by label alone:
 * <ul>
 * <li>in progress - {@link MscLabels#IN_REVIEW}</li>
 * <li>pending FCP - {@link MscLabels#PROPOSED_FCP} with a review attached</li>
 * <li>in FCP - {@link MscLabels#FCP}</li>
 * </ul>
 * Tracker convention keeps these labels mutually exclusive; nothing here
 * enforces it. Every section is rendered even when empty.
 */
@Service
@Slf4j
public class StageReportRenderer {

    static final String EMPTY_SECTION = "No MSCs in this category.";
    private static final String SECTION_SEPARATOR = "\n\n";
    private static final String ALL_HEADER = "# Today's MSC Status";
    private static final String IN_PROGRESS_TITLE = "In Progress";
    private static final String PENDING_TITLE = "Pending Final Comment Period";
    private static final String FCP_TITLE = "In Final Comment Period";
    private static final Duration FCP_ANNOUNCEMENT_LAG = Duration.ofDays(1);

    private final IssueTrackerPort issueTrackerPort;
    private final Clock clock;
    private final ZoneId zone;
    private final int fcpLengthDays;
    private final long botAccountId;
    private final Map<String, String> mentions;

    public StageReportRenderer(IssueTrackerPort issueTrackerPort, Clock clock, BotProperties properties) {
        this.issueTrackerPort = issueTrackerPort;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getSummary().getZone());
        this.fcpLengthDays = properties.getMsc().getFcpLength();
        this.botAccountId = properties.getMsc().getBotAccountId();
        this.mentions = properties.getUserIds();
    }

    // ==================== CLASSIFICATION ====================

    public List<StatusEntry> inProgress(List<StatusEntry> entries) {
        return entries.stream()
                .filter(entry -> entry.hasLabel(MscLabels.IN_REVIEW))
                .toList();
    }

    /**
     * Entries pending FCP. With a reviewer filter, only entries still waiting on
     * that reviewer's approval are kept.
     */
    public List<StatusEntry> pending(List<StatusEntry> entries, String reviewer) {
        return entries.stream()
                .filter(entry -> entry.hasLabel(MscLabels.PROPOSED_FCP))
                .filter(entry -> entry.findReview().isPresent())
                .filter(entry -> reviewer == null || entry.review().outstandingReviewers().stream()
                        .anyMatch(login -> login.equalsIgnoreCase(reviewer)))
                .toList();
    }

    public List<StatusEntry> inFcp(List<StatusEntry> entries) {
        return entries.stream()
                .filter(entry -> entry.hasLabel(MscLabels.FCP))
                .toList();
    }

    // ==================== RENDERING ====================

    public String render(SummaryContentMode mode, List<StatusEntry> entries) {
        return switch (mode) {
        case ALL -> renderAll(entries);
        case PENDING -> renderPending(entries, null);
        case FCP -> renderFcp(entries);
        case IN_PROGRESS -> renderInProgress(entries);
        };
    }

    /**
     * All three sections, in-progress then pending then in-FCP, each sorted by MSC
     * number.
     */
    public String renderAll(List<StatusEntry> entries) {
        List<StatusEntry> sorted = entries.stream()
                .sorted(Comparator.comparingInt(StatusEntry::number))
                .toList();
        return ALL_HEADER
                + renderInProgress(sorted)
                + renderPending(sorted, null)
                + renderFcp(sorted);
    }

    public String renderInProgress(List<StatusEntry> entries) {
        List<String> lines = inProgress(entries).stream()
                .map(entry -> issueLink(entry.issue()))
                .toList();
        return section(IN_PROGRESS_TITLE, lines);
    }

    public String renderPending(List<StatusEntry> entries, String reviewer) {
        List<String> lines = pending(entries, reviewer).stream()
                .map(this::pendingLine)
                .toList();
        return section(PENDING_TITLE, lines);
    }

    public String renderFcp(List<StatusEntry> entries) {
        List<String> lines = inFcp(entries).stream()
                .map(this::fcpLine)
                .toList();
        return section(FCP_TITLE, lines);
    }

    /**
     * Goal line for rooms with priority MSCs. A priority MSC counts as completed
     * when it has left every active stage or finished its FCP.
     */
    public String renderPriorityProgress(List<StatusEntry> entries, Collection<Integer> priorityMscs) {
        long completed = entries.stream()
                .filter(entry -> priorityMscs.contains(entry.number()))
                .filter(this::isConcluded)
                .count();
        return "Priority MSC progress: " + completed + "/" + priorityMscs.size();
    }

    boolean isConcluded(StatusEntry entry) {
        boolean active = MscLabels.ACTIVE_STAGES.stream().anyMatch(entry::hasLabel);
        return !active || entry.hasLabel(MscLabels.FINISHED_FCP);
    }

    /**
     * Days left in an issue's FCP, derived from the newest comment of the bot
     * account. The bot announces FCP a day after it starts; the start day and the
     * current day are not counted as elapsed.
     */
    Optional<Long> remainingFcpDays(TrackedIssue issue) {
        List<IssueComment> comments = issueTrackerPort.listComments(issue.number());
        for (int i = comments.size() - 1; i >= 0; i--) {
            IssueComment comment = comments.get(i);
            if (comment.authorId() == botAccountId) {
                Instant start = comment.createdAt().minus(FCP_ANNOUNCEMENT_LAG);
                LocalDate startDate = start.atZone(zone).toLocalDate();
                LocalDate today = LocalDate.now(clock.withZone(zone));
                long elapsed = Math.max(0, ChronoUnit.DAYS.between(startDate, today) - 1);
                return Optional.of(fcpLengthDays - elapsed);
            }
        }
        log.debug("[Report] No bot comment on MSC{}, FCP end unknown", issue.number());
        return Optional.empty();
    }

    private String pendingLine(StatusEntry entry) {
        ReviewRecord review = entry.review();
        List<String> reviewers = review.outstandingReviewers().stream()
                .map(login -> mentions.getOrDefault(login, login))
                .toList();
        return issueLink(entry.issue()) + " - *" + review.disposition().displayName() + "*"
                + SECTION_SEPARATOR + "To review: " + String.join(", ", reviewers);
    }

    private String fcpLine(StatusEntry entry) {
        String line = issueLink(entry.issue());
        Optional<Long> remaining = remainingFcpDays(entry.issue());
        if (remaining.isEmpty()) {
            return line;
        }
        long days = remaining.get();
        if (days > 0) {
            return line + " - Ends in **" + days + (days == 1 ? " day" : " days") + "**";
        }
        return line + " - Ends **today**";
    }

    private static String issueLink(TrackedIssue issue) {
        return "[[MSC" + issue.number() + "](" + issue.htmlUrl() + ")] - " + issue.title();
    }

    private static String section(String title, List<String> lines) {
        String body = lines.isEmpty() ? EMPTY_SECTION : String.join(SECTION_SEPARATOR, lines);
        return SECTION_SEPARATOR + "**" + title + "**" + SECTION_SEPARATOR + body;
    }
}
