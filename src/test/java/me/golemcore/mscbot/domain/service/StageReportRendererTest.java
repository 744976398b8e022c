package me.golemcore.mscbot.domain.service;

import me.golemcore.mscbot.domain.model.IssueComment;
import me.golemcore.mscbot.domain.model.MscLabels;
import me.golemcore.mscbot.domain.model.ReviewRecord;
import me.golemcore.mscbot.domain.model.StatusEntry;
import me.golemcore.mscbot.domain.model.SummaryContentMode;
import me.golemcore.mscbot.domain.model.TrackedIssue;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.port.outbound.IssueTrackerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StageReportRendererTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final long BOT_ACCOUNT_ID = 40832866L;
    private static final long OTHER_ACCOUNT_ID = 12345L;

    private IssueTrackerPort issueTrackerPort;
    private BotProperties properties;
    private StageReportRenderer renderer;

    @BeforeEach
    void setUp() {
        issueTrackerPort = mock(IssueTrackerPort.class);
        when(issueTrackerPort.listComments(anyInt())).thenReturn(List.of());
        properties = new BotProperties();
        properties.getMsc().setFcpLength(7);
        properties.getUserIds().put("alice", "@alice:example.org");
        renderer = new StageReportRenderer(issueTrackerPort, Clock.fixed(FIXED_NOW, ZoneOffset.UTC), properties);
    }

    @Test
    void shouldReportRemainingFcpDaysFromNewestBotComment() {
        TrackedIssue issue = issue(42, MscLabels.PROPOSAL, MscLabels.FCP);
        when(issueTrackerPort.listComments(42)).thenReturn(List.of(
                comment(BOT_ACCOUNT_ID, FIXED_NOW.minus(Duration.ofDays(30))),
                comment(BOT_ACCOUNT_ID, FIXED_NOW.minus(Duration.ofDays(2))),
                comment(OTHER_ACCOUNT_ID, FIXED_NOW.minus(Duration.ofHours(1)))));

        String report = renderer.renderFcp(List.of(StatusEntry.of(issue)));

        assertTrue(report.contains("[[MSC42](https://github.com/matrix-org/matrix-doc/pull/42)] - "
                + "MSC42: Proposal 42 - Ends in **5 days**"), report);
    }

    @Test
    void shouldUseSingularForLastDay() {
        TrackedIssue issue = issue(42, MscLabels.FCP);
        when(issueTrackerPort.listComments(42)).thenReturn(List.of(
                comment(BOT_ACCOUNT_ID, Instant.parse("2026-02-05T10:00:00Z"))));

        assertEquals(Optional.of(1L), renderer.remainingFcpDays(issue));
        assertTrue(renderer.renderFcp(List.of(StatusEntry.of(issue))).contains("Ends in **1 day**"));
    }

    @Test
    void shouldReportEndsTodayWhenFcpIsOver() {
        TrackedIssue issue = issue(42, MscLabels.FCP);
        when(issueTrackerPort.listComments(42)).thenReturn(List.of(
                comment(BOT_ACCOUNT_ID, FIXED_NOW.minus(Duration.ofDays(20)))));

        assertTrue(renderer.renderFcp(List.of(StatusEntry.of(issue))).contains("Ends **today**"));
    }

    @Test
    void shouldOmitEndClauseWithoutBotComment() {
        TrackedIssue issue = issue(42, MscLabels.FCP);
        when(issueTrackerPort.listComments(42)).thenReturn(List.of(
                comment(OTHER_ACCOUNT_ID, FIXED_NOW.minus(Duration.ofDays(2)))));

        String report = renderer.renderFcp(List.of(StatusEntry.of(issue)));

        assertTrue(report.endsWith("MSC42: Proposal 42"), report);
        assertEquals(Optional.empty(), renderer.remainingFcpDays(issue));
    }

    @Test
    void shouldRenderPendingWithDispositionAndOutstandingReviewers() {
        StatusEntry pending = pendingEntry(7, List.of(
                new ReviewRecord.ReviewerApproval("alice", false),
                new ReviewRecord.ReviewerApproval("bob", true),
                new ReviewRecord.ReviewerApproval("carol", false)));

        String report = renderer.renderPending(List.of(pending), null);

        assertTrue(report.contains("**Pending Final Comment Period**"));
        assertTrue(report.contains("MSC7: Proposal 7 - *merge*"));
        assertTrue(report.contains("To review: @alice:example.org, carol"), report);
        assertFalse(report.contains("bob"));
    }

    @Test
    void shouldFilterPendingByReviewerIgnoringCase() {
        StatusEntry waitingOnAlice = pendingEntry(7, List.of(new ReviewRecord.ReviewerApproval("alice", false)));
        StatusEntry waitingOnBob = pendingEntry(8, List.of(new ReviewRecord.ReviewerApproval("bob", false)));

        List<StatusEntry> pending = renderer.pending(List.of(waitingOnAlice, waitingOnBob), "Alice");

        assertEquals(1, pending.size());
        assertEquals(7, pending.get(0).number());
    }

    @Test
    void shouldSkipPendingEntriesWithoutReview() {
        StatusEntry unmatched = StatusEntry.of(issue(9, MscLabels.PROPOSAL, MscLabels.PROPOSED_FCP));

        assertTrue(renderer.pending(List.of(unmatched), null).isEmpty());
    }

    @Test
    void shouldRenderEmptySectionSentence() {
        String report = renderer.renderInProgress(List.of());

        assertEquals("\n\n**In Progress**\n\n" + StageReportRenderer.EMPTY_SECTION, report);
    }

    @Test
    void shouldKeepBucketsDisjointAndOrderedInCompositeReport() {
        List<StatusEntry> entries = List.of(
                StatusEntry.of(issue(30, MscLabels.PROPOSAL, MscLabels.FCP)),
                pendingEntry(20, List.of(new ReviewRecord.ReviewerApproval("bob", false))),
                StatusEntry.of(issue(12, MscLabels.PROPOSAL, MscLabels.IN_REVIEW)),
                StatusEntry.of(issue(10, MscLabels.PROPOSAL, MscLabels.IN_REVIEW)),
                StatusEntry.of(issue(5, MscLabels.PROPOSAL)));

        Set<Integer> inProgress = numbers(renderer.inProgress(entries));
        Set<Integer> pending = numbers(renderer.pending(entries, null));
        Set<Integer> inFcp = numbers(renderer.inFcp(entries));
        Set<Integer> union = new HashSet<>(inProgress);
        union.addAll(pending);
        union.addAll(inFcp);
        assertEquals(inProgress.size() + pending.size() + inFcp.size(), union.size());

        String report = renderer.renderAll(entries);

        assertTrue(report.startsWith("# Today's MSC Status"));
        int inProgressAt = report.indexOf("**In Progress**");
        int pendingAt = report.indexOf("**Pending Final Comment Period**");
        int fcpAt = report.indexOf("**In Final Comment Period**");
        assertTrue(inProgressAt < pendingAt && pendingAt < fcpAt);
        assertTrue(report.indexOf("[MSC10]") < report.indexOf("[MSC12]"));
        assertTrue(report.indexOf("[MSC12]") < pendingAt);
        assertTrue(report.indexOf("[MSC20]") > pendingAt && report.indexOf("[MSC20]") < fcpAt);
        assertTrue(report.indexOf("[MSC30]") > fcpAt);
        assertFalse(report.contains("[MSC5]"));
    }

    @Test
    void shouldRenderByContentMode() {
        List<StatusEntry> entries = List.of(StatusEntry.of(issue(10, MscLabels.IN_REVIEW)));

        assertEquals(renderer.renderInProgress(entries), renderer.render(SummaryContentMode.IN_PROGRESS, entries));
        assertEquals(renderer.renderFcp(entries), renderer.render(SummaryContentMode.FCP, entries));
        assertEquals(renderer.renderAll(entries), renderer.render(SummaryContentMode.ALL, entries));
    }

    @Test
    void shouldCountConcludedPriorityMscs() {
        List<StatusEntry> entries = List.of(
                StatusEntry.of(issue(1, MscLabels.PROPOSAL, MscLabels.IN_REVIEW)),
                StatusEntry.of(issue(2, MscLabels.PROPOSAL, MscLabels.FCP, MscLabels.FINISHED_FCP)),
                StatusEntry.of(issue(3, MscLabels.PROPOSAL)),
                StatusEntry.of(issue(4, MscLabels.PROPOSAL)));

        assertEquals("Priority MSC progress: 2/3", renderer.renderPriorityProgress(entries, List.of(1, 2, 3)));
    }

    private static Set<Integer> numbers(List<StatusEntry> entries) {
        Set<Integer> numbers = new HashSet<>();
        entries.forEach(entry -> numbers.add(entry.number()));
        return numbers;
    }

    private static StatusEntry pendingEntry(int number, List<ReviewRecord.ReviewerApproval> reviewers) {
        TrackedIssue issue = issue(number, MscLabels.PROPOSAL, MscLabels.PROPOSED_FCP);
        return new StatusEntry(issue, issue.labels(),
                new ReviewRecord(number, ReviewRecord.Disposition.MERGE, reviewers, null));
    }

    private static TrackedIssue issue(int number, String... labels) {
        return new TrackedIssue(number, "MSC" + number + ": Proposal " + number,
                "https://github.com/matrix-org/matrix-doc/pull/" + number, Set.of(labels));
    }

    private static IssueComment comment(long authorId, Instant createdAt) {
        return new IssueComment(authorId, "user" + authorId, createdAt);
    }
}
