package me.golemcore.mscbot.domain.service;

import me.golemcore.mscbot.domain.model.ExternalServiceException;
import me.golemcore.mscbot.domain.model.LabelEvent;
import me.golemcore.mscbot.domain.model.MscLabels;
import me.golemcore.mscbot.domain.model.NewsWindow;
import me.golemcore.mscbot.domain.model.TrackedIssue;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.port.outbound.AnnouncementFeedPort;
import me.golemcore.mscbot.port.outbound.IssueTrackerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NewsDigestServiceTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final Instant FROM = Instant.parse("2026-02-01T00:00:00Z");
    private static final Instant UNTIL = Instant.parse("2026-02-08T00:00:00Z");

    private IssueTrackerPort issueTrackerPort;
    private AnnouncementFeedPort announcementFeedPort;
    private NewsDigestService service;

    @BeforeEach
    void setUp() {
        issueTrackerPort = mock(IssueTrackerPort.class);
        announcementFeedPort = mock(AnnouncementFeedPort.class);
        when(issueTrackerPort.listLabelEvents(anyInt())).thenReturn(List.of());
        Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
        BotProperties properties = new BotProperties();
        service = new NewsDigestService(issueTrackerPort, announcementFeedPort,
                new NaturalTimeParser(clock, properties), clock, properties);
    }

    @Test
    void shouldIncludeEventAtWindowStartAndExcludeEventAtWindowEnd() {
        TrackedIssue atStart = issue(1, "MSC1: At start");
        TrackedIssue atEnd = issue(2, "MSC2: At end");
        when(issueTrackerPort.listLabelEvents(1)).thenReturn(List.of(added(MscLabels.FCP, FROM)));
        when(issueTrackerPort.listLabelEvents(2)).thenReturn(List.of(added(MscLabels.MERGED, UNTIL)));

        String digest = service.digest(FROM, UNTIL, List.of(atStart, atEnd));

        assertTrue(digest.contains("[[MSC 1]: At start](https://github.com/matrix-org/matrix-doc/pull/1)"), digest);
        assertFalse(digest.contains("MSC 2"), digest);
        assertTrue(digest.contains("*No MSCs have been approved.*"));
        assertTrue(digest.contains("*No MSCs have been started.*"));
    }

    @Test
    void shouldKeepOnlyLatestWatchedEventPerIssue() {
        TrackedIssue issue = issue(3, "MSC3: Moving along");
        when(issueTrackerPort.listLabelEvents(3)).thenReturn(List.of(
                added(MscLabels.IN_REVIEW, FROM.plus(Duration.ofHours(1))),
                added(MscLabels.FCP, FROM.plus(Duration.ofHours(2))),
                added("kind:core", FROM.plus(Duration.ofHours(3))),
                new LabelEvent(MscLabels.MERGED, false, FROM.plus(Duration.ofHours(4)))));

        String digest = service.digest(FROM, UNTIL, List.of(issue));

        int fcpSection = digest.indexOf("**Final Comment Period**");
        int startedSection = digest.indexOf("**In Progress MSCs**");
        int line = digest.indexOf("[[MSC 3]");
        assertTrue(line > fcpSection && line < startedSection, digest);
        assertEquals(digest.indexOf("[[MSC 3]"), digest.lastIndexOf("[[MSC 3]"));
        assertTrue(digest.contains("*No MSCs have been started.*"));
    }

    @Test
    void shouldBucketApprovedAndStartedIssues() {
        when(issueTrackerPort.listLabelEvents(4)).thenReturn(List.of(
                added(MscLabels.SPEC_PR_MISSING, FROM.plus(Duration.ofDays(1)))));
        when(issueTrackerPort.listLabelEvents(5)).thenReturn(List.of(
                added(MscLabels.PROPOSAL, FROM.plus(Duration.ofDays(1)))));

        String digest = service.digest(FROM, UNTIL, List.of(issue(5, "Started"), issue(4, "Approved")));

        int approvedSection = digest.indexOf("**Approved MSCs**");
        int fcpSection = digest.indexOf("**Final Comment Period**");
        int startedSection = digest.indexOf("**In Progress MSCs**");
        int approvedLine = digest.indexOf("[[MSC 4]: Approved]");
        int startedLine = digest.indexOf("[[MSC 5]: Started]");
        assertTrue(approvedLine > approvedSection && approvedLine < fcpSection, digest);
        assertTrue(startedLine > startedSection, digest);
        assertTrue(digest.contains("*No MSCs have entered FCP.*"));
    }

    @Test
    void shouldStripProposalPrefixFromTitles() {
        assertEquals("Spaces", NewsDigestService.displayTitle(issue(1234, "MSC1234: Spaces")));
        assertEquals("Threads", NewsDigestService.displayTitle(issue(1234, "MSC 1234: Threads")));
        assertEquals("MSC999: Other", NewsDigestService.displayTitle(issue(1234, "MSC999: Other")));
        assertEquals("Plain title", NewsDigestService.displayTitle(issue(1234, "Plain title")));
    }

    @Test
    void shouldDefaultToLastWeek() {
        NewsWindow window = service.resolveWindow(List.of());

        assertEquals(FIXED_NOW.minus(Duration.ofDays(7)), window.from());
        assertEquals(FIXED_NOW, window.until());
        assertFalse(window.sinceAnnouncement());
    }

    @Test
    void shouldResolveWindowSinceLastAnnouncement() {
        Instant published = Instant.parse("2026-02-06T17:00:00Z");
        when(announcementFeedPort.latestPublishedAt()).thenReturn(published);

        NewsWindow window = service.resolveWindow(List.of("TWIM"));

        assertEquals(published, window.from());
        assertEquals(FIXED_NOW, window.until());
        assertTrue(window.sinceAnnouncement());
    }

    @Test
    void shouldPropagateAnnouncementFeedFailure() {
        when(announcementFeedPort.latestPublishedAt()).thenThrow(new ExternalServiceException("down"));

        assertThrows(ExternalServiceException.class, () -> service.resolveWindow(List.of("twim")));
    }

    @Test
    void shouldResolveSinceAndFromToRanges() {
        NewsWindow since = service.resolveWindow(List.of("since", "2", "days", "ago"));
        assertEquals(FIXED_NOW.minus(Duration.ofDays(2)), since.from());
        assertEquals(FIXED_NOW, since.until());

        NewsWindow range = service.resolveWindow(List.of("from", "2026-01-01", "to", "2026-01-31"));
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), range.from());
        assertEquals(Instant.parse("2026-01-31T00:00:00Z"), range.until());
    }

    @Test
    void shouldReportUnparseableTimes() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> service.resolveWindow(List.of("since", "someday")));

        assertEquals("Unable to parse 'someday' and/or 'now' as time", error.getMessage());
    }

    @Test
    void shouldReportUnknownRangeSyntax() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> service.resolveWindow(List.of("from", "yesterday", "to")));
        assertEquals(NewsDigestService.USAGE, error.getMessage());

        assertThrows(IllegalArgumentException.class, () -> service.resolveWindow(List.of("lately")));
    }

    @Test
    void shouldRenderHeaderAndPriorityWarning() {
        NewsWindow window = new NewsWindow(Instant.parse("2026-02-06T17:00:00Z"), FIXED_NOW, true);

        String news = service.renderNews(window, List.of(), true);

        assertTrue(news.startsWith("News from **2026-02-06 17:00 UTC** (last TWIM) until **2026-02-11 10:00 UTC**."),
                news);
        assertTrue(news.endsWith("you may not be seeing all available MSC news."));
    }

    @Test
    void shouldOmitWarningWithoutPriorityMscs() {
        String news = service.renderNews(new NewsWindow(FROM, UNTIL, false), List.of(), false);

        assertTrue(news.startsWith("News from **2026-02-01 00:00 UTC** until **2026-02-08 00:00 UTC**."), news);
        assertFalse(news.contains("priority"));
    }

    private static TrackedIssue issue(int number, String title) {
        return new TrackedIssue(number, title, "https://github.com/matrix-org/matrix-doc/pull/" + number,
                Set.of(MscLabels.PROPOSAL));
    }

    private static LabelEvent added(String label, Instant at) {
        return new LabelEvent(label, true, at);
    }
}
