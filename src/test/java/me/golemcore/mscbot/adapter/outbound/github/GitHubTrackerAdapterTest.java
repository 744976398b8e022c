package me.golemcore.mscbot.adapter.outbound.github;

import feign.FeignException;
import feign.Request;
import me.golemcore.mscbot.domain.model.ExternalServiceException;
import me.golemcore.mscbot.domain.model.IssueComment;
import me.golemcore.mscbot.domain.model.LabelEvent;
import me.golemcore.mscbot.domain.model.TrackedIssue;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.infrastructure.http.FeignClientFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GitHubTrackerAdapterTest {

    private static final Instant CREATED = Instant.parse("2026-02-01T12:00:00Z");

    private GitHubApi api;
    private GitHubTrackerAdapter adapter;

    @BeforeEach
    void setUp() {
        api = mock(GitHubApi.class);
        FeignClientFactory factory = mock(FeignClientFactory.class);
        when(factory.create(eq(GitHubApi.class), anyString(), anyList())).thenReturn(api);
        adapter = new GitHubTrackerAdapter(factory, new BotProperties());
    }

    private static GitHubApi.Issue issue(int number, String... labels) {
        GitHubApi.Issue issue = new GitHubApi.Issue();
        issue.setNumber(number);
        issue.setTitle("MSC" + number + ": title");
        issue.setHtmlUrl("https://github.com/matrix-org/matrix-doc/pull/" + number);
        for (String name : labels) {
            issue.getLabels().add(label(name));
        }
        return issue;
    }

    private static GitHubApi.Label label(String name) {
        GitHubApi.Label label = new GitHubApi.Label();
        label.setName(name);
        return label;
    }

    private static GitHubApi.IssueEvent event(String type, String labelName) {
        GitHubApi.IssueEvent event = new GitHubApi.IssueEvent();
        event.setEvent(type);
        event.setLabel(labelName != null ? label(labelName) : null);
        event.setCreatedAt(CREATED);
        return event;
    }

    private static FeignException feignException(int status) {
        Request request = Request.create(
                Request.HttpMethod.GET, "https://api.github.com/repos/matrix-org/matrix-doc/issues",
                Collections.emptyMap(), null, null, null);
        return FeignException.errorStatus("listIssues", feign.Response.builder()
                .status(status)
                .reason("Error")
                .request(request)
                .headers(Collections.emptyMap())
                .build());
    }

    @Test
    void shouldMapIssuesWithLabels() {
        when(api.listIssues("matrix-org", "matrix-doc", "proposal", 100, 1))
                .thenReturn(List.of(issue(1234, "proposal", "kind:core")));

        List<TrackedIssue> issues = adapter.listIssuesByLabel("proposal");

        assertEquals(1, issues.size());
        TrackedIssue issue = issues.get(0);
        assertEquals(1234, issue.number());
        assertEquals("MSC1234: title", issue.title());
        assertEquals(Set.of("proposal", "kind:core"), issue.labels());
    }

    @Test
    void shouldFollowFullPages() {
        List<GitHubApi.Issue> firstPage = new ArrayList<>();
        for (int i = 0; i < GitHubTrackerAdapter.PAGE_SIZE; i++) {
            firstPage.add(issue(i + 1, "proposal"));
        }
        when(api.listIssues("matrix-org", "matrix-doc", "proposal", 100, 1)).thenReturn(firstPage);
        when(api.listIssues("matrix-org", "matrix-doc", "proposal", 100, 2))
                .thenReturn(List.of(issue(500, "proposal")));

        List<TrackedIssue> issues = adapter.listIssuesByLabel("proposal");

        assertEquals(101, issues.size());
        verify(api, never()).listIssues("matrix-org", "matrix-doc", "proposal", 100, 3);
    }

    @Test
    void shouldStopOnEmptyPage() {
        when(api.listIssues(anyString(), anyString(), anyString(), anyInt(), anyInt())).thenReturn(List.of());

        assertTrue(adapter.listIssuesByLabel("merged").isEmpty());
    }

    @Test
    void shouldKeepOnlyLabelEvents() {
        when(api.listEvents("matrix-org", "matrix-doc", 7, 100, 1)).thenReturn(List.of(
                event("labeled", "final-comment-period"),
                event("commented", null),
                event("unlabeled", "proposal-in-review"),
                event("renamed", null)));

        List<LabelEvent> events = adapter.listLabelEvents(7);

        assertEquals(2, events.size());
        assertEquals("final-comment-period", events.get(0).label());
        assertTrue(events.get(0).added());
        assertEquals("proposal-in-review", events.get(1).label());
        assertFalse(events.get(1).added());
        assertEquals(CREATED, events.get(1).createdAt());
    }

    @Test
    void shouldMapCommentAuthors() {
        GitHubApi.User user = new GitHubApi.User();
        user.setId(40832866L);
        user.setLogin("mscbot");
        GitHubApi.Comment byBot = new GitHubApi.Comment();
        byBot.setUser(user);
        byBot.setCreatedAt(CREATED);
        GitHubApi.Comment ghost = new GitHubApi.Comment();
        ghost.setCreatedAt(CREATED);
        when(api.listComments("matrix-org", "matrix-doc", 7, 100, 1)).thenReturn(List.of(byBot, ghost));

        List<IssueComment> comments = adapter.listComments(7);

        assertEquals(40832866L, comments.get(0).authorId());
        assertEquals("mscbot", comments.get(0).authorLogin());
        assertEquals(-1L, comments.get(1).authorId());
    }

    @Test
    void shouldWrapHttpFailures() {
        when(api.listIssues(anyString(), anyString(), anyString(), anyInt(), anyInt()))
                .thenThrow(feignException(502));

        assertThrows(ExternalServiceException.class, () -> adapter.listIssuesByLabel("proposal"));
    }

    @Test
    void shouldRejectRepositoryWithoutOwner() {
        BotProperties properties = new BotProperties();
        properties.getGithub().setRepo("matrix-doc");
        FeignClientFactory factory = mock(FeignClientFactory.class);

        assertThrows(IllegalStateException.class, () -> new GitHubTrackerAdapter(factory, properties));
    }
}
