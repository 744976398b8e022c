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

package me.golemcore.mscbot.adapter.outbound.github;

import feign.FeignException;
import feign.RequestInterceptor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mscbot.domain.model.ExternalServiceException;
import me.golemcore.mscbot.domain.model.IssueComment;
import me.golemcore.mscbot.domain.model.LabelEvent;
import me.golemcore.mscbot.domain.model.TrackedIssue;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.infrastructure.http.FeignClientFactory;
import me.golemcore.mscbot.port.outbound.IssueTrackerPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * {@link IssueTrackerPort} backed by the GitHub REST API.
 *
 * <p>
 * Every listing is paginated with the maximum page size until a short page is
 * returned.
 */
@Component
@Slf4j
public class GitHubTrackerAdapter implements IssueTrackerPort {

    static final int PAGE_SIZE = 100;
    private static final int MAX_PAGES = 50;
    private static final String EVENT_LABELED = "labeled";
    private static final String EVENT_UNLABELED = "unlabeled";

    private final GitHubApi api;
    private final String owner;
    private final String repo;

    public GitHubTrackerAdapter(FeignClientFactory feignClientFactory, BotProperties properties) {
        BotProperties.GithubProperties github = properties.getGithub();
        String[] parts = github.getRepo().split("/", 2);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalStateException("GitHub repository must be 'owner/name': " + github.getRepo());
        }
        this.owner = parts[0];
        this.repo = parts[1];
        this.api = createApi(feignClientFactory, github);
    }

    @Override
    public List<TrackedIssue> listIssuesByLabel(String label) {
        List<GitHubApi.Issue> issues = fetchAll("issues labelled " + label,
                page -> api.listIssues(owner, repo, label, PAGE_SIZE, page));
        log.debug("[GitHub] {} open issues labelled {}", issues.size(), label);
        return issues.stream()
                .map(GitHubTrackerAdapter::toTrackedIssue)
                .toList();
    }

    @Override
    public List<IssueComment> listComments(int issueNumber) {
        return fetchAll("comments of #" + issueNumber,
                page -> api.listComments(owner, repo, issueNumber, PAGE_SIZE, page))
                .stream()
                .filter(comment -> comment.getCreatedAt() != null)
                .map(GitHubTrackerAdapter::toComment)
                .toList();
    }

    @Override
    public List<LabelEvent> listLabelEvents(int issueNumber) {
        return fetchAll("events of #" + issueNumber,
                page -> api.listEvents(owner, repo, issueNumber, PAGE_SIZE, page))
                .stream()
                .filter(event -> EVENT_LABELED.equals(event.getEvent()) || EVENT_UNLABELED.equals(event.getEvent()))
                .filter(event -> event.getLabel() != null && event.getCreatedAt() != null)
                .map(event -> new LabelEvent(event.getLabel().getName(), EVENT_LABELED.equals(event.getEvent()),
                        event.getCreatedAt()))
                .toList();
    }

    private <T> List<T> fetchAll(String description, IntFunction<List<T>> pageFetcher) {
        List<T> all = new ArrayList<>();
        try {
            for (int page = 1; page <= MAX_PAGES; page++) {
                List<T> items = pageFetcher.apply(page);
                if (items == null || items.isEmpty()) {
                    break;
                }
                all.addAll(items);
                if (items.size() < PAGE_SIZE) {
                    break;
                }
            }
        } catch (FeignException e) {
            log.warn("[GitHub] Failed to list {}: HTTP {}", description, e.status());
            throw new ExternalServiceException("GitHub request failed for " + description, e);
        }
        return all;
    }

    private static TrackedIssue toTrackedIssue(GitHubApi.Issue issue) {
        Set<String> labels = new LinkedHashSet<>();
        if (issue.getLabels() != null) {
            issue.getLabels().forEach(label -> labels.add(label.getName()));
        }
        return new TrackedIssue(issue.getNumber(), issue.getTitle(), issue.getHtmlUrl(), labels);
    }

    private static IssueComment toComment(GitHubApi.Comment comment) {
        GitHubApi.User user = comment.getUser();
        return new IssueComment(user != null ? user.getId() : -1L, user != null ? user.getLogin() : null,
                comment.getCreatedAt());
    }

    private static GitHubApi createApi(FeignClientFactory factory, BotProperties.GithubProperties github) {
        String token = github.getToken();
        List<RequestInterceptor> interceptors = List.of(template -> {
            template.header("Accept", "application/vnd.github+json");
            template.header("User-Agent", "msc-bot");
            if (token != null && !token.isBlank()) {
                template.header("Authorization", "token " + token);
            }
        });
        return factory.create(GitHubApi.class, github.getApiUrl(), interceptors);
    }
}
