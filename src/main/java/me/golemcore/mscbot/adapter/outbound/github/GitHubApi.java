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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Param;
import feign.RequestLine;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * GitHub REST v3 endpoints for issues, issue comments and issue events.
 */
interface GitHubApi {

    @RequestLine("GET /repos/{owner}/{repo}/issues?labels={label}&state=open&per_page={perPage}&page={page}")
    List<Issue> listIssues(@Param("owner") String owner, @Param("repo") String repo,
            @Param("label") String label, @Param("perPage") int perPage, @Param("page") int page);

    @RequestLine("GET /repos/{owner}/{repo}/issues/{number}/comments?per_page={perPage}&page={page}")
    List<Comment> listComments(@Param("owner") String owner, @Param("repo") String repo,
            @Param("number") int number, @Param("perPage") int perPage, @Param("page") int page);

    @RequestLine("GET /repos/{owner}/{repo}/issues/{number}/events?per_page={perPage}&page={page}")
    List<IssueEvent> listEvents(@Param("owner") String owner, @Param("repo") String repo,
            @Param("number") int number, @Param("perPage") int perPage, @Param("page") int page);

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class Issue {
        private int number;
        private String title;
        @JsonProperty("html_url")
        private String htmlUrl;
        private List<Label> labels = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class Label {
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class User {
        private long id;
        private String login;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class Comment {
        private User user;
        @JsonProperty("created_at")
        private Instant createdAt;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class IssueEvent {
        private String event;
        private Label label;
        @JsonProperty("created_at")
        private Instant createdAt;
    }
}
