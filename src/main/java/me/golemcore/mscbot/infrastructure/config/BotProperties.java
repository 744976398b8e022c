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

package me.golemcore.mscbot.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link MatrixProperties} - chat transport account and sync behaviour</li>
 * <li>{@link GithubProperties} - proposal repository and watched labels</li>
 * <li>{@link MscBotProperties} - review feed location</li>
 * <li>{@link MscProperties} - FCP length and bot account used to infer FCP
 * start</li>
 * <li>{@link SummaryProperties} - default daily summary time and zone</li>
 * <li>{@link NewsProperties} - change digest defaults and announcement feed</li>
 * <li>{@link StorageProperties} - room data persistence</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    /** Users address the bot as {@code <commandPrefix>: <command>}. */
    private String commandPrefix = "mscbot";

    /** GitHub login to chat user id, used to mention reviewers. */
    private Map<String, String> userIds = new LinkedHashMap<>();

    private MatrixProperties matrix = new MatrixProperties();
    private GithubProperties github = new GithubProperties();
    private MscBotProperties mscbot = new MscBotProperties();
    private MscProperties msc = new MscProperties();
    private SummaryProperties summary = new SummaryProperties();
    private NewsProperties news = new NewsProperties();
    private LoopProperties loop = new LoopProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class MatrixProperties {
        private boolean enabled = true;
        /** Derived from the server part of {@link #userId} when blank. */
        private String homeserverUrl;
        private String userId = "@mscbot:matrix.org";
        private String accessToken;
        /** Only {@code m.text} notifies most clients; {@code m.notice} does not. */
        private String messageType = "m.text";
        private long syncTimeoutMs = 0;
        private long joinDelayMs = 3000;
        private long joinRetryBackoffMs = 5000;
        private int joinMaxAttempts = 2;
    }

    @Data
    public static class GithubProperties {
        private String apiUrl = "https://api.github.com";
        private String repo = "matrix-org/matrix-doc";
        private String token;
        private List<String> labels = new ArrayList<>(List.of(
                "proposal",
                "proposal-in-review",
                "proposed-final-comment-period",
                "final-comment-period",
                "finished-final-comment-period",
                "spec-pr-missing",
                "spec-pr-in-review",
                "merged"));
    }

    @Data
    public static class MscBotProperties {
        private String url = "https://mscbot.amorgan.xyz";
    }

    @Data
    public static class MscProperties {
        /** Length of a final comment period in days. */
        private int fcpLength = 5;
        /** Numeric tracker id of the account that announces FCP start. */
        private long botAccountId = 40832866L;
    }

    @Data
    public static class SummaryProperties {
        private String defaultTime = "07:00";
        private String zone = "UTC";
    }

    @Data
    public static class NewsProperties {
        private String announcementFeedUrl = "https://matrix.org/blog/category/this-week-in-matrix/feed/";
        private String announcementKeyword = "twim";
        private String defaultSince = "1 week ago";
    }

    @Data
    public static class LoopProperties {
        private long pollIntervalMs = 5000;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String roomDataDirectory = "rooms";
        private String roomDataFile = "room_data.json";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.mscbot";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
