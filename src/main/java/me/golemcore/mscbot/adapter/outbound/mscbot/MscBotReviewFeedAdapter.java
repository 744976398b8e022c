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

package me.golemcore.mscbot.adapter.outbound.mscbot;

import com.fasterxml.jackson.databind.JsonNode;
import feign.FeignException;
import feign.RequestLine;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.mscbot.domain.model.ExternalServiceException;
import me.golemcore.mscbot.domain.model.ReviewRecord;
import me.golemcore.mscbot.infrastructure.config.BotProperties;
import me.golemcore.mscbot.infrastructure.http.FeignClientFactory;
import me.golemcore.mscbot.port.outbound.ReviewFeedPort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ReviewFeedPort} reading the mscbot {@code /api/all} endpoint.
 *
 * <p>
 * Record shape: {@code issue.number}, {@code fcp.disposition},
 * {@code fcp.fcp_start} (UTC without offset) and {@code reviews} as
 * {@code [user, approved]} pairs.
 */
@Component
@Slf4j
public class MscBotReviewFeedAdapter implements ReviewFeedPort {

    private final MscBotApi api;

    public MscBotReviewFeedAdapter(FeignClientFactory feignClientFactory, BotProperties properties) {
        this.api = feignClientFactory.create(MscBotApi.class, properties.getMscbot().getUrl());
    }

    @Override
    public List<ReviewRecord> fetchAll() {
        JsonNode records;
        try {
            records = api.all();
        } catch (FeignException e) {
            log.warn("[MscBot] Failed to fetch reviews: HTTP {}", e.status());
            throw new ExternalServiceException("Review feed request failed", e);
        }
        if (records == null || !records.isArray()) {
            throw new ExternalServiceException("Review feed returned no record list");
        }

        List<ReviewRecord> reviews = new ArrayList<>(records.size());
        for (JsonNode node : records) {
            JsonNode number = node.path("issue").path("number");
            if (!number.canConvertToInt()) {
                log.debug("[MscBot] Skipping record without issue number");
                continue;
            }
            reviews.add(toReviewRecord(number.asInt(), node));
        }
        log.debug("[MscBot] Fetched {} review records", reviews.size());
        return reviews;
    }

    static ReviewRecord toReviewRecord(int issueNumber, JsonNode node) {
        JsonNode fcp = node.path("fcp");
        List<ReviewRecord.ReviewerApproval> reviewers = new ArrayList<>();
        for (JsonNode pair : node.path("reviews")) {
            JsonNode user = pair.path(0);
            String login = user.isTextual() ? user.asText() : user.path("login").asText(null);
            if (login != null) {
                reviewers.add(new ReviewRecord.ReviewerApproval(login, pair.path(1).asBoolean(false)));
            }
        }
        return new ReviewRecord(issueNumber,
                ReviewRecord.Disposition.fromValue(fcp.path("disposition").asText(null)),
                reviewers,
                parseFcpStart(fcp.path("fcp_start").asText(null)));
    }

    static Instant parseFcpStart(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim()).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("[MscBot] Ignoring unparseable fcp_start '{}'", value);
            return null;
        }
    }

    interface MscBotApi {
        @RequestLine("GET /api/all")
        JsonNode all();
    }
}
