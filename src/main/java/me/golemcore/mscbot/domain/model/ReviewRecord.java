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

package me.golemcore.mscbot.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * In-flight FCP review as published by the review feed. Linked to a
 * {@link TrackedIssue} by issue number.
 */
public record ReviewRecord(int issueNumber, Disposition disposition, List<ReviewerApproval> reviewers,
        Instant fcpStart) {

    public ReviewRecord {
        reviewers = reviewers == null ? List.of() : List.copyOf(reviewers);
        disposition = disposition == null ? Disposition.UNKNOWN : disposition;
    }

    /**
     * Logins of reviewers that have not approved yet, in feed order.
     */
    public List<String> outstandingReviewers() {
        return reviewers.stream()
                .filter(r -> !r.approved())
                .map(ReviewerApproval::login)
                .toList();
    }

    public Optional<Instant> findFcpStart() {
        return Optional.ofNullable(fcpStart);
    }

    public record ReviewerApproval(String login, boolean approved) {
    }

    /**
     * Outcome the FCP is heading towards.
     */
    public enum Disposition {
        MERGE, CLOSE, POSTPONE, UNKNOWN;

        public static Disposition fromValue(String value) {
            if (value == null || value.isBlank()) {
                return UNKNOWN;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return UNKNOWN;
            }
        }

        public String displayName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
