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

import java.util.Optional;
import java.util.Set;

/**
 * Unified status of one proposal: the issue, its labels at aggregation time and
 * the matching review record when the proposal is pending FCP.
 *
 * <p>
 * A review may only be attached to an issue labelled
 * {@link MscLabels#PROPOSED_FCP}, and only when both refer to the same issue
 * number.
 */
public record StatusEntry(TrackedIssue issue, Set<String> labels, ReviewRecord review) {

    public StatusEntry {
        if (issue == null) {
            throw new IllegalArgumentException("issue is required");
        }
        labels = labels == null ? issue.labels() : Set.copyOf(labels);
        if (review != null) {
            if (!labels.contains(MscLabels.PROPOSED_FCP)) {
                throw new IllegalArgumentException(
                        "Review attached to MSC" + issue.number() + " without the proposed FCP label");
            }
            if (review.issueNumber() != issue.number()) {
                throw new IllegalArgumentException(
                        "Review for #" + review.issueNumber() + " attached to MSC" + issue.number());
            }
        }
    }

    public static StatusEntry of(TrackedIssue issue) {
        return new StatusEntry(issue, issue.labels(), null);
    }

    public int number() {
        return issue.number();
    }

    public boolean hasLabel(String label) {
        return labels.contains(label);
    }

    public Optional<ReviewRecord> findReview() {
        return Optional.ofNullable(review);
    }
}
