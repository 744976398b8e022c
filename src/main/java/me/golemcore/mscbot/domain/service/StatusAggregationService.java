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

import me.golemcore.mscbot.domain.model.MscLabels;
import me.golemcore.mscbot.domain.model.ReviewRecord;
import me.golemcore.mscbot.domain.model.RoomSettings;
import me.golemcore.mscbot.domain.model.StatusEntry;
import me.golemcore.mscbot.domain.model.TrackedIssue;
import me.golemcore.mscbot.port.outbound.IssueTrackerPort;
import me.golemcore.mscbot.port.outbound.ReviewFeedPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins open proposals from the tracker with FCP review records from the review
 * feed.
 *
 * <p>
 * Each call fetches the proposal list and the whole review feed exactly once.
 * A failure of either fetch propagates to the caller; no partial result is
 * produced. A proposal labelled as pending FCP but missing from the feed is
 * returned without a review.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatusAggregationService {

    private final IssueTrackerPort issueTrackerPort;
    private final ReviewFeedPort reviewFeedPort;
    private final RoomSettingsService roomSettingsService;

    /**
     * Aggregate the status of every open proposal.
     */
    public List<StatusEntry> aggregate() {
        return aggregate(null);
    }

    /**
     * Aggregate the status of open proposals, restricted to the room's priority
     * MSCs when the room has any.
     *
     * @param roomId
     *            room whose priority list scopes the result, or {@code null}
     * @return unsorted status entries
     */
    public List<StatusEntry> aggregate(String roomId) {
        List<TrackedIssue> issues = issueTrackerPort.listIssuesByLabel(MscLabels.PROPOSAL);

        if (roomId != null) {
            RoomSettings settings = roomSettingsService.getSettings(roomId);
            if (settings.hasPriorityMscs()) {
                List<Integer> priority = settings.getPriorityMscs();
                issues = issues.stream()
                        .filter(issue -> priority.contains(issue.number()))
                        .toList();
            }
        }

        Map<Integer, ReviewRecord> reviewsByIssue = new HashMap<>();
        for (ReviewRecord review : reviewFeedPort.fetchAll()) {
            reviewsByIssue.putIfAbsent(review.issueNumber(), review);
        }

        List<StatusEntry> entries = new ArrayList<>(issues.size());
        int unmatched = 0;
        for (TrackedIssue issue : issues) {
            ReviewRecord review = null;
            if (issue.hasLabel(MscLabels.PROPOSED_FCP)) {
                review = reviewsByIssue.get(issue.number());
                if (review == null) {
                    unmatched++;
                }
            }
            entries.add(new StatusEntry(issue, issue.labels(), review));
        }

        log.debug("[Aggregator] {} proposals, {} reviews, {} pending without review",
                entries.size(), reviewsByIssue.size(), unmatched);
        return entries;
    }
}
