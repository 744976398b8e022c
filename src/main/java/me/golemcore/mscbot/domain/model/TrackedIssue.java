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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Read-only snapshot of a proposal issue as returned by the tracker. Comments
 * and label events are fetched separately through
 * {@link me.golemcore.mscbot.port.outbound.IssueTrackerPort}.
 */
public record TrackedIssue(int number, String title, String htmlUrl, Set<String> labels) {

    public TrackedIssue {
        labels = labels == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(labels));
    }

    public boolean hasLabel(String label) {
        return labels.contains(label);
    }
}
