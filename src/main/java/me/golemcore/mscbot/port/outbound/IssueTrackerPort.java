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

package me.golemcore.mscbot.port.outbound;

import me.golemcore.mscbot.domain.model.IssueComment;
import me.golemcore.mscbot.domain.model.LabelEvent;
import me.golemcore.mscbot.domain.model.TrackedIssue;

import java.util.List;

/**
 * Port for the issue tracker hosting the proposals.
 *
 * <p>
 * Implementations throw
 * {@link me.golemcore.mscbot.domain.model.ExternalServiceException} when the
 * tracker cannot be reached.
 */
public interface IssueTrackerPort {

    /**
     * List open issues carrying the given label.
     */
    List<TrackedIssue> listIssuesByLabel(String label);

    /**
     * List an issue's comments, oldest first.
     */
    List<IssueComment> listComments(int issueNumber);

    /**
     * List an issue's label additions and removals, oldest first.
     */
    List<LabelEvent> listLabelEvents(int issueNumber);
}
