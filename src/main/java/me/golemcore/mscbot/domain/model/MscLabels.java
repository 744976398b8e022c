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

import java.util.Set;

/**
 * Tracker label names that drive the MSC lifecycle.
 *
 * <p>
 * A proposal moves from {@link #PROPOSAL} through {@link #IN_REVIEW},
 * {@link #PROPOSED_FCP} and {@link #FCP} to one of the concluded labels.
 */
public final class MscLabels {

    public static final String PROPOSAL = "proposal";
    public static final String IN_REVIEW = "proposal-in-review";
    public static final String PROPOSED_FCP = "proposed-final-comment-period";
    public static final String FCP = "final-comment-period";
    public static final String FINISHED_FCP = "finished-final-comment-period";
    public static final String SPEC_PR_MISSING = "spec-pr-missing";
    public static final String SPEC_PR_IN_REVIEW = "spec-pr-in-review";
    public static final String MERGED = "merged";

    /** Labels that mean a proposal was accepted. */
    public static final Set<String> APPROVED = Set.of(FINISHED_FCP, SPEC_PR_MISSING, SPEC_PR_IN_REVIEW, MERGED);

    /** Labels that mean a proposal is still being discussed. */
    public static final Set<String> STARTED = Set.of(PROPOSAL, IN_REVIEW);

    /** Labels of the three active stages. */
    public static final Set<String> ACTIVE_STAGES = Set.of(IN_REVIEW, PROPOSED_FCP, FCP);

    private MscLabels() {
    }
}
