package me.golemcore.mscbot.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StatusEntryTest {

    private static TrackedIssue issue(int number, String... labels) {
        return new TrackedIssue(number, "MSC" + number, "https://example.org/" + number, Set.of(labels));
    }

    @Test
    void shouldAttachReviewToProposedFcpIssue() {
        ReviewRecord review = new ReviewRecord(1, ReviewRecord.Disposition.MERGE, List.of(), null);

        StatusEntry entry = new StatusEntry(issue(1, MscLabels.PROPOSED_FCP), null, review);

        assertEquals(review, entry.findReview().orElseThrow());
        assertTrue(entry.hasLabel(MscLabels.PROPOSED_FCP));
    }

    @Test
    void shouldRejectReviewWithoutProposedFcpLabel() {
        ReviewRecord review = new ReviewRecord(1, ReviewRecord.Disposition.MERGE, List.of(), null);

        assertThrows(IllegalArgumentException.class,
                () -> new StatusEntry(issue(1, MscLabels.FCP), null, review));
    }

    @Test
    void shouldRejectReviewOfAnotherIssue() {
        ReviewRecord review = new ReviewRecord(2, ReviewRecord.Disposition.CLOSE, List.of(), null);

        assertThrows(IllegalArgumentException.class,
                () -> new StatusEntry(issue(1, MscLabels.PROPOSED_FCP), null, review));
    }

    @Test
    void shouldListOutstandingReviewersInFeedOrder() {
        ReviewRecord review = new ReviewRecord(1, null, List.of(
                new ReviewRecord.ReviewerApproval("carol", false),
                new ReviewRecord.ReviewerApproval("alice", true),
                new ReviewRecord.ReviewerApproval("bob", false)), null);

        assertEquals(List.of("carol", "bob"), review.outstandingReviewers());
        assertEquals(ReviewRecord.Disposition.UNKNOWN, review.disposition());
    }

    @Test
    void shouldParseDispositionIgnoringCase() {
        assertEquals(ReviewRecord.Disposition.POSTPONE, ReviewRecord.Disposition.fromValue(" Postpone "));
        assertEquals(ReviewRecord.Disposition.UNKNOWN, ReviewRecord.Disposition.fromValue("maybe"));
    }
}
