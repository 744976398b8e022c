package me.golemcore.mscbot.domain.model;

import java.time.Instant;

/** A tracker comment reduced to what FCP start inference needs. */
public record IssueComment(long authorId, String authorLogin, Instant createdAt) {
}
