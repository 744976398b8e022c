package me.golemcore.mscbot.domain.model;

import java.time.Instant;

/**
 * Half-open time range {@code [from, until)} covered by a news digest.
 *
 * @param sinceAnnouncement
 *            true when {@code from} was taken from the announcement feed
 */
public record NewsWindow(Instant from, Instant until, boolean sinceAnnouncement) {

    public boolean contains(Instant instant) {
        return !instant.isBefore(from) && instant.isBefore(until);
    }
}
