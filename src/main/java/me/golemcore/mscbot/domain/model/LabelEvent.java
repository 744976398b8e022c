package me.golemcore.mscbot.domain.model;

import java.time.Instant;

/**
 * Entry of an issue's label timeline.
 *
 * @param added
 *            true for a label being applied, false for its removal
 */
public record LabelEvent(String label, boolean added, Instant createdAt) {
}
