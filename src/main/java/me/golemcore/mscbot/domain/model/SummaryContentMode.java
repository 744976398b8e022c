package me.golemcore.mscbot.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Which report a room's daily summary contains.
 */
public enum SummaryContentMode {

    ALL("all"), PENDING("pending"), FCP("fcp"), IN_PROGRESS("in-progress");

    private final String value;

    SummaryContentMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<SummaryContentMode> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(mode -> mode.value.equals(normalized))
                .findFirst();
    }
}
