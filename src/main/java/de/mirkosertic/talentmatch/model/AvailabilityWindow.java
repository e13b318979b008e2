package de.mirkosertic.talentmatch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * A period in which a reviewer is available, optionally in a city other than
 * their home city.
 */
public record AvailabilityWindow(
        @Nullable String city,
        @Nullable LocalDate from,
        @Nullable LocalDate to
) {

    public boolean covers(final LocalDate date) {
        if (from != null && date.isBefore(from)) {
            return false;
        }
        return to == null || !date.isAfter(to);
    }
}
