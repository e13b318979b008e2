package de.mirkosertic.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Expectation level of a proposer, mapped to an inclusive range of experience years.
 */
public enum ExperienceBand {

    BASIC("basic", 0, 2),
    INTERMEDIATE("intermediate", 2, 5),
    PRO("pro", 5, 8),
    TOP_TIER("top-tier", 8, 15),
    EXPERT("expert", 15, 999);

    private final String label;
    private final int minYears;
    private final int maxYears;

    ExperienceBand(final String label, final int minYears, final int maxYears) {
        this.label = label;
        this.minYears = minYears;
        this.maxYears = maxYears;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getMinYears() {
        return minYears;
    }

    public int getMaxYears() {
        return maxYears;
    }

    public boolean contains(final int years) {
        return years >= minYears && years <= maxYears;
    }

    /**
     * Resolves a free-form expectation level. "beginner" and "senior" are accepted
     * as aliases for {@link #BASIC} and {@link #PRO}.
     *
     * @param label the label, may be null or blank
     * @return the band, or null if no level was given
     * @throws InvalidSpecificationException if the label is not a known level
     */
    @JsonCreator
    public static @Nullable ExperienceBand fromLabel(final @Nullable String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        final String normalized = label.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        return switch (normalized) {
            case "basic", "beginner" -> BASIC;
            case "intermediate" -> INTERMEDIATE;
            case "pro", "senior" -> PRO;
            case "top-tier", "toptier" -> TOP_TIER;
            case "expert" -> EXPERT;
            default -> throw new InvalidSpecificationException("Unknown experience level: " + label);
        };
    }
}
