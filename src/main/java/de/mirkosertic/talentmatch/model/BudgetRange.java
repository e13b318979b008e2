package de.mirkosertic.talentmatch.model;

import org.jspecify.annotations.Nullable;

/**
 * A budget either as a single value (min == max) or as an inclusive range.
 * Either bound may be unknown.
 */
public record BudgetRange(@Nullable Integer min, @Nullable Integer max) {

    public BudgetRange {
        if (min != null && min < 0 || max != null && max < 0) {
            throw new InvalidSpecificationException("Budget bounds must not be negative");
        }
        if (min != null && max != null && min > max) {
            throw new InvalidSpecificationException("Budget min " + min + " exceeds max " + max);
        }
    }

    public static BudgetRange of(final int value) {
        return new BudgetRange(value, value);
    }

    public static BudgetRange between(final int min, final int max) {
        return new BudgetRange(min, max);
    }

    public boolean isComplete() {
        return min != null && max != null;
    }

    /**
     * The single value a proposer is looking to spend: the midpoint of a range,
     * or whichever bound is known.
     */
    public @Nullable Double target() {
        if (min != null && max != null) {
            return (min + max) / 2.0;
        }
        if (min != null) {
            return min.doubleValue();
        }
        return max == null ? null : max.doubleValue();
    }

    public boolean contains(final double value) {
        return isComplete() && value >= min && value <= max;
    }
}
