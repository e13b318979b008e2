package de.mirkosertic.talentmatch.dto;

import de.mirkosertic.talentmatch.model.BudgetRange;
import de.mirkosertic.talentmatch.model.Reviewer;
import de.mirkosertic.talentmatch.util.TextCleaner;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Optional in-memory filters applied to the supplied candidate pool before it is
 * truncated to the candidate cap. A null or empty criterion does not filter.
 *
 * @param city               reviewer city must contain this text (case-insensitive)
 * @param maxBudget          reviewer minimum budget must not exceed this value
 * @param minExperienceYears reviewer must have at least this many years; unknown years fail the filter
 * @param categories         reviewer must have a category containing one of these
 * @param minRating          reviewer rating must be at least this value; unknown ratings count as 4.0
 */
public record CandidateFilters(
        @Nullable String city,
        @Nullable Integer maxBudget,
        @Nullable Integer minExperienceYears,
        List<String> categories,
        @Nullable Double minRating
) {

    private static final double DEFAULT_RATING = 4.0;

    public CandidateFilters {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public static CandidateFilters none() {
        return new CandidateFilters(null, null, null, List.of(), null);
    }

    public List<Reviewer> apply(final List<Reviewer> reviewers) {
        final List<Reviewer> result = new ArrayList<>(reviewers.size());
        for (final Reviewer reviewer : reviewers) {
            if (matches(reviewer)) {
                result.add(reviewer);
            }
        }
        return result;
    }

    public boolean matches(final Reviewer reviewer) {
        final String wantedCity = TextCleaner.normalizeKey(city);
        if (!wantedCity.isEmpty() && !TextCleaner.normalizeKey(reviewer.city()).contains(wantedCity)) {
            return false;
        }
        if (maxBudget != null) {
            final BudgetRange budget = reviewer.budget();
            if (budget != null && budget.min() != null && budget.min() > maxBudget) {
                return false;
            }
        }
        if (minExperienceYears != null
                && (reviewer.experienceYears() == null || reviewer.experienceYears() < minExperienceYears)) {
            return false;
        }
        if (minRating != null) {
            final double rating = reviewer.rating() == null ? DEFAULT_RATING : reviewer.rating();
            if (rating < minRating) {
                return false;
            }
        }
        final List<String> wanted = TextCleaner.normalizeTags(categories);
        if (!wanted.isEmpty()) {
            final List<String> offered = TextCleaner.normalizeTags(reviewer.categories());
            for (final String category : wanted) {
                for (final String candidate : offered) {
                    if (candidate.contains(category)) {
                        return true;
                    }
                }
            }
            return false;
        }
        return true;
    }
}
