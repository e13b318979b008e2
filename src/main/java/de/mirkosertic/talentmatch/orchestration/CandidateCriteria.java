package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.dto.CandidateFilters;
import de.mirkosertic.talentmatch.model.BudgetRange;
import de.mirkosertic.talentmatch.model.Proposer;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Query handed to a {@link CandidateSource}.
 *
 * @param category            category the reviewer must serve
 * @param city                city the reviewer should be in, null for any
 * @param minBudget           lower end of the proposer's budget
 * @param maxBudget           upper end of the proposer's budget
 * @param minExperienceYears  minimum experience, null for any
 * @param minRating           minimum rating, null for any
 * @param styleTags           style tags of the proposer, for sources that can rank by them
 * @param requireAvailability only reviewers currently available
 * @param limit               maximum number of reviewers to return
 */
public record CandidateCriteria(
        @Nullable String category,
        @Nullable String city,
        @Nullable Integer minBudget,
        @Nullable Integer maxBudget,
        @Nullable Integer minExperienceYears,
        @Nullable Double minRating,
        List<String> styleTags,
        boolean requireAvailability,
        int limit
) {

    public CandidateCriteria {
        styleTags = styleTags == null ? List.of() : List.copyOf(styleTags);
    }

    /**
     * Derives the query from a proposer; explicit filters take precedence.
     */
    public static CandidateCriteria forProposer(final Proposer proposer, final CandidateFilters filters, final int limit) {
        final BudgetRange budget = proposer.budget();
        final String category = !filters.categories().isEmpty() ? filters.categories().get(0) : proposer.category();
        final String city = filters.city() != null ? filters.city() : proposer.isRemoteTolerant() ? null : proposer.city();
        final Integer maxBudget = filters.maxBudget() != null ? filters.maxBudget() : budget == null ? null : budget.max();
        final Integer minExperience = filters.minExperienceYears() != null
                ? filters.minExperienceYears()
                : proposer.experienceBand() == null ? null : proposer.experienceBand().getMinYears();
        return new CandidateCriteria(category, city, budget == null ? null : budget.min(), maxBudget,
                minExperience, filters.minRating(), proposer.styleTags(), !proposer.isRemoteTolerant(), limit);
    }
}
