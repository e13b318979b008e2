package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.dto.PreferenceRequest;
import de.mirkosertic.talentmatch.model.BudgetRange;
import de.mirkosertic.talentmatch.model.ExperienceBand;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.Proposer;

import java.time.Clock;

/**
 * Turns free-form preferences into a virtual gig that can be matched like any
 * posted gig.
 */
public class VirtualProposerFactory {

    static final String ID_PREFIX = "virtual-gig-";
    static final int CANDIDATE_MULTIPLIER = 3;

    private final Clock clock;

    public VirtualProposerFactory() {
        this(Clock.systemUTC());
    }

    public VirtualProposerFactory(final Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws InvalidSpecificationException if neither profession nor category is given,
     *                                       the budget range is inverted or the experience level is unknown
     */
    public Proposer create(final PreferenceRequest preferences) {
        final String profession = blankToNull(preferences.profession());
        final String category = blankToNull(preferences.category());
        if (profession == null && category == null) {
            throw new InvalidSpecificationException("Preferences need a profession or a category");
        }
        final String effectiveProfession = profession == null ? category : profession;
        final String effectiveCategory = category == null ? profession : category;

        final String description = blankToNull(preferences.projectDescription()) == null
                ? "Looking for " + effectiveProfession + " for " + effectiveCategory
                : preferences.projectDescription();

        return new Proposer(
                ID_PREFIX + clock.millis(),
                effectiveProfession + " - " + effectiveCategory,
                effectiveCategory,
                preferences.location(),
                null,
                preferences.remote(),
                budget(preferences),
                ExperienceBand.fromLabel(preferences.experienceLevel()),
                preferences.requiredSkills(),
                preferences.styleTags(),
                description,
                preferences.startDate());
    }

    /**
     * Retrieval query for the preferences. Asks for three times the limit so that
     * scoring has room to choose.
     */
    public CandidateCriteria criteria(final PreferenceRequest preferences, final int limit) {
        final ExperienceBand band = ExperienceBand.fromLabel(preferences.experienceLevel());
        final Integer minExperience;
        if (band == null) {
            minExperience = null;
        } else if (band == ExperienceBand.BASIC) {
            minExperience = 0;
        } else if (band == ExperienceBand.INTERMEDIATE) {
            minExperience = 2;
        } else {
            minExperience = 5;
        }
        final String category = blankToNull(preferences.profession()) != null ? preferences.profession() : preferences.category();
        return new CandidateCriteria(category, preferences.location(), preferences.budgetMin(), preferences.budgetMax(),
                minExperience, preferences.minRating(), preferences.styleTags(),
                !preferences.remote(), limit * CANDIDATE_MULTIPLIER);
    }

    private static BudgetRange budget(final PreferenceRequest preferences) {
        if (preferences.budgetMin() == null && preferences.budgetMax() == null) {
            return null;
        }
        final BudgetRange range = new BudgetRange(preferences.budgetMin(), preferences.budgetMax());
        final Double midpoint = range.target();
        return BudgetRange.of((int) Math.round(midpoint));
    }

    private static String blankToNull(final String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
