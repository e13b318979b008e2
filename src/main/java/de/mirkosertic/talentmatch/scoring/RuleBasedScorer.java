package de.mirkosertic.talentmatch.scoring;

import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.AvailabilityWindow;
import de.mirkosertic.talentmatch.model.BudgetRange;
import de.mirkosertic.talentmatch.model.ExperienceBand;
import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;
import de.mirkosertic.talentmatch.model.ScoreFactor;
import de.mirkosertic.talentmatch.util.TextCleaner;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic, rule-based part of the compatibility score.
 * <p>
 * Every factor is scaled into its own cap. Most factors keep a small positive
 * floor on a clear mismatch so that one weak factor cannot rule a candidate out.
 */
public class RuleBasedScorer {

    static final double ALTERNATE_CITY_SHARE = 0.8;
    static final double REGION_SHARE = 2.0 / 3.0;
    static final double DISTANT_CITY_SHARE = 1.0 / 3.0;

    static final double BUDGET_UNKNOWN_SHARE = 2.0 / 3.0;
    static final double BUDGET_BAND_PENALTY = 0.2;
    static final double BUDGET_FLOOR_SHARE = 0.2;

    static final double CATEGORY_SHARE = 2.0 / 3.0;
    static final double SKILL_INCREMENT_SHARE = 2.0 / 15.0;

    static final double OVER_QUALIFIED_SHARE = 0.8;
    static final double UNDER_QUALIFIED_SHARE = 0.5;

    static final double AVAILABILITY_UNKNOWN_SHARE = 0.6;
    static final double AVAILABILITY_CONFLICT_SHARE = 0.4;

    static final double NEUTRAL_SHARE = 0.5;
    static final double DEFAULT_RATING = 4.0;
    static final double MAX_RATING = 5.0;

    /**
     * Scores all rule-based factors. The result holds one entry per non-semantic factor.
     */
    public Map<ScoreFactor, Double> score(final Proposer proposer, final Reviewer reviewer, final AlgorithmConfig config) {
        final Map<ScoreFactor, Double> factors = new EnumMap<>(ScoreFactor.class);
        factors.put(ScoreFactor.LOCATION, location(proposer, reviewer, config));
        factors.put(ScoreFactor.BUDGET, budget(proposer, reviewer, config.cap(ScoreFactor.BUDGET)));
        factors.put(ScoreFactor.SKILLS, skills(proposer, reviewer, config));
        factors.put(ScoreFactor.EXPERIENCE, experience(proposer, reviewer, config.cap(ScoreFactor.EXPERIENCE)));
        factors.put(ScoreFactor.AVAILABILITY, availability(proposer, reviewer, config.cap(ScoreFactor.AVAILABILITY)));
        factors.put(ScoreFactor.STYLE_OVERLAP, styleOverlap(proposer, reviewer, config.cap(ScoreFactor.STYLE_OVERLAP)));
        factors.put(ScoreFactor.RATING, rating(reviewer, config.cap(ScoreFactor.RATING)));
        return factors;
    }

    /**
     * Capped sum of the rule-based factors.
     */
    public static double total(final Map<ScoreFactor, Double> factors, final AlgorithmConfig config) {
        double sum = 0;
        for (final Map.Entry<ScoreFactor, Double> entry : factors.entrySet()) {
            if (!entry.getKey().isSemantic()) {
                sum += entry.getValue();
            }
        }
        return Math.min(config.ruleMax(), sum);
    }

    double location(final Proposer proposer, final Reviewer reviewer, final AlgorithmConfig config) {
        final double cap = config.cap(ScoreFactor.LOCATION);
        final String proposerCity = TextCleaner.normalizeKey(proposer.city());
        if (proposerCity.isEmpty() || proposer.isRemoteTolerant()) {
            return cap;
        }
        final String reviewerCity = TextCleaner.normalizeKey(reviewer.city());
        if (proposerCity.equals(reviewerCity)) {
            return cap;
        }
        for (final AvailabilityWindow window : reviewer.availability()) {
            if (proposerCity.equals(TextCleaner.normalizeKey(window.city()))) {
                return cap * ALTERNATE_CITY_SHARE;
            }
        }
        if (sameRegion(proposer, reviewer, proposerCity, reviewerCity, config)) {
            return cap * REGION_SHARE;
        }
        return cap * DISTANT_CITY_SHARE;
    }

    private boolean sameRegion(final Proposer proposer, final Reviewer reviewer,
                               final String proposerCity, final String reviewerCity,
                               final AlgorithmConfig config) {
        final String proposerRegion = TextCleaner.normalizeKey(proposer.region());
        if (!proposerRegion.isEmpty() && proposerRegion.equals(TextCleaner.normalizeKey(reviewer.region()))) {
            return true;
        }
        if (reviewerCity.isEmpty()) {
            return false;
        }
        return neighbours(config, proposerCity).contains(reviewerCity)
                || neighbours(config, reviewerCity).contains(proposerCity);
    }

    private Set<String> neighbours(final AlgorithmConfig config, final String city) {
        return new HashSet<>(TextCleaner.normalizeTags(config.regions().get(city)));
    }

    double budget(final Proposer proposer, final Reviewer reviewer, final double cap) {
        final BudgetRange proposerBudget = proposer.budget();
        final BudgetRange reviewerBudget = reviewer.budget();
        final Double target = proposerBudget == null ? null : proposerBudget.target();
        if (target == null || reviewerBudget == null
                || reviewerBudget.min() == null && reviewerBudget.max() == null) {
            return cap * BUDGET_UNKNOWN_SHARE;
        }
        final double gap;
        if (reviewerBudget.min() != null && target < reviewerBudget.min()) {
            gap = (reviewerBudget.min() - target) / reviewerBudget.min();
        } else if (reviewerBudget.max() != null && target > reviewerBudget.max()) {
            if (reviewerBudget.max() == 0) {
                return cap * BUDGET_FLOOR_SHARE;
            }
            gap = (target - reviewerBudget.max()) / reviewerBudget.max();
        } else {
            return cap;
        }
        final int startedBands = (int) Math.ceil(gap / 0.1);
        final double points = cap - cap * BUDGET_BAND_PENALTY * startedBands;
        return Math.max(cap * BUDGET_FLOOR_SHARE, points);
    }

    double skills(final Proposer proposer, final Reviewer reviewer, final AlgorithmConfig config) {
        final double cap = config.cap(ScoreFactor.SKILLS);
        final double categoryPoints = cap * CATEGORY_SHARE;
        final String category = TextCleaner.normalizeKey(proposer.category());
        final String alias = category.isEmpty() ? "" : TextCleaner.normalizeKey(config.categoryAliases().getOrDefault(category, category));

        double points;
        if (category.isEmpty()) {
            points = categoryPoints * NEUTRAL_SHARE;
        } else {
            final List<String> reviewerCategories = TextCleaner.normalizeTags(reviewer.categories());
            points = reviewerCategories.contains(category) || reviewerCategories.contains(alias) ? categoryPoints : 0.0;
        }

        List<String> required = TextCleaner.normalizeTags(proposer.skillTags());
        if (required.isEmpty() && !category.isEmpty()) {
            required = TextCleaner.normalizeTags(config.categorySkills().getOrDefault(alias,
                    config.categorySkills().getOrDefault(category, List.of())));
        }
        final List<String> offered = TextCleaner.normalizeTags(reviewer.skillTags());
        int overlapping = 0;
        for (final String skill : required) {
            for (final String candidate : offered) {
                if (candidate.contains(skill) || skill.contains(candidate)) {
                    overlapping++;
                    break;
                }
            }
        }
        final double skillPoints = Math.min(cap - categoryPoints, overlapping * cap * SKILL_INCREMENT_SHARE);
        points += skillPoints;
        return Math.min(cap, points);
    }

    double experience(final Proposer proposer, final Reviewer reviewer, final double cap) {
        final ExperienceBand band = proposer.experienceBand();
        if (band == null) {
            return cap;
        }
        final Integer years = reviewer.experienceYears();
        if (years == null) {
            return cap * UNDER_QUALIFIED_SHARE;
        }
        if (band.contains(years)) {
            return cap;
        }
        return years > band.getMaxYears() ? cap * OVER_QUALIFIED_SHARE : cap * UNDER_QUALIFIED_SHARE;
    }

    double availability(final Proposer proposer, final Reviewer reviewer, final double cap) {
        if (proposer.startDate() == null) {
            return cap * AVAILABILITY_UNKNOWN_SHARE;
        }
        boolean anyDated = false;
        for (final AvailabilityWindow window : reviewer.availability()) {
            if (window.from() == null && window.to() == null) {
                continue;
            }
            anyDated = true;
            if (window.covers(proposer.startDate())) {
                return cap;
            }
        }
        return anyDated ? cap * AVAILABILITY_CONFLICT_SHARE : cap * AVAILABILITY_UNKNOWN_SHARE;
    }

    double styleOverlap(final Proposer proposer, final Reviewer reviewer, final double cap) {
        final Set<String> left = new HashSet<>(TextCleaner.normalizeTags(proposer.styleTags()));
        final Set<String> right = new HashSet<>(TextCleaner.normalizeTags(reviewer.styleTags()));
        if (left.isEmpty() || right.isEmpty()) {
            return cap * NEUTRAL_SHARE;
        }
        final Set<String> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return cap * left.size() / union.size();
    }

    double rating(final Reviewer reviewer, final double cap) {
        final double value = reviewer.rating() == null ? DEFAULT_RATING : reviewer.rating();
        final double bounded = Math.max(0.0, Math.min(MAX_RATING, value));
        return cap * bounded / MAX_RATING;
    }
}
