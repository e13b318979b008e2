package de.mirkosertic.talentmatch.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Weights, caps and limits of one matching run.
 * <p>
 * The default point table splits 100 points into a rule-based part (60) and a
 * semantic part (40). Both weights default to 1.0, so the point split already
 * expresses the balance between the two parts; the weights do not have to sum to 1.
 *
 * @param ruleWeight      multiplier for the rule-based score
 * @param semanticWeight  multiplier for the semantic score
 * @param ruleMax         cap for the sum of the rule-based factors
 * @param semanticMax     cap for the sum of the semantic factors, at most {@code 100 - ruleMax}
 * @param factorCaps      cap per factor
 * @param candidateCap    maximum number of reviewers considered per run
 * @param minScore        minimum total for a ranked match to qualify
 * @param maxIterations   safety bound for the deferred-acceptance loop
 * @param stableEnabled   whether automatic selection may pick stable matching
 * @param scaleRuleOnly   stretch the rule-based score over the full range when no semantic score is available
 * @param regions         city to neighbouring cities, compared case-insensitively
 * @param categoryAliases proposer category to the reviewer category it maps to
 * @param categorySkills  category to skill keywords used when a proposer lists no skills
 */
public record AlgorithmConfig(
        double ruleWeight,
        double semanticWeight,
        double ruleMax,
        double semanticMax,
        Map<ScoreFactor, Double> factorCaps,
        int candidateCap,
        int minScore,
        int maxIterations,
        boolean stableEnabled,
        boolean scaleRuleOnly,
        Map<String, List<String>> regions,
        Map<String, String> categoryAliases,
        Map<String, List<String>> categorySkills
) {

    public static final int NEUTRAL_SCORE = 50;

    public AlgorithmConfig {
        final EnumMap<ScoreFactor, Double> caps = new EnumMap<>(ScoreFactor.class);
        caps.putAll(defaultCaps());
        if (factorCaps != null) {
            caps.putAll(factorCaps);
        }
        factorCaps = Collections.unmodifiableMap(caps);
        regions = regions == null ? Map.of() : lowerCaseKeys(regions);
        categoryAliases = categoryAliases == null ? Map.of() : lowerCaseKeys(categoryAliases);
        categorySkills = categorySkills == null ? Map.of() : lowerCaseKeys(categorySkills);
    }

    public static AlgorithmConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .ruleWeight(ruleWeight)
                .semanticWeight(semanticWeight)
                .ruleMax(ruleMax)
                .semanticMax(semanticMax)
                .factorCaps(factorCaps)
                .candidateCap(candidateCap)
                .minScore(minScore)
                .maxIterations(maxIterations)
                .stableEnabled(stableEnabled)
                .scaleRuleOnly(scaleRuleOnly)
                .regions(regions)
                .categoryAliases(categoryAliases)
                .categorySkills(categorySkills);
    }

    public double cap(final ScoreFactor factor) {
        return factorCaps.getOrDefault(factor, 0.0);
    }

    /**
     * Checks the invariants of the configuration.
     *
     * @throws InvalidSpecificationException if a weight is negative, a cap lies outside [0, 100],
     *                                       the semantic cap exceeds {@code 100 - ruleMax} or a limit is not positive
     */
    public void validate() {
        if (ruleWeight < 0 || semanticWeight < 0) {
            throw new InvalidSpecificationException("Weights must not be negative");
        }
        if (ruleMax < 0 || ruleMax > ScoreBreakdown.MAX_TOTAL) {
            throw new InvalidSpecificationException("Rule-based maximum must lie in [0, 100]: " + ruleMax);
        }
        if (semanticMax < 0 || semanticMax > ScoreBreakdown.MAX_TOTAL - ruleMax) {
            throw new InvalidSpecificationException(
                    "Semantic maximum must lie in [0, " + (ScoreBreakdown.MAX_TOTAL - ruleMax) + "]: " + semanticMax);
        }
        for (final Map.Entry<ScoreFactor, Double> entry : factorCaps.entrySet()) {
            if (entry.getValue() < 0 || entry.getValue() > ScoreBreakdown.MAX_TOTAL) {
                throw new InvalidSpecificationException("Cap for " + entry.getKey().getKey() + " out of range: " + entry.getValue());
            }
        }
        if (candidateCap <= 0) {
            throw new InvalidSpecificationException("Candidate cap must be positive: " + candidateCap);
        }
        if (maxIterations <= 0) {
            throw new InvalidSpecificationException("Maximum iterations must be positive: " + maxIterations);
        }
        if (minScore < 0 || minScore > ScoreBreakdown.MAX_TOTAL) {
            throw new InvalidSpecificationException("Minimum score must lie in [0, 100]: " + minScore);
        }
    }

    public static Map<ScoreFactor, Double> defaultCaps() {
        final EnumMap<ScoreFactor, Double> caps = new EnumMap<>(ScoreFactor.class);
        caps.put(ScoreFactor.LOCATION, 15.0);
        caps.put(ScoreFactor.BUDGET, 15.0);
        caps.put(ScoreFactor.SKILLS, 15.0);
        caps.put(ScoreFactor.EXPERIENCE, 10.0);
        caps.put(ScoreFactor.AVAILABILITY, 5.0);
        caps.put(ScoreFactor.STYLE_OVERLAP, 5.0);
        caps.put(ScoreFactor.RATING, 5.0);
        caps.put(ScoreFactor.STYLE_SIMILARITY, 20.0);
        caps.put(ScoreFactor.SEMANTIC_MATCH, 20.0);
        return caps;
    }

    private static <V> Map<String, V> lowerCaseKeys(final Map<String, V> source) {
        final Map<String, V> result = new LinkedHashMap<>();
        source.forEach((key, value) -> result.put(key.trim().toLowerCase(Locale.ROOT), value));
        return Collections.unmodifiableMap(result);
    }

    public static final class Builder {

        private double ruleWeight = 1.0;
        private double semanticWeight = 1.0;
        private double ruleMax = 60;
        private double semanticMax = 40;
        private final Map<ScoreFactor, Double> factorCaps = new EnumMap<>(defaultCaps());
        private int candidateCap = 50;
        private int minScore = 30;
        private int maxIterations = 10_000;
        private boolean stableEnabled = true;
        private boolean scaleRuleOnly = false;
        private Map<String, List<String>> regions = Map.of();
        private Map<String, String> categoryAliases = Map.of();
        private Map<String, List<String>> categorySkills = Map.of();

        private Builder() {
        }

        public Builder ruleWeight(final double value) {
            this.ruleWeight = value;
            return this;
        }

        public Builder semanticWeight(final double value) {
            this.semanticWeight = value;
            return this;
        }

        public Builder ruleMax(final double value) {
            this.ruleMax = value;
            return this;
        }

        public Builder semanticMax(final double value) {
            this.semanticMax = value;
            return this;
        }

        public Builder factorCap(final ScoreFactor factor, final double cap) {
            this.factorCaps.put(factor, cap);
            return this;
        }

        public Builder factorCaps(final Map<ScoreFactor, Double> caps) {
            this.factorCaps.putAll(caps);
            return this;
        }

        public Builder candidateCap(final int value) {
            this.candidateCap = value;
            return this;
        }

        public Builder minScore(final int value) {
            this.minScore = value;
            return this;
        }

        public Builder maxIterations(final int value) {
            this.maxIterations = value;
            return this;
        }

        public Builder stableEnabled(final boolean value) {
            this.stableEnabled = value;
            return this;
        }

        public Builder scaleRuleOnly(final boolean value) {
            this.scaleRuleOnly = value;
            return this;
        }

        public Builder regions(final Map<String, List<String>> value) {
            this.regions = value;
            return this;
        }

        public Builder categoryAliases(final Map<String, String> value) {
            this.categoryAliases = value;
            return this;
        }

        public Builder categorySkills(final Map<String, List<String>> value) {
            this.categorySkills = value;
            return this;
        }

        public AlgorithmConfig build() {
            return new AlgorithmConfig(ruleWeight, semanticWeight, ruleMax, semanticMax, factorCaps,
                    candidateCap, minScore, maxIterations, stableEnabled, scaleRuleOnly,
                    regions, categoryAliases, categorySkills);
        }
    }
}
