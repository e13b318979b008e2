package de.mirkosertic.talentmatch.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-factor point contributions for one (proposer, reviewer) pair.
 *
 * @param factors             non-negative points per factor
 * @param ruleBasedScore      capped sum of the rule-based factors
 * @param semanticScore       capped sum of the semantic factors, 0 when unavailable
 * @param total               weighted combination, rounded and clamped to [0, 100]
 * @param algorithm           scoring path that produced this breakdown
 * @param semanticSource      origin of the semantic points
 * @param semanticUnavailable true if the semantic contribution was dropped
 */
public record ScoreBreakdown(
        Map<ScoreFactor, Double> factors,
        double ruleBasedScore,
        double semanticScore,
        int total,
        ScoringAlgorithm algorithm,
        SemanticSource semanticSource,
        boolean semanticUnavailable
) {

    public static final int MAX_TOTAL = 100;

    public ScoreBreakdown {
        if (total < 0 || total > MAX_TOTAL) {
            throw new IllegalArgumentException("Total out of range: " + total);
        }
        final EnumMap<ScoreFactor, Double> copy = new EnumMap<>(ScoreFactor.class);
        if (factors != null) {
            copy.putAll(factors);
        }
        factors = Collections.unmodifiableMap(copy);
    }

    /**
     * Neutral substitute for a pair whose scoring failed.
     */
    public static ScoreBreakdown neutral(final int neutralScore) {
        return new ScoreBreakdown(Map.of(), 0, 0, neutralScore,
                ScoringAlgorithm.NEUTRAL_FALLBACK, SemanticSource.UNAVAILABLE, true);
    }

    public double factor(final ScoreFactor factor) {
        return factors.getOrDefault(factor, 0.0);
    }
}
