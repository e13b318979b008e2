package de.mirkosertic.talentmatch.scoring;

import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.ScoreBreakdown;
import de.mirkosertic.talentmatch.model.ScoreFactor;
import de.mirkosertic.talentmatch.model.ScoringAlgorithm;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a score breakdown into a short human-readable reasoning.
 */
public class MatchExplainer {

    static final double STRONG_SHARE = 0.7;

    static final String GENERAL_COMPATIBILITY = "General compatibility based on project requirements";
    static final String NEUTRAL_FALLBACK = "Neutral score, the pair could not be scored";

    /**
     * Lists every factor that reached more than 70% of its cap, e.g.
     * "Strong match in: Location compatibility, Budget alignment".
     */
    public String explain(final ScoreBreakdown breakdown, final AlgorithmConfig config) {
        if (breakdown.algorithm() == ScoringAlgorithm.NEUTRAL_FALLBACK) {
            return NEUTRAL_FALLBACK;
        }
        final List<String> strong = new ArrayList<>();
        for (final ScoreFactor factor : ScoreFactor.values()) {
            final double cap = config.cap(factor);
            if (cap > 0 && breakdown.factor(factor) > cap * STRONG_SHARE) {
                strong.add(factor.getLabel());
            }
        }
        final String reasoning = strong.isEmpty()
                ? GENERAL_COMPATIBILITY
                : "Strong match in: " + String.join(", ", strong);
        if (breakdown.algorithm() == ScoringAlgorithm.RULE_ONLY) {
            return reasoning + " (rule-based only)";
        }
        if (breakdown.semanticUnavailable()) {
            return reasoning + " (semantic similarity unavailable)";
        }
        return reasoning;
    }
}
