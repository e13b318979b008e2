package de.mirkosertic.talentmatch.scoring;

import de.mirkosertic.talentmatch.model.ScoreBreakdown;
import org.jspecify.annotations.Nullable;

/**
 * Score of one pair. When scoring the pair failed, the breakdown is the neutral
 * substitute and {@code failureReason} says why.
 */
public record PairScore(ScoringPair pair, ScoreBreakdown breakdown, @Nullable String failureReason) {

    public static PairScore scored(final ScoringPair pair, final ScoreBreakdown breakdown) {
        return new PairScore(pair, breakdown, null);
    }

    public static PairScore fallback(final ScoringPair pair, final int neutralScore, final String failureReason) {
        return new PairScore(pair, ScoreBreakdown.neutral(neutralScore), failureReason);
    }

    public boolean isFallback() {
        return failureReason != null;
    }

    public String proposerId() {
        return pair.proposer().id();
    }

    public String reviewerId() {
        return pair.reviewer().id();
    }

    public int total() {
        return breakdown.total();
    }
}
