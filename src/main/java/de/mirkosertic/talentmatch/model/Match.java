package de.mirkosertic.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A proposed pairing with its score breakdown and position in the result.
 */
public record Match(
        String proposerId,
        String reviewerId,
        ScoreBreakdown breakdown,
        int rank,
        MatchType matchType,
        boolean stabilityVerified,
        String reasoning
) {

    @JsonProperty("score")
    public int score() {
        return breakdown.total();
    }

    public Match withRank(final int newRank) {
        return new Match(proposerId, reviewerId, breakdown, newRank, matchType, stabilityVerified, reasoning);
    }
}
