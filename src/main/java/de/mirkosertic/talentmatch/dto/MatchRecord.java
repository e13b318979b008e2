package de.mirkosertic.talentmatch.dto;

import de.mirkosertic.talentmatch.model.Match;
import de.mirkosertic.talentmatch.model.MatchType;
import de.mirkosertic.talentmatch.orchestration.MatchAlgorithm;

/**
 * Flat form of a match for the caller's persistence layer.
 */
public record MatchRecord(
        String proposerId,
        String reviewerId,
        int score,
        int rank,
        MatchAlgorithm algorithm,
        MatchType matchType,
        boolean stabilityVerified
) {

    public static MatchRecord from(final Match match, final MatchAlgorithm algorithm) {
        return new MatchRecord(match.proposerId(), match.reviewerId(), match.score(), match.rank(),
                algorithm, match.matchType(), match.stabilityVerified());
    }
}
