package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.model.Match;

import java.util.List;

/**
 * What a successful strategy produced, before the orchestrator adds timing and
 * fallback information.
 */
public record MatchOutcome(
        List<Match> matches,
        Stability stability,
        int matchedProposers,
        int matchedReviewers,
        int solverIterations,
        boolean semanticDegraded,
        List<MatchWarning> warnings
) {

    public MatchOutcome {
        matches = List.copyOf(matches);
        warnings = List.copyOf(warnings);
    }
}
