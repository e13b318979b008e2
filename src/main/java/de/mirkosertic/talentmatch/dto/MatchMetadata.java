package de.mirkosertic.talentmatch.dto;

import de.mirkosertic.talentmatch.orchestration.AlgorithmFailure;
import de.mirkosertic.talentmatch.orchestration.MatchAlgorithm;
import de.mirkosertic.talentmatch.orchestration.MatchWarning;
import de.mirkosertic.talentmatch.orchestration.Stability;

import java.util.List;

/**
 * Facts about a matching run.
 *
 * @param suppliedCandidates      number of candidates the caller supplied, before filtering
 * @param totalCandidates         size of the candidate pool after filtering, before truncation
 * @param qualifiedOrMatchedCount number of matches returned
 * @param processingTimeMs        wall-clock duration of the run
 * @param algorithm               the algorithm that produced the matches
 * @param stability               whether the result is a verified stable matching
 * @param totalProposers          proposers in the run
 * @param totalReviewers          reviewers considered after truncation
 * @param matchedProposers        proposers with at least one match
 * @param matchedReviewers        distinct reviewers in the matches
 * @param solverIterations        proposals made by the stable matching solver, 0 for ranked runs
 * @param semanticDegraded        true if any score lacks the provider's semantic contribution
 * @param fallbacks               algorithms that failed before the reported one succeeded
 * @param warnings                non-fatal conditions
 */
public record MatchMetadata(
        int suppliedCandidates,
        int totalCandidates,
        int qualifiedOrMatchedCount,
        long processingTimeMs,
        MatchAlgorithm algorithm,
        Stability stability,
        int totalProposers,
        int totalReviewers,
        int matchedProposers,
        int matchedReviewers,
        int solverIterations,
        boolean semanticDegraded,
        List<AlgorithmFailure> fallbacks,
        List<MatchWarning> warnings
) {

    public MatchMetadata {
        fallbacks = fallbacks == null ? List.of() : List.copyOf(fallbacks);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * Metadata for a run without candidates.
     */
    public static MatchMetadata empty(final MatchAlgorithm algorithm, final int suppliedCandidates,
                                      final int totalProposers, final long processingTimeMs,
                                      final List<MatchWarning> warnings) {
        return new MatchMetadata(suppliedCandidates, 0, 0, processingTimeMs, algorithm, Stability.NOT_GUARANTEED,
                totalProposers, 0, 0, 0, 0, false, List.of(), warnings);
    }
}
