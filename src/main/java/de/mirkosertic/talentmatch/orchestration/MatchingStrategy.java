package de.mirkosertic.talentmatch.orchestration;

/**
 * One way of turning proposers and reviewers into matches.
 * <p>
 * Implementations report failures as {@link AlgorithmResult#failure(AlgorithmFailure)}
 * instead of throwing, so that the orchestrator can continue its fallback chain.
 */
public interface MatchingStrategy {

    MatchAlgorithm algorithm();

    AlgorithmResult execute(MatchContext context);
}
