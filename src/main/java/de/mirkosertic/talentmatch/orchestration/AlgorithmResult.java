package de.mirkosertic.talentmatch.orchestration;

import org.jspecify.annotations.Nullable;

/**
 * Either the outcome of a strategy or the reason it failed; exactly one is set.
 */
public record AlgorithmResult(MatchAlgorithm algorithm, @Nullable MatchOutcome outcome, @Nullable AlgorithmFailure failure) {

    public AlgorithmResult {
        if ((outcome == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of outcome and failure must be set");
        }
    }

    public static AlgorithmResult success(final MatchAlgorithm algorithm, final MatchOutcome outcome) {
        return new AlgorithmResult(algorithm, outcome, null);
    }

    public static AlgorithmResult failure(final AlgorithmFailure failure) {
        return new AlgorithmResult(failure.algorithm(), null, failure);
    }

    public boolean isSuccess() {
        return outcome != null;
    }
}
