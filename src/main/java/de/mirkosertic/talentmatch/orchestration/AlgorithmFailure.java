package de.mirkosertic.talentmatch.orchestration;

/**
 * Why an algorithm did not produce a result.
 *
 * @param algorithm        the algorithm that failed
 * @param reason           human-readable cause
 * @param deadlineExceeded true if the run deadline passed, which skips straight to rule-only ranking
 */
public record AlgorithmFailure(MatchAlgorithm algorithm, String reason, boolean deadlineExceeded) {

    public static AlgorithmFailure of(final MatchAlgorithm algorithm, final Throwable cause) {
        return new AlgorithmFailure(algorithm, cause.getClass().getSimpleName() + ": " + cause.getMessage(), false);
    }

    public static AlgorithmFailure deadline(final MatchAlgorithm algorithm, final String reason) {
        return new AlgorithmFailure(algorithm, reason, true);
    }
}
