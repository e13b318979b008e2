package de.mirkosertic.talentmatch.dto;

import de.mirkosertic.talentmatch.model.Match;
import de.mirkosertic.talentmatch.orchestration.AlgorithmFailure;
import de.mirkosertic.talentmatch.orchestration.MatchAlgorithm;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response of a matching run. Failures are reported here as structured errors,
 * never as exceptions.
 */
public record MatchResponse(
        boolean success,
        List<Match> matches,
        @Nullable MatchMetadata metadata,
        @Nullable String error,
        @Nullable String errorType,
        List<MatchAlgorithm> exhaustedAlgorithms
) {

    public static final String INVALID_SPECIFICATION = "invalid-specification";
    public static final String ALGORITHMS_EXHAUSTED = "algorithms-exhausted";
    public static final String CANDIDATE_RETRIEVAL_FAILED = "candidate-retrieval-failed";

    /**
     * Create a successful response.
     */
    public static MatchResponse success(final List<Match> matches, final MatchMetadata metadata) {
        return new MatchResponse(true, List.copyOf(matches), metadata, null, null, List.of());
    }

    /**
     * Create an error response for malformed input.
     */
    public static MatchResponse invalid(final String errorMessage) {
        return new MatchResponse(false, List.of(), null, errorMessage, INVALID_SPECIFICATION, List.of());
    }

    /**
     * Create an error response for a failing candidate source.
     */
    public static MatchResponse retrievalFailed(final String errorMessage) {
        return new MatchResponse(false, List.of(), null, errorMessage, CANDIDATE_RETRIEVAL_FAILED, List.of());
    }

    /**
     * Create an error response naming every algorithm of the fallback chain that failed.
     */
    public static MatchResponse exhausted(final List<AlgorithmFailure> failures) {
        final List<MatchAlgorithm> algorithms = new ArrayList<>();
        for (final AlgorithmFailure failure : failures) {
            algorithms.add(failure.algorithm());
        }
        final String message = "All algorithms failed: " + failures.stream()
                .map(failure -> failure.algorithm().getValue() + " (" + failure.reason() + ")")
                .collect(Collectors.joining(", "));
        return new MatchResponse(false, List.of(), null, message, ALGORITHMS_EXHAUSTED, algorithms);
    }

    /**
     * The matches in the flat form handed to persistence.
     */
    public List<MatchRecord> toRecords() {
        if (metadata == null) {
            return List.of();
        }
        final List<MatchRecord> records = new ArrayList<>(matches.size());
        for (final Match match : matches) {
            records.add(MatchRecord.from(match, metadata.algorithm()));
        }
        return records;
    }
}
