package de.mirkosertic.talentmatch.dto;

import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;
import de.mirkosertic.talentmatch.orchestration.AlgorithmKind;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Request for one matching run. Either {@code proposers} or {@code preferences}
 * must be given; the candidate pool has already been retrieved by the caller.
 *
 * @param proposers   gigs to match
 * @param preferences free-form preferences, turned into a virtual proposer when no proposer is given
 * @param candidates  reviewer pool
 * @param limit       maximum matches per proposer, default 10
 * @param algorithm   algorithm hint, default auto
 * @param filters     in-memory candidate filters
 * @param deadlineMs  run deadline in milliseconds, default from configuration
 */
public record MatchRequest(
        List<Proposer> proposers,
        @Nullable PreferenceRequest preferences,
        List<Reviewer> candidates,
        @Nullable Integer limit,
        @Nullable AlgorithmKind algorithm,
        @Nullable CandidateFilters filters,
        @Nullable Long deadlineMs
) {

    public static final int DEFAULT_LIMIT = 10;

    public MatchRequest {
        proposers = proposers == null ? List.of() : List.copyOf(proposers);
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static MatchRequest of(final Proposer proposer, final List<Reviewer> candidates, final AlgorithmKind algorithm) {
        return new MatchRequest(List.of(proposer), null, candidates, null, algorithm, null, null);
    }

    public int effectiveLimit() {
        return limit == null ? DEFAULT_LIMIT : limit;
    }

    public AlgorithmKind effectiveAlgorithm() {
        return algorithm == null ? AlgorithmKind.AUTO : algorithm;
    }

    public CandidateFilters effectiveFilters() {
        return filters == null ? CandidateFilters.none() : filters;
    }
}
