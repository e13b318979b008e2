package de.mirkosertic.talentmatch.matching;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of the deferred-acceptance solver.
 *
 * @param pairs                  proposer id to reviewer id, ordered by proposer id
 * @param iterations             number of proposals made
 * @param iterationLimitReached  true if the solver stopped at the iteration cap; the matching is then partial
 * @param unmatchedProposers     proposers without a reviewer, ordered by id
 * @param unmatchedReviewers     reviewers without a proposer, ordered by id
 */
public record StableMatching(
        Map<String, String> pairs,
        int iterations,
        boolean iterationLimitReached,
        List<String> unmatchedProposers,
        List<String> unmatchedReviewers
) {

    public StableMatching {
        pairs = Collections.unmodifiableMap(new TreeMap<>(pairs));
        unmatchedProposers = List.copyOf(unmatchedProposers);
        unmatchedReviewers = List.copyOf(unmatchedReviewers);
    }

    public @Nullable String reviewerOf(final String proposerId) {
        return pairs.get(proposerId);
    }

    public int size() {
        return pairs.size();
    }
}
