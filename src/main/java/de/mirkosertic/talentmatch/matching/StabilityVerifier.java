package de.mirkosertic.talentmatch.matching;

import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.PreferenceList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Finds blocking pairs in a matching.
 * <p>
 * Works only from the matching and the preference lists, never from solver
 * state. A proposer left unmatched prefers every reviewer it ranks over staying
 * alone, so a partial matching is reported unstable whenever such a reviewer is
 * free or would trade up.
 */
public class StabilityVerifier {

    public StabilityReport verify(final StableMatching matching, final PreferenceLists preferences) {
        return verify(matching.pairs(), preferences.proposerPrefs(), preferences.reviewerPrefs());
    }

    /**
     * @param matching       proposer id to reviewer id
     * @param proposerPrefs  proposer id to its ranking of reviewers
     * @param reviewerPrefs  reviewer id to its ranking of proposers
     * @throws InvalidSpecificationException if a reviewer is matched to two proposers
     */
    public StabilityReport verify(final Map<String, String> matching,
                                  final Map<String, PreferenceList> proposerPrefs,
                                  final Map<String, PreferenceList> reviewerPrefs) {
        final Map<String, String> holderOf = new HashMap<>();
        for (final Map.Entry<String, String> entry : matching.entrySet()) {
            final String previous = holderOf.put(entry.getValue(), entry.getKey());
            if (previous != null) {
                throw new InvalidSpecificationException("Reviewer " + entry.getValue()
                        + " is matched to both " + previous + " and " + entry.getKey());
            }
        }

        final List<BlockingPair> blockingPairs = new ArrayList<>();
        for (final String proposerId : new TreeSet<>(proposerPrefs.keySet())) {
            final PreferenceList ranking = proposerPrefs.get(proposerId);
            final String current = matching.get(proposerId);
            final int currentRank = current == null ? -1 : ranking.rankOf(current);
            final int preferredUpTo = currentRank < 0 ? ranking.size() : currentRank;

            for (int i = 0; i < preferredUpTo; i++) {
                final String reviewerId = ranking.get(i);
                if (blocks(proposerId, reviewerId, holderOf.get(reviewerId), reviewerPrefs.get(reviewerId))) {
                    blockingPairs.add(new BlockingPair(proposerId, reviewerId));
                }
            }
        }
        return new StabilityReport(blockingPairs.isEmpty(), blockingPairs);
    }

    private static boolean blocks(final String proposerId, final String reviewerId,
                                  final String holder, final PreferenceList reviewerRanking) {
        if (reviewerRanking == null) {
            return false;
        }
        final int proposerRank = reviewerRanking.rankOf(proposerId);
        if (proposerRank < 0) {
            return false;
        }
        if (holder == null) {
            return true;
        }
        final int holderRank = reviewerRanking.rankOf(holder);
        return holderRank < 0 || proposerRank < holderRank;
    }
}
