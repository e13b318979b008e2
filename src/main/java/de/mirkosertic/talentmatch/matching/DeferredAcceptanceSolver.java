package de.mirkosertic.talentmatch.matching;

import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.PreferenceList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Proposer-optimal stable matching by deferred acceptance (Gale-Shapley).
 *
 * <p>Every proposer and reviewer gets a dense index in id order at the start of
 * a run; the match state lives in plain arrays:</p>
 * <ul>
 *   <li>{@code matchOf[p]}: reviewer index held for proposer p, or -1</li>
 *   <li>{@code holderOf[r]}: proposer index held by reviewer r, or -1</li>
 *   <li>{@code nextProposal[p]}: position in p's list of the next reviewer to propose to</li>
 *   <li>{@code reviewerRank[r][p]}: rank of p in r's list, {@link #UNACCEPTABLE} if absent</li>
 * </ul>
 *
 * <p>The loop is strictly sequential. One proposal counts as one iteration; at
 * the iteration cap the solver stops and returns the partial matching.</p>
 */
public class DeferredAcceptanceSolver {

    private static final Logger logger = LoggerFactory.getLogger(DeferredAcceptanceSolver.class);

    static final int UNACCEPTABLE = Integer.MAX_VALUE;
    private static final int NONE = -1;

    public StableMatching solve(final PreferenceLists preferences, final int maxIterations) {
        return solve(preferences.proposerPrefs(), preferences.reviewerPrefs(), maxIterations);
    }

    /**
     * Runs deferred acceptance.
     *
     * @param proposerPrefs  proposer id to its ranking of reviewers
     * @param reviewerPrefs  reviewer id to its ranking of proposers
     * @param maxIterations  maximum number of proposals
     * @return the matching; partial and flagged if the iteration cap was reached
     * @throws InvalidSpecificationException if a list names an unknown id or the cap is not positive
     */
    public StableMatching solve(final Map<String, PreferenceList> proposerPrefs,
                                final Map<String, PreferenceList> reviewerPrefs,
                                final int maxIterations) {
        if (maxIterations <= 0) {
            throw new InvalidSpecificationException("Maximum iterations must be positive: " + maxIterations);
        }
        final List<String> proposers = new ArrayList<>(new TreeSet<>(proposerPrefs.keySet()));
        final List<String> reviewers = new ArrayList<>(new TreeSet<>(reviewerPrefs.keySet()));
        final Map<String, Integer> proposerIndex = index(proposers);
        final Map<String, Integer> reviewerIndex = index(reviewers);

        final int[][] choices = new int[proposers.size()][];
        for (int p = 0; p < proposers.size(); p++) {
            final PreferenceList list = proposerPrefs.get(proposers.get(p));
            choices[p] = new int[list.size()];
            for (int i = 0; i < list.size(); i++) {
                final Integer r = reviewerIndex.get(list.get(i));
                if (r == null) {
                    throw new InvalidSpecificationException("Proposer " + proposers.get(p)
                            + " ranks unknown reviewer " + list.get(i));
                }
                choices[p][i] = r;
            }
        }

        final int[][] reviewerRank = new int[reviewers.size()][proposers.size()];
        for (int r = 0; r < reviewers.size(); r++) {
            Arrays.fill(reviewerRank[r], UNACCEPTABLE);
            final PreferenceList list = reviewerPrefs.get(reviewers.get(r));
            for (int i = 0; i < list.size(); i++) {
                final Integer p = proposerIndex.get(list.get(i));
                if (p == null) {
                    throw new InvalidSpecificationException("Reviewer " + reviewers.get(r)
                            + " ranks unknown proposer " + list.get(i));
                }
                reviewerRank[r][p] = i;
            }
        }

        final int[] matchOf = new int[proposers.size()];
        final int[] holderOf = new int[reviewers.size()];
        final int[] nextProposal = new int[proposers.size()];
        Arrays.fill(matchOf, NONE);
        Arrays.fill(holderOf, NONE);

        final Deque<Integer> unmatched = new ArrayDeque<>();
        for (int p = 0; p < proposers.size(); p++) {
            unmatched.addLast(p);
        }

        int iterations = 0;
        boolean limitReached = false;
        while (!unmatched.isEmpty()) {
            final int p = unmatched.peekFirst();
            if (nextProposal[p] >= choices[p].length) {
                unmatched.pollFirst();
                logger.debug("Proposer {} exhausted its preferences", proposers.get(p));
                continue;
            }
            if (iterations >= maxIterations) {
                limitReached = true;
                break;
            }
            unmatched.pollFirst();
            iterations++;

            final int r = choices[p][nextProposal[p]++];
            if (reviewerRank[r][p] == UNACCEPTABLE) {
                logger.debug("Reviewer {} does not rank proposer {}, rejected", reviewers.get(r), proposers.get(p));
                unmatched.addFirst(p);
                continue;
            }
            final int holder = holderOf[r];
            if (holder == NONE) {
                holderOf[r] = p;
                matchOf[p] = r;
                logger.debug("Reviewer {} holds proposer {}", reviewers.get(r), proposers.get(p));
            } else if (reviewerRank[r][p] < reviewerRank[r][holder]) {
                holderOf[r] = p;
                matchOf[p] = r;
                matchOf[holder] = NONE;
                unmatched.addLast(holder);
                logger.debug("Reviewer {} switches from proposer {} to {}", reviewers.get(r),
                        proposers.get(holder), proposers.get(p));
            } else {
                unmatched.addFirst(p);
                logger.debug("Reviewer {} rejects proposer {}", reviewers.get(r), proposers.get(p));
            }
        }

        if (limitReached) {
            logger.warn("Deferred acceptance stopped at the iteration cap of {} with {} proposers still unmatched",
                    maxIterations, unmatched.size());
        }
        logger.info("Deferred acceptance completed in {} iterations", iterations);

        final Map<String, String> pairs = new HashMap<>();
        final List<String> unmatchedProposers = new ArrayList<>();
        for (int p = 0; p < proposers.size(); p++) {
            if (matchOf[p] == NONE) {
                unmatchedProposers.add(proposers.get(p));
            } else {
                pairs.put(proposers.get(p), reviewers.get(matchOf[p]));
            }
        }
        final List<String> unmatchedReviewers = new ArrayList<>();
        for (int r = 0; r < reviewers.size(); r++) {
            if (holderOf[r] == NONE) {
                unmatchedReviewers.add(reviewers.get(r));
            }
        }
        return new StableMatching(pairs, iterations, limitReached, unmatchedProposers, unmatchedReviewers);
    }

    public SolverDescription describe() {
        return new SolverDescription(
                "Gale-Shapley",
                "O(n*m)",
                "Guaranteed",
                "Optimal for proposers",
                "Truthful for proposers",
                List.of("https://en.wikipedia.org/wiki/Gale%E2%80%93Shapley_algorithm",
                        "https://en.wikipedia.org/wiki/Stable_matching_problem"));
    }

    private static Map<String, Integer> index(final List<String> ids) {
        final Map<String, Integer> result = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            result.put(ids.get(i), i);
        }
        return result;
    }
}
