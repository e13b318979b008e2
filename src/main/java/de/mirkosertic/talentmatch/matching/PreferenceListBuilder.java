package de.mirkosertic.talentmatch.matching;

import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.DeadlineExceededException;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.PreferenceList;
import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;
import de.mirkosertic.talentmatch.model.ScoreBreakdown;
import de.mirkosertic.talentmatch.scoring.HybridScoringEngine;
import de.mirkosertic.talentmatch.scoring.PairScore;
import de.mirkosertic.talentmatch.scoring.ScoringPair;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Scores every proposer x reviewer pair once and derives both sides' preference lists.
 * <p>
 * Lists are sorted by score descending, ties broken by id ascending. A proposer's
 * list and a reviewer's list rank by the same pairwise score.
 */
public class PreferenceListBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PreferenceListBuilder.class);

    private final HybridScoringEngine scoringEngine;

    public PreferenceListBuilder(final HybridScoringEngine scoringEngine) {
        this.scoringEngine = scoringEngine;
    }

    public PreferenceLists buildPreferences(final List<Proposer> proposers, final List<Reviewer> reviewers,
                                            final AlgorithmConfig config) {
        return buildPreferences(proposers, reviewers, config, null);
    }

    /**
     * Builds the preference lists, scoring all pairs in one batch.
     *
     * @throws DeadlineExceededException     if the deadline passes while similarities are outstanding
     * @throws InvalidSpecificationException if an id occurs twice on one side
     */
    public PreferenceLists buildPreferences(final List<Proposer> proposers, final List<Reviewer> reviewers,
                                            final AlgorithmConfig config, final @Nullable Instant deadline) {
        requireUniqueIds(proposers.stream().map(Proposer::id).toList(), "proposer");
        requireUniqueIds(reviewers.stream().map(Reviewer::id).toList(), "reviewer");

        final List<ScoringPair> pairs = new ArrayList<>(proposers.size() * reviewers.size());
        for (final Proposer proposer : proposers) {
            for (final Reviewer reviewer : reviewers) {
                pairs.add(new ScoringPair(proposer, reviewer));
            }
        }
        final List<PairScore> scores = scoringEngine.scoreAll(pairs, config, deadline);
        final PreferenceLists lists = fromScores(
                proposers.stream().map(Proposer::id).toList(),
                reviewers.stream().map(Reviewer::id).toList(),
                scores);
        logger.info("Built preference lists for {} proposers and {} reviewers ({} neutral substitutions)",
                proposers.size(), reviewers.size(), lists.fallbacks().size());
        return lists;
    }

    /**
     * Derives preference lists from already scored pairs.
     */
    public static PreferenceLists fromScores(final List<String> proposerIds, final List<String> reviewerIds,
                                             final List<PairScore> scores) {
        final Map<String, Map<String, ScoreBreakdown>> table = new TreeMap<>();
        final List<PairFallback> fallbacks = new ArrayList<>();
        for (final PairScore score : scores) {
            table.computeIfAbsent(score.proposerId(), id -> new TreeMap<>()).put(score.reviewerId(), score.breakdown());
            if (score.isFallback()) {
                fallbacks.add(new PairFallback(score.proposerId(), score.reviewerId(), score.total(), score.failureReason()));
            }
        }

        final Map<String, PreferenceList> proposerPrefs = new LinkedHashMap<>();
        for (final String proposerId : proposerIds) {
            final Map<String, ScoreBreakdown> row = table.getOrDefault(proposerId, Map.of());
            proposerPrefs.put(proposerId, rank(proposerId, reviewerIds, row::get));
        }
        final Map<String, PreferenceList> reviewerPrefs = new LinkedHashMap<>();
        for (final String reviewerId : reviewerIds) {
            reviewerPrefs.put(reviewerId, rank(reviewerId, proposerIds,
                    proposerId -> table.getOrDefault(proposerId, Map.of()).get(reviewerId)));
        }
        return new PreferenceLists(proposerPrefs, reviewerPrefs, table, fallbacks);
    }

    private static PreferenceList rank(final String ownerId, final List<String> candidates,
                                       final Function<String, @Nullable ScoreBreakdown> lookup) {
        final List<String> ranked = new ArrayList<>(candidates);
        ranked.removeIf(id -> lookup.apply(id) == null);
        ranked.sort(Comparator.<String>comparingInt(id -> lookup.apply(id).total()).reversed()
                .thenComparing(Comparator.naturalOrder()));
        return new PreferenceList(ownerId, ranked);
    }

    private static void requireUniqueIds(final List<String> ids, final String side) {
        final Set<String> seen = new HashSet<>();
        for (final String id : ids) {
            if (id == null || id.isBlank()) {
                throw new InvalidSpecificationException("Every " + side + " needs an id");
            }
            if (!seen.add(id)) {
                throw new InvalidSpecificationException("Duplicate " + side + " id: " + id);
            }
        }
    }
}
