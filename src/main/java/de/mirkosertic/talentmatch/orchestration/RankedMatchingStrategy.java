package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.DeadlineExceededException;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.Match;
import de.mirkosertic.talentmatch.model.MatchType;
import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;
import de.mirkosertic.talentmatch.model.ScoreBreakdown;
import de.mirkosertic.talentmatch.scoring.HybridScoringEngine;
import de.mirkosertic.talentmatch.scoring.MatchExplainer;
import de.mirkosertic.talentmatch.scoring.PairScore;
import de.mirkosertic.talentmatch.scoring.ScoringPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Direct ranked scoring: every candidate is scored against each proposer,
 * candidates below the minimum score are skipped and the rest are sorted by
 * score descending (ties by reviewer id) and truncated to the limit.
 * <p>
 * The rule-only variant never consults the similarity service and therefore
 * cannot run into the deadline.
 */
public class RankedMatchingStrategy implements MatchingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(RankedMatchingStrategy.class);

    private static final Comparator<PairScore> BY_SCORE = Comparator.comparingInt(PairScore::total).reversed()
            .thenComparing(PairScore::reviewerId);

    private final HybridScoringEngine scoringEngine;
    private final MatchExplainer explainer;
    private final boolean ruleOnly;

    public RankedMatchingStrategy(final HybridScoringEngine scoringEngine, final MatchExplainer explainer, final boolean ruleOnly) {
        this.scoringEngine = scoringEngine;
        this.explainer = explainer;
        this.ruleOnly = ruleOnly;
    }

    @Override
    public MatchAlgorithm algorithm() {
        return ruleOnly ? MatchAlgorithm.RULE_ONLY_RANKED : MatchAlgorithm.HYBRID_RANKED;
    }

    @Override
    public AlgorithmResult execute(final MatchContext context) {
        try {
            return AlgorithmResult.success(algorithm(), rank(context));
        } catch (final DeadlineExceededException e) {
            logger.warn("{} ran past the deadline: {}", algorithm().getValue(), e.getMessage());
            return AlgorithmResult.failure(AlgorithmFailure.deadline(algorithm(), e.getMessage()));
        } catch (final InvalidSpecificationException e) {
            throw e;
        } catch (final RuntimeException e) {
            logger.warn("{} failed", algorithm().getValue(), e);
            return AlgorithmResult.failure(AlgorithmFailure.of(algorithm(), e));
        }
    }

    private MatchOutcome rank(final MatchContext context) {
        final AlgorithmConfig config = context.config();
        final List<ScoringPair> pairs = new ArrayList<>();
        for (final Proposer proposer : context.proposers()) {
            for (final Reviewer reviewer : context.reviewers()) {
                pairs.add(new ScoringPair(proposer, reviewer));
            }
        }
        final List<PairScore> scores = ruleOnly
                ? scoringEngine.scoreAllRuleOnly(pairs, config)
                : scoringEngine.scoreAll(pairs, config, context.deadline());

        final Map<String, List<PairScore>> byProposer = new LinkedHashMap<>();
        for (final Proposer proposer : context.proposers()) {
            byProposer.put(proposer.id(), new ArrayList<>());
        }
        boolean fallbacks = false;
        boolean degraded = false;
        for (final PairScore score : scores) {
            byProposer.get(score.proposerId()).add(score);
            fallbacks |= score.isFallback();
            degraded |= isDegraded(score.breakdown());
        }

        final List<Match> matches = new ArrayList<>();
        final Set<String> matchedReviewers = new HashSet<>();
        int matchedProposers = 0;
        for (final Map.Entry<String, List<PairScore>> entry : byProposer.entrySet()) {
            final List<PairScore> qualified = new ArrayList<>();
            for (final PairScore score : entry.getValue()) {
                if (score.total() >= config.minScore()) {
                    qualified.add(score);
                }
            }
            qualified.sort(BY_SCORE);
            final int count = Math.min(context.limit(), qualified.size());
            for (int i = 0; i < count; i++) {
                final PairScore score = qualified.get(i);
                matches.add(new Match(score.proposerId(), score.reviewerId(), score.breakdown(), i + 1,
                        MatchType.RANKED, false, explainer.explain(score.breakdown(), config)));
                matchedReviewers.add(score.reviewerId());
            }
            if (count > 0) {
                matchedProposers++;
            }
            logger.debug("Proposer {}: {} of {} candidates qualified", entry.getKey(), qualified.size(), entry.getValue().size());
        }

        final List<MatchWarning> warnings = new ArrayList<>();
        if (fallbacks) {
            warnings.add(MatchWarning.NEUTRAL_SCORE_SUBSTITUTED);
        }
        if (degraded && !ruleOnly) {
            warnings.add(MatchWarning.SEMANTIC_DEGRADED);
        }
        return new MatchOutcome(matches, Stability.NOT_GUARANTEED, matchedProposers, matchedReviewers.size(),
                0, degraded, warnings);
    }

    private static boolean isDegraded(final ScoreBreakdown breakdown) {
        return breakdown.semanticUnavailable() || breakdown.semanticSource().isDegraded();
    }
}
