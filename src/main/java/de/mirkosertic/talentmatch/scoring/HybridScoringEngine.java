package de.mirkosertic.talentmatch.scoring;

import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.DeadlineExceededException;
import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;
import de.mirkosertic.talentmatch.model.ScoreBreakdown;
import de.mirkosertic.talentmatch.model.ScoreFactor;
import de.mirkosertic.talentmatch.model.ScoringAlgorithm;
import de.mirkosertic.talentmatch.model.SemanticSource;
import de.mirkosertic.talentmatch.semantic.SemanticSimilarityService;
import de.mirkosertic.talentmatch.semantic.SimilarityOutcome;
import de.mirkosertic.talentmatch.semantic.SimilarityRequest;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the rule-based score with the semantic score into one compatibility score.
 *
 * <p>All similarities of a batch are fetched through
 * {@link SemanticSimilarityService#fetchSimilarities(List, Instant)} before any
 * pair is combined. A semantic factor whose input is missing on either side gets
 * half its cap. When the similarity service reports a request as unavailable the
 * corresponding factor contributes 0 and the breakdown is flagged; with
 * {@code scaleRuleOnly} the rule-based score is then stretched over the full range.</p>
 */
public class HybridScoringEngine {

    private static final Logger logger = LoggerFactory.getLogger(HybridScoringEngine.class);

    private final RuleBasedScorer ruleBasedScorer;
    private final SemanticSimilarityService similarityService;

    public HybridScoringEngine(final RuleBasedScorer ruleBasedScorer, final SemanticSimilarityService similarityService) {
        this.ruleBasedScorer = ruleBasedScorer;
        this.similarityService = similarityService;
    }

    /**
     * Scores a single pair, without a deadline.
     */
    public ScoreBreakdown score(final Proposer proposer, final Reviewer reviewer, final AlgorithmConfig config) {
        final ScoringPair pair = new ScoringPair(proposer, reviewer);
        final List<SemanticInputs> inputs = List.of(SemanticInputs.of(pair));
        final List<SimilarityOutcome> outcomes = similarityService.fetchSimilarities(requests(inputs), null);
        return combine(pair, inputs.get(0), outcomes, 0, fallbackSource(), config);
    }

    /**
     * Scores every pair. A pair whose scoring fails gets the neutral score instead
     * of aborting the batch.
     *
     * @throws DeadlineExceededException if the deadline passes while similarities are outstanding
     */
    public List<PairScore> scoreAll(final List<ScoringPair> pairs, final AlgorithmConfig config, final @Nullable Instant deadline) {
        final List<SemanticInputs> inputs = new ArrayList<>(pairs.size());
        for (final ScoringPair pair : pairs) {
            inputs.add(SemanticInputs.of(pair));
        }
        final List<SimilarityOutcome> outcomes = similarityService.fetchSimilarities(requests(inputs), deadline);
        final SemanticSource missingInputSource = fallbackSource();

        final List<PairScore> result = new ArrayList<>(pairs.size());
        int offset = 0;
        for (int i = 0; i < pairs.size(); i++) {
            final ScoringPair pair = pairs.get(i);
            final SemanticInputs pairInputs = inputs.get(i);
            try {
                result.add(PairScore.scored(pair, combine(pair, pairInputs, outcomes, offset, missingInputSource, config)));
            } catch (final RuntimeException e) {
                logger.warn("Scoring of pair ({}, {}) failed, using neutral score {}: {}",
                        pair.proposer().id(), pair.reviewer().id(), AlgorithmConfig.NEUTRAL_SCORE, e.getMessage());
                result.add(PairScore.fallback(pair, AlgorithmConfig.NEUTRAL_SCORE, e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
            offset += pairInputs.requestCount();
        }
        return result;
    }

    /**
     * Rule-only scoring of a single pair; the semantic part is disabled.
     */
    public ScoreBreakdown scoreRuleOnly(final Proposer proposer, final Reviewer reviewer, final AlgorithmConfig config) {
        final Map<ScoreFactor, Double> factors = ruleBasedScorer.score(proposer, reviewer, config);
        final double rule = RuleBasedScorer.total(factors, config);
        final double effectiveRule = config.scaleRuleOnly() ? scaleToFullRange(rule, config) : rule;
        final int total = clampTotal(effectiveRule * config.ruleWeight());
        return new ScoreBreakdown(factors, rule, 0.0, total, ScoringAlgorithm.RULE_ONLY, SemanticSource.DISABLED, true);
    }

    /**
     * Rule-only scoring of every pair, with the same neutral substitution as {@link #scoreAll}.
     */
    public List<PairScore> scoreAllRuleOnly(final List<ScoringPair> pairs, final AlgorithmConfig config) {
        final List<PairScore> result = new ArrayList<>(pairs.size());
        for (final ScoringPair pair : pairs) {
            try {
                result.add(PairScore.scored(pair, scoreRuleOnly(pair.proposer(), pair.reviewer(), config)));
            } catch (final RuntimeException e) {
                logger.warn("Rule-only scoring of pair ({}, {}) failed, using neutral score {}: {}",
                        pair.proposer().id(), pair.reviewer().id(), AlgorithmConfig.NEUTRAL_SCORE, e.getMessage());
                result.add(PairScore.fallback(pair, AlgorithmConfig.NEUTRAL_SCORE, e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }
        return result;
    }

    public SemanticSimilarityService getSimilarityService() {
        return similarityService;
    }

    private ScoreBreakdown combine(final ScoringPair pair, final SemanticInputs inputs,
                                   final List<SimilarityOutcome> outcomes, final int offset,
                                   final SemanticSource missingInputSource, final AlgorithmConfig config) {
        final Map<ScoreFactor, Double> factors = new EnumMap<>(ScoreFactor.class);
        factors.putAll(ruleBasedScorer.score(pair.proposer(), pair.reviewer(), config));
        final double rule = RuleBasedScorer.total(factors, config);

        int next = offset;
        final SimilarityOutcome style = inputs.hasStyle() ? outcomes.get(next++) : null;
        final SimilarityOutcome text = inputs.hasText() ? outcomes.get(next) : null;
        SemanticSource source = worse(style == null ? null : style.source(), text == null ? null : text.source());
        if (source == null) {
            source = missingInputSource;
        }

        final boolean unavailable = source == SemanticSource.UNAVAILABLE;
        factors.put(ScoreFactor.STYLE_SIMILARITY, semanticPoints(style, unavailable, config.cap(ScoreFactor.STYLE_SIMILARITY)));
        factors.put(ScoreFactor.SEMANTIC_MATCH, semanticPoints(text, unavailable, config.cap(ScoreFactor.SEMANTIC_MATCH)));

        double semantic = Math.min(config.semanticMax(),
                factors.get(ScoreFactor.STYLE_SIMILARITY) + factors.get(ScoreFactor.SEMANTIC_MATCH));
        double effectiveRule = rule;
        if (unavailable && config.scaleRuleOnly()) {
            effectiveRule = scaleToFullRange(rule, config);
            semantic = 0.0;
            factors.put(ScoreFactor.STYLE_SIMILARITY, 0.0);
            factors.put(ScoreFactor.SEMANTIC_MATCH, 0.0);
        }
        final int total = clampTotal(effectiveRule * config.ruleWeight() + semantic * config.semanticWeight());
        return new ScoreBreakdown(factors, rule, semantic, total, ScoringAlgorithm.HYBRID, source, unavailable);
    }

    private static double semanticPoints(final @Nullable SimilarityOutcome outcome, final boolean unavailable, final double cap) {
        if (outcome == null) {
            // Missing text or tags on one side
            return unavailable ? 0.0 : cap * RuleBasedScorer.NEUTRAL_SHARE;
        }
        if (!outcome.isAvailable()) {
            return 0.0;
        }
        return outcome.score() * cap;
    }

    private SemanticSource fallbackSource() {
        if (similarityService.isProviderAvailable()) {
            return SemanticSource.PROVIDER;
        }
        return similarityService.isHeuristicFallback() ? SemanticSource.HEURISTIC : SemanticSource.UNAVAILABLE;
    }

    private static @Nullable SemanticSource worse(final @Nullable SemanticSource current, final @Nullable SemanticSource candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate == null) {
            return current;
        }
        return candidate.ordinal() > current.ordinal() ? candidate : current;
    }

    private static double scaleToFullRange(final double rule, final AlgorithmConfig config) {
        if (config.ruleMax() <= 0) {
            return 0.0;
        }
        return rule * ScoreBreakdown.MAX_TOTAL / config.ruleMax();
    }

    private static int clampTotal(final double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return (int) Math.max(0, Math.min(ScoreBreakdown.MAX_TOTAL, Math.round(value)));
    }

    private static List<SimilarityRequest> requests(final List<SemanticInputs> inputs) {
        final List<SimilarityRequest> requests = new ArrayList<>();
        for (final SemanticInputs input : inputs) {
            if (input.hasStyle()) {
                requests.add(SimilarityRequest.tags(input.proposerStyle(), input.reviewerStyle()));
            }
            if (input.hasText()) {
                requests.add(SimilarityRequest.text(input.brief(), input.profile()));
            }
        }
        return requests;
    }

    private record SemanticInputs(List<String> proposerStyle, List<String> reviewerStyle, String brief, String profile) {

        static SemanticInputs of(final ScoringPair pair) {
            return new SemanticInputs(pair.proposer().styleTags(), pair.reviewer().styleTags(),
                    pair.proposer().briefText(), pair.reviewer().profileDescription());
        }

        boolean hasStyle() {
            return !proposerStyle.isEmpty() && !reviewerStyle.isEmpty();
        }

        boolean hasText() {
            return !brief.isBlank() && !profile.isBlank();
        }

        int requestCount() {
            return (hasStyle() ? 1 : 0) + (hasText() ? 1 : 0);
        }
    }
}
