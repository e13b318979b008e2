package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.matching.DeferredAcceptanceSolver;
import de.mirkosertic.talentmatch.matching.PreferenceListBuilder;
import de.mirkosertic.talentmatch.matching.PreferenceLists;
import de.mirkosertic.talentmatch.matching.StabilityReport;
import de.mirkosertic.talentmatch.matching.StabilityVerifier;
import de.mirkosertic.talentmatch.matching.StableMatching;
import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.DeadlineExceededException;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.Match;
import de.mirkosertic.talentmatch.model.MatchType;
import de.mirkosertic.talentmatch.model.ScoreBreakdown;
import de.mirkosertic.talentmatch.scoring.MatchExplainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Stable matching: build preference lists, run deferred acceptance, then audit
 * the result with the stability verifier. Stability is reported as guaranteed
 * only if the verifier finds no blocking pair and the solver finished below its
 * iteration cap.
 */
public class StableMatchingStrategy implements MatchingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(StableMatchingStrategy.class);

    private final PreferenceListBuilder preferenceListBuilder;
    private final DeferredAcceptanceSolver solver;
    private final StabilityVerifier verifier;
    private final MatchExplainer explainer;

    public StableMatchingStrategy(final PreferenceListBuilder preferenceListBuilder,
                                  final DeferredAcceptanceSolver solver,
                                  final StabilityVerifier verifier,
                                  final MatchExplainer explainer) {
        this.preferenceListBuilder = preferenceListBuilder;
        this.solver = solver;
        this.verifier = verifier;
        this.explainer = explainer;
    }

    @Override
    public MatchAlgorithm algorithm() {
        return MatchAlgorithm.GALE_SHAPLEY;
    }

    @Override
    public AlgorithmResult execute(final MatchContext context) {
        try {
            return AlgorithmResult.success(algorithm(), match(context));
        } catch (final DeadlineExceededException e) {
            logger.warn("Preference list construction ran past the deadline: {}", e.getMessage());
            return AlgorithmResult.failure(AlgorithmFailure.deadline(algorithm(), e.getMessage()));
        } catch (final InvalidSpecificationException e) {
            throw e;
        } catch (final RuntimeException e) {
            logger.warn("Stable matching failed", e);
            return AlgorithmResult.failure(AlgorithmFailure.of(algorithm(), e));
        }
    }

    private MatchOutcome match(final MatchContext context) {
        final AlgorithmConfig config = context.config();
        final PreferenceLists preferences = preferenceListBuilder.buildPreferences(
                context.proposers(), context.reviewers(), config, context.deadline());
        final StableMatching matching = solver.solve(preferences, config.maxIterations());
        final StabilityReport report = verifier.verify(matching, preferences);

        final List<MatchWarning> warnings = new ArrayList<>();
        if (matching.iterationLimitReached()) {
            warnings.add(MatchWarning.SOLVER_ITERATION_LIMIT_REACHED);
        }
        if (!report.stable()) {
            warnings.add(MatchWarning.STABILITY_NOT_VERIFIED);
            if (!matching.iterationLimitReached()) {
                logger.error("Completed matching has {} blocking pairs: {}", report.totalBlockingPairs(), report.blockingPairs());
            }
        }
        if (preferences.hasFallbacks()) {
            warnings.add(MatchWarning.NEUTRAL_SCORE_SUBSTITUTED);
        }
        final boolean degraded = preferences.isSemanticDegraded();
        if (degraded) {
            warnings.add(MatchWarning.SEMANTIC_DEGRADED);
        }

        final List<Match> matches = new ArrayList<>();
        for (final Map.Entry<String, String> pair : matching.pairs().entrySet()) {
            ScoreBreakdown breakdown = preferences.breakdown(pair.getKey(), pair.getValue());
            if (breakdown == null) {
                breakdown = ScoreBreakdown.neutral(AlgorithmConfig.NEUTRAL_SCORE);
            }
            matches.add(new Match(pair.getKey(), pair.getValue(), breakdown, 0, MatchType.STABLE,
                    report.stable(), explainer.explain(breakdown, config)));
        }
        matches.sort(Comparator.comparingInt(Match::score).reversed()
                .thenComparing(Match::proposerId)
                .thenComparing(Match::reviewerId));
        final List<Match> ranked = new ArrayList<>(matches.size());
        for (int i = 0; i < matches.size(); i++) {
            ranked.add(matches.get(i).withRank(i + 1));
        }

        final boolean guaranteed = report.stable() && !matching.iterationLimitReached();
        return new MatchOutcome(ranked, guaranteed ? Stability.GUARANTEED : Stability.NOT_GUARANTEED,
                matching.size(), matching.size(), matching.iterations(), degraded, warnings);
    }
}
