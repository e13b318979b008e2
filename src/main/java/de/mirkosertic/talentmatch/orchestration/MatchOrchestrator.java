package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.config.BuildInfo;
import de.mirkosertic.talentmatch.dto.AlgorithmInfo;
import de.mirkosertic.talentmatch.dto.CandidateFilters;
import de.mirkosertic.talentmatch.dto.MatchMetadata;
import de.mirkosertic.talentmatch.dto.MatchRequest;
import de.mirkosertic.talentmatch.dto.MatchResponse;
import de.mirkosertic.talentmatch.dto.PreferenceRequest;
import de.mirkosertic.talentmatch.matching.DeferredAcceptanceSolver;
import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;
import de.mirkosertic.talentmatch.semantic.SemanticSimilarityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Top-level entry point of the matching engine.
 *
 * <p>Selects an algorithm from the caller's hint, runs it through the strategy
 * dispatch table and walks the fallback chain on failure:</p>
 * <ul>
 *   <li>gale-shapley, then hybrid-ranked, then rule-only-ranked</li>
 *   <li>hybrid-ranked, then rule-only-ranked</li>
 * </ul>
 * <p>A failure caused by the run deadline jumps straight to rule-only ranking.
 * Every fallback taken is listed in the response metadata. Malformed input and an
 * exhausted chain are reported as structured error responses.</p>
 */
public class MatchOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(MatchOrchestrator.class);

    private static final Map<MatchAlgorithm, MatchAlgorithm> NEXT_IN_CHAIN = new EnumMap<>(Map.of(
            MatchAlgorithm.GALE_SHAPLEY, MatchAlgorithm.HYBRID_RANKED,
            MatchAlgorithm.HYBRID_RANKED, MatchAlgorithm.RULE_ONLY_RANKED
    ));

    private final Map<MatchAlgorithm, MatchingStrategy> strategies = new EnumMap<>(MatchAlgorithm.class);
    private final SemanticSimilarityService similarityService;
    private final AlgorithmConfig config;
    private final long defaultDeadlineMs;
    private final MatchRequestValidator validator = new MatchRequestValidator();
    private final VirtualProposerFactory virtualProposerFactory;

    public MatchOrchestrator(final Collection<MatchingStrategy> strategies,
                             final SemanticSimilarityService similarityService,
                             final AlgorithmConfig config,
                             final long defaultDeadlineMs) {
        this(strategies, similarityService, config, defaultDeadlineMs, new VirtualProposerFactory());
    }

    public MatchOrchestrator(final Collection<MatchingStrategy> strategies,
                             final SemanticSimilarityService similarityService,
                             final AlgorithmConfig config,
                             final long defaultDeadlineMs,
                             final VirtualProposerFactory virtualProposerFactory) {
        for (final MatchingStrategy strategy : strategies) {
            this.strategies.put(strategy.algorithm(), strategy);
        }
        this.similarityService = similarityService;
        this.config = config;
        this.defaultDeadlineMs = defaultDeadlineMs;
        this.virtualProposerFactory = virtualProposerFactory;
        config.validate();

        logger.info("MatchOrchestrator initialized with strategies {}", this.strategies.keySet());
    }

    public MatchResponse findMatches(final MatchRequest request) {
        return findMatches(request, config);
    }

    /**
     * Runs one matching request with the given configuration.
     */
    public MatchResponse findMatches(final MatchRequest request, final AlgorithmConfig runConfig) {
        final long startNanos = System.nanoTime();
        try {
            validator.validate(request, runConfig);
            final List<Proposer> proposers = request.proposers().isEmpty()
                    ? List.of(virtualProposerFactory.create(request.preferences()))
                    : request.proposers();

            final List<Reviewer> pool = request.effectiveFilters().apply(request.candidates());
            final MatchAlgorithm selected = select(request.effectiveAlgorithm(), pool.size(), runConfig);
            logger.info("Matching started: proposers={}, candidates={}, hint={}, selected={}",
                    proposers.size(), pool.size(), request.effectiveAlgorithm().getValue(), selected.getValue());

            final List<MatchWarning> warnings = new ArrayList<>();
            List<Reviewer> reviewers = pool;
            if (pool.size() > runConfig.candidateCap()) {
                logger.warn("Candidate pool of {} exceeds the cap of {}, truncating", pool.size(), runConfig.candidateCap());
                reviewers = pool.subList(0, runConfig.candidateCap());
                warnings.add(MatchWarning.CANDIDATES_TRUNCATED);
            }

            if (reviewers.isEmpty()) {
                logger.info("No candidates to match");
                return MatchResponse.success(List.of(),
                        MatchMetadata.empty(selected, request.candidates().size(), proposers.size(),
                                elapsedMs(startNanos), warnings));
            }

            final long deadlineMs = request.deadlineMs() != null ? request.deadlineMs() : defaultDeadlineMs;
            final MatchContext context = new MatchContext(proposers, reviewers, runConfig,
                    request.effectiveLimit(), Instant.now().plusMillis(deadlineMs));
            return runChain(selected, context, request.candidates().size(), pool.size(), warnings, startNanos);
        } catch (final InvalidSpecificationException e) {
            logger.warn("Rejected matching request: {}", e.getMessage());
            return MatchResponse.invalid(e.getMessage());
        }
    }

    /**
     * Matches one proposer against the reviewers a candidate source returns for it.
     */
    public MatchResponse findMatches(final Proposer proposer, final CandidateSource source, final int limit,
                                     final AlgorithmKind hint, final CandidateFilters filters) {
        final List<Reviewer> candidates;
        try {
            candidates = source.findCandidates(CandidateCriteria.forProposer(proposer, filters, config.candidateCap()));
        } catch (final RuntimeException e) {
            logger.error("Candidate retrieval for proposer {} failed", proposer.id(), e);
            return MatchResponse.retrievalFailed("Candidate retrieval failed: " + e.getMessage());
        }
        return findMatches(new MatchRequest(List.of(proposer), null, candidates, limit, hint, filters, null));
    }

    /**
     * Matches free-form preferences: retrieves candidates for them, then matches a
     * virtual gig built from the same preferences.
     */
    public MatchResponse matchPreferences(final PreferenceRequest preferences, final CandidateSource source,
                                          final int limit, final AlgorithmKind hint) {
        final List<Reviewer> candidates;
        try {
            candidates = source.findCandidates(virtualProposerFactory.criteria(preferences, limit));
        } catch (final InvalidSpecificationException e) {
            logger.warn("Rejected preferences: {}", e.getMessage());
            return MatchResponse.invalid(e.getMessage());
        } catch (final RuntimeException e) {
            logger.error("Candidate retrieval for preferences failed", e);
            return MatchResponse.retrievalFailed("Candidate retrieval failed: " + e.getMessage());
        }
        return findMatches(new MatchRequest(List.of(), preferences, candidates, limit, hint, null, null));
    }

    /**
     * Describes the engine: version, algorithms, fallback chain, configuration and similarity health.
     */
    public AlgorithmInfo describe() {
        final Map<String, String> algorithms = new LinkedHashMap<>();
        algorithms.put("primary", "Gale-Shapley stable matching with hybrid scoring");
        algorithms.put("fallback", "Hybrid ranked scoring");
        algorithms.put("lastResort", "Rule-based ranked scoring");

        final Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("stableEnabled", config.stableEnabled());
        configuration.put("candidateCap", config.candidateCap());
        configuration.put("minScore", config.minScore());
        configuration.put("maxIterations", config.maxIterations());
        configuration.put("ruleWeight", config.ruleWeight());
        configuration.put("semanticWeight", config.semanticWeight());
        configuration.put("ruleMax", config.ruleMax());
        configuration.put("semanticMax", config.semanticMax());
        configuration.put("deadlineMs", defaultDeadlineMs);

        return new AlgorithmInfo(
                "Talent Match Engine",
                BuildInfo.getVersion(),
                BuildInfo.getBuildTimestamp(),
                algorithms,
                List.of(MatchAlgorithm.GALE_SHAPLEY, MatchAlgorithm.HYBRID_RANKED, MatchAlgorithm.RULE_ONLY_RANKED),
                new DeferredAcceptanceSolver().describe(),
                configuration,
                similarityService.status());
    }

    static MatchAlgorithm select(final AlgorithmKind hint, final int poolSize, final AlgorithmConfig config) {
        return switch (hint) {
            case STABLE -> MatchAlgorithm.GALE_SHAPLEY;
            case RANKED -> MatchAlgorithm.HYBRID_RANKED;
            case AUTO -> config.stableEnabled() && poolSize <= config.candidateCap()
                    ? MatchAlgorithm.GALE_SHAPLEY
                    : MatchAlgorithm.HYBRID_RANKED;
        };
    }

    private MatchResponse runChain(final MatchAlgorithm selected, final MatchContext context,
                                   final int suppliedCandidates, final int totalCandidates,
                                   final List<MatchWarning> warnings, final long startNanos) {
        final List<AlgorithmFailure> failures = new ArrayList<>();
        MatchAlgorithm current = selected;
        while (current != null) {
            final AlgorithmResult result = execute(current, context);
            if (result.isSuccess()) {
                return respond(result, context, suppliedCandidates, totalCandidates, failures, warnings, startNanos);
            }
            final AlgorithmFailure failure = result.failure();
            failures.add(failure);
            final MatchAlgorithm next = failure.deadlineExceeded() && current != MatchAlgorithm.RULE_ONLY_RANKED
                    ? MatchAlgorithm.RULE_ONLY_RANKED
                    : NEXT_IN_CHAIN.get(current);
            if (next != null) {
                logger.info("{} failed ({}), falling back to {}", current.getValue(), failure.reason(), next.getValue());
            }
            current = next;
        }
        logger.error("Every algorithm in the fallback chain failed: {}", failures);
        return MatchResponse.exhausted(failures);
    }

    private AlgorithmResult execute(final MatchAlgorithm algorithm, final MatchContext context) {
        final MatchingStrategy strategy = strategies.get(algorithm);
        if (strategy == null) {
            return AlgorithmResult.failure(new AlgorithmFailure(algorithm, "No strategy registered", false));
        }
        try {
            return strategy.execute(context);
        } catch (final InvalidSpecificationException e) {
            throw e;
        } catch (final RuntimeException e) {
            logger.warn("Strategy {} threw instead of reporting a failure", algorithm.getValue(), e);
            return AlgorithmResult.failure(AlgorithmFailure.of(algorithm, e));
        }
    }

    private MatchResponse respond(final AlgorithmResult result, final MatchContext context,
                                  final int suppliedCandidates, final int totalCandidates,
                                  final List<AlgorithmFailure> failures, final List<MatchWarning> warnings,
                                  final long startNanos) {
        final MatchOutcome outcome = result.outcome();
        final List<MatchWarning> allWarnings = new ArrayList<>(warnings);
        for (final AlgorithmFailure failure : failures) {
            if (failure.deadlineExceeded() && !allWarnings.contains(MatchWarning.DEADLINE_EXCEEDED)) {
                allWarnings.add(MatchWarning.DEADLINE_EXCEEDED);
            }
        }
        for (final MatchWarning warning : outcome.warnings()) {
            if (!allWarnings.contains(warning)) {
                allWarnings.add(warning);
            }
        }

        final long processingTimeMs = elapsedMs(startNanos);
        final MatchMetadata metadata = new MatchMetadata(
                suppliedCandidates,
                totalCandidates,
                outcome.matches().size(),
                processingTimeMs,
                result.algorithm(),
                outcome.stability(),
                context.proposers().size(),
                context.reviewers().size(),
                outcome.matchedProposers(),
                outcome.matchedReviewers(),
                outcome.solverIterations(),
                outcome.semanticDegraded(),
                failures,
                allWarnings);

        logger.info("Matching completed: algorithm={}, stability={}, matches={}, fallbacks={}, time={}ms",
                result.algorithm().getValue(), outcome.stability().getValue(), outcome.matches().size(),
                failures.size(), processingTimeMs);
        return MatchResponse.success(outcome.matches(), metadata);
    }

    private static long elapsedMs(final long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
