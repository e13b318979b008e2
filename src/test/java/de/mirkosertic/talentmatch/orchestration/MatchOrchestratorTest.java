package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.TestProfiles;
import de.mirkosertic.talentmatch.dto.AlgorithmInfo;
import de.mirkosertic.talentmatch.dto.CandidateFilters;
import de.mirkosertic.talentmatch.dto.MatchRequest;
import de.mirkosertic.talentmatch.dto.MatchResponse;
import de.mirkosertic.talentmatch.dto.PreferenceRequest;
import de.mirkosertic.talentmatch.matching.DeferredAcceptanceSolver;
import de.mirkosertic.talentmatch.matching.PreferenceListBuilder;
import de.mirkosertic.talentmatch.matching.StabilityVerifier;
import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.Match;
import de.mirkosertic.talentmatch.model.MatchType;
import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;
import de.mirkosertic.talentmatch.scoring.HybridScoringEngine;
import de.mirkosertic.talentmatch.scoring.MatchExplainer;
import de.mirkosertic.talentmatch.scoring.RuleBasedScorer;
import de.mirkosertic.talentmatch.semantic.LexicalSimilarityProvider;
import de.mirkosertic.talentmatch.semantic.SemanticSimilarityService;
import de.mirkosertic.talentmatch.semantic.SimilarityExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("MatchOrchestrator Tests")
class MatchOrchestratorTest {

    private final AlgorithmConfig config = AlgorithmConfig.defaults();
    private SimilarityExecutorService executor;
    private SemanticSimilarityService similarityService;

    @BeforeEach
    void setUp() {
        executor = new SimilarityExecutorService(2);
        similarityService = new SemanticSimilarityService(null, new LexicalSimilarityProvider(), executor, 1000, 100, true);
    }

    @AfterEach
    void tearDown() {
        similarityService.close();
        executor.shutdown();
    }

    private MatchOrchestrator realOrchestrator(final SemanticSimilarityService service) {
        final HybridScoringEngine engine = new HybridScoringEngine(new RuleBasedScorer(), service);
        final MatchExplainer explainer = new MatchExplainer();
        return new MatchOrchestrator(List.of(
                new StableMatchingStrategy(new PreferenceListBuilder(engine), new DeferredAcceptanceSolver(),
                        new StabilityVerifier(), explainer),
                new RankedMatchingStrategy(engine, explainer, false),
                new RankedMatchingStrategy(engine, explainer, true)),
                service, config, 10_000);
    }

    private static List<Proposer> gigs() {
        return List.of(TestProfiles.gig("gig-a", "Mumbai"), TestProfiles.gig("gig-b", "Delhi"));
    }

    private static List<Reviewer> talents() {
        return List.of(TestProfiles.talent("t1", "Mumbai"), TestProfiles.talent("t2", "Delhi"),
                TestProfiles.talent("t3", "Goa"));
    }

    @Nested
    @DisplayName("Algorithm selection")
    class Selection {

        @Test
        @DisplayName("Auto picks stable matching for a pool within the cap")
        void autoPicksStable() {
            assertThat(MatchOrchestrator.select(AlgorithmKind.AUTO, 50, config)).isEqualTo(MatchAlgorithm.GALE_SHAPLEY);
        }

        @Test
        @DisplayName("Auto picks ranked scoring for a large pool or when stable matching is disabled")
        void autoPicksRanked() {
            assertThat(MatchOrchestrator.select(AlgorithmKind.AUTO, 51, config)).isEqualTo(MatchAlgorithm.HYBRID_RANKED);
            assertThat(MatchOrchestrator.select(AlgorithmKind.AUTO, 5, config.toBuilder().stableEnabled(false).build()))
                    .isEqualTo(MatchAlgorithm.HYBRID_RANKED);
        }

        @Test
        @DisplayName("Explicit hints are honoured")
        void explicitHints() {
            assertThat(MatchOrchestrator.select(AlgorithmKind.STABLE, 500, config)).isEqualTo(MatchAlgorithm.GALE_SHAPLEY);
            assertThat(MatchOrchestrator.select(AlgorithmKind.RANKED, 5, config)).isEqualTo(MatchAlgorithm.HYBRID_RANKED);
        }
    }

    @Nested
    @DisplayName("Fallback chain")
    class FallbackChain {

        private MatchingStrategy stable;
        private MatchingStrategy hybrid;
        private MatchingStrategy ruleOnly;
        private MatchOrchestrator orchestrator;

        @BeforeEach
        void setUp() {
            stable = strategy(MatchAlgorithm.GALE_SHAPLEY);
            hybrid = strategy(MatchAlgorithm.HYBRID_RANKED);
            ruleOnly = strategy(MatchAlgorithm.RULE_ONLY_RANKED);
            orchestrator = new MatchOrchestrator(List.of(stable, hybrid, ruleOnly), similarityService, config, 10_000);
        }

        private MatchingStrategy strategy(final MatchAlgorithm algorithm) {
            final MatchingStrategy strategy = mock(MatchingStrategy.class);
            when(strategy.algorithm()).thenReturn(algorithm);
            return strategy;
        }

        private AlgorithmResult succeeded(final MatchAlgorithm algorithm) {
            return AlgorithmResult.success(algorithm, new MatchOutcome(List.of(), Stability.NOT_GUARANTEED,
                    0, 0, 0, false, List.of()));
        }

        private MatchResponse run() {
            return orchestrator.findMatches(MatchRequest.of(TestProfiles.gig("gig-a", "Mumbai"),
                    List.of(TestProfiles.talent("t1", "Mumbai")), AlgorithmKind.STABLE));
        }

        @Test
        @DisplayName("A failing stable run falls back to hybrid ranking")
        void stableFallsBackToHybrid() {
            when(stable.execute(any())).thenReturn(AlgorithmResult.failure(
                    AlgorithmFailure.of(MatchAlgorithm.GALE_SHAPLEY, new IllegalStateException("solver broke"))));
            when(hybrid.execute(any())).thenReturn(succeeded(MatchAlgorithm.HYBRID_RANKED));

            final MatchResponse response = run();

            assertThat(response.success()).isTrue();
            assertThat(response.metadata().algorithm()).isEqualTo(MatchAlgorithm.HYBRID_RANKED);
            assertThat(response.metadata().fallbacks())
                    .extracting(AlgorithmFailure::algorithm)
                    .containsExactly(MatchAlgorithm.GALE_SHAPLEY);
            assertThat(response.metadata().fallbacks().get(0).reason()).contains("solver broke");
            verify(ruleOnly, never()).execute(any());
        }

        @Test
        @DisplayName("A deadline failure skips straight to rule-only ranking")
        void deadlineSkipsToRuleOnly() {
            when(stable.execute(any())).thenReturn(AlgorithmResult.failure(
                    AlgorithmFailure.deadline(MatchAlgorithm.GALE_SHAPLEY, "deadline passed")));
            when(ruleOnly.execute(any())).thenReturn(succeeded(MatchAlgorithm.RULE_ONLY_RANKED));

            final MatchResponse response = run();

            assertThat(response.success()).isTrue();
            assertThat(response.metadata().algorithm()).isEqualTo(MatchAlgorithm.RULE_ONLY_RANKED);
            assertThat(response.metadata().warnings()).contains(MatchWarning.DEADLINE_EXCEEDED);
            verify(hybrid, never()).execute(any());
        }

        @Test
        @DisplayName("A strategy that throws counts as failed")
        void throwingStrategyCountsAsFailed() {
            when(stable.execute(any())).thenThrow(new IllegalStateException("unexpected"));
            when(hybrid.execute(any())).thenReturn(succeeded(MatchAlgorithm.HYBRID_RANKED));

            final MatchResponse response = run();

            assertThat(response.success()).isTrue();
            assertThat(response.metadata().fallbacks()).hasSize(1);
        }

        @Test
        @DisplayName("An exhausted chain is reported with every failed algorithm")
        void exhaustedChain() {
            when(stable.execute(any())).thenReturn(AlgorithmResult.failure(
                    AlgorithmFailure.of(MatchAlgorithm.GALE_SHAPLEY, new IllegalStateException("a"))));
            when(hybrid.execute(any())).thenReturn(AlgorithmResult.failure(
                    AlgorithmFailure.of(MatchAlgorithm.HYBRID_RANKED, new IllegalStateException("b"))));
            when(ruleOnly.execute(any())).thenReturn(AlgorithmResult.failure(
                    AlgorithmFailure.of(MatchAlgorithm.RULE_ONLY_RANKED, new IllegalStateException("c"))));

            final MatchResponse response = run();

            assertThat(response.success()).isFalse();
            assertThat(response.errorType()).isEqualTo(MatchResponse.ALGORITHMS_EXHAUSTED);
            assertThat(response.exhaustedAlgorithms()).containsExactly(
                    MatchAlgorithm.GALE_SHAPLEY, MatchAlgorithm.HYBRID_RANKED, MatchAlgorithm.RULE_ONLY_RANKED);
            assertThat(response.error()).startsWith("All algorithms failed: gale-shapley (");
        }

        @Test
        @DisplayName("Invalid input found by a strategy is not retried")
        void invalidInputIsNotRetried() {
            when(stable.execute(any())).thenThrow(new InvalidSpecificationException("bad preference list"));

            final MatchResponse response = run();

            assertThat(response.success()).isFalse();
            assertThat(response.errorType()).isEqualTo(MatchResponse.INVALID_SPECIFICATION);
            verify(hybrid, never()).execute(any());
        }

        @Test
        @DisplayName("A missing strategy counts as failed")
        void missingStrategyCountsAsFailed() {
            final MatchOrchestrator partial = new MatchOrchestrator(List.of(ruleOnly), similarityService, config, 10_000);
            when(ruleOnly.execute(any())).thenReturn(succeeded(MatchAlgorithm.RULE_ONLY_RANKED));

            final MatchResponse response = partial.findMatches(MatchRequest.of(TestProfiles.gig("gig-a", "Mumbai"),
                    List.of(TestProfiles.talent("t1", "Mumbai")), AlgorithmKind.STABLE));

            assertThat(response.success()).isTrue();
            assertThat(response.metadata().fallbacks())
                    .extracting(AlgorithmFailure::algorithm)
                    .containsExactly(MatchAlgorithm.GALE_SHAPLEY, MatchAlgorithm.HYBRID_RANKED);
        }
    }

    @Nested
    @DisplayName("End to end")
    class EndToEnd {

        private MatchOrchestrator orchestrator;

        @BeforeEach
        void setUp() {
            orchestrator = realOrchestrator(similarityService);
        }

        @Test
        @DisplayName("An empty pool yields an empty successful result")
        void emptyPool() {
            final MatchResponse response = orchestrator.findMatches(
                    new MatchRequest(gigs(), null, List.of(), null, null, null, null));

            assertThat(response.success()).isTrue();
            assertThat(response.matches()).isEmpty();
            assertThat(response.metadata().suppliedCandidates()).isZero();
            assertThat(response.metadata().totalCandidates()).isZero();
            assertThat(response.metadata().stability()).isEqualTo(Stability.NOT_GUARANTEED);
        }

        @Test
        @DisplayName("Stable matching assigns every reviewer at most once and verifies stability")
        void stableMatching() {
            final MatchResponse response = orchestrator.findMatches(
                    new MatchRequest(gigs(), null, talents(), null, AlgorithmKind.AUTO, null, null));

            assertThat(response.success()).isTrue();
            assertThat(response.metadata().algorithm()).isEqualTo(MatchAlgorithm.GALE_SHAPLEY);
            assertThat(response.metadata().stability()).isEqualTo(Stability.GUARANTEED);
            assertThat(response.metadata().solverIterations()).isPositive();
            assertThat(response.matches()).hasSize(2);
            assertThat(response.matches()).allMatch(match -> match.matchType() == MatchType.STABLE && match.stabilityVerified());
            assertThat(response.matches()).extracting(Match::rank).containsExactly(1, 2);

            final Set<String> reviewers = new HashSet<>();
            for (final Match match : response.matches()) {
                assertThat(reviewers.add(match.reviewerId())).isTrue();
            }
            assertThat(response.toRecords()).hasSize(2);
        }

        @Test
        @DisplayName("Ranked matching respects the limit, the minimum score and the order")
        void rankedMatching() {
            final MatchResponse response = orchestrator.findMatches(
                    new MatchRequest(gigs(), null, talents(), 2, AlgorithmKind.RANKED, null, null));

            assertThat(response.success()).isTrue();
            assertThat(response.metadata().algorithm()).isEqualTo(MatchAlgorithm.HYBRID_RANKED);
            assertThat(response.metadata().stability()).isEqualTo(Stability.NOT_GUARANTEED);
            for (final Proposer gig : gigs()) {
                final List<Match> own = new ArrayList<>();
                for (final Match match : response.matches()) {
                    if (match.proposerId().equals(gig.id())) {
                        own.add(match);
                    }
                }
                assertThat(own).hasSizeLessThanOrEqualTo(2);
                assertThat(own).allMatch(match -> match.score() >= config.minScore());
                assertThat(own).extracting(Match::score).isSortedAccordingTo((a, b) -> Integer.compare(b, a));
                for (int i = 0; i < own.size(); i++) {
                    assertThat(own.get(i).rank()).isEqualTo(i + 1);
                }
            }
        }

        @Test
        @DisplayName("An oversized pool is truncated and ranked")
        void oversizedPool() {
            final AlgorithmConfig small = config.toBuilder().candidateCap(2).build();

            final MatchResponse response = orchestrator.findMatches(
                    new MatchRequest(gigs(), null, talents(), null, null, null, null), small);

            assertThat(response.metadata().algorithm()).isEqualTo(MatchAlgorithm.HYBRID_RANKED);
            assertThat(response.metadata().totalCandidates()).isEqualTo(3);
            assertThat(response.metadata().totalReviewers()).isEqualTo(2);
            assertThat(response.metadata().warnings()).contains(MatchWarning.CANDIDATES_TRUNCATED);
            assertThat(response.matches()).noneMatch(match -> match.reviewerId().equals("t3"));
        }

        @Test
        @DisplayName("Hitting the iteration cap reports stability as not guaranteed")
        void iterationCapHit() {
            final AlgorithmConfig capped = config.toBuilder().maxIterations(1).build();

            final MatchResponse response = orchestrator.findMatches(
                    new MatchRequest(gigs(), null, talents(), null, AlgorithmKind.STABLE, null, null), capped);

            assertThat(response.success()).isTrue();
            assertThat(response.metadata().algorithm()).isEqualTo(MatchAlgorithm.GALE_SHAPLEY);
            assertThat(response.metadata().stability()).isEqualTo(Stability.NOT_GUARANTEED);
            assertThat(response.metadata().warnings()).contains(MatchWarning.SOLVER_ITERATION_LIMIT_REACHED);
            assertThat(response.matches()).hasSize(1);
        }

        @Test
        @DisplayName("Unavailable semantics still produce a full result with the degradation flag")
        void unavailableSemantics() {
            final SemanticSimilarityService unavailable = new SemanticSimilarityService(null,
                    new LexicalSimilarityProvider(), executor, 1000, 100, false);
            final MatchOrchestrator degraded = realOrchestrator(unavailable);

            final MatchResponse response = degraded.findMatches(
                    new MatchRequest(gigs(), null, talents(), null, AlgorithmKind.RANKED, null, null));

            assertThat(response.success()).isTrue();
            assertThat(response.matches()).isNotEmpty();
            assertThat(response.metadata().semanticDegraded()).isTrue();
            assertThat(response.metadata().warnings()).contains(MatchWarning.SEMANTIC_DEGRADED);
            for (final Match match : response.matches()) {
                assertThat(match.breakdown().semanticScore()).isEqualTo(0.0);
                assertThat(match.breakdown().semanticUnavailable()).isTrue();
                assertThat(match.reasoning()).endsWith("(semantic similarity unavailable)");
            }
            unavailable.close();
        }

        @Test
        @DisplayName("Filters narrow the pool before matching")
        void filtersNarrowPool() {
            final CandidateFilters filters = new CandidateFilters("delhi", null, null, List.of(), null);

            final MatchResponse response = orchestrator.findMatches(
                    new MatchRequest(gigs(), null, talents(), null, AlgorithmKind.RANKED, filters, null));

            assertThat(response.metadata().suppliedCandidates()).isEqualTo(3);
            assertThat(response.metadata().totalCandidates()).isEqualTo(1);
            assertThat(response.matches()).allMatch(match -> match.reviewerId().equals("t2"));
        }

        @Test
        @DisplayName("A pool emptied by filters still reports the supplied candidates")
        void filtersEmptyPool() {
            final CandidateFilters filters = new CandidateFilters("chennai", null, null, List.of(), null);

            final MatchResponse response = orchestrator.findMatches(
                    new MatchRequest(gigs(), null, talents(), null, null, filters, null));

            assertThat(response.success()).isTrue();
            assertThat(response.matches()).isEmpty();
            assertThat(response.metadata().suppliedCandidates()).isEqualTo(3);
            assertThat(response.metadata().totalCandidates()).isZero();
        }

        @Test
        @DisplayName("Preferences are matched through a virtual gig")
        void preferencesBecomeVirtualGig() {
            final PreferenceRequest preferences = new PreferenceRequest("Photographer", "Photography", 8000, 12000,
                    "Mumbai", List.of("wedding"), List.of("candid"), "pro", null, false, null, null);

            final MatchResponse response = orchestrator.findMatches(
                    new MatchRequest(List.of(), preferences, talents(), 3, AlgorithmKind.RANKED, null, null));

            assertThat(response.success()).isTrue();
            assertThat(response.matches()).isNotEmpty();
            assertThat(response.matches()).allMatch(match -> match.proposerId().startsWith(VirtualProposerFactory.ID_PREFIX));
        }

        @Test
        @DisplayName("Candidates are fetched from the source with criteria derived from the proposer")
        void candidateSource() {
            final AtomicReference<CandidateCriteria> seen = new AtomicReference<>();
            final CandidateSource source = criteria -> {
                seen.set(criteria);
                return talents();
            };

            final MatchResponse response = orchestrator.findMatches(TestProfiles.gig("gig-a", "Mumbai"), source, 5,
                    AlgorithmKind.AUTO, CandidateFilters.none());

            assertThat(response.success()).isTrue();
            assertThat(seen.get().category()).isEqualTo("Photography");
            assertThat(seen.get().city()).isEqualTo("Mumbai");
            assertThat(seen.get().limit()).isEqualTo(config.candidateCap());
        }

        @Test
        @DisplayName("A failing candidate source is reported as a retrieval failure")
        void failingCandidateSource() {
            final CandidateSource source = criteria -> {
                throw new IllegalStateException("database offline");
            };

            final MatchResponse response = orchestrator.matchPreferences(
                    new PreferenceRequest("Stylist", null, null, null, null, null, null, null, null, true, null, null),
                    source, 5, AlgorithmKind.AUTO);

            assertThat(response.success()).isFalse();
            assertThat(response.errorType()).isEqualTo(MatchResponse.CANDIDATE_RETRIEVAL_FAILED);
            assertThat(response.error()).contains("database offline");
        }

        @Test
        @DisplayName("Malformed requests are rejected with a structured error")
        void malformedRequests() {
            assertThat(orchestrator.findMatches(new MatchRequest(List.of(), null, talents(), null, null, null, null)).errorType())
                    .isEqualTo(MatchResponse.INVALID_SPECIFICATION);
            assertThat(orchestrator.findMatches(new MatchRequest(gigs(), null, talents(), 0, null, null, null)).errorType())
                    .isEqualTo(MatchResponse.INVALID_SPECIFICATION);
            final List<Reviewer> duplicates = List.of(TestProfiles.talent("t1", "Mumbai"), TestProfiles.talent("t1", "Goa"));
            final MatchResponse response = orchestrator.findMatches(new MatchRequest(gigs(), null, duplicates, null, null, null, null));
            assertThat(response.success()).isFalse();
            assertThat(response.error()).contains("t1");
        }

        @Test
        @DisplayName("Describes algorithms, fallback chain and similarity health")
        void describe() {
            final AlgorithmInfo info = orchestrator.describe();

            assertThat(info.fallbackChain()).containsExactly(
                    MatchAlgorithm.GALE_SHAPLEY, MatchAlgorithm.HYBRID_RANKED, MatchAlgorithm.RULE_ONLY_RANKED);
            assertThat(info.stableMatching().algorithm()).isEqualTo("Gale-Shapley");
            assertThat(info.configuration()).containsEntry("candidateCap", 50);
            assertThat(info.similarity().providerName()).isEqualTo("none");
            assertThat(info.similarity().heuristicFallback()).isTrue();
        }
    }
}
