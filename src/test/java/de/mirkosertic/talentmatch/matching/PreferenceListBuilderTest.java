package de.mirkosertic.talentmatch.matching;

import de.mirkosertic.talentmatch.TestProfiles;
import de.mirkosertic.talentmatch.model.AlgorithmConfig;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;
import de.mirkosertic.talentmatch.model.ScoreBreakdown;
import de.mirkosertic.talentmatch.model.ScoreFactor;
import de.mirkosertic.talentmatch.model.ScoringAlgorithm;
import de.mirkosertic.talentmatch.model.SemanticSource;
import de.mirkosertic.talentmatch.scoring.HybridScoringEngine;
import de.mirkosertic.talentmatch.scoring.PairScore;
import de.mirkosertic.talentmatch.scoring.RuleBasedScorer;
import de.mirkosertic.talentmatch.scoring.ScoringPair;
import de.mirkosertic.talentmatch.semantic.LexicalSimilarityProvider;
import de.mirkosertic.talentmatch.semantic.SemanticSimilarityService;
import de.mirkosertic.talentmatch.semantic.SimilarityExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PreferenceListBuilder Tests")
class PreferenceListBuilderTest {

    private final AlgorithmConfig config = AlgorithmConfig.defaults();
    private SimilarityExecutorService executor;
    private PreferenceListBuilder builder;

    @BeforeEach
    void setUp() {
        executor = new SimilarityExecutorService(2);
        builder = new PreferenceListBuilder(new HybridScoringEngine(new RuleBasedScorer(),
                new SemanticSimilarityService(null, new LexicalSimilarityProvider(), executor, 1000, 100, true)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static PairScore scored(final String proposerId, final String reviewerId, final int total) {
        final ScoringPair pair = new ScoringPair(TestProfiles.gig(proposerId, "Mumbai"), TestProfiles.talent(reviewerId, "Mumbai"));
        return PairScore.scored(pair, new ScoreBreakdown(Map.of(), 0, 0, total,
                ScoringAlgorithm.HYBRID, SemanticSource.PROVIDER, false));
    }

    @Test
    @DisplayName("Should rank by score and break ties by id")
    void shouldRankByScoreThenId() {
        final PreferenceLists lists = PreferenceListBuilder.fromScores(
                List.of("p1", "p2"),
                List.of("r3", "r1", "r2"),
                List.of(
                        scored("p1", "r1", 70), scored("p1", "r2", 90), scored("p1", "r3", 70),
                        scored("p2", "r1", 40), scored("p2", "r2", 40), scored("p2", "r3", 80)));

        assertThat(lists.proposerPrefs().get("p1").rankedIds()).containsExactly("r2", "r1", "r3");
        assertThat(lists.proposerPrefs().get("p2").rankedIds()).containsExactly("r3", "r1", "r2");
        // Reviewers rank by the same pairwise score
        assertThat(lists.reviewerPrefs().get("r1").rankedIds()).containsExactly("p1", "p2");
        assertThat(lists.reviewerPrefs().get("r2").rankedIds()).containsExactly("p1", "p2");
        assertThat(lists.reviewerPrefs().get("r3").rankedIds()).containsExactly("p2", "p1");
        assertThat(lists.breakdown("p1", "r2").total()).isEqualTo(90);
        assertThat(lists.hasFallbacks()).isFalse();
    }

    @Test
    @DisplayName("Should record pairs that received the neutral score")
    void shouldRecordNeutralSubstitutions() {
        final ScoringPair pair = new ScoringPair(TestProfiles.gig("p1", "Mumbai"), TestProfiles.talent("r1", "Mumbai"));

        final PreferenceLists lists = PreferenceListBuilder.fromScores(List.of("p1"), List.of("r1", "r2"), List.of(
                PairScore.fallback(pair, AlgorithmConfig.NEUTRAL_SCORE, "IllegalStateException: broken"),
                scored("p1", "r2", 60)));

        assertThat(lists.fallbacks()).containsExactly(
                new PairFallback("p1", "r1", AlgorithmConfig.NEUTRAL_SCORE, "IllegalStateException: broken"));
        assertThat(lists.proposerPrefs().get("p1").rankedIds()).containsExactly("r2", "r1");
        assertThat(lists.isSemanticDegraded()).isTrue();
    }

    @Test
    @DisplayName("Should score every pair of the cross product")
    void shouldScoreCrossProduct() {
        final List<Proposer> proposers = List.of(TestProfiles.gig("gig-a", "Mumbai"), TestProfiles.gig("gig-b", "Delhi"));
        final List<Reviewer> reviewers = List.of(TestProfiles.talent("t1", "Mumbai"), TestProfiles.talent("t2", "Delhi"),
                TestProfiles.talent("t3", "Goa"));

        final PreferenceLists lists = builder.buildPreferences(proposers, reviewers, config);

        assertThat(lists.proposerPrefs()).containsOnlyKeys("gig-a", "gig-b");
        assertThat(lists.reviewerPrefs()).containsOnlyKeys("t1", "t2", "t3");
        assertThat(lists.proposerPrefs().get("gig-a").rankedIds()).hasSize(3).startsWith("t1");
        assertThat(lists.proposerPrefs().get("gig-b").rankedIds()).startsWith("t2");
        assertThat(lists.breakdown("gig-a", "t1").factor(ScoreFactor.LOCATION)).isEqualTo(15.0);
        // No provider configured, so the heuristic answered
        assertThat(lists.isSemanticDegraded()).isTrue();
    }

    @Test
    @DisplayName("Should reject duplicate ids")
    void shouldRejectDuplicateIds() {
        final List<Proposer> proposers = List.of(TestProfiles.gig("gig-a", "Mumbai"), TestProfiles.gig("gig-a", "Delhi"));

        assertThatThrownBy(() -> builder.buildPreferences(proposers, List.of(TestProfiles.talent("t1", "Mumbai")), config))
                .isInstanceOf(InvalidSpecificationException.class)
                .hasMessageContaining("gig-a");
    }
}
