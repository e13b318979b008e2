package de.mirkosertic.talentmatch.matching;

import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.PreferenceList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static de.mirkosertic.talentmatch.matching.DeferredAcceptanceSolverTest.lists;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StabilityVerifier Tests")
class StabilityVerifierTest {

    private final StabilityVerifier verifier = new StabilityVerifier();

    private final Map<String, PreferenceList> proposers = lists("P1:R1,R2", "P2:R1,R2");
    private final Map<String, PreferenceList> reviewers = lists("R1:P2,P1", "R2:P1,P2");

    @Test
    @DisplayName("Should accept a stable matching")
    void shouldAcceptStableMatching() {
        final StabilityReport report = verifier.verify(Map.of("P1", "R2", "P2", "R1"), proposers, reviewers);

        assertThat(report.stable()).isTrue();
        assertThat(report.blockingPairs()).isEmpty();
    }

    @Test
    @DisplayName("Should find the pair that prefers each other")
    void shouldFindBlockingPair() {
        // R1 prefers P2, and P2 prefers R1 over its partner R2
        final StabilityReport report = verifier.verify(Map.of("P1", "R1", "P2", "R2"), proposers, reviewers);

        assertThat(report.stable()).isFalse();
        assertThat(report.blockingPairs()).containsExactly(new BlockingPair("P2", "R1"));
    }

    @Test
    @DisplayName("Should treat an unmatched proposer and a free reviewer as blocking")
    void shouldDetectUnmatchedBlocking() {
        final StabilityReport report = verifier.verify(Map.of("P2", "R1"), proposers, reviewers);

        assertThat(report.blockingPairs()).containsExactly(new BlockingPair("P1", "R2"));
    }

    @Test
    @DisplayName("Should ignore pairs the reviewer does not rank")
    void shouldIgnoreUnrankedPairs() {
        final StabilityReport report = verifier.verify(Map.of(),
                lists("A:X"),
                lists("X:"));

        assertThat(report.stable()).isTrue();
    }

    @Test
    @DisplayName("Should verify a solver result through its preference lists")
    void shouldVerifySolverResult() {
        final PreferenceLists preferences = PreferenceLists.of(proposers, reviewers);
        final StableMatching matching = new StableMatching(Map.of("P1", "R1", "P2", "R2"), 2, false, List.of(), List.of());

        assertThat(verifier.verify(matching, preferences).totalBlockingPairs()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a reviewer matched twice")
    void shouldRejectDoubleAssignment() {
        assertThatThrownBy(() -> verifier.verify(Map.of("P1", "R1", "P2", "R1"), proposers, reviewers))
                .isInstanceOf(InvalidSpecificationException.class)
                .hasMessageContaining("R1");
    }
}
