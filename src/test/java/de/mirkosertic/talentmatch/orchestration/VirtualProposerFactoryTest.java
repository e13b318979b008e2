package de.mirkosertic.talentmatch.orchestration;

import de.mirkosertic.talentmatch.dto.PreferenceRequest;
import de.mirkosertic.talentmatch.model.BudgetRange;
import de.mirkosertic.talentmatch.model.ExperienceBand;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;
import de.mirkosertic.talentmatch.model.Proposer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VirtualProposerFactory Tests")
class VirtualProposerFactoryTest {

    private final VirtualProposerFactory factory = new VirtualProposerFactory(
            Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC));

    private static PreferenceRequest preferences(final String profession, final String category,
                                                 final Integer budgetMin, final Integer budgetMax,
                                                 final String experienceLevel, final boolean remote) {
        return new PreferenceRequest(profession, category, budgetMin, budgetMax, "Pune", List.of("portrait"),
                List.of("moody"), experienceLevel, null, remote, null, 4.0);
    }

    @Test
    @DisplayName("Builds a virtual gig from the preferences")
    void buildsVirtualGig() {
        final Proposer gig = factory.create(preferences("Photographer", "Wedding", 8000, 12000, "pro", false));

        assertThat(gig.id()).isEqualTo("virtual-gig-1700000000000");
        assertThat(gig.title()).isEqualTo("Photographer - Wedding");
        assertThat(gig.category()).isEqualTo("Wedding");
        assertThat(gig.city()).isEqualTo("Pune");
        assertThat(gig.budget()).isEqualTo(BudgetRange.of(10000));
        assertThat(gig.experienceBand()).isEqualTo(ExperienceBand.PRO);
        assertThat(gig.skillTags()).containsExactly("portrait");
        assertThat(gig.styleTags()).containsExactly("moody");
        assertThat(gig.brief()).isEqualTo("Looking for Photographer for Wedding");
    }

    @Test
    @DisplayName("A missing category falls back to the profession and vice versa")
    void missingSideFallsBack() {
        assertThat(factory.create(preferences("Stylist", null, null, null, null, true)).title())
                .isEqualTo("Stylist - Stylist");
        assertThat(factory.create(preferences(" ", "Animation", null, null, null, true)).category())
                .isEqualTo("Animation");
    }

    @Test
    @DisplayName("An explicit project description is kept and a missing budget stays unknown")
    void explicitDescription() {
        final Proposer gig = factory.create(new PreferenceRequest("Director", "Music video", null, null, null,
                null, null, null, "Short music video in a vintage look", true, null, null));

        assertThat(gig.brief()).isEqualTo("Short music video in a vintage look");
        assertThat(gig.budget()).isNull();
        assertThat(gig.isRemoteTolerant()).isTrue();
    }

    @Test
    @DisplayName("Rejects preferences without profession and category")
    void rejectsEmptyPreferences() {
        assertThatThrownBy(() -> factory.create(preferences(null, "  ", null, null, null, false)))
                .isInstanceOf(InvalidSpecificationException.class);
    }

    @Test
    @DisplayName("Rejects inverted budgets and unknown experience levels")
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> factory.create(preferences("Photographer", null, 5000, 1000, null, false)))
                .isInstanceOf(InvalidSpecificationException.class);
        assertThatThrownBy(() -> factory.create(preferences("Photographer", null, null, null, "legendary", false)))
                .isInstanceOf(InvalidSpecificationException.class);
    }

    @Test
    @DisplayName("Retrieval criteria ask for three times the limit")
    void criteria() {
        final CandidateCriteria criteria = factory.criteria(
                preferences("Photographer", "Wedding", 8000, 12000, "intermediate", false), 10);

        assertThat(criteria.category()).isEqualTo("Photographer");
        assertThat(criteria.city()).isEqualTo("Pune");
        assertThat(criteria.minBudget()).isEqualTo(8000);
        assertThat(criteria.maxBudget()).isEqualTo(12000);
        assertThat(criteria.minExperienceYears()).isEqualTo(2);
        assertThat(criteria.minRating()).isEqualTo(4.0);
        assertThat(criteria.requireAvailability()).isTrue();
        assertThat(criteria.limit()).isEqualTo(30);
    }

    @Test
    @DisplayName("Experience levels map to minimum years")
    void experienceLevels() {
        assertThat(factory.criteria(preferences("Photographer", null, null, null, "basic", true), 1).minExperienceYears())
                .isZero();
        assertThat(factory.criteria(preferences("Photographer", null, null, null, "expert", true), 1).minExperienceYears())
                .isEqualTo(5);
        assertThat(factory.criteria(preferences("Photographer", null, null, null, null, true), 1).minExperienceYears())
                .isNull();
        assertThat(factory.criteria(preferences("Photographer", null, null, null, null, true), 1).requireAvailability())
                .isFalse();
    }
}
