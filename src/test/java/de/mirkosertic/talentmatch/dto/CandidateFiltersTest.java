package de.mirkosertic.talentmatch.dto;

import de.mirkosertic.talentmatch.model.BudgetRange;
import de.mirkosertic.talentmatch.model.Reviewer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CandidateFilters Tests")
class CandidateFiltersTest {

    private static Reviewer reviewer(final String id, final String city, final Integer years,
                                     final Integer budgetMin, final Double rating, final String category) {
        return new Reviewer(id, null, city, null, years,
                budgetMin == null ? null : BudgetRange.between(budgetMin, budgetMin + 5000),
                List.of(category), List.of(), List.of(), List.of(), rating, null);
    }

    @Test
    @DisplayName("No filter keeps every reviewer in order")
    void noFilter() {
        final List<Reviewer> pool = List.of(
                reviewer("a", "Mumbai", 3, 1000, 4.0, "Photographer"),
                reviewer("b", null, null, null, null, "Stylist"));

        assertThat(CandidateFilters.none().apply(pool)).containsExactlyElementsOf(pool);
    }

    @Test
    @DisplayName("City matches case-insensitively by substring")
    void cityFilter() {
        final CandidateFilters filters = new CandidateFilters("mumbai", null, null, List.of(), null);

        assertThat(filters.matches(reviewer("a", "Navi Mumbai", 3, 1000, 4.0, "Photographer"))).isTrue();
        assertThat(filters.matches(reviewer("b", "Pune", 3, 1000, 4.0, "Photographer"))).isFalse();
        assertThat(filters.matches(reviewer("c", null, 3, 1000, 4.0, "Photographer"))).isFalse();
    }

    @Test
    @DisplayName("Maximum budget is compared against the reviewer's minimum")
    void budgetFilter() {
        final CandidateFilters filters = new CandidateFilters(null, 5000, null, List.of(), null);

        assertThat(filters.matches(reviewer("a", "Pune", 3, 5000, 4.0, "Photographer"))).isTrue();
        assertThat(filters.matches(reviewer("b", "Pune", 3, 6000, 4.0, "Photographer"))).isFalse();
        assertThat(filters.matches(reviewer("c", "Pune", 3, null, 4.0, "Photographer"))).isTrue();
    }

    @Test
    @DisplayName("Unknown experience fails the experience filter")
    void experienceFilter() {
        final CandidateFilters filters = new CandidateFilters(null, null, 3, List.of(), null);

        assertThat(filters.matches(reviewer("a", "Pune", 3, 1000, 4.0, "Photographer"))).isTrue();
        assertThat(filters.matches(reviewer("b", "Pune", 2, 1000, 4.0, "Photographer"))).isFalse();
        assertThat(filters.matches(reviewer("c", "Pune", null, 1000, 4.0, "Photographer"))).isFalse();
    }

    @Test
    @DisplayName("Unknown rating counts as four stars")
    void ratingFilter() {
        assertThat(new CandidateFilters(null, null, null, List.of(), 4.0)
                .matches(reviewer("a", "Pune", 3, 1000, null, "Photographer"))).isTrue();
        assertThat(new CandidateFilters(null, null, null, List.of(), 4.5)
                .matches(reviewer("a", "Pune", 3, 1000, null, "Photographer"))).isFalse();
    }

    @Test
    @DisplayName("Any requested category may match by substring")
    void categoryFilter() {
        final CandidateFilters filters = new CandidateFilters(null, null, null, List.of("Stylist", "Photo"), null);

        assertThat(filters.matches(reviewer("a", "Pune", 3, 1000, 4.0, "Wedding Photographer"))).isTrue();
        assertThat(filters.matches(reviewer("b", "Pune", 3, 1000, 4.0, "Animator"))).isFalse();
    }
}
