package de.mirkosertic.talentmatch.dto;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;

/**
 * Free-form preferences of a client who has not posted a gig yet. Turned into a
 * virtual proposer before matching.
 */
public record PreferenceRequest(
        @Nullable String profession,
        @Nullable String category,
        @Nullable Integer budgetMin,
        @Nullable Integer budgetMax,
        @Nullable String location,
        List<String> requiredSkills,
        List<String> styleTags,
        @Nullable String experienceLevel,
        @Nullable String projectDescription,
        boolean remote,
        @Nullable LocalDate startDate,
        @Nullable Double minRating
) {

    public PreferenceRequest {
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
        styleTags = styleTags == null ? List.of() : List.copyOf(styleTags);
    }
}
