package de.mirkosertic.talentmatch.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A talent profile on the reviewing side of a match. Read-only for the duration
 * of a matching run.
 */
public record Reviewer(
        String id,
        @Nullable String name,
        @Nullable String city,
        @Nullable String region,
        @Nullable Integer experienceYears,
        @Nullable BudgetRange budget,
        List<String> categories,
        List<String> skillTags,
        List<String> styleTags,
        List<AvailabilityWindow> availability,
        @Nullable Double rating,
        @Nullable String profileText
) {

    public Reviewer {
        categories = categories == null ? List.of() : List.copyOf(categories);
        skillTags = skillTags == null ? List.of() : List.copyOf(skillTags);
        styleTags = styleTags == null ? List.of() : List.copyOf(styleTags);
        availability = availability == null ? List.of() : List.copyOf(availability);
    }

    /**
     * Text describing the profile: name, bio and skills.
     */
    public String profileDescription() {
        final StringBuilder text = new StringBuilder();
        if (name != null) {
            text.append(name);
        }
        if (profileText != null) {
            text.append(' ').append(profileText);
        }
        if (!skillTags.isEmpty()) {
            text.append(' ').append(String.join(" ", skillTags));
        }
        return text.toString().trim();
    }
}
