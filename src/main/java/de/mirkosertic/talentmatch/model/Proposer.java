package de.mirkosertic.talentmatch.model;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;

/**
 * The proposing side of a match: a gig, or a virtual gig synthesized from
 * free-form preferences. Read-only for the duration of a matching run.
 */
public record Proposer(
        String id,
        @Nullable String title,
        @Nullable String category,
        @Nullable String city,
        @Nullable String region,
        boolean remote,
        @Nullable BudgetRange budget,
        @Nullable ExperienceBand experienceBand,
        List<String> skillTags,
        List<String> styleTags,
        @Nullable String brief,
        @Nullable LocalDate startDate
) {

    public Proposer {
        skillTags = skillTags == null ? List.of() : List.copyOf(skillTags);
        styleTags = styleTags == null ? List.of() : List.copyOf(styleTags);
    }

    /**
     * Remote-tolerant proposers either say so explicitly or name "Remote" as their city.
     */
    public boolean isRemoteTolerant() {
        return remote || city != null && "remote".equalsIgnoreCase(city.trim());
    }

    /**
     * Text describing what the proposer is looking for, used for semantic comparison.
     */
    public String briefText() {
        final StringBuilder text = new StringBuilder();
        if (title != null) {
            text.append(title);
        }
        if (brief != null) {
            text.append(' ').append(brief);
        }
        return text.toString().trim();
    }
}
