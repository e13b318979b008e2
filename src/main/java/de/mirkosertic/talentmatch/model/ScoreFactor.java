package de.mirkosertic.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The factors contributing points to a compatibility score.
 */
public enum ScoreFactor {

    LOCATION("location", "Location compatibility", false),
    BUDGET("budget", "Budget alignment", false),
    SKILLS("skills", "Skills match", false),
    EXPERIENCE("experience", "Experience level", false),
    AVAILABILITY("availability", "Availability", false),
    STYLE_OVERLAP("styleOverlap", "Style overlap", false),
    RATING("rating", "Rating", false),
    STYLE_SIMILARITY("styleSimilarity", "Style similarity", true),
    SEMANTIC_MATCH("semanticMatch", "Brief and profile match", true);

    private final String key;
    private final String label;
    private final boolean semantic;

    ScoreFactor(final String key, final String label, final boolean semantic) {
        this.key = key;
        this.label = label;
        this.semantic = semantic;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSemantic() {
        return semantic;
    }
}
