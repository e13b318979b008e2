package de.mirkosertic.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The scoring path that produced a {@link ScoreBreakdown}.
 */
public enum ScoringAlgorithm {

    /** Rule-based and semantic points combined. */
    HYBRID("hybrid"),
    /** Rule-based points only, semantic scoring switched off or unavailable. */
    RULE_ONLY("rule-only"),
    /** Scoring of the pair failed and a neutral substitute was used. */
    NEUTRAL_FALLBACK("neutral-fallback");

    private final String tag;

    ScoringAlgorithm(final String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
