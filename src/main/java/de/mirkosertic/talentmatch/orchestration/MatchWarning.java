package de.mirkosertic.talentmatch.orchestration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Non-fatal conditions reported in the response metadata.
 */
public enum MatchWarning {

    SOLVER_ITERATION_LIMIT_REACHED("solver-iteration-limit-reached"),
    STABILITY_NOT_VERIFIED("stability-not-verified"),
    NEUTRAL_SCORE_SUBSTITUTED("neutral-score-substituted"),
    SEMANTIC_DEGRADED("semantic-degraded"),
    CANDIDATES_TRUNCATED("candidates-truncated"),
    DEADLINE_EXCEEDED("deadline-exceeded");

    private final String value;

    MatchWarning(final String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
