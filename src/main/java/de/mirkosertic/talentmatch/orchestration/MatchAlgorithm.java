package de.mirkosertic.talentmatch.orchestration;

import com.fasterxml.jackson.annotation.JsonValue;
import de.mirkosertic.talentmatch.model.MatchType;

/**
 * The algorithm that actually produced a result.
 */
public enum MatchAlgorithm {

    GALE_SHAPLEY("gale-shapley", MatchType.STABLE),
    HYBRID_RANKED("hybrid-ranked", MatchType.RANKED),
    RULE_ONLY_RANKED("rule-only-ranked", MatchType.RANKED);

    private final String value;
    private final MatchType matchType;

    MatchAlgorithm(final String value, final MatchType matchType) {
        this.value = value;
        this.matchType = matchType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public MatchType getMatchType() {
        return matchType;
    }
}
