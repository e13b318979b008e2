package de.mirkosertic.talentmatch.orchestration;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Stability {

    GUARANTEED("guaranteed"),
    NOT_GUARANTEED("not-guaranteed");

    private final String value;

    Stability(final String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
