package de.mirkosertic.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchType {

    RANKED("ranked"),
    STABLE("stable");

    private final String tag;

    MatchType(final String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
