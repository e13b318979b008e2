package de.mirkosertic.talentmatch.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the semantic part of a score came from.
 */
public enum SemanticSource {

    PROVIDER("provider"),
    HEURISTIC("heuristic"),
    UNAVAILABLE("unavailable"),
    DISABLED("disabled");

    private final String tag;

    SemanticSource(final String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * True if the semantic contribution is not the one the provider would have given.
     */
    public boolean isDegraded() {
        return this != PROVIDER;
    }
}
