package de.mirkosertic.talentmatch.orchestration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import de.mirkosertic.talentmatch.model.InvalidSpecificationException;

import java.util.Locale;

/**
 * The caller's algorithm hint.
 */
public enum AlgorithmKind {

    AUTO("auto"),
    STABLE("stable"),
    RANKED("ranked");

    private final String value;

    AlgorithmKind(final String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses a hint. "gale-shapley" is accepted for {@link #STABLE}, "enhanced"
     * and "hybrid" for {@link #RANKED}; null or blank means {@link #AUTO}.
     *
     * @throws InvalidSpecificationException for any other value
     */
    @JsonCreator
    public static AlgorithmKind fromValue(final String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto" -> AUTO;
            case "stable", "gale-shapley" -> STABLE;
            case "ranked", "enhanced", "hybrid" -> RANKED;
            default -> throw new InvalidSpecificationException("Unknown algorithm: " + value);
        };
    }
}
