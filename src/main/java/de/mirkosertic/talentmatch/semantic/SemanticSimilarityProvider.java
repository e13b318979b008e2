package de.mirkosertic.talentmatch.semantic;

import java.util.List;

/**
 * Contract for an external text-similarity service.
 * <p>
 * Scores lie in [0, 1]. Implementations may block; callers run them with a timeout
 * and treat every failure as unavailability.
 */
public interface SemanticSimilarityProvider {

    double textSimilarity(String left, String right) throws ScoringProviderUnavailableException;

    /**
     * Compares two tag sets. The default compares the comma-joined tags as text.
     */
    default double tagSimilarity(final List<String> left, final List<String> right) throws ScoringProviderUnavailableException {
        return textSimilarity(String.join(", ", left), String.join(", ", right));
    }

    boolean isAvailable();

    String getName();
}
