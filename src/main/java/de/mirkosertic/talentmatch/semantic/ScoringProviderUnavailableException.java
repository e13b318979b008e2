package de.mirkosertic.talentmatch.semantic;

/**
 * Thrown by a {@link SemanticSimilarityProvider} that cannot answer a similarity query.
 * Always recoverable: callers degrade to the lexical heuristic or to a zero semantic score.
 */
public class ScoringProviderUnavailableException extends Exception {

    public ScoringProviderUnavailableException(final String message) {
        super(message);
    }

    public ScoringProviderUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
