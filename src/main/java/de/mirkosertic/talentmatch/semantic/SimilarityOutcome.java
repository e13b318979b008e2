package de.mirkosertic.talentmatch.semantic;

import de.mirkosertic.talentmatch.model.SemanticSource;

/**
 * Result of one similarity request.
 *
 * @param score  similarity in [0, 1]; 0 when {@code source} is UNAVAILABLE
 * @param source where the score came from
 */
public record SimilarityOutcome(double score, SemanticSource source) {

    public SimilarityOutcome {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Similarity out of range: " + score);
        }
    }

    public static SimilarityOutcome provider(final double score) {
        return new SimilarityOutcome(clamp(score), SemanticSource.PROVIDER);
    }

    public static SimilarityOutcome heuristic(final double score) {
        return new SimilarityOutcome(clamp(score), SemanticSource.HEURISTIC);
    }

    public static SimilarityOutcome unavailable() {
        return new SimilarityOutcome(0.0, SemanticSource.UNAVAILABLE);
    }

    public boolean isAvailable() {
        return source != SemanticSource.UNAVAILABLE;
    }

    private static double clamp(final double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
