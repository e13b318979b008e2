package de.mirkosertic.talentmatch.semantic;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;

/**
 * Similarity provider backed by a text embedding model.
 * <p>
 * Scores are the cosine similarity of the two embeddings; negative values are
 * clamped to 0. Any failure of the model is reported as
 * {@link ScoringProviderUnavailableException}.
 */
public class EmbeddingSimilarityProvider implements SemanticSimilarityProvider {

    private final EmbeddingModel embeddingModel;
    private final String modelName;

    public EmbeddingSimilarityProvider(final EmbeddingModel embeddingModel, final String modelName) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
    }

    @Override
    public double textSimilarity(final String left, final String right) throws ScoringProviderUnavailableException {
        if (left == null || right == null || left.isBlank() || right.isBlank()) {
            return 0.0;
        }
        final Embedding leftEmbedding = embed(left);
        final Embedding rightEmbedding = embed(right);
        if (leftEmbedding.dimension() != rightEmbedding.dimension()) {
            throw new ScoringProviderUnavailableException("Embedding dimensions differ: "
                    + leftEmbedding.dimension() + " vs " + rightEmbedding.dimension());
        }
        final double cosine = CosineSimilarity.between(leftEmbedding, rightEmbedding);
        if (Double.isNaN(cosine)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    private Embedding embed(final String text) throws ScoringProviderUnavailableException {
        try {
            final Embedding embedding = embeddingModel.embed(text).content();
            if (embedding == null) {
                throw new ScoringProviderUnavailableException("Embedding model " + modelName + " returned no embedding");
            }
            return embedding;
        } catch (final RuntimeException e) {
            throw new ScoringProviderUnavailableException("Embedding model " + modelName + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        return embeddingModel != null;
    }

    @Override
    public String getName() {
        return "embedding:" + modelName;
    }
}
