package de.mirkosertic.talentmatch.semantic;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("EmbeddingSimilarityProvider Tests")
class EmbeddingSimilarityProviderTest {

    private EmbeddingModel model;
    private EmbeddingSimilarityProvider provider;

    @BeforeEach
    void setUp() {
        model = mock(EmbeddingModel.class);
        provider = new EmbeddingSimilarityProvider(model, "test-model");
    }

    private void embeds(final String text, final float... vector) {
        when(model.embed(text)).thenReturn(Response.from(Embedding.from(vector)));
    }

    @Test
    @DisplayName("Should score the cosine similarity of the embeddings")
    void shouldScoreCosineSimilarity() throws Exception {
        embeds("moody portraits", 1.0f, 0.0f);
        embeds("dark portraits", 1.0f, 0.0f);
        embeds("cartoon animation", 0.0f, 1.0f);

        assertThat(provider.textSimilarity("moody portraits", "dark portraits")).isCloseTo(1.0, within(1e-6));
        assertThat(provider.textSimilarity("moody portraits", "cartoon animation")).isCloseTo(0.0, within(1e-6));
    }

    @Test
    @DisplayName("Should clamp negative cosine similarity to 0")
    void shouldClampNegativeSimilarity() throws Exception {
        embeds("bright", 1.0f, 0.0f);
        embeds("dark", -1.0f, 0.0f);

        assertThat(provider.textSimilarity("bright", "dark")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should not call the model for blank input")
    void shouldSkipBlankInput() throws Exception {
        assertThat(provider.textSimilarity(" ", "dark")).isEqualTo(0.0);
        verifyNoInteractions(model);
    }

    @Test
    @DisplayName("Should report differing dimensions as unavailability")
    void shouldRejectDimensionMismatch() {
        embeds("short", 1.0f, 0.0f);
        embeds("long", 1.0f, 0.0f, 0.0f);

        assertThatThrownBy(() -> provider.textSimilarity("short", "long"))
                .isInstanceOf(ScoringProviderUnavailableException.class)
                .hasMessageContaining("dimensions");
    }

    @Test
    @DisplayName("Should wrap model failures")
    void shouldWrapModelFailures() {
        when(model.embed("anything")).thenThrow(new IllegalStateException("quota exceeded"));

        assertThatThrownBy(() -> provider.textSimilarity("anything", "else"))
                .isInstanceOf(ScoringProviderUnavailableException.class)
                .hasMessageContaining("quota exceeded")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should compare tag sets as joined text")
    void shouldCompareTagsAsText() throws Exception {
        embeds("moody, warm", 0.6f, 0.8f);
        embeds("warm", 0.6f, 0.8f);

        assertThat(provider.tagSimilarity(List.of("moody", "warm"), List.of("warm")))
                .isCloseTo(1.0, within(1e-6));
        assertThat(provider.getName()).isEqualTo("embedding:test-model");
    }
}
