package de.mirkosertic.talentmatch.semantic;

import de.mirkosertic.talentmatch.util.TextCleaner;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic similarity heuristic based on token overlap.
 * <p>
 * Text similarity is the Jaccard coefficient of the analyzed token sets, tag
 * similarity the Jaccard coefficient of the lower-cased tag sets. Used whenever
 * the external provider is absent, fails or times out.
 */
public class LexicalSimilarityProvider implements SemanticSimilarityProvider, AutoCloseable {

    private static final String FIELD = "text";

    private final Analyzer analyzer;

    public LexicalSimilarityProvider() {
        this(new ProfileTextAnalyzer());
    }

    public LexicalSimilarityProvider(final Analyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public double textSimilarity(final String left, final String right) {
        return jaccard(tokenize(left), tokenize(right));
    }

    @Override
    public double tagSimilarity(final List<String> left, final List<String> right) {
        return jaccard(normalizeTags(left), normalizeTags(right));
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String getName() {
        return "lexical-overlap";
    }

    Set<String> tokenize(final String text) {
        final Set<String> tokens = new HashSet<>();
        final String cleaned = TextCleaner.clean(text);
        if (cleaned == null || cleaned.isEmpty()) {
            return tokens;
        }
        try (TokenStream stream = analyzer.tokenStream(FIELD, cleaned)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to tokenize text", e);
        }
        return tokens;
    }

    private static Set<String> normalizeTags(final List<String> tags) {
        final Set<String> result = new HashSet<>();
        if (tags != null) {
            for (final String tag : tags) {
                if (tag != null && !tag.isBlank()) {
                    result.add(tag.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return result;
    }

    private static double jaccard(final Set<String> left, final Set<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        final Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        final Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    @Override
    public void close() {
        analyzer.close();
    }
}
