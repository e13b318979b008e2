package de.mirkosertic.talentmatch.semantic;

import java.util.List;

/**
 * One comparison for the batch similarity contract.
 * For {@link SimilarityKind#TEXT} requests each side holds exactly one element.
 */
public record SimilarityRequest(SimilarityKind kind, List<String> left, List<String> right) {

    public SimilarityRequest {
        left = left == null ? List.of() : List.copyOf(left);
        right = right == null ? List.of() : List.copyOf(right);
    }

    public static SimilarityRequest text(final String left, final String right) {
        return new SimilarityRequest(SimilarityKind.TEXT,
                List.of(left == null ? "" : left), List.of(right == null ? "" : right));
    }

    public static SimilarityRequest tags(final List<String> left, final List<String> right) {
        return new SimilarityRequest(SimilarityKind.TAGS, left, right);
    }

    public String leftText() {
        return left.isEmpty() ? "" : left.get(0);
    }

    public String rightText() {
        return right.isEmpty() ? "" : right.get(0);
    }
}
