package de.mirkosertic.talentmatch.semantic;

/**
 * What a similarity request compares.
 */
public enum SimilarityKind {
    TEXT,
    TAGS
}
