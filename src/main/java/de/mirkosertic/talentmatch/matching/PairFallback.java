package de.mirkosertic.talentmatch.matching;

/**
 * Records that a pair was ranked with a neutral score because scoring it failed.
 */
public record PairFallback(String proposerId, String reviewerId, int substitutedScore, String reason) {
}
