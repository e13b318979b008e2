package de.mirkosertic.talentmatch.matching;

/**
 * A proposer and reviewer, not matched to each other, who both prefer each other
 * over their current assignment.
 */
public record BlockingPair(String proposerId, String reviewerId) {
}
