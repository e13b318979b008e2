package de.mirkosertic.talentmatch.scoring;

import de.mirkosertic.talentmatch.model.Proposer;
import de.mirkosertic.talentmatch.model.Reviewer;

/**
 * A (proposer, reviewer) combination to score.
 */
public record ScoringPair(Proposer proposer, Reviewer reviewer) {
}
