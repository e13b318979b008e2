package de.mirkosertic.talentmatch.matching;

import java.util.List;

/**
 * Outcome of a stability check.
 */
public record StabilityReport(boolean stable, List<BlockingPair> blockingPairs) {

    public StabilityReport {
        blockingPairs = List.copyOf(blockingPairs);
    }

    public int totalBlockingPairs() {
        return blockingPairs.size();
    }
}
