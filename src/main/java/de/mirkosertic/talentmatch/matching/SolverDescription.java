package de.mirkosertic.talentmatch.matching;

import java.util.List;

/**
 * Static facts about the stable matching algorithm.
 */
public record SolverDescription(
        String algorithm,
        String complexity,
        String stability,
        String optimality,
        String truthfulness,
        List<String> references
) {
}
