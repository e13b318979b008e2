package de.mirkosertic.talentmatch.dto;

import de.mirkosertic.talentmatch.matching.SolverDescription;
import de.mirkosertic.talentmatch.orchestration.MatchAlgorithm;
import de.mirkosertic.talentmatch.semantic.SimilarityStatus;

import java.util.List;
import java.util.Map;

/**
 * Description of the matching engine: version, algorithms, fallback chain,
 * effective configuration and similarity service health.
 */
public record AlgorithmInfo(
        String name,
        String version,
        String buildTimestamp,
        Map<String, String> algorithms,
        List<MatchAlgorithm> fallbackChain,
        SolverDescription stableMatching,
        Map<String, Object> configuration,
        SimilarityStatus similarity
) {
}
