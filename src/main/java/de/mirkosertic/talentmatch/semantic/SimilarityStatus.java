package de.mirkosertic.talentmatch.semantic;

/**
 * Health snapshot of the similarity service.
 *
 * @param providerName      name of the configured provider, or "none"
 * @param providerAvailable whether the provider currently reports itself available
 * @param heuristicFallback whether failures fall back to the lexical heuristic
 * @param cacheHits         cache hits since start
 * @param cacheMisses       cache misses since start
 * @param cacheSize         current number of cached similarities
 * @param hitRate           hit rate in percent
 * @param providerFailures  provider calls that failed
 * @param providerTimeouts  provider calls that timed out
 */
public record SimilarityStatus(
        String providerName,
        boolean providerAvailable,
        boolean heuristicFallback,
        long cacheHits,
        long cacheMisses,
        long cacheSize,
        double hitRate,
        long providerFailures,
        long providerTimeouts
) {
}
