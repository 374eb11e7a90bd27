package com.expansion.leads.config;

/**
 * Identity resolver settings.
 *
 * @param matchThreshold     minimum confidence (0-100) for a candidate to count as a match
 * @param localityBonus      added when the locality hint appears in the candidate address snippet
 * @param activeStatusBonus  added when the candidate status is "active"
 * @param maxQueryVariants   maximum search variants issued per name
 * @param resultsPerQuery    results requested per search
 * @param cacheMaxSize       in-run resolution cache capacity
 */
public record ResolverConfig(
        int matchThreshold,
        int localityBonus,
        int activeStatusBonus,
        int maxQueryVariants,
        int resultsPerQuery,
        int cacheMaxSize
) {
    public ResolverConfig {
        if (matchThreshold < 1 || matchThreshold > 100) {
            throw new IllegalArgumentException("matchThreshold must be between 1 and 100");
        }
        if (localityBonus < 0 || activeStatusBonus < 0) {
            throw new IllegalArgumentException("Resolver bonuses must be >= 0");
        }
        if (maxQueryVariants < 1 || maxQueryVariants > 4) {
            throw new IllegalArgumentException("maxQueryVariants must be between 1 and 4");
        }
        if (resultsPerQuery < 1) {
            throw new IllegalArgumentException("resultsPerQuery must be > 0");
        }
        if (cacheMaxSize < 1) {
            throw new IllegalArgumentException("cacheMaxSize must be > 0");
        }
    }

    public static ResolverConfig defaults() {
        return new ResolverConfig(72, 8, 3, 4, 12, 5_000);
    }
}
