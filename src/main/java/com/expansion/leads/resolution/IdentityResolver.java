package com.expansion.leads.resolution;

import com.expansion.leads.cache.CacheStats;
import com.expansion.leads.cache.NoOpResolutionCache;
import com.expansion.leads.cache.ResolutionCache;
import com.expansion.leads.config.ResolverConfig;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.core.model.RegistrySearchHit;
import com.expansion.leads.metrics.MetricsService;
import com.expansion.leads.metrics.NoOpMetricsService;
import com.expansion.leads.rules.TextNormalizer;
import com.expansion.leads.similarity.NameSimilarity;
import com.expansion.leads.similarity.TokenSetSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a free-text organisation name to a registry identifier.
 *
 * <p>Each query variant is searched in turn. Every candidate is scored once, by identifier:
 * token-set similarity of the normalized names, plus a bonus when the locality hint appears
 * in the candidate's address and a smaller one when the company is active, capped at 100.
 * The best candidate is returned only when it reaches the configured threshold; anything
 * weaker is reported as {@link ResolutionResult#noMatch()}.</p>
 *
 * <p>A failed search for one variant is logged and the remaining variants are still tried.
 * Only when every variant failed and nothing was scored does the failure propagate.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final RegistryClient registry;
    private final ResolverConfig config;
    private final TextNormalizer normalizer;
    private final NameSimilarity similarity;
    private final QueryVariants queryVariants;
    private final ResolutionCache cache;
    private final MetricsService metrics;

    public IdentityResolver(RegistryClient registry, ResolverConfig config, TextNormalizer normalizer) {
        this(registry, config, normalizer, new NoOpResolutionCache(), new NoOpMetricsService());
    }

    public IdentityResolver(RegistryClient registry, ResolverConfig config, TextNormalizer normalizer,
                            ResolutionCache cache, MetricsService metrics) {
        this.registry = registry;
        this.config = config;
        this.normalizer = normalizer;
        this.similarity = new TokenSetSimilarity();
        this.queryVariants = new QueryVariants(normalizer);
        this.cache = cache;
        this.metrics = metrics;
    }

    public CacheStats cacheStats() {
        return cache.getStats();
    }

    /**
     * Resolves with the configured threshold.
     */
    public ResolutionResult resolve(String name, String locality) {
        return resolve(name, locality, config.matchThreshold());
    }

    /**
     * Resolves {@code name}, returning a match only if its confidence is at least {@code threshold}.
     */
    public ResolutionResult resolve(String name, String locality, int threshold) {
        String normalizedName = normalizer.entityNormalize(name);
        if (normalizedName.isEmpty()) {
            return ResolutionResult.noMatch();
        }

        Optional<ResolutionResult> cached = cache.get(normalizedName + "#" + threshold, locality);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();

        String localityUpper = normalizer.collapse(locality).toUpperCase(Locale.ROOT);
        Set<String> scored = new HashSet<>();
        String bestId = "";
        String bestTitle = "";
        int bestScore = 0;
        UpstreamException lastFailure = null;
        int failures = 0;

        List<String> queries = queryVariants.generate(name, locality, config.maxQueryVariants());
        for (String query : queries) {
            List<RegistrySearchHit> hits;
            try {
                hits = registry.search(query, config.resultsPerQuery());
            } catch (UpstreamException e) {
                log.warn("resolver.search.failed query='{}' status={}: {}", query, e.getStatus(), e.getMessage());
                lastFailure = e;
                failures++;
                continue;
            }

            for (RegistrySearchHit hit : hits) {
                if (hit.title().isEmpty() || hit.identifier().isEmpty() || !scored.add(hit.identifier())) {
                    continue;
                }
                int score = scoreCandidate(normalizedName, localityUpper, hit);
                log.trace("resolver.candidate id={} title='{}' score={}", hit.identifier(), hit.title(), score);
                if (score > bestScore) {
                    bestScore = score;
                    bestId = hit.identifier();
                    bestTitle = hit.title();
                }
            }
        }

        if (lastFailure != null && failures == queries.size()) {
            throw lastFailure;
        }

        metrics.recordResolutionScore(bestScore);
        ResolutionResult result = bestScore >= threshold && !bestId.isEmpty()
                ? new ResolutionResult(bestId, bestScore, bestTitle)
                : ResolutionResult.noMatch();
        log.debug("resolver.done name='{}' best={} score={} matched={}",
                name, bestId, bestScore, result.isMatch());

        if (failures == 0) {
            cache.put(normalizedName + "#" + threshold, locality, result);
        }
        return result;
    }

    int scoreCandidate(String normalizedName, String localityUpper, RegistrySearchHit hit) {
        int score = similarity.ratio(normalizedName, normalizer.entityNormalize(hit.title()));
        if (!localityUpper.isEmpty()
                && hit.addressSnippet().toUpperCase(Locale.ROOT).contains(localityUpper)) {
            score += config.localityBonus();
        }
        if ("active".equalsIgnoreCase(hit.status().trim())) {
            score += config.activeStatusBonus();
        }
        return Math.min(100, score);
    }
}
