package com.expansion.leads.cache;

import com.expansion.leads.resolution.ResolutionResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Caffeine-backed resolution cache. Entries live for the lifetime of the cache instance,
 * which is one run; durable reuse goes through the state store's sponsor mapping.
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<CacheKey, ResolutionResult> cache;

    public CaffeineResolutionCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
        log.debug("CaffeineResolutionCache initialized: maxSize={}", maxSize);
    }

    @Override
    public Optional<ResolutionResult> get(String normalizedName, String locality) {
        return Optional.ofNullable(cache.getIfPresent(CacheKey.of(normalizedName, locality)));
    }

    @Override
    public void put(String normalizedName, String locality, ResolutionResult result) {
        cache.put(CacheKey.of(normalizedName, locality), result);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(caffeineStats.hitCount(), caffeineStats.missCount(), cache.estimatedSize());
    }

    /**
     * Cache key combining normalized name and lower-cased locality.
     */
    record CacheKey(String normalizedName, String locality) {
        static CacheKey of(String normalizedName, String locality) {
            return new CacheKey(
                    normalizedName != null ? normalizedName : "",
                    locality != null ? locality.trim().toLowerCase(Locale.ROOT) : "");
        }
    }
}
