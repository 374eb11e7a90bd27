package com.expansion.leads.cache;

import com.expansion.leads.resolution.ResolutionResult;

import java.util.Optional;

/**
 * Used when the resolver is built without a cache: every sponsor row goes to the registry.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<ResolutionResult> get(String normalizedName, String locality) {
        return Optional.empty();
    }

    @Override
    public void put(String normalizedName, String locality, ResolutionResult result) {
        // nothing kept between rows
    }

    @Override
    public void invalidateAll() {
        // nothing to drop
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
