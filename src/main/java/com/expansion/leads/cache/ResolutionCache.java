package com.expansion.leads.cache;

import com.expansion.leads.resolution.ResolutionResult;

import java.util.Optional;

/**
 * In-run cache of identity resolution outcomes, keyed by normalized name + locality.
 * No-match outcomes are cached too so a repeated name does not repeat its searches.
 */
public interface ResolutionCache {

    Optional<ResolutionResult> get(String normalizedName, String locality);

    void put(String normalizedName, String locality, ResolutionResult result);

    void invalidateAll();

    CacheStats getStats();
}
