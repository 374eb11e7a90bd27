package com.expansion.leads.cache;

/**
 * Snapshot of resolver cache activity for one run. A hit is a sponsor row whose name and locality
 * were already resolved (or already failed to resolve) earlier in the same run.
 */
public record CacheStats(long hits, long misses, long entries) {

    private static final CacheStats EMPTY = new CacheStats(0, 0, 0);

    public static CacheStats empty() {
        return EMPTY;
    }

    public long lookups() {
        return hits + misses;
    }

    /** Share of lookups answered without a registry search, 0.0 when nothing was looked up. */
    public double hitRate() {
        return lookups() == 0 ? 0.0 : (double) hits / lookups();
    }

    @Override
    public String toString() {
        return String.format("hits=%d misses=%d entries=%d hitRate=%.2f", hits, misses, entries, hitRate());
    }
}
