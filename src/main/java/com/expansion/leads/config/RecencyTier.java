package com.expansion.leads.config;

/**
 * Points awarded when an entity registered at most {@code maxDays} days before the run.
 */
public record RecencyTier(int maxDays, int points) {

    public RecencyTier {
        if (maxDays < 0) {
            throw new IllegalArgumentException("maxDays must be >= 0");
        }
        if (points < 0) {
            throw new IllegalArgumentException("points must be >= 0");
        }
    }
}
