package com.expansion.leads.store;

import java.time.Instant;
import java.util.Objects;

/**
 * A confident sponsor row to registry number match, reused on later runs without searching.
 */
public record SponsorMapping(String rowKey, String registryNumber, int matchScore, Instant matchedAt) {

    public SponsorMapping {
        Objects.requireNonNull(rowKey, "rowKey is required");
        Objects.requireNonNull(registryNumber, "registryNumber is required");
    }
}
