package com.expansion.leads.enrichment;

import java.util.List;

/**
 * Stage A outcome: ranked candidate base URLs, or the reason there are none.
 */
public record DiscoveryResult(List<String> candidates, boolean budgetExhausted) {

    public DiscoveryResult {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public static DiscoveryResult budgetSkipped() {
        return new DiscoveryResult(List.of(), true);
    }

    public static DiscoveryResult of(List<String> candidates) {
        return new DiscoveryResult(candidates, false);
    }
}
