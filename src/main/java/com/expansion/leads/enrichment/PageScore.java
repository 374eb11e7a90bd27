package com.expansion.leads.enrichment;

import java.util.List;

/**
 * Verification score of a single page, 0 to 10, with the evidence behind it.
 */
public record PageScore(int score, List<String> evidence) {

    public PageScore {
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public static PageScore zero() {
        return new PageScore(0, List.of());
    }
}
