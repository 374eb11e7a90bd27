package com.expansion.leads.enrichment;

import com.expansion.leads.core.model.VerificationLevel;

import java.util.List;

/**
 * Stage B outcome for the best candidate, with the pages fetched from it.
 *
 * @param website  best candidate base URL, or empty when no candidate could be fetched
 * @param level    verification level reached
 * @param score    best verification score across the candidate's pages
 * @param evidence deduplicated evidence
 * @param pages    pages fetched from the best candidate, homepage first
 */
public record VerificationOutcome(String website, VerificationLevel level, int score, List<String> evidence,
                                  List<PageFetchResult> pages) {

    public VerificationOutcome {
        website = website != null ? website : "";
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        pages = pages != null ? List.copyOf(pages) : List.of();
    }

    public static VerificationOutcome nothingFetched() {
        return new VerificationOutcome("", VerificationLevel.NONE, 0, List.of(), List.of());
    }

    public boolean hasWebsite() {
        return !website.isEmpty();
    }
}
