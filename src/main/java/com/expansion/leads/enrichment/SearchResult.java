package com.expansion.leads.enrichment;

/**
 * One organic web search result.
 */
public record SearchResult(String title, String link, String snippet) {

    public SearchResult {
        title = title != null ? title : "";
        link = link != null ? link : "";
        snippet = snippet != null ? snippet : "";
    }
}
