package com.expansion.leads.core.model;

/**
 * One result of a free-text registry search.
 */
public record RegistrySearchHit(
        String title,
        String identifier,
        String status,
        String addressSnippet
) {
    public RegistrySearchHit {
        title = title != null ? title : "";
        identifier = identifier != null ? identifier : "";
        status = status != null ? status : "";
        addressSnippet = addressSnippet != null ? addressSnippet : "";
    }
}
