package com.expansion.leads.enrichment;

/**
 * An anchor found on a fetched page.
 *
 * @param href absolute URL
 * @param text anchor text
 */
public record PageLink(String href, String text) {

    public PageLink {
        href = href != null ? href : "";
        text = text != null ? text : "";
    }
}
