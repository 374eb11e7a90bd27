package com.expansion.leads.enrichment;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks same-site contact, about and legal pages from a page's links.
 */
public class ContactLinkFinder {

    private static final List<String> KEYWORDS = List.of(
            "contact", "about", "privacy", "legal", "imprint", "terms");

    private final int maxLinks;

    public ContactLinkFinder(int maxLinks) {
        this.maxLinks = maxLinks;
    }

    public List<String> find(PageFetchResult page, String siteUrl) {
        Set<String> out = new LinkedHashSet<>();
        String pageUrl = UrlUtils.stripFragment(page.url());
        for (PageLink link : page.links()) {
            if (out.size() >= maxLinks) {
                break;
            }
            String href = UrlUtils.stripFragment(link.href().trim());
            if (href.isEmpty() || !UrlUtils.sameHost(href, siteUrl) || href.equals(pageUrl)) {
                continue;
            }
            String haystack = href.toLowerCase(Locale.ROOT) + " " + link.text().toLowerCase(Locale.ROOT);
            if (KEYWORDS.stream().anyMatch(haystack::contains)) {
                out.add(href);
            }
        }
        return List.copyOf(out);
    }
}
