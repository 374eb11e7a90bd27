package com.expansion.leads.enrichment;

import java.util.List;
import java.util.Locale;

/**
 * Aggregator, social and registry domains that are never an organisation's official site.
 * A host is denied when it equals a listed domain or is a subdomain of one.
 */
public class DomainDenyList {

    private final List<String> domains;

    public DomainDenyList(List<String> domains) {
        this.domains = domains.stream()
                .map(d -> d.trim().toLowerCase(Locale.ROOT))
                .filter(d -> !d.isEmpty())
                .toList();
    }

    public boolean isDenied(String url) {
        String host = UrlUtils.host(url);
        if (host.isEmpty()) {
            return true;
        }
        for (String domain : domains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }
}
