package com.expansion.leads.enrichment;

import com.expansion.leads.config.EnrichmentConfig;
import com.expansion.leads.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stage A: one budgeted search biased toward the official site, then heuristic ranking of results.
 *
 * <p>The budget is checked before the call is issued. Between consecutive search calls the
 * configured pause is applied; page fetches are not throttled.</p>
 */
public class WebsiteDiscovery {
    private static final Logger log = LoggerFactory.getLogger(WebsiteDiscovery.class);

    private static final int REJECT = -999;
    private static final List<String> CORPORATE_PATHS = List.of("/careers", "/jobs", "/contact", "/about");
    private static final List<String> DIRECTORY_LANGUAGE = List.of(
            "company profile", "company information", "companies house", "director", "filings");
    private static final List<String> BLOG_PLATFORMS = List.of("wordpress.com", "blogspot.", "wixsite.");

    private final SearchClient searchClient;
    private final EnrichmentConfig config;
    private final DomainDenyList denyList;
    private final EnrichmentBudget budget;
    private final Sleeper sleeper;
    private final MetricsService metrics;

    public WebsiteDiscovery(SearchClient searchClient, EnrichmentConfig config, DomainDenyList denyList,
                            EnrichmentBudget budget, Sleeper sleeper, MetricsService metrics) {
        this.searchClient = searchClient;
        this.config = config;
        this.denyList = denyList;
        this.budget = budget;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    /**
     * @throws com.expansion.leads.core.UpstreamException if the search call fails
     */
    public DiscoveryResult discover(EnrichmentTarget target) {
        if (target.name().isEmpty()) {
            return DiscoveryResult.of(List.of());
        }
        if (!budget.tryConsume()) {
            metrics.incrementBudgetSkip();
            log.info("enrichment.skipped reason=budget used={} cap={}", budget.used(), budget.cap());
            return DiscoveryResult.budgetSkipped();
        }
        if (budget.used() > 1) {
            sleeper.sleep(config.getSearchSleep());
        }

        String query = buildQuery(target);
        metrics.incrementSearchCall();
        List<SearchResult> results = searchClient.query(query, config.getSearchLocale());
        log.debug("discovery.search query='{}' results={}", query, results.size());

        Map<String, Integer> best = new LinkedHashMap<>();
        for (SearchResult result : results) {
            if (result.link().isEmpty() || denyList.isDenied(result.link())) {
                continue;
            }
            String base = UrlUtils.baseUrl(result.link());
            if (base.isEmpty() || denyList.isDenied(base)) {
                continue;
            }
            int score = scoreCandidate(result, target.name());
            if (score <= -100) {
                continue;
            }
            best.merge(base, score, Math::max);
        }

        // Dedupe by host: http and https variants of one site collapse to the higher score.
        Map<String, Map.Entry<String, Integer>> byHost = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : best.entrySet()) {
            String host = UrlUtils.host(entry.getKey());
            Map.Entry<String, Integer> existing = byHost.get(host);
            if (existing == null || entry.getValue() > existing.getValue()) {
                byHost.put(host, entry);
            }
        }

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(byHost.values());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        List<String> candidates = ranked.stream()
                .limit(config.getMaxCandidates())
                .map(Map.Entry::getKey)
                .toList();
        log.debug("discovery.candidates {}", candidates);
        return DiscoveryResult.of(candidates);
    }

    String buildQuery(EnrichmentTarget target) {
        StringBuilder q = new StringBuilder("\"").append(target.name()).append("\" official website");
        if (!target.locality().isEmpty()) {
            q.append(' ').append(target.locality());
        }
        if (!target.postcode().isEmpty()) {
            q.append(' ').append(target.postcode());
        }
        return q.toString();
    }

    /**
     * Higher is more likely the official site.
     */
    int scoreCandidate(SearchResult result, String companyName) {
        String url = result.link().toLowerCase(Locale.ROOT);
        String host = UrlUtils.host(result.link());
        if (host.isEmpty() || denyList.isDenied(result.link())) {
            return REJECT;
        }
        String title = result.title().toLowerCase(Locale.ROOT);
        String snippet = result.snippet().toLowerCase(Locale.ROOT);
        String name = companyName.toLowerCase(Locale.ROOT).trim();
        String prefix = name.length() > 6 ? name.substring(0, 6) : name;

        int score = 0;
        if (BLOG_PLATFORMS.stream().anyMatch(host::contains)) {
            score -= 10;
        }
        if (CORPORATE_PATHS.stream().anyMatch(url::contains)) {
            score += 8;
        }
        if (!name.isEmpty()) {
            if (title.contains(prefix)) score += 12;
            if (snippet.contains(prefix)) score += 6;
            if (title.contains(name)) score += 10;
            if (snippet.contains(name)) score += 5;
        }
        if (DIRECTORY_LANGUAGE.stream().anyMatch(title::contains)) {
            score -= 25;
        }
        if (DIRECTORY_LANGUAGE.stream().anyMatch(snippet::contains)) {
            score -= 15;
        }
        if (host.endsWith(".uk")) {
            score += 3;
        }
        return score;
    }
}
