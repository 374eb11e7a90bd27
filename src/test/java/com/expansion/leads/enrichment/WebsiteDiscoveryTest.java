package com.expansion.leads.enrichment;

import com.expansion.leads.config.EnrichmentConfig;
import com.expansion.leads.metrics.NoOpMetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WebsiteDiscovery Tests")
class WebsiteDiscoveryTest {

    private final EnrichmentConfig config = EnrichmentConfig.builder()
            .searchSleep(Duration.ofMillis(1200))
            .maxCandidates(2)
            .build();
    private final DomainDenyList denyList = new DomainDenyList(config.getDenyDomains());
    private final List<Duration> sleeps = new ArrayList<>();
    private final List<String> queries = new ArrayList<>();

    private WebsiteDiscovery discovery(List<SearchResult> results, EnrichmentBudget budget) {
        SearchClient search = (query, locale) -> {
            queries.add(query + " @" + locale);
            return results;
        };
        return new WebsiteDiscovery(search, config, denyList, budget, sleeps::add, new NoOpMetricsService());
    }

    private static EnrichmentTarget target(String name) {
        return new EnrichmentTarget("NAME::x::", name, "", "EC1A 1BB", "London");
    }

    @Test
    void discover_ranksOfficialSiteFirst() {
        List<SearchResult> results = List.of(
                new SearchResult("Globex blog", "https://globex.wordpress.com/post", "Globex news"),
                new SearchResult("Globex Ltd - Contact", "https://www.globex.co.uk/contact", "Globex Ltd London"),
                new SearchResult("GLOBEX LTD company profile", "https://www.companydirectory.io/globex",
                        "Directors and filings"));

        DiscoveryResult result = discovery(results, new EnrichmentBudget(5)).discover(target("Globex Ltd"));

        assertFalse(result.budgetExhausted());
        assertEquals(List.of("https://www.globex.co.uk", "https://globex.wordpress.com"), result.candidates());
    }

    @Test
    void discover_dedupesSchemesByHost() {
        List<SearchResult> results = List.of(
                new SearchResult("Globex", "http://globex.com/", ""),
                new SearchResult("Globex Ltd", "https://globex.com/about", "Globex Ltd"));

        DiscoveryResult result = discovery(results, new EnrichmentBudget(5)).discover(target("Globex Ltd"));

        assertEquals(List.of("https://globex.com"), result.candidates());
    }

    @Test
    void discover_dropsDeniedDomains() {
        List<SearchResult> results = List.of(
                new SearchResult("Globex | LinkedIn", "https://uk.linkedin.com/company/globex", "Globex Ltd"),
                new SearchResult("Globex", "https://www.gov.uk/globex", "Globex Ltd"));

        assertTrue(discovery(results, new EnrichmentBudget(5)).discover(target("Globex Ltd")).candidates().isEmpty());
    }

    @Test
    void discover_queryIncludesLocalityAndPostcode() {
        discovery(List.of(), new EnrichmentBudget(5)).discover(target("Globex Ltd"));

        assertEquals(List.of("\"Globex Ltd\" official website London EC1A 1BB @United Kingdom"), queries);
    }

    @Test
    void discover_sleepsBetweenCallsOnly() {
        WebsiteDiscovery discovery = discovery(List.of(), new EnrichmentBudget(5));

        discovery.discover(target("Globex Ltd"));
        assertTrue(sleeps.isEmpty());

        discovery.discover(target("Initech Ltd"));
        discovery.discover(target("Umbrella Ltd"));
        assertEquals(List.of(Duration.ofMillis(1200), Duration.ofMillis(1200)), sleeps);
    }

    @Test
    void discover_budgetExhausted() {
        EnrichmentBudget budget = new EnrichmentBudget(0);

        DiscoveryResult result = discovery(List.of(), budget).discover(target("Globex Ltd"));

        assertTrue(result.budgetExhausted());
        assertTrue(queries.isEmpty());
    }

    @Test
    void discover_blankNameSpendsNothing() {
        EnrichmentBudget budget = new EnrichmentBudget(1);

        DiscoveryResult result = discovery(List.of(), budget).discover(target(""));

        assertTrue(result.candidates().isEmpty());
        assertFalse(result.budgetExhausted());
        assertEquals(0, budget.used());
    }
}
