package com.expansion.leads.enrichment;

import com.expansion.leads.config.EnrichmentConfig;
import com.expansion.leads.core.model.VerificationLevel;
import com.expansion.leads.rules.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WebsiteVerifier Tests")
class WebsiteVerifierTest {

    private static final EnrichmentTarget ACME = new EnrichmentTarget(
            "12345678", "Acme Robotics Ltd", "12345678", "EC1A 1BB", "London");

    private final EnrichmentConfig config = EnrichmentConfig.defaults();
    private final Map<String, PageFetchResult> pages = new HashMap<>();
    private final List<String> fetched = new ArrayList<>();
    private WebsiteVerifier verifier;

    @BeforeEach
    void setUp() {
        PageFetcher fetcher = url -> {
            fetched.add(url);
            return pages.getOrDefault(url, PageFetchResult.failed(url, 404));
        };
        verifier = new WebsiteVerifier(fetcher, new PageVerifier(config, new TextNormalizer()), config);
    }

    private void page(String url, String text, PageLink... links) {
        pages.put(url, new PageFetchResult(url, 200, text, List.of(links)));
    }

    @Test
    void verify_stopsAtFirstVerifiedCandidate() {
        page("https://acme.co.uk", "Company number 12345678 EC1A 1BB",
                new PageLink("https://acme.co.uk/contact", "Contact"));
        page("https://acme.co.uk/contact", "Call us");
        page("https://acme-robots.com", "Acme Robotics");

        VerificationOutcome outcome = verifier.verify(ACME, List.of("https://acme.co.uk", "https://acme-robots.com"));

        assertEquals(VerificationLevel.VERIFIED, outcome.level());
        assertEquals("https://acme.co.uk", outcome.website());
        assertEquals(2, outcome.pages().size());
        assertFalse(fetched.contains("https://acme-robots.com"));
    }

    @Test
    void verify_contactLinksNotFollowedBelowVerified() {
        page("https://acme.co.uk", "Acme Robotics, EC1A 1BB",
                new PageLink("https://acme.co.uk/about", "About"));
        page("https://acme.co.uk/about", "Company number 12345678");

        VerificationOutcome outcome = verifier.verify(ACME, List.of("https://acme.co.uk"));

        assertEquals(VerificationLevel.PLAUSIBLE, outcome.level());
        assertEquals(List.of("https://acme.co.uk"), fetched);
    }

    @Test
    void verify_keepsBestScoringCandidate() {
        page("https://acme-robots.com", "Welcome");
        page("https://acme.co.uk", "Acme Robotics EC1A 1BB");

        VerificationOutcome outcome = verifier.verify(ACME, List.of("https://acme-robots.com", "https://acme.co.uk"));

        assertEquals("https://acme.co.uk", outcome.website());
        assertEquals(VerificationLevel.PLAUSIBLE, outcome.level());
    }

    @Test
    void verify_allFetchesFail() {
        VerificationOutcome outcome = verifier.verify(ACME, List.of("https://acme.co.uk"));

        assertFalse(outcome.hasWebsite());
        assertEquals(VerificationLevel.NONE, outcome.level());
    }
}
