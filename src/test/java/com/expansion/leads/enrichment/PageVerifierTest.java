package com.expansion.leads.enrichment;

import com.expansion.leads.config.EnrichmentConfig;
import com.expansion.leads.rules.TextNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PageVerifier Tests")
class PageVerifierTest {

    private static final EnrichmentTarget ACME = new EnrichmentTarget(
            "12345678", "Acme Robotics Ltd", "12345678", "EC1A 1BB", "London");

    private final PageVerifier verifier = new PageVerifier(EnrichmentConfig.defaults(), new TextNormalizer());

    @Test
    @DisplayName("Registry number alone is worth six points")
    void registryNumberAlone() {
        PageScore score = verifier.score(ACME, "Company No 12345678");

        assertEquals(6, score.score());
        assertTrue(score.evidence().contains("Company number found"));
    }

    @Test
    @DisplayName("Registry number and postcode together reach nine or more")
    void numberAndPostcode() {
        PageScore score = verifier.score(ACME, "Registered number 12345678, ec1a 1bb");

        assertTrue(score.score() >= 9);
        assertTrue(score.evidence().contains("Registered postcode found"));
        assertTrue(score.evidence().contains("Independent checks agree"));
    }

    @Test
    @DisplayName("Number embedded in a longer number does not count")
    void numberNeedsWordBoundary() {
        assertEquals(0, verifier.score(ACME, "Order ref 9123456789").score());
    }

    @Test
    @DisplayName("Strong name similarity alone earns two points")
    void nameOnly() {
        assertEquals(2, verifier.score(ACME, "Acme Robotics").score());
    }

    @Test
    @DisplayName("Score is capped at ten")
    void capped() {
        PageScore score = verifier.score(ACME, "Acme Robotics Ltd, company 12345678, EC1A 1BB");
        assertEquals(10, score.score());
    }

    @Test
    @DisplayName("Blank page scores zero")
    void blankPage() {
        assertEquals(PageScore.zero(), verifier.score(ACME, "  "));
    }

    @Test
    @DisplayName("Text beyond the page limit is ignored")
    void pageTextLimit() {
        PageVerifier limited = new PageVerifier(EnrichmentConfig.builder().pageTextLimit(20).build(),
                new TextNormalizer());

        assertEquals(0, limited.score(ACME, "x".repeat(30) + " 12345678").score());
    }
}
