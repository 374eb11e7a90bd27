package com.expansion.leads.resolution;

import com.expansion.leads.cache.CaffeineResolutionCache;
import com.expansion.leads.config.ResolverConfig;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.core.model.RegistrySearchHit;
import com.expansion.leads.metrics.MetricsService;
import com.expansion.leads.metrics.NoOpMetricsService;
import com.expansion.leads.rules.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    private static final RegistrySearchHit ACME = new RegistrySearchHit(
            "ACME ROBOTICS LIMITED", "12345678", "active", "1 High Street, London, EC1A 1BB");

    @Mock
    private RegistryClient registry;

    private final TextNormalizer normalizer = new TextNormalizer();
    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new IdentityResolver(registry, ResolverConfig.defaults(), normalizer);
    }

    @Test
    @DisplayName("Exact name with matching locality resolves to the registry number")
    void exactMatch() {
        when(registry.search(anyString(), anyInt())).thenReturn(List.of(ACME));

        ResolutionResult result = resolver.resolve("Acme Robotics Ltd", "London");

        assertTrue(result.isMatch());
        assertEquals("12345678", result.identifier());
        assertEquals(100, result.score());
        assertEquals("ACME ROBOTICS LIMITED", result.matchedTitle());
    }

    @Test
    @DisplayName("A weak best candidate yields no match with score 0")
    void weakCandidateIsNoMatch() {
        MetricsService metrics = mock(MetricsService.class);
        resolver = new IdentityResolver(registry, ResolverConfig.defaults(), normalizer,
                new CaffeineResolutionCache(10), metrics);
        when(registry.search(anyString(), anyInt())).thenReturn(List.of(
                new RegistrySearchHit("SOUTHERN CATERING LTD", "09999999", "dissolved", "Bristol")));

        ResolutionResult result = resolver.resolve("Northwind Consulting Ltd", "Leeds");

        assertFalse(result.isMatch());
        assertEquals("", result.identifier());
        assertEquals(0, result.score());

        ArgumentCaptor<Integer> best = ArgumentCaptor.forClass(Integer.class);
        verify(metrics).recordResolutionScore(best.capture());
        assertTrue(best.getValue() < 72);
    }

    @Test
    @DisplayName("A match is returned exactly when the best score reaches the threshold")
    void thresholdProperty() {
        RegistrySearchHit hit = new RegistrySearchHit("ACME WIDGET SUPPLIES LTD", "07654321", "active", "");
        when(registry.search(anyString(), anyInt())).thenReturn(List.of(hit));
        int score = resolver.scoreCandidate("acme widgets", "", hit);

        for (int threshold = 1; threshold <= 100; threshold++) {
            ResolutionResult result = resolver.resolve("Acme Widgets Ltd", "", threshold);
            assertEquals(score >= threshold, result.isMatch(), "threshold=" + threshold);
            if (result.isMatch()) {
                assertEquals(score, result.score());
            }
        }
    }

    @Test
    @DisplayName("Locality and active status add bonuses, capped at 100")
    void scoreCandidateBonuses() {
        RegistrySearchHit dissolvedElsewhere = new RegistrySearchHit("ACME ROBOTICS", "1", "dissolved", "Leeds");
        RegistrySearchHit activeInLondon = new RegistrySearchHit("ACME WIDGETS", "2", "Active", "London");

        assertEquals(100, resolver.scoreCandidate("acme robotics", "LONDON", dissolvedElsewhere));
        int base = resolver.scoreCandidate("acme robotics", "", new RegistrySearchHit("ACME WIDGETS", "2", "", ""));
        int boosted = resolver.scoreCandidate("acme robotics", "LONDON", activeInLondon);
        assertEquals(Math.min(100, base + 8 + 3), boosted);
    }

    @Test
    @DisplayName("Blank names never reach the registry")
    void blankName() {
        assertFalse(resolver.resolve("  ", "London").isMatch());
        verifyNoInteractions(registry);
    }

    @Nested
    @DisplayName("Upstream failures")
    class Failures {

        @Test
        @DisplayName("All query variants failing propagates the error")
        void allVariantsFail() {
            when(registry.search(anyString(), anyInt())).thenThrow(new UpstreamException("unavailable", 503));

            UpstreamException e = assertThrows(UpstreamException.class,
                    () -> resolver.resolve("Acme Robotics Ltd", "London"));
            assertEquals(503, e.getStatus());
        }

        @Test
        @DisplayName("A failed variant is skipped and the rest still resolve")
        void partialFailure() {
            when(registry.search(anyString(), anyInt()))
                    .thenThrow(new UpstreamException("rate limited", 429))
                    .thenReturn(List.of(ACME));

            ResolutionResult result = resolver.resolve("Acme Robotics Ltd", "London");

            assertEquals("12345678", result.identifier());
        }

        @Test
        @DisplayName("Results of a partially failed resolution are not cached")
        void partialFailureNotCached() {
            resolver = new IdentityResolver(registry, ResolverConfig.defaults(), normalizer,
                    new CaffeineResolutionCache(10), new NoOpMetricsService());
            when(registry.search(anyString(), anyInt()))
                    .thenThrow(new UpstreamException("rate limited", 429))
                    .thenReturn(List.of(ACME));

            resolver.resolve("Acme Robotics Ltd", "London");
            resolver.resolve("Acme Robotics Ltd", "London");

            verify(registry, times(6)).search(anyString(), anyInt());
        }
    }

    @Test
    @DisplayName("A cached resolution skips the registry")
    void cachedResolution() {
        resolver = new IdentityResolver(registry, ResolverConfig.defaults(), normalizer,
                new CaffeineResolutionCache(10), new NoOpMetricsService());
        when(registry.search(anyString(), anyInt())).thenReturn(List.of(ACME));

        ResolutionResult first = resolver.resolve("Acme Robotics Ltd", "London");
        ResolutionResult second = resolver.resolve("ACME ROBOTICS LIMITED", "london");

        assertEquals(first, second);
        verify(registry, times(3)).search(anyString(), anyInt());
    }
}
