package com.expansion.leads.pipeline;

import com.expansion.leads.config.EnrichmentConfig;
import com.expansion.leads.config.LeadsConfig;
import com.expansion.leads.config.OutputConfig;
import com.expansion.leads.config.SourceConfig;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.core.model.BeneficialOwner;
import com.expansion.leads.core.model.Bucket;
import com.expansion.leads.core.model.CompanyProfile;
import com.expansion.leads.core.model.EnrichStatus;
import com.expansion.leads.core.model.Entity;
import com.expansion.leads.core.model.Incorporation;
import com.expansion.leads.core.model.Lead;
import com.expansion.leads.core.model.RegisteredAddress;
import com.expansion.leads.core.model.RegistrySearchHit;
import com.expansion.leads.core.model.SeenKey;
import com.expansion.leads.core.model.Signal;
import com.expansion.leads.core.model.SignalNames;
import com.expansion.leads.core.model.SignalSet;
import com.expansion.leads.core.model.SourceRecord;
import com.expansion.leads.core.model.SourceType;
import com.expansion.leads.core.model.VerificationLevel;
import com.expansion.leads.enrichment.ContactExtractor;
import com.expansion.leads.enrichment.DomainDenyList;
import com.expansion.leads.enrichment.EnrichmentBudget;
import com.expansion.leads.enrichment.EnrichmentPipeline;
import com.expansion.leads.enrichment.HiringIntentDetector;
import com.expansion.leads.enrichment.PageFetchResult;
import com.expansion.leads.enrichment.PageFetcher;
import com.expansion.leads.enrichment.PageVerifier;
import com.expansion.leads.enrichment.SearchClient;
import com.expansion.leads.enrichment.SearchResult;
import com.expansion.leads.enrichment.Sleeper;
import com.expansion.leads.enrichment.WebsiteDiscovery;
import com.expansion.leads.enrichment.WebsiteVerifier;
import com.expansion.leads.metrics.NoOpMetricsService;
import com.expansion.leads.resolution.RegistryClient;
import com.expansion.leads.rules.TextNormalizer;
import com.expansion.leads.sources.SponsorRegisterSource;
import com.expansion.leads.store.InMemoryStateStore;
import com.expansion.leads.store.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeadPipelineTest {

    private static final Instant FIRST_RUN = Instant.parse("2026-03-01T06:00:00Z");
    private static final Instant SECOND_RUN = FIRST_RUN.plus(Duration.ofDays(1));
    private static final Instant THIRD_RUN = SECOND_RUN.plus(Duration.ofDays(1));

    private static final SourceRecord ALPHA = SourceRecord.sponsorRow("SPONSOR::ALPHA::LEEDS::SKILLED WORKER::WORKER",
            "Alpha Analytics Ltd", "Leeds", "West Yorkshire", "Skilled Worker", "Worker");
    private static final SourceRecord BETA = SourceRecord.sponsorRow("SPONSOR::BETA::YORK::SKILLED WORKER::WORKER",
            "Beta Bakeries Ltd", "York", "", "Skilled Worker", "Worker");
    private static final SourceRecord ACME = SourceRecord.sponsorRow(
            "SPONSOR::ACME ROBOTICS::LONDON::GLOBAL BUSINESS MOBILITY: UK EXPANSION WORKER::",
            "Acme Robotics Ltd", "London", "", "Global Business Mobility: UK Expansion Worker", "");

    @Mock
    private RegistryClient registry;

    @Mock
    private SponsorRegisterSource sponsorSource;

    private InMemoryStateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore();
    }

    private static SourceConfig sources(int maxCompaniesToCheck) {
        SourceConfig defaults = SourceConfig.defaults();
        return new SourceConfig("", defaults.routeAllowList(), defaults.minCleanNameLength(),
                defaults.maxNonAlnumRatio(), defaults.incorporationLookbackDays(), maxCompaniesToCheck);
    }

    private LeadPipeline pipeline(int maxCompaniesToCheck, SponsorRegisterSource source) {
        LeadsConfig config = LeadsConfig.builder()
                .sources(sources(maxCompaniesToCheck))
                .output(new OutputConfig(25, 0, 30, null))
                .build();
        return LeadPipeline.builder()
                .config(config)
                .sponsorSource(source)
                .registry(registry)
                .stateStore(store)
                .build();
    }

    private static CompanyProfile profile(String number, String name, String country) {
        return new CompanyProfile(number, name, "active", LocalDate.of(2026, 2, 20), List.of("62012"),
                new RegisteredAddress("1 High Street", "EC1A 1BB", "London", country));
    }

    private static BeneficialOwner germanOwner() {
        return new BeneficialOwner("individual-person-with-significant-control", "Hans Muller", "Germany", false);
    }

    @Nested
    @DisplayName("Sponsor register")
    class SponsorRegister {

        @Test
        @DisplayName("First run baselines the register and emits no sponsor leads")
        void firstRunBaselines() {
            when(sponsorSource.fetch()).thenReturn(List.of(ALPHA, BETA));

            RunResult result = pipeline(0, sponsorSource).run(FIRST_RUN);

            assertTrue(result.summary().baselineRun());
            assertEquals(2, result.summary().sponsorRowsTotal());
            assertEquals(0, result.summary().sponsorRowsNew());
            assertTrue(result.leads().isEmpty());
            assertTrue(store.isSeen(ALPHA.seenKey()));
            assertTrue(store.isSeen(BETA.seenKey()));
            assertTrue(store.getMeta(StateStore.META_SPONSOR_BASELINED).isPresent());
            verifyNoInteractions(registry);
        }

        @Test
        @DisplayName("A row added after the baseline becomes exactly one new lead")
        void newRowAfterBaseline() {
            when(sponsorSource.fetch())
                    .thenReturn(List.of(ALPHA, BETA))
                    .thenReturn(List.of(ALPHA, BETA, ACME));

            LeadPipeline pipeline = pipeline(0, sponsorSource);
            pipeline.run(FIRST_RUN);
            RunResult second = pipeline.run(SECOND_RUN);

            assertFalse(second.summary().baselineRun());
            assertEquals(1, second.summary().sponsorRowsNew());
            assertEquals(1, second.leads().size());
            Lead lead = second.leads().get(0);
            assertEquals("Acme Robotics Ltd", lead.getEntity().getDisplayName());
            assertEquals("Global Business Mobility: UK Expansion Worker", lead.getRoute());
            assertTrue(lead.isSponsorSourced());
            assertFalse(lead.getEntity().hasRegistryNumber());
            assertEquals(0, lead.getResolutionScore());
            assertTrue(store.findLead(lead.getKey()).isPresent());
        }

        @Test
        @DisplayName("Re-running against an unchanged register surfaces nothing new")
        void idempotentRerun() {
            when(sponsorSource.fetch())
                    .thenReturn(List.of(ALPHA, BETA))
                    .thenReturn(List.of(ALPHA, BETA, ACME))
                    .thenReturn(List.of(ALPHA, BETA, ACME));

            LeadPipeline pipeline = pipeline(0, sponsorSource);
            pipeline.run(FIRST_RUN);
            pipeline.run(SECOND_RUN);
            RunResult third = pipeline.run(THIRD_RUN);

            assertEquals(0, third.summary().sponsorRowsNew());
            assertTrue(third.freshLeads().isEmpty());
        }

        @Test
        @DisplayName("A confident registry match enriches the lead and is remembered as a mapping")
        void resolvedRowUsesRegistryFacts() {
            when(sponsorSource.fetch())
                    .thenReturn(List.of(ALPHA))
                    .thenReturn(List.of(ALPHA, ACME));
            when(registry.search(anyString(), anyInt())).thenReturn(List.of(
                    new RegistrySearchHit("ACME ROBOTICS LIMITED", "12345678", "active", "1 High Street, London, EC1A 1BB")));
            when(registry.profile("12345678")).thenReturn(
                    Optional.of(profile("12345678", "ACME ROBOTICS LIMITED", "England")));
            when(registry.owners("12345678")).thenReturn(List.of(germanOwner()));

            LeadPipeline pipeline = pipeline(0, sponsorSource);
            pipeline.run(FIRST_RUN);
            RunResult second = pipeline.run(SECOND_RUN);

            Lead lead = second.leads().get(0);
            assertEquals("12345678", lead.getKey());
            assertTrue(lead.getResolutionScore() >= 72);
            assertTrue(lead.getSignals().isFired(SignalNames.FOREIGN_BENEFICIAL_OWNER));
            assertTrue(store.findSponsorMapping(ACME.sourceKey()).isPresent());
            assertEquals("12345678", store.findSponsorMapping(ACME.sourceKey()).get().registryNumber());
        }

        @Test
        @DisplayName("A row whose resolution fails upstream is skipped and retried next run")
        void upstreamFailureSkipsRow() {
            when(sponsorSource.fetch())
                    .thenReturn(List.of(ALPHA))
                    .thenReturn(List.of(ALPHA, ACME))
                    .thenReturn(List.of(ALPHA, ACME));
            when(registry.search(anyString(), anyInt()))
                    .thenThrow(new UpstreamException("registry unavailable", 503));

            LeadPipeline pipeline = pipeline(0, sponsorSource);
            pipeline.run(FIRST_RUN);
            RunResult second = pipeline.run(SECOND_RUN);

            assertTrue(second.leads().isEmpty());
            assertEquals(1, second.summary().itemsSkipped());
            assertFalse(store.isSeen(ACME.seenKey()));

            reset(registry);
            RunResult third = pipeline.run(THIRD_RUN);

            assertEquals(1, third.leads().size());
            assertEquals(0, third.summary().itemsSkipped());
            assertTrue(store.isSeen(ACME.seenKey()));
        }

        @Test
        @DisplayName("A failed download neither baselines nor emits anything")
        void fetchFailure() {
            when(sponsorSource.fetch())
                    .thenThrow(new UpstreamException("download failed", 500))
                    .thenReturn(List.of(ALPHA));

            LeadPipeline pipeline = pipeline(0, sponsorSource);
            RunResult first = pipeline.run(FIRST_RUN);

            assertFalse(first.summary().baselineRun());
            assertEquals(1, first.summary().itemsSkipped());
            assertTrue(store.getMeta(StateStore.META_SPONSOR_BASELINED).isEmpty());

            RunResult second = pipeline.run(SECOND_RUN);
            assertTrue(second.summary().baselineRun());
            assertTrue(second.leads().isEmpty());
        }

        @Test
        @DisplayName("The run summary is stored under the run id")
        void runSummaryStored() {
            when(sponsorSource.fetch()).thenReturn(List.of(ALPHA));

            RunResult result = pipeline(0, sponsorSource).run(FIRST_RUN);

            assertEquals(result.summary().runId(), store.findRun(result.summary().runId()).orElseThrow().runId());
            assertEquals(result.summary().runId(), store.getMeta(StateStore.META_LAST_RUN_ID).orElseThrow());
        }
    }

    @Nested
    @DisplayName("Registry incorporations")
    class RegistryIncorporations {

        @Test
        @DisplayName("Only overseas-linked incorporations become leads, and all are marked seen")
        void overseasFilter() {
            when(registry.incorporatedBetween(any(), any(), anyInt())).thenReturn(List.of(
                    new Incorporation("11111111", "GLOBEX UK LIMITED", LocalDate.of(2026, 2, 25)),
                    new Incorporation("22222222", "LOCAL PLUMBING LIMITED", LocalDate.of(2026, 2, 24))));
            when(registry.profile("11111111")).thenReturn(
                    Optional.of(profile("11111111", "GLOBEX UK LIMITED", "England")));
            when(registry.profile("22222222")).thenReturn(
                    Optional.of(profile("22222222", "LOCAL PLUMBING LIMITED", "England")));
            when(registry.owners("11111111")).thenReturn(List.of(germanOwner()));

            LeadPipeline pipeline = pipeline(10, null);
            RunResult first = pipeline.run(FIRST_RUN);

            assertEquals(1, first.leads().size());
            Lead lead = first.leads().get(0);
            assertEquals("11111111", lead.getKey());
            assertEquals(100, lead.getResolutionScore());
            assertEquals(List.of(SourceType.COMPANIES_HOUSE), new ArrayList<>(lead.getProvenance()));
            assertEquals(1, first.summary().registryCandidates());
            assertTrue(store.isSeen(SeenKey.forIncorporation("11111111")));
            assertTrue(store.isSeen(SeenKey.forIncorporation("22222222")));

            RunResult second = pipeline.run(SECOND_RUN);
            assertTrue(second.freshLeads().isEmpty());
            verify(registry, times(1)).profile("11111111");
            verify(registry, times(1)).profile("22222222");
        }

        @Test
        @DisplayName("A failed incorporation listing skips the stage without failing the run")
        void listingFailure() {
            when(registry.incorporatedBetween(any(), any(), anyInt()))
                    .thenThrow(new UpstreamException("registry unavailable", 502));

            RunResult result = pipeline(10, null).run(FIRST_RUN);

            assertTrue(result.leads().isEmpty());
            assertEquals(1, result.summary().itemsSkipped());
        }
    }

    @Nested
    @DisplayName("Enrichment")
    class Enrichment {

        private static final String SITE = "https://www.acmerobotics.co.uk";

        private final EnrichmentConfig enrichmentConfig = EnrichmentConfig.builder().searchSleep(Duration.ZERO).build();
        private final List<String> queries = new ArrayList<>();
        private final Map<String, PageFetchResult> pages = new HashMap<>();
        private List<SearchResult> searchResults = List.of();
        private EnrichmentBudget budget;

        private LeadPipeline enrichingPipeline(int maxLeads, SponsorRegisterSource source) {
            budget = new EnrichmentBudget(10);
            SearchClient search = (query, locale) -> {
                queries.add(query);
                return searchResults;
            };
            PageFetcher fetcher = url -> pages.getOrDefault(url, PageFetchResult.failed(url, 404));
            NoOpMetricsService metrics = new NoOpMetricsService();
            WebsiteDiscovery discovery = new WebsiteDiscovery(search, enrichmentConfig,
                    new DomainDenyList(enrichmentConfig.getDenyDomains()), budget, Sleeper.none(), metrics);
            WebsiteVerifier verifier = new WebsiteVerifier(fetcher,
                    new PageVerifier(enrichmentConfig, new TextNormalizer()), enrichmentConfig);
            EnrichmentPipeline enrichment = new EnrichmentPipeline(discovery, verifier,
                    new ContactExtractor(enrichmentConfig), new HiringIntentDetector(), store, enrichmentConfig,
                    metrics);

            LeadsConfig config = LeadsConfig.builder()
                    .sources(sources(10))
                    .output(new OutputConfig(maxLeads, 0, 30, null))
                    .build();
            return LeadPipeline.builder()
                    .config(config)
                    .sponsorSource(source)
                    .registry(registry)
                    .stateStore(store)
                    .enrichment(enrichment, budget)
                    .build();
        }

        @Test
        @DisplayName("A suppressed entity is dropped before enrichment and spends no search budget")
        void suppressedLeadNeverSearched() {
            when(sponsorSource.fetch())
                    .thenReturn(List.of(ALPHA))
                    .thenReturn(List.of(ALPHA, ACME));
            String acmeKey = Entity.nameKey("acme robotics", "London");

            LeadPipeline pipeline = enrichingPipeline(25, sponsorSource);
            pipeline.run(FIRST_RUN);
            store.suppress(acmeKey, "do not contact", FIRST_RUN);
            RunResult second = pipeline.run(SECOND_RUN);

            assertTrue(second.leads().isEmpty());
            assertTrue(queries.isEmpty());
            assertEquals(0, budget.used());
            assertEquals(0, second.summary().searchCalls());
            assertTrue(store.findLead(acmeKey).isEmpty());
            assertTrue(store.isSeen(ACME.seenKey()));
        }

        @Test
        @DisplayName("Only leads inside the output cap are enriched")
        void enrichmentCappedAtOutputSize() {
            when(sponsorSource.fetch())
                    .thenReturn(List.of(ALPHA))
                    .thenReturn(List.of(ALPHA, BETA, ACME));

            LeadPipeline pipeline = enrichingPipeline(1, sponsorSource);
            pipeline.run(FIRST_RUN);
            RunResult second = pipeline.run(SECOND_RUN);

            assertEquals(1, second.leads().size());
            Lead top = second.leads().get(0);
            assertEquals(EnrichStatus.NO_WEBSITE, top.getEnrichment().status());
            assertEquals(1, queries.size());
            assertTrue(queries.get(0).contains(top.getEntity().getDisplayName()));
            assertEquals(1, second.summary().searchCalls());

            String otherKey = top.getKey().equals(Entity.nameKey("beta bakeries", "York"))
                    ? Entity.nameKey("acme robotics", "London")
                    : Entity.nameKey("beta bakeries", "York");
            assertEquals(EnrichStatus.NOT_RUN, store.findLead(otherKey).orElseThrow().getEnrichment().status());
        }

        @Test
        @DisplayName("A WATCH registry-only lead is skipped as low priority without a search")
        void watchRegistryLeadSkipped() {
            when(registry.incorporatedBetween(any(), any(), anyInt())).thenReturn(List.of(
                    new Incorporation("33333333", "NORDWIND TRADING LIMITED", LocalDate.of(2026, 2, 25))));
            when(registry.profile("33333333")).thenReturn(Optional.of(new CompanyProfile("33333333",
                    "NORDWIND TRADING LIMITED", "active", LocalDate.of(2024, 1, 10), List.of(),
                    new RegisteredAddress("1 High Street", "EC1A 1BB", "London", "England"))));
            when(registry.owners("33333333")).thenReturn(List.of(germanOwner()));

            RunResult result = enrichingPipeline(25, null).run(FIRST_RUN);

            assertEquals(1, result.leads().size());
            Lead lead = result.leads().get(0);
            assertEquals(Bucket.WATCH, lead.getScore().bucket());
            assertEquals(EnrichStatus.SKIPPED_LOW_PRIORITY, lead.getEnrichment().status());
            assertEquals(lead.getPreEnrichmentScore(), lead.getScore().score());
            assertTrue(queries.isEmpty());
            assertEquals(0, budget.used());
        }

        @Test
        @DisplayName("A verified website re-scores the lead and counts towards verified sites")
        void verifiedSiteRescores() {
            when(sponsorSource.fetch())
                    .thenReturn(List.of(ALPHA))
                    .thenReturn(List.of(ALPHA, ACME));
            when(registry.search(anyString(), anyInt())).thenReturn(List.of(
                    new RegistrySearchHit("ACME ROBOTICS LIMITED", "12345678", "active", "1 High Street, London, EC1A 1BB")));
            when(registry.profile("12345678")).thenReturn(
                    Optional.of(profile("12345678", "ACME ROBOTICS LIMITED", "England")));
            searchResults = List.of(new SearchResult("Acme Robotics - Industrial robots", SITE + "/", "Acme Robotics Ltd"));
            pages.put(SITE, new PageFetchResult(SITE, 200, "Acme Robotics Ltd. Registered in England, "
                    + "company number 12345678. Registered office London EC1A 1BB.", List.of()));

            LeadPipeline pipeline = enrichingPipeline(25, sponsorSource);
            pipeline.run(FIRST_RUN);
            RunResult second = pipeline.run(SECOND_RUN);

            Lead lead = second.leads().get(0);
            assertEquals("12345678", lead.getKey());
            assertEquals(VerificationLevel.VERIFIED, lead.getEnrichment().level());
            assertEquals(SITE, lead.getEnrichment().website());
            assertEquals(Math.min(100, lead.getPreEnrichmentScore() + 10), lead.getScore().score());
            assertEquals(1, second.summary().verifiedSites());
            assertEquals(1, second.summary().searchCalls());
        }
    }

    @Nested
    @DisplayName("Overseas link")
    class OverseasLink {

        private SignalSet fired(String... names) {
            List<Signal> signals = new ArrayList<>();
            for (String name : names) {
                signals.add(Signal.flag(name, List.of(name)));
            }
            return new SignalSet(signals);
        }

        @Test
        @DisplayName("Foreign owner, residence or registered office each qualify")
        void singleSignalsQualify() {
            assertTrue(LeadPipeline.isOverseasLinked(fired(SignalNames.FOREIGN_BENEFICIAL_OWNER)));
            assertTrue(LeadPipeline.isOverseasLinked(fired(SignalNames.FOREIGN_OFFICER_RESIDENCE)));
            assertTrue(LeadPipeline.isOverseasLinked(fired(SignalNames.FOREIGN_REGISTERED_OFFICE)));
        }

        @Test
        @DisplayName("Foreign nationality needs a foreign officer address as well")
        void nationalityNeedsAddress() {
            assertFalse(LeadPipeline.isOverseasLinked(fired(SignalNames.FOREIGN_OFFICER_NATIONALITY)));
            assertTrue(LeadPipeline.isOverseasLinked(fired(SignalNames.FOREIGN_OFFICER_NATIONALITY,
                    SignalNames.FOREIGN_OFFICER_ADDRESS)));
        }

        @Test
        @DisplayName("Domestic-only signals do not qualify")
        void domesticSignals() {
            assertFalse(LeadPipeline.isOverseasLinked(SignalSet.empty()));
            assertFalse(LeadPipeline.isOverseasLinked(fired(SignalNames.MULTIPLE_DIRECTORS,
                    SignalNames.RECENT_REGISTRATION)));
        }
    }
}
