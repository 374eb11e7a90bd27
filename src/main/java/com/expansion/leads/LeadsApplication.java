package com.expansion.leads;

import com.expansion.leads.cache.CaffeineResolutionCache;
import com.expansion.leads.config.EnrichmentConfig;
import com.expansion.leads.config.LeadsConfig;
import com.expansion.leads.config.LeadsConfigLoader;
import com.expansion.leads.core.ConfigurationException;
import com.expansion.leads.core.LeadsException;
import com.expansion.leads.enrichment.ContactExtractor;
import com.expansion.leads.enrichment.DomainDenyList;
import com.expansion.leads.enrichment.EnrichmentBudget;
import com.expansion.leads.enrichment.EnrichmentPipeline;
import com.expansion.leads.enrichment.HiringIntentDetector;
import com.expansion.leads.enrichment.PageVerifier;
import com.expansion.leads.enrichment.Sleeper;
import com.expansion.leads.enrichment.WebsiteDiscovery;
import com.expansion.leads.enrichment.WebsiteVerifier;
import com.expansion.leads.export.CsvLeadExporter;
import com.expansion.leads.http.CompaniesHouseClient;
import com.expansion.leads.http.HttpExecutor;
import com.expansion.leads.http.JsoupPageFetcher;
import com.expansion.leads.http.SerpApiSearchClient;
import com.expansion.leads.metrics.MetricsService;
import com.expansion.leads.metrics.MicrometerMetricsService;
import com.expansion.leads.pipeline.LeadPipeline;
import com.expansion.leads.pipeline.RunResult;
import com.expansion.leads.resolution.IdentityResolver;
import com.expansion.leads.rules.TextNormalizer;
import com.expansion.leads.sources.GovUkSponsorRegisterSource;
import com.expansion.leads.sources.SponsorRegisterParser;
import com.expansion.leads.store.JdbcStateStore;
import com.expansion.leads.store.StateStore;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Command-line entry point: one run per invocation.
 *
 * <pre>
 * java -jar expansion-leads.jar [path/to/leads.properties]
 * </pre>
 *
 * <p>Exit status 0 on success, 2 on a configuration problem, 1 on any other failure.</p>
 */
public final class LeadsApplication {
    private static final Logger log = LoggerFactory.getLogger(LeadsApplication.class);

    private LeadsApplication() {
    }

    public static void main(String[] args) {
        Path configFile = args.length > 0 ? Path.of(args[0]) : null;
        try {
            LeadsConfig config = LeadsConfigLoader.load(configFile, System.getenv());
            RunResult result = run(config);
            log.info("Run {} finished with {} leads", result.summary().runId(), result.leads().size());
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.exit(2);
        } catch (LeadsException e) {
            log.error("Run failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static RunResult run(LeadsConfig config) {
        log.info("Starting with {}", config);
        if (config.getRegistryApiKey().isBlank()) {
            throw new ConfigurationException(LeadsConfigLoader.REGISTRY_KEY_ENV + " is not set");
        }
        CsvLeadExporter exporter = new CsvLeadExporter(config.getOutput().outputDirectory());

        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        MetricsService metrics = new MicrometerMetricsService(meterRegistry);
        TextNormalizer normalizer = new TextNormalizer();
        HttpExecutor executor = new HttpExecutor(config.getHttp());

        CompaniesHouseClient registry = new CompaniesHouseClient(executor, config.getHttp(),
                config.getRegistryApiKey());
        IdentityResolver resolver = new IdentityResolver(registry, config.getResolver(), normalizer,
                new CaffeineResolutionCache(config.getResolver().cacheMaxSize()), metrics);

        try (StateStore store = JdbcStateStore.open(config.getDatabasePath())) {
            LeadPipeline.Builder pipeline = LeadPipeline.builder()
                    .config(config)
                    .registry(registry)
                    .resolver(resolver)
                    .stateStore(store)
                    .normalizer(normalizer)
                    .metrics(metrics)
                    .sink(exporter);

            String sponsorLocation = config.getSources().sponsorRegisterUrl();
            if (!sponsorLocation.isEmpty()) {
                pipeline.sponsorSource(new GovUkSponsorRegisterSource(sponsorLocation, executor, config.getHttp(),
                        new SponsorRegisterParser(config.getSources(), normalizer)));
            } else {
                log.warn("No sponsor register location configured; only registry incorporations are scanned");
            }

            if (config.isEnrichmentEnabled()) {
                EnrichmentConfig enrichmentConfig = config.getEnrichment();
                EnrichmentBudget budget = new EnrichmentBudget(enrichmentConfig.getSearchCallBudget());
                WebsiteDiscovery discovery = new WebsiteDiscovery(
                        new SerpApiSearchClient(executor, config.getHttp(), config.getSearchApiKey()),
                        enrichmentConfig, new DomainDenyList(enrichmentConfig.getDenyDomains()), budget,
                        Sleeper.threadSleep(), metrics);
                WebsiteVerifier verifier = new WebsiteVerifier(new JsoupPageFetcher(executor, config.getHttp()),
                        new PageVerifier(enrichmentConfig, normalizer), enrichmentConfig);
                pipeline.enrichment(new EnrichmentPipeline(discovery, verifier, new ContactExtractor(enrichmentConfig),
                        new HiringIntentDetector(), store, enrichmentConfig, metrics), budget);
            } else {
                log.warn("{} is not set; website enrichment is disabled", LeadsConfigLoader.SEARCH_KEY_ENV);
            }

            RunResult result = pipeline.build().run(Instant.now());
            logMeters(meterRegistry);
            return result;
        }
    }

    private static void logMeters(SimpleMeterRegistry registry) {
        for (Meter meter : registry.getMeters()) {
            log.debug("metric {} {}", meter.getId().getName(), meter.measure());
        }
    }
}
