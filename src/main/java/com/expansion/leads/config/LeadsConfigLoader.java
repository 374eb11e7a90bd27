package com.expansion.leads.config;

import com.expansion.leads.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Builds {@link LeadsConfig} from layered properties.
 *
 * <p>Precedence, lowest first: {@code leads.properties} on the classpath, an optional external
 * properties file, then environment variables named {@code LEADS_} plus the upper-snake property
 * key (e.g. {@code output.max-leads} becomes {@code LEADS_OUTPUT_MAX_LEADS}). API keys are read
 * from the environment only.</p>
 */
public final class LeadsConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(LeadsConfigLoader.class);

    public static final String CLASSPATH_RESOURCE = "leads.properties";
    public static final String ENV_PREFIX = "LEADS_";
    public static final String REGISTRY_KEY_ENV = "COMPANIES_HOUSE_API_KEY";
    public static final String SEARCH_KEY_ENV = "SERPAPI_API_KEY";

    private static final List<String> KNOWN_KEYS = List.of(
            "resolver.match-threshold", "resolver.locality-bonus", "resolver.active-status-bonus",
            "resolver.max-query-variants", "resolver.results-per-query", "resolver.cache-max-size",
            "scoring.hot-threshold", "scoring.medium-threshold", "scoring.sector-boost-keywords",
            "scoring.sector-penalty-keywords", "scoring.mailbox-phrases", "scoring.priority-countries",
            "enrichment.search-call-budget", "enrichment.search-sleep-ms", "enrichment.search-locale",
            "enrichment.max-candidates", "enrichment.plausible-threshold", "enrichment.verified-threshold",
            "enrichment.cache-ttl-days", "enrichment.include-personal-emails", "enrichment.deny-domains",
            "sources.sponsor-register-url", "sources.route-allow-list", "sources.min-clean-name-length",
            "sources.max-non-alnum-ratio", "sources.incorporation-lookback-days", "sources.max-companies-to-check",
            "output.max-leads", "output.min-leads", "output.backfill-window-days", "output.directory",
            "http.registry-base-url", "http.search-base-url", "http.connect-timeout-seconds",
            "http.api-timeout-seconds", "http.page-timeout-seconds", "http.max-attempts",
            "http.initial-backoff-ms", "http.user-agent", "database.path");

    private final Properties properties = new Properties();

    private LeadsConfigLoader() {
    }

    /**
     * Loads the process configuration.
     *
     * @param externalFile optional properties file overriding the bundled defaults, may be null
     * @param env          environment variables, usually {@link System#getenv()}
     * @throws ConfigurationException when a file cannot be read or a value is invalid
     */
    public static LeadsConfig load(Path externalFile, Map<String, String> env) {
        LeadsConfigLoader loader = new LeadsConfigLoader();
        loader.loadClasspath();
        if (externalFile != null) {
            loader.loadFile(externalFile);
        }
        loader.overlayEnvironment(env);
        try {
            return loader.build(env);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private void loadClasspath() {
        try (InputStream in = LeadsConfigLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on the classpath, using built-in defaults", CLASSPATH_RESOURCE);
                return;
            }
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read classpath " + CLASSPATH_RESOURCE, e);
        }
    }

    private void loadFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
            log.info("config.loaded file={}", file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + file, e);
        }
    }

    private void overlayEnvironment(Map<String, String> env) {
        Set<String> keys = new LinkedHashSet<>(KNOWN_KEYS);
        keys.addAll(properties.stringPropertyNames());
        for (String key : keys) {
            String value = env.get(envName(key));
            if (value != null && !value.isBlank()) {
                properties.setProperty(key, value.trim());
            }
        }
    }

    static String envName(String key) {
        return ENV_PREFIX + key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    private LeadsConfig build(Map<String, String> env) {
        ResolverConfig resolverDefaults = ResolverConfig.defaults();
        ResolverConfig resolver = new ResolverConfig(
                intValue("resolver.match-threshold", resolverDefaults.matchThreshold()),
                intValue("resolver.locality-bonus", resolverDefaults.localityBonus()),
                intValue("resolver.active-status-bonus", resolverDefaults.activeStatusBonus()),
                intValue("resolver.max-query-variants", resolverDefaults.maxQueryVariants()),
                intValue("resolver.results-per-query", resolverDefaults.resultsPerQuery()),
                intValue("resolver.cache-max-size", resolverDefaults.cacheMaxSize()));

        ScoringConfig scoringDefaults = ScoringConfig.defaults();
        ScoringConfig scoring = ScoringConfig.builder()
                .hotThreshold(intValue("scoring.hot-threshold", scoringDefaults.getHotThreshold()))
                .mediumThreshold(intValue("scoring.medium-threshold", scoringDefaults.getMediumThreshold()))
                .sectorBoostKeywords(listValue("scoring.sector-boost-keywords", scoringDefaults.getSectorBoostKeywords()))
                .sectorPenaltyKeywords(listValue("scoring.sector-penalty-keywords", scoringDefaults.getSectorPenaltyKeywords()))
                .mailboxPhrases(listValue("scoring.mailbox-phrases", scoringDefaults.getMailboxPhrases()))
                .priorityCountries(listValue("scoring.priority-countries", scoringDefaults.getPriorityCountries()))
                .build();

        EnrichmentConfig enrichmentDefaults = EnrichmentConfig.defaults();
        EnrichmentConfig enrichment = EnrichmentConfig.builder()
                .searchCallBudget(intValue("enrichment.search-call-budget", enrichmentDefaults.getSearchCallBudget()))
                .searchSleep(Duration.ofMillis(intValue("enrichment.search-sleep-ms",
                        (int) enrichmentDefaults.getSearchSleep().toMillis())))
                .searchLocale(stringValue("enrichment.search-locale", enrichmentDefaults.getSearchLocale()))
                .maxCandidates(intValue("enrichment.max-candidates", enrichmentDefaults.getMaxCandidates()))
                .plausibleThreshold(intValue("enrichment.plausible-threshold", enrichmentDefaults.getPlausibleThreshold()))
                .verifiedThreshold(intValue("enrichment.verified-threshold", enrichmentDefaults.getVerifiedThreshold()))
                .cacheTtl(Duration.ofDays(intValue("enrichment.cache-ttl-days",
                        (int) enrichmentDefaults.getCacheTtl().toDays())))
                .includePersonalEmails(booleanValue("enrichment.include-personal-emails",
                        enrichmentDefaults.isIncludePersonalEmails()))
                .denyDomains(listValue("enrichment.deny-domains", enrichmentDefaults.getDenyDomains()))
                .build();

        SourceConfig sourceDefaults = SourceConfig.defaults();
        SourceConfig sources = new SourceConfig(
                stringValue("sources.sponsor-register-url", sourceDefaults.sponsorRegisterUrl()),
                listValue("sources.route-allow-list", sourceDefaults.routeAllowList(), "\\|"),
                intValue("sources.min-clean-name-length", sourceDefaults.minCleanNameLength()),
                doubleValue("sources.max-non-alnum-ratio", sourceDefaults.maxNonAlnumRatio()),
                intValue("sources.incorporation-lookback-days", sourceDefaults.incorporationLookbackDays()),
                intValue("sources.max-companies-to-check", sourceDefaults.maxCompaniesToCheck()));

        OutputConfig outputDefaults = OutputConfig.defaults();
        String directory = stringValue("output.directory", "");
        OutputConfig output = new OutputConfig(
                intValue("output.max-leads", outputDefaults.maxLeads()),
                intValue("output.min-leads", outputDefaults.minLeads()),
                intValue("output.backfill-window-days", outputDefaults.backfillWindowDays()),
                directory.isEmpty() ? null : Path.of(directory));

        HttpConfig httpDefaults = HttpConfig.defaults();
        HttpConfig http = new HttpConfig(
                stringValue("http.registry-base-url", httpDefaults.registryBaseUrl()),
                stringValue("http.search-base-url", httpDefaults.searchBaseUrl()),
                Duration.ofSeconds(intValue("http.connect-timeout-seconds", (int) httpDefaults.connectTimeout().toSeconds())),
                Duration.ofSeconds(intValue("http.api-timeout-seconds", (int) httpDefaults.apiTimeout().toSeconds())),
                Duration.ofSeconds(intValue("http.page-timeout-seconds", (int) httpDefaults.pageTimeout().toSeconds())),
                intValue("http.max-attempts", httpDefaults.maxAttempts()),
                Duration.ofMillis(intValue("http.initial-backoff-ms", (int) httpDefaults.initialBackoff().toMillis())),
                stringValue("http.user-agent", httpDefaults.userAgent()));

        return LeadsConfig.builder()
                .resolver(resolver)
                .scoring(scoring)
                .enrichment(enrichment)
                .sources(sources)
                .output(output)
                .http(http)
                .databasePath(Path.of(stringValue("database.path", "data/leads.sqlite")))
                .registryApiKey(env.getOrDefault(REGISTRY_KEY_ENV, ""))
                .searchApiKey(env.getOrDefault(SEARCH_KEY_ENV, ""))
                .build();
    }

    private String stringValue(String key, String fallback) {
        String value = properties.getProperty(key);
        return value != null ? value.trim() : fallback;
    }

    private int intValue(String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    private double doubleValue(String key, double fallback) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Property " + key + " must be a number, got '" + value + "'", e);
        }
    }

    private boolean booleanValue(String key, boolean fallback) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? fallback : Boolean.parseBoolean(value.trim());
    }

    private List<String> listValue(String key, List<String> fallback) {
        return listValue(key, fallback, ",");
    }

    private List<String> listValue(String key, List<String> fallback, String separator) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return Arrays.stream(value.split(separator))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
