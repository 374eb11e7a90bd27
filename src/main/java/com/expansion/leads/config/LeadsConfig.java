package com.expansion.leads.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable process configuration, built once at startup and handed to every component.
 */
public class LeadsConfig {

    private final ResolverConfig resolver;
    private final ScoringConfig scoring;
    private final EnrichmentConfig enrichment;
    private final SourceConfig sources;
    private final OutputConfig output;
    private final HttpConfig http;
    private final Path databasePath;
    private final String registryApiKey;
    private final String searchApiKey;

    private LeadsConfig(Builder builder) {
        this.resolver = builder.resolver;
        this.scoring = builder.scoring;
        this.enrichment = builder.enrichment;
        this.sources = builder.sources;
        this.output = builder.output;
        this.http = builder.http;
        this.databasePath = builder.databasePath;
        this.registryApiKey = builder.registryApiKey != null ? builder.registryApiKey : "";
        this.searchApiKey = builder.searchApiKey != null ? builder.searchApiKey : "";
    }

    public static LeadsConfig defaults() {
        return builder().build();
    }

    public ResolverConfig getResolver() {
        return resolver;
    }

    public ScoringConfig getScoring() {
        return scoring;
    }

    public EnrichmentConfig getEnrichment() {
        return enrichment;
    }

    public SourceConfig getSources() {
        return sources;
    }

    public OutputConfig getOutput() {
        return output;
    }

    public HttpConfig getHttp() {
        return http;
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    public String getRegistryApiKey() {
        return registryApiKey;
    }

    public String getSearchApiKey() {
        return searchApiKey;
    }

    /**
     * Website enrichment runs only when a search API key is available.
     */
    public boolean isEnrichmentEnabled() {
        return !searchApiKey.isBlank();
    }

    @Override
    public String toString() {
        return "LeadsConfig{" +
                "matchThreshold=" + resolver.matchThreshold() +
                ", hot=" + scoring.getHotThreshold() +
                ", medium=" + scoring.getMediumThreshold() +
                ", searchBudget=" + enrichment.getSearchCallBudget() +
                ", maxLeads=" + output.maxLeads() +
                ", minLeads=" + output.minLeads() +
                ", database=" + databasePath +
                ", enrichment=" + (isEnrichmentEnabled() ? "on" : "off") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResolverConfig resolver = ResolverConfig.defaults();
        private ScoringConfig scoring = ScoringConfig.defaults();
        private EnrichmentConfig enrichment = EnrichmentConfig.defaults();
        private SourceConfig sources = SourceConfig.defaults();
        private OutputConfig output = OutputConfig.defaults();
        private HttpConfig http = HttpConfig.defaults();
        private Path databasePath = Path.of("data", "leads.sqlite");
        private String registryApiKey;
        private String searchApiKey;

        public Builder resolver(ResolverConfig resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder scoring(ScoringConfig scoring) {
            this.scoring = scoring;
            return this;
        }

        public Builder enrichment(EnrichmentConfig enrichment) {
            this.enrichment = enrichment;
            return this;
        }

        public Builder sources(SourceConfig sources) {
            this.sources = sources;
            return this;
        }

        public Builder output(OutputConfig output) {
            this.output = output;
            return this;
        }

        public Builder http(HttpConfig http) {
            this.http = http;
            return this;
        }

        public Builder databasePath(Path databasePath) {
            this.databasePath = databasePath;
            return this;
        }

        public Builder registryApiKey(String registryApiKey) {
            this.registryApiKey = registryApiKey;
            return this;
        }

        public Builder searchApiKey(String searchApiKey) {
            this.searchApiKey = searchApiKey;
            return this;
        }

        public LeadsConfig build() {
            Objects.requireNonNull(resolver, "resolver config is required");
            Objects.requireNonNull(scoring, "scoring config is required");
            Objects.requireNonNull(enrichment, "enrichment config is required");
            Objects.requireNonNull(sources, "source config is required");
            Objects.requireNonNull(output, "output config is required");
            Objects.requireNonNull(http, "http config is required");
            Objects.requireNonNull(databasePath, "databasePath is required");
            return new LeadsConfig(this);
        }
    }
}
