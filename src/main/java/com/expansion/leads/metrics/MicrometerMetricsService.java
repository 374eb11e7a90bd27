package com.expansion.leads.metrics;

import com.expansion.leads.core.model.Bucket;
import com.expansion.leads.core.model.EnrichStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code leads.search.calls} - Counter</li>
 *   <li>{@code leads.enrichment.budget.skipped} - Counter</li>
 *   <li>{@code leads.enrichment.verified} - Counter</li>
 *   <li>{@code leads.enrichment.status} - Counter (tag: status)</li>
 *   <li>{@code leads.resolution.score} - DistributionSummary</li>
 *   <li>{@code leads.score} - DistributionSummary (tag: bucket)</li>
 *   <li>{@code leads.emitted} - Counter</li>
 *   <li>{@code leads.backfilled} - Counter</li>
 *   <li>{@code leads.items.skipped} - Counter (tag: stage)</li>
 *   <li>{@code leads.cache.hit} / {@code leads.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Counter searchCallCounter;
    private final Counter budgetSkipCounter;
    private final Counter verifiedSiteCounter;
    private final Counter leadsEmittedCounter;
    private final Counter backfilledCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final DistributionSummary resolutionScoreSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.searchCallCounter = Counter.builder("leads.search.calls")
                .description("Search API calls issued")
                .register(registry);
        this.budgetSkipCounter = Counter.builder("leads.enrichment.budget.skipped")
                .description("Leads not enriched because the search budget was spent")
                .register(registry);
        this.verifiedSiteCounter = Counter.builder("leads.enrichment.verified")
                .description("Websites verified as official")
                .register(registry);
        this.leadsEmittedCounter = Counter.builder("leads.emitted")
                .description("Leads in run output")
                .register(registry);
        this.backfilledCounter = Counter.builder("leads.backfilled")
                .description("Leads taken from history to reach the output floor")
                .register(registry);
        this.cacheHitCounter = Counter.builder("leads.cache.hit")
                .description("Resolution and enrichment cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("leads.cache.miss")
                .description("Resolution and enrichment cache misses")
                .register(registry);
        this.resolutionScoreSummary = DistributionSummary.builder("leads.resolution.score")
                .description("Best candidate confidence from identity resolution")
                .register(registry);
    }

    @Override
    public void incrementSearchCall() {
        searchCallCounter.increment();
    }

    @Override
    public void incrementBudgetSkip() {
        budgetSkipCounter.increment();
    }

    @Override
    public void incrementVerifiedSite() {
        verifiedSiteCounter.increment();
    }

    @Override
    public void recordEnrichmentStatus(EnrichStatus status) {
        String key = "status:" + status.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("leads.enrichment.status")
                        .description("Enrichment outcomes by status")
                        .tag("status", status.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordResolutionScore(int score) {
        resolutionScoreSummary.record(score);
    }

    @Override
    public void recordLeadScore(int score, Bucket bucket) {
        DistributionSummary summary = summaryCache.computeIfAbsent(bucket.name(), k ->
                DistributionSummary.builder("leads.score")
                        .description("Lead scores by bucket")
                        .tag("bucket", bucket.name())
                        .register(registry));
        summary.record(score);
    }

    @Override
    public void incrementLeadsEmitted(int count) {
        leadsEmittedCounter.increment(count);
    }

    @Override
    public void incrementBackfilled(int count) {
        backfilledCounter.increment(count);
    }

    @Override
    public void incrementItemSkipped(String stage) {
        String key = "skipped:" + stage;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("leads.items.skipped")
                        .description("Items skipped after an upstream failure")
                        .tag("stage", stage)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
