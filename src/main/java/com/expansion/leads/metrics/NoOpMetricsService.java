package com.expansion.leads.metrics;

import com.expansion.leads.core.model.Bucket;
import com.expansion.leads.core.model.EnrichStatus;

/**
 * No-op metrics service. All methods do nothing.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementSearchCall() {
    }

    @Override
    public void incrementBudgetSkip() {
    }

    @Override
    public void incrementVerifiedSite() {
    }

    @Override
    public void recordEnrichmentStatus(EnrichStatus status) {
    }

    @Override
    public void recordResolutionScore(int score) {
    }

    @Override
    public void recordLeadScore(int score, Bucket bucket) {
    }

    @Override
    public void incrementLeadsEmitted(int count) {
    }

    @Override
    public void incrementBackfilled(int count) {
    }

    @Override
    public void incrementItemSkipped(String stage) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
