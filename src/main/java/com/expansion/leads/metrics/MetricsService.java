package com.expansion.leads.metrics;

import com.expansion.leads.core.model.Bucket;
import com.expansion.leads.core.model.EnrichStatus;

/**
 * Interface for recording pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so components can be used without a registry.
 */
public interface MetricsService {

    void incrementSearchCall();

    void incrementBudgetSkip();

    void incrementVerifiedSite();

    void recordEnrichmentStatus(EnrichStatus status);

    void recordResolutionScore(int score);

    void recordLeadScore(int score, Bucket bucket);

    void incrementLeadsEmitted(int count);

    void incrementBackfilled(int count);

    void incrementItemSkipped(String stage);

    void recordCacheHit();

    void recordCacheMiss();
}
