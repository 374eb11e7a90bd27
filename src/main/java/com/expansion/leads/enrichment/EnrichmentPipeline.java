package com.expansion.leads.enrichment;

import com.expansion.leads.config.EnrichmentConfig;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.core.model.EnrichStatus;
import com.expansion.leads.core.model.EnrichmentResult;
import com.expansion.leads.core.model.EnrichmentState;
import com.expansion.leads.core.model.VerificationLevel;
import com.expansion.leads.metrics.MetricsService;
import com.expansion.leads.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Budget-gated enrichment for one entity: cache lookup, discovery, verification, then contact
 * extraction on a verified site only.
 *
 * <p>A fresh cached result is returned as-is and spends no budget. Results that reached a website
 * decision are written to the cache immediately.</p>
 */
public class EnrichmentPipeline {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentPipeline.class);

    private final WebsiteDiscovery discovery;
    private final WebsiteVerifier verifier;
    private final ContactExtractor contactExtractor;
    private final HiringIntentDetector hiringDetector;
    private final StateStore store;
    private final EnrichmentConfig config;
    private final MetricsService metrics;

    public EnrichmentPipeline(WebsiteDiscovery discovery, WebsiteVerifier verifier,
                              ContactExtractor contactExtractor, HiringIntentDetector hiringDetector,
                              StateStore store, EnrichmentConfig config, MetricsService metrics) {
        this.discovery = discovery;
        this.verifier = verifier;
        this.contactExtractor = contactExtractor;
        this.hiringDetector = hiringDetector;
        this.store = store;
        this.config = config;
        this.metrics = metrics;
    }

    public EnrichmentResult enrich(EnrichmentTarget target, Instant now) {
        Optional<EnrichmentResult> cached = store.findEnrichment(target.entityKey());
        if (cached.isPresent() && isFresh(cached.get(), now)) {
            metrics.recordCacheHit();
            log.debug("enrichment.cached key={}", target.entityKey());
            return record(cached.get().withStatus(EnrichStatus.CACHED));
        }
        metrics.recordCacheMiss();

        EnrichmentResult result;
        try {
            result = runStages(target, now);
        } catch (UpstreamException e) {
            log.warn("enrichment.failed key={} status={} message={}", target.entityKey(), e.getStatus(),
                    e.getMessage());
            result = new EnrichmentResult("", VerificationLevel.NONE, 0, List.of(), List.of(), List.of(),
                    false, EnrichStatus.FAILED_UPSTREAM, EnrichmentState.UNVERIFIED, now);
        }

        if (result.isCacheable()) {
            store.saveEnrichment(target.entityKey(), result);
        }
        return record(result);
    }

    private EnrichmentResult runStages(EnrichmentTarget target, Instant now) {
        DiscoveryResult discovered = discovery.discover(target);
        if (discovered.budgetExhausted()) {
            return EnrichmentResult.skipped(EnrichStatus.SKIPPED_BUDGET, now);
        }
        if (discovered.candidates().isEmpty()) {
            return noWebsite(now);
        }

        VerificationOutcome outcome = verifier.verify(target, discovered.candidates());
        if (!outcome.hasWebsite()) {
            return noWebsite(now);
        }

        switch (outcome.level()) {
            case VERIFIED:
                return verified(outcome, now);
            case PLAUSIBLE:
                return new EnrichmentResult(outcome.website(), VerificationLevel.PLAUSIBLE, outcome.score(),
                        outcome.evidence(), List.of(), List.of(), false, EnrichStatus.MANUAL_VERIFY,
                        EnrichmentState.PLAUSIBLE, now);
            default:
                return new EnrichmentResult(outcome.website(), VerificationLevel.NONE, outcome.score(),
                        outcome.evidence(), List.of(), List.of(), false, EnrichStatus.MANUAL_VERIFY,
                        EnrichmentState.UNVERIFIED, now);
        }
    }

    private EnrichmentResult verified(VerificationOutcome outcome, Instant now) {
        metrics.incrementVerifiedSite();
        List<String> texts = outcome.pages().stream().map(PageFetchResult::text).toList();
        ContactDetails contacts = contactExtractor.extract(texts, UrlUtils.host(outcome.website()));
        boolean hiring = hiringDetector.detect(outcome.pages());
        boolean anyContacts = !contacts.isEmpty();
        log.info("enrichment.verified site={} emails={} phones={} hiring={}", outcome.website(),
                contacts.emails().size(), contacts.phones().size(), hiring);
        return new EnrichmentResult(outcome.website(), VerificationLevel.VERIFIED, outcome.score(),
                outcome.evidence(), contacts.emails(), contacts.phones(), hiring,
                anyContacts ? EnrichStatus.VERIFIED_SCRAPED : EnrichStatus.VERIFIED_NO_CONTACTS,
                anyContacts ? EnrichmentState.CONTACTS_EXTRACTED : EnrichmentState.VERIFIED, now);
    }

    private static EnrichmentResult noWebsite(Instant now) {
        return new EnrichmentResult("", VerificationLevel.NONE, 0, List.of(), List.of(), List.of(), false,
                EnrichStatus.NO_WEBSITE, EnrichmentState.UNVERIFIED, now);
    }

    private boolean isFresh(EnrichmentResult cached, Instant now) {
        return cached.updatedAt() != null && cached.updatedAt().plus(config.getCacheTtl()).isAfter(now);
    }

    private EnrichmentResult record(EnrichmentResult result) {
        metrics.recordEnrichmentStatus(result.status());
        return result;
    }
}
