package com.expansion.leads.store;

import com.expansion.leads.core.model.EnrichmentResult;
import com.expansion.leads.core.model.Lead;
import com.expansion.leads.core.model.RunSummary;
import com.expansion.leads.core.model.SeenKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable state: seen keys, run metadata, stored leads, the enrichment cache,
 * sponsor mappings and suppressions. The single source of truth for "already seen"
 * and "enrichment still fresh".
 */
public interface StateStore extends AutoCloseable {

    String META_SPONSOR_BASELINED = "sponsor_baselined";
    String META_LAST_RUN_ID = "last_run_id";

    Optional<String> getMeta(String key);

    boolean isSeen(SeenKey key);

    Optional<SponsorMapping> findSponsorMapping(String rowKey);

    Optional<EnrichmentResult> findEnrichment(String entityKey);

    /**
     * Writes through immediately; cached enrichment does not mark anything as seen.
     */
    void saveEnrichment(String entityKey, EnrichmentResult result);

    Optional<Lead> findLead(String entityKey);

    /**
     * Unsuppressed leads last seen at or after {@code since}, highest score first, then most recent.
     */
    List<Lead> findRecentLeads(Instant since, int limit);

    boolean isSuppressed(String entityKey);

    /**
     * Marks a lead do-not-contact; it is excluded from fresh output and from backfill.
     */
    void suppress(String entityKey, String note, Instant at);

    /**
     * Atomically records the run: metadata, seen keys, leads (upserted by entity key) and mappings.
     * Either all of it is durable afterwards or none of it is.
     */
    void commit(RunCommit commit);

    Optional<RunSummary> findRun(String runId);

    @Override
    default void close() {
    }
}
