package com.expansion.leads.store;

import com.expansion.leads.core.model.EnrichmentResult;
import com.expansion.leads.core.model.Entity;
import com.expansion.leads.core.model.Lead;
import com.expansion.leads.core.model.RunSummary;
import com.expansion.leads.core.model.SeenKey;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory implementation of StateStore for tests and dry runs.
 * Thread-safe via a single monitor; commit swaps everything in under the same lock.
 */
public class InMemoryStateStore implements StateStore {

    private final Map<String, String> meta = new HashMap<>();
    private final Set<SeenKey> seen = new HashSet<>();
    private final Map<String, SponsorMapping> mappings = new HashMap<>();
    private final Map<String, EnrichmentResult> enrichment = new HashMap<>();
    private final Map<String, StoredLead> leads = new LinkedHashMap<>();
    private final Map<String, String> suppressed = new HashMap<>();
    private final Map<String, RunSummary> runs = new HashMap<>();

    @Override
    public synchronized Optional<String> getMeta(String key) {
        return Optional.ofNullable(meta.get(key));
    }

    @Override
    public synchronized boolean isSeen(SeenKey key) {
        return seen.contains(key);
    }

    @Override
    public synchronized Optional<SponsorMapping> findSponsorMapping(String rowKey) {
        return Optional.ofNullable(mappings.get(rowKey));
    }

    @Override
    public synchronized Optional<EnrichmentResult> findEnrichment(String entityKey) {
        return Optional.ofNullable(enrichment.get(entityKey));
    }

    @Override
    public synchronized void saveEnrichment(String entityKey, EnrichmentResult result) {
        enrichment.put(entityKey, result);
    }

    @Override
    public synchronized Optional<Lead> findLead(String entityKey) {
        return Optional.ofNullable(leads.get(entityKey)).map(StoredLead::lead);
    }

    @Override
    public synchronized List<Lead> findRecentLeads(Instant since, int limit) {
        return leads.values().stream()
                .filter(s -> !s.lastSeen().isBefore(since))
                .filter(s -> !suppressed.containsKey(s.lead().getKey()))
                .sorted(Comparator.comparingInt((StoredLead s) -> s.lead().getScore().score()).reversed()
                        .thenComparing(StoredLead::lastSeen, Comparator.reverseOrder()))
                .limit(limit)
                .map(StoredLead::lead)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean isSuppressed(String entityKey) {
        return suppressed.containsKey(entityKey);
    }

    @Override
    public synchronized void suppress(String entityKey, String note, Instant at) {
        suppressed.put(entityKey, note != null ? note : "");
    }

    @Override
    public synchronized void commit(RunCommit commit) {
        meta.putAll(commit.meta());
        seen.addAll(commit.seenKeys());
        for (SponsorMapping mapping : commit.sponsorMappings()) {
            mappings.put(mapping.rowKey(), mapping);
        }
        for (Lead lead : commit.leads()) {
            Instant firstSeen = commit.committedAt();
            Entity entity = lead.getEntity();
            if (entity.hasRegistryNumber()) {
                StoredLead stale = leads.remove(entity.getNameKey());
                if (stale != null) {
                    firstSeen = stale.firstSeen();
                }
            }
            StoredLead existing = leads.get(lead.getKey());
            if (existing != null) {
                firstSeen = existing.firstSeen();
            }
            leads.put(lead.getKey(), new StoredLead(lead, firstSeen, commit.committedAt()));
        }
        runs.put(commit.summary().runId(), commit.summary());
    }

    @Override
    public synchronized Optional<RunSummary> findRun(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    synchronized int seenCount() {
        return seen.size();
    }

    private record StoredLead(Lead lead, Instant firstSeen, Instant lastSeen) {
    }
}
