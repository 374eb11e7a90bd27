package com.expansion.leads.pipeline;

import com.expansion.leads.config.OutputConfig;
import com.expansion.leads.core.model.Entity;
import com.expansion.leads.core.model.Lead;
import com.expansion.leads.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-source leads into one lead per entity, ranks and caps them, and tops up a thin
 * output from recently stored leads.
 */
public class LeadAssembler {
    private static final Logger log = LoggerFactory.getLogger(LeadAssembler.class);

    public static final String BACKFILL_MARKER = "Backfilled from recent leads";

    static final Comparator<Lead> RANKING = Comparator
            .comparingInt((Lead lead) -> lead.getScore().score()).reversed()
            .thenComparing(Lead::getKey);

    private final OutputConfig config;

    public LeadAssembler(OutputConfig config) {
        this.config = config;
    }

    /**
     * Collapses leads sharing an entity identifier. A name-keyed lead whose name key matches the
     * name key of a registry-numbered lead is folded into that lead.
     *
     * @return merged leads, ranked
     */
    public List<Lead> merge(List<Lead> leads) {
        Map<String, Lead> byKey = new LinkedHashMap<>();
        for (Lead lead : leads) {
            byKey.merge(lead.getKey(), lead, LeadAssembler::combine);
        }

        Map<String, String> numberedByNameKey = new HashMap<>();
        for (Lead lead : byKey.values()) {
            Entity entity = lead.getEntity();
            if (entity.hasRegistryNumber()) {
                numberedByNameKey.putIfAbsent(entity.getNameKey(), lead.getKey());
            }
        }

        Map<String, Lead> merged = new LinkedHashMap<>();
        for (Lead lead : byKey.values()) {
            String target = Entity.isNameKey(lead.getKey())
                    ? numberedByNameKey.getOrDefault(lead.getKey(), lead.getKey())
                    : lead.getKey();
            if (!target.equals(lead.getKey())) {
                log.debug("assemble.attach nameKey={} to={}", lead.getKey(), target);
            }
            merged.merge(target, lead, LeadAssembler::combine);
        }

        List<Lead> ranked = new ArrayList<>(merged.values());
        ranked.sort(RANKING);
        return ranked;
    }

    /**
     * Removes leads whose key is suppressed, keeping order. Runs before enrichment so that a
     * do-not-contact entity is never searched for or scraped.
     */
    public List<Lead> dropSuppressed(List<Lead> leads, StateStore store) {
        List<Lead> kept = new ArrayList<>(leads.size());
        for (Lead lead : leads) {
            if (store.isSuppressed(lead.getKey())) {
                log.debug("assemble.suppressed key={}", lead.getKey());
                continue;
            }
            kept.add(lead);
        }
        return kept;
    }

    /**
     * Ranks and caps fresh leads, then backfills from the store while the fresh count is below
     * the configured minimum. Suppressed keys never appear. Backfilled leads are tagged in their
     * rationale.
     */
    public List<Lead> assemble(List<Lead> fresh, StateStore store, Instant now) {
        List<Lead> output = dropSuppressed(fresh, store);
        output.sort(RANKING);
        if (output.size() > config.maxLeads()) {
            output = new ArrayList<>(output.subList(0, config.maxLeads()));
        }

        if (output.size() < config.minLeads()) {
            Set<String> present = new HashSet<>();
            for (Lead lead : output) {
                present.add(lead.getKey());
                present.add(lead.getEntity().getNameKey());
            }
            Instant since = now.minus(Duration.ofDays(config.backfillWindowDays()));
            int added = 0;
            for (Lead stored : store.findRecentLeads(since, config.maxLeads() * 4)) {
                if (output.size() >= config.minLeads()) {
                    break;
                }
                if (present.contains(stored.getKey()) || store.isSuppressed(stored.getKey())) {
                    continue;
                }
                output.add(stored.asBackfill(BACKFILL_MARKER));
                present.add(stored.getKey());
                added++;
            }
            log.info("assemble.backfill fresh={} added={}", fresh.size(), added);
        }

        output.sort(RANKING);
        if (output.size() > config.maxLeads()) {
            output = new ArrayList<>(output.subList(0, config.maxLeads()));
        }
        return output;
    }

    /**
     * The more complete entity wins; the higher-scored assessment wins; provenance is the union.
     */
    static Lead combine(Lead a, Lead b) {
        Lead assessed = b.getScore().score() > a.getScore().score() ? b : a;
        Lead other = assessed == a ? b : a;
        Entity entity = moreComplete(a.getEntity(), b.getEntity());

        Lead.Builder builder = Lead.builder(assessed).entity(entity);
        other.getProvenance().forEach(builder::addSource);
        if (assessed.getRoute().isEmpty() && !other.getRoute().isEmpty()) {
            builder.route(other.getRoute()).subRoute(other.getSubRoute());
        }
        builder.resolutionScore(Math.max(a.getResolutionScore(), b.getResolutionScore()));
        return builder.build();
    }

    private static Entity moreComplete(Entity a, Entity b) {
        if (a.hasRegistryNumber() != b.hasRegistryNumber()) {
            return a.hasRegistryNumber() ? a : b;
        }
        return b.completeness() > a.completeness() ? b : a;
    }
}
