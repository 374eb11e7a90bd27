package com.expansion.leads.store;

import com.expansion.leads.core.model.Lead;
import com.expansion.leads.core.model.RunSummary;
import com.expansion.leads.core.model.SeenKey;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a run writes, applied by {@link StateStore#commit} as one unit.
 * Seen keys are never recorded without the leads derived from them.
 */
public record RunCommit(
        RunSummary summary,
        Map<String, String> meta,
        List<SeenKey> seenKeys,
        List<Lead> leads,
        List<SponsorMapping> sponsorMappings,
        Instant committedAt
) {
    public RunCommit {
        Objects.requireNonNull(summary, "summary is required");
        Objects.requireNonNull(committedAt, "committedAt is required");
        meta = meta != null ? Map.copyOf(meta) : Map.of();
        seenKeys = seenKeys != null ? List.copyOf(seenKeys) : List.of();
        leads = leads != null ? List.copyOf(leads) : List.of();
        sponsorMappings = sponsorMappings != null ? List.copyOf(sponsorMappings) : List.of();
    }
}
