package com.expansion.leads.pipeline;

import com.expansion.leads.core.model.Lead;
import com.expansion.leads.core.model.RunSummary;

import java.util.List;
import java.util.Objects;

/**
 * What one run produced: its bookkeeping and the final, capped lead list.
 */
public record RunResult(RunSummary summary, List<Lead> leads) {

    public RunResult {
        Objects.requireNonNull(summary, "summary is required");
        leads = leads != null ? List.copyOf(leads) : List.of();
    }

    /**
     * Leads surfaced by this run, excluding backfilled ones.
     */
    public List<Lead> freshLeads() {
        return leads.stream().filter(lead -> !lead.isBackfilled()).toList();
    }
}
