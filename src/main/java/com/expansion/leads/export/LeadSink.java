package com.expansion.leads.export;

import com.expansion.leads.core.model.Lead;
import com.expansion.leads.core.model.RunSummary;

import java.util.List;

/**
 * Receives the final lead list of a run, after the run has been committed.
 */
public interface LeadSink {

    void accept(List<Lead> leads, RunSummary summary);

    LeadSink NOOP = (leads, summary) -> { };
}
