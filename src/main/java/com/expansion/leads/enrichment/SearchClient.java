package com.expansion.leads.enrichment;

import java.util.List;

/**
 * Web search collaborator. Every call spends one unit of the run's search budget,
 * so callers must check the budget before calling.
 */
public interface SearchClient {

    /**
     * @throws com.expansion.leads.core.UpstreamException on a transient failure after retries
     */
    List<SearchResult> query(String query, String locale);
}
