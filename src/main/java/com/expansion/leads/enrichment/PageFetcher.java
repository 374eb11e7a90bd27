package com.expansion.leads.enrichment;

/**
 * Fetches one web page. Never throws: non-2xx responses, timeouts and I/O errors all come back
 * as a failed {@link PageFetchResult}.
 */
public interface PageFetcher {

    PageFetchResult fetch(String url);
}
