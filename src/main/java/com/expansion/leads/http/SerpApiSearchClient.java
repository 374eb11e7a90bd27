package com.expansion.leads.http;

import com.expansion.leads.config.HttpConfig;
import com.expansion.leads.core.ConfigurationException;
import com.expansion.leads.core.UpstreamException;
import com.expansion.leads.enrichment.SearchClient;
import com.expansion.leads.enrichment.SearchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SerpAPI Google search. Returns organic results only.
 */
public class SerpApiSearchClient implements SearchClient {

    private static final int RESULTS_PER_QUERY = 10;

    private final HttpExecutor executor;
    private final HttpConfig config;
    private final String apiKey;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SerpApiSearchClient(HttpExecutor executor, HttpConfig config, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("A search API key is required when enrichment is enabled");
        }
        this.executor = executor;
        this.config = config;
        this.apiKey = apiKey.trim();
    }

    @Override
    public List<SearchResult> query(String query, String locale) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("engine", "google");
        params.put("q", query);
        params.put("num", String.valueOf(RESULTS_PER_QUERY));
        if (locale != null && !locale.isBlank()) {
            params.put("location", locale);
        }
        params.put("api_key", apiKey);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.searchBaseUrl() + CompaniesHouseClient.query(params)))
                .timeout(config.apiTimeout())
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResult result = executor.execute(request);
        if (result.isNotFound() || result.body().isBlank()) {
            return List.of();
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Unreadable search response", e);
        }
        List<SearchResult> results = new ArrayList<>();
        for (JsonNode item : json.path("organic_results")) {
            results.add(new SearchResult(item.path("title").asText(""), item.path("link").asText(""),
                    item.path("snippet").asText("")));
        }
        return results;
    }
}
