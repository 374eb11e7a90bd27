package com.expansion.leads.config;

import java.time.Duration;

/**
 * HTTP boundary settings shared by all upstream clients.
 *
 * @param registryBaseUrl companies registry API root
 * @param searchBaseUrl   search API endpoint
 * @param connectTimeout  connection timeout
 * @param apiTimeout      request timeout for registry and search calls
 * @param pageTimeout     request timeout for website page fetches
 * @param maxAttempts     attempts per request, including the first
 * @param initialBackoff  delay before the second attempt; doubles on each further attempt
 * @param userAgent       User-Agent header for page fetches
 */
public record HttpConfig(
        String registryBaseUrl,
        String searchBaseUrl,
        Duration connectTimeout,
        Duration apiTimeout,
        Duration pageTimeout,
        int maxAttempts,
        Duration initialBackoff,
        String userAgent
) {
    public HttpConfig {
        if (registryBaseUrl == null || registryBaseUrl.isBlank()) {
            throw new IllegalArgumentException("registryBaseUrl is required");
        }
        if (searchBaseUrl == null || searchBaseUrl.isBlank()) {
            throw new IllegalArgumentException("searchBaseUrl is required");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (connectTimeout == null || apiTimeout == null || pageTimeout == null || initialBackoff == null) {
            throw new IllegalArgumentException("Timeouts are required");
        }
        userAgent = userAgent != null ? userAgent : "";
    }

    public static HttpConfig defaults() {
        return new HttpConfig(
                "https://api.company-information.service.gov.uk",
                "https://serpapi.com/search.json",
                Duration.ofSeconds(10),
                Duration.ofSeconds(25),
                Duration.ofSeconds(20),
                3,
                Duration.ofMillis(500),
                "Mozilla/5.0 (compatible; ExpansionLeads/1.0)");
    }
}
