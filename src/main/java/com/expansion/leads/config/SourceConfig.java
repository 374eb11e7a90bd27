package com.expansion.leads.config;

import java.util.List;

/**
 * Upstream feed settings.
 *
 * @param sponsorRegisterUrl     location of the sponsor register CSV, or empty to skip the feed
 * @param routeAllowList         sponsor routes that are kept
 * @param minCleanNameLength     shortest organisation name kept after cleaning
 * @param maxNonAlnumRatio       rows whose names exceed this share of symbols are dropped as noise
 * @param incorporationLookbackDays how far back to list new incorporations
 * @param maxCompaniesToCheck    cap on incorporations profiled per run
 */
public record SourceConfig(
        String sponsorRegisterUrl,
        List<String> routeAllowList,
        int minCleanNameLength,
        double maxNonAlnumRatio,
        int incorporationLookbackDays,
        int maxCompaniesToCheck
) {
    public SourceConfig {
        sponsorRegisterUrl = sponsorRegisterUrl != null ? sponsorRegisterUrl.trim() : "";
        routeAllowList = routeAllowList != null ? List.copyOf(routeAllowList) : List.of();
        if (minCleanNameLength < 1) {
            throw new IllegalArgumentException("minCleanNameLength must be > 0");
        }
        if (maxNonAlnumRatio < 0.0 || maxNonAlnumRatio > 1.0) {
            throw new IllegalArgumentException("maxNonAlnumRatio must be between 0 and 1");
        }
        if (incorporationLookbackDays < 0 || maxCompaniesToCheck < 0) {
            throw new IllegalArgumentException("Incorporation limits must be >= 0");
        }
    }

    public static SourceConfig defaults() {
        return new SourceConfig("",
                List.of("Skilled Worker",
                        "Global Business Mobility: Senior or Specialist Worker",
                        "Global Business Mobility: UK Expansion Worker"),
                3, 0.35, 30, 140);
    }

    public SourceConfig withSponsorRegisterUrl(String url) {
        return new SourceConfig(url, routeAllowList, minCleanNameLength, maxNonAlnumRatio,
                incorporationLookbackDays, maxCompaniesToCheck);
    }
}
