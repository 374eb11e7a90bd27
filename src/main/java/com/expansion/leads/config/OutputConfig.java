package com.expansion.leads.config;

import java.nio.file.Path;

/**
 * Output sizing and destination.
 *
 * @param maxLeads           cap on leads in one run's output
 * @param minLeads           below this fresh count the output is backfilled from history
 * @param backfillWindowDays how recent a stored lead must be to be backfilled
 * @param outputDirectory    where the CSV export goes; null when not configured
 */
public record OutputConfig(int maxLeads, int minLeads, int backfillWindowDays, Path outputDirectory) {

    public OutputConfig {
        if (maxLeads < 1) {
            throw new IllegalArgumentException("maxLeads must be > 0");
        }
        if (minLeads < 0 || minLeads > maxLeads) {
            throw new IllegalArgumentException("minLeads must be between 0 and maxLeads");
        }
        if (backfillWindowDays < 0) {
            throw new IllegalArgumentException("backfillWindowDays must be >= 0");
        }
    }

    public static OutputConfig defaults() {
        return new OutputConfig(25, 10, 30, null);
    }

    public OutputConfig withOutputDirectory(Path directory) {
        return new OutputConfig(maxLeads, minLeads, backfillWindowDays, directory);
    }
}
