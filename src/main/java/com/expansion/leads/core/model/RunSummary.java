package com.expansion.leads.core.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Bookkeeping for one pipeline run.
 *
 * @param runId              run identifier, the logical start time as {@code yyyyMMdd'T'HHmmss'Z'}
 * @param startedAt          logical "now" of the run
 * @param finishedAt         completion time
 * @param baselineRun        true when this run captured the sponsor baseline
 * @param sponsorRowsTotal   sponsor rows after filtering
 * @param sponsorRowsNew     sponsor rows not seen before
 * @param registryCandidates overseas-linked incorporations considered
 * @param searchCalls        search calls spent
 * @param verifiedSites      websites verified
 * @param leadsEmitted       leads in the output
 * @param backfilled         of which taken from history
 * @param itemsSkipped       items skipped after upstream failures
 */
public record RunSummary(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        boolean baselineRun,
        int sponsorRowsTotal,
        int sponsorRowsNew,
        int registryCandidates,
        int searchCalls,
        int verifiedSites,
        int leadsEmitted,
        int backfilled,
        int itemsSkipped
) {
    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    public RunSummary {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(startedAt, "startedAt is required");
    }

    public static String runIdFor(Instant now) {
        return RUN_ID_FORMAT.format(now);
    }
}
