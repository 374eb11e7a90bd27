package com.expansion.leads.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of website discovery and verification for one entity.
 *
 * <p>Contacts are only ever attached to a VERIFIED site; construction fails otherwise.</p>
 *
 * @param website      base URL of the chosen candidate, or empty
 * @param level        verification level
 * @param score        verification score, 0 to 10
 * @param evidence     deduplicated verification evidence
 * @param emails       extracted emails (VERIFIED only)
 * @param phones       extracted phone numbers (VERIFIED only)
 * @param hiringIntent whether the verified site shows hiring activity
 * @param status       reviewer-facing status
 * @param state        furthest state reached
 * @param updatedAt    when the result was computed; drives cache freshness
 */
public record EnrichmentResult(
        String website,
        VerificationLevel level,
        int score,
        List<String> evidence,
        List<String> emails,
        List<String> phones,
        boolean hiringIntent,
        EnrichStatus status,
        EnrichmentState state,
        Instant updatedAt
) {
    public static final int MAX_VERIFICATION_SCORE = 10;

    public EnrichmentResult {
        website = website != null ? website : "";
        Objects.requireNonNull(level, "level is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(state, "state is required");
        if (score < 0 || score > MAX_VERIFICATION_SCORE) {
            throw new IllegalArgumentException("Verification score must be between 0 and 10, got " + score);
        }
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        emails = emails != null ? List.copyOf(emails) : List.of();
        phones = phones != null ? List.copyOf(phones) : List.of();
        if (level != VerificationLevel.VERIFIED && (!emails.isEmpty() || !phones.isEmpty())) {
            throw new IllegalArgumentException("Contacts may only be attached to a VERIFIED website");
        }
        if (level != VerificationLevel.VERIFIED && hiringIntent) {
            throw new IllegalArgumentException("Hiring intent requires a VERIFIED website");
        }
    }

    /**
     * A result for an entity that was not enriched at all, with the reason.
     */
    public static EnrichmentResult skipped(EnrichStatus status, Instant at) {
        return new EnrichmentResult("", VerificationLevel.NONE, 0, List.of(), List.of(), List.of(),
                false, status, EnrichmentState.NOT_ATTEMPTED, at);
    }

    public static EnrichmentResult notRun() {
        return skipped(EnrichStatus.NOT_RUN, null);
    }

    public boolean isVerified() {
        return level == VerificationLevel.VERIFIED;
    }

    /**
     * Results that spent no budget and carry no finding are not worth caching.
     */
    public boolean isCacheable() {
        return state != EnrichmentState.NOT_ATTEMPTED && status != EnrichStatus.FAILED_UPSTREAM;
    }

    public EnrichmentResult withStatus(EnrichStatus newStatus) {
        return new EnrichmentResult(website, level, score, evidence, emails, phones, hiringIntent,
                newStatus, state, updatedAt);
    }
}
