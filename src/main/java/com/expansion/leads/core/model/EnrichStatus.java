package com.expansion.leads.core.model;

/**
 * Reviewer-facing explanation of an enrichment outcome.
 */
public enum EnrichStatus {
    NOT_RUN("Not enriched"),
    SKIPPED_BUDGET("Skipped (budget cap)"),
    SKIPPED_LOW_PRIORITY("Skipped (low priority)"),
    CACHED("Used cached enrichment"),
    NO_WEBSITE("No website found"),
    MANUAL_VERIFY("Manual verify needed"),
    VERIFIED_SCRAPED("Verified & scraped"),
    VERIFIED_NO_CONTACTS("Verified (no contacts found)"),
    FAILED_UPSTREAM("Enrichment failed (upstream error)");

    private final String label;

    EnrichStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EnrichStatus fromLabel(String label) {
        for (EnrichStatus status : values()) {
            if (status.label.equals(label) || status.name().equals(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown enrichment status: " + label);
    }
}
