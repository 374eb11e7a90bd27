package com.expansion.leads.core.model;

/**
 * Per-lead progress through enrichment.
 * {@code NOT_ATTEMPTED -> DISCOVERED -> VERIFIED | PLAUSIBLE | UNVERIFIED -> CONTACTS_EXTRACTED}.
 */
public enum EnrichmentState {
    NOT_ATTEMPTED,
    DISCOVERED,
    VERIFIED,
    PLAUSIBLE,
    UNVERIFIED,
    CONTACTS_EXTRACTED
}
