package com.expansion.leads.core.model;

/**
 * Confidence that a discovered website is the organisation's official site.
 */
public enum VerificationLevel {
    NONE,
    PLAUSIBLE,
    VERIFIED
}
