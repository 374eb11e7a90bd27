package com.expansion.leads.core.model;

/**
 * Upstream source a record came from. Declaration order is the provenance order
 * used when several sources contribute to one lead.
 */
public enum SourceType {
    /**
     * Government register of licensed worker sponsors (bulk CSV feed).
     */
    SPONSOR_REGISTER,

    /**
     * Companies registry (search, profile, officers and beneficial owners).
     */
    COMPANIES_HOUSE
}
