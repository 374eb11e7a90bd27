package com.expansion.leads.core.model;

import java.util.Locale;

/**
 * A person (or legal entity) with significant control over a company.
 *
 * @param kind    registry kind, e.g. "individual-person-with-significant-control"
 *                or "corporate-entity-person-with-significant-control"
 * @param name    owner name
 * @param country declared country of the owner's address
 * @param ceased  whether control has ceased
 */
public record BeneficialOwner(
        String kind,
        String name,
        String country,
        boolean ceased
) {
    private static final String[] CORPORATE_KINDS = {
            "corporate-entity", "legal-person", "corporate", "other-registrable-person"
    };

    public BeneficialOwner {
        kind = kind != null ? kind : "";
        name = name != null ? name : "";
        country = country != null ? country : "";
    }

    public boolean isActive() {
        return !ceased;
    }

    /**
     * True when the owner is not an individual.
     */
    public boolean isCorporate() {
        String k = kind.toLowerCase(Locale.ROOT);
        for (String corporate : CORPORATE_KINDS) {
            if (k.contains(corporate)) {
                return true;
            }
        }
        return false;
    }
}
