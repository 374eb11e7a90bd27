package com.expansion.leads.enrichment;

import java.util.Objects;

/**
 * The facts enrichment needs about one entity.
 *
 * @param entityKey      entity identifier, also the enrichment cache key
 * @param name           display name
 * @param registryNumber registry number, or empty
 * @param postcode       registered postcode, or empty
 * @param locality       registered town, or empty
 */
public record EnrichmentTarget(String entityKey, String name, String registryNumber, String postcode,
                               String locality) {

    public EnrichmentTarget {
        Objects.requireNonNull(entityKey, "entityKey is required");
        name = name != null ? name.trim() : "";
        registryNumber = registryNumber != null ? registryNumber.trim() : "";
        postcode = postcode != null ? postcode.trim() : "";
        locality = locality != null ? locality.trim() : "";
    }
}
