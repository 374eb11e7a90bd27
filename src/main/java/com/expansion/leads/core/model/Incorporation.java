package com.expansion.leads.core.model;

import java.time.LocalDate;

/**
 * A recent incorporation listed by the registry's advanced search.
 */
public record Incorporation(
        String registryNumber,
        String name,
        LocalDate registrationDate
) {
    public Incorporation {
        registryNumber = registryNumber != null ? registryNumber : "";
        name = name != null ? name : "";
    }
}
