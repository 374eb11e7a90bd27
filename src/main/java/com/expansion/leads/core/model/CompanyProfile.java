package com.expansion.leads.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Registry profile of a company.
 */
public record CompanyProfile(
        String registryNumber,
        String name,
        String status,
        LocalDate registrationDate,
        List<String> classificationCodes,
        RegisteredAddress address
) {
    public CompanyProfile {
        Objects.requireNonNull(registryNumber, "registryNumber is required");
        name = name != null ? name : "";
        status = status != null ? status : "";
        classificationCodes = classificationCodes != null ? List.copyOf(classificationCodes) : List.of();
        address = address != null ? address : RegisteredAddress.empty();
    }
}
