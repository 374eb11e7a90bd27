package com.expansion.leads.signals;

import com.expansion.leads.core.model.BeneficialOwner;
import com.expansion.leads.core.model.CompanyProfile;
import com.expansion.leads.core.model.Officer;
import com.expansion.leads.core.model.RegisteredAddress;

import java.time.LocalDate;
import java.util.List;

/**
 * Registry facts about one entity, as input to signal extraction. Missing facts are empty, never null.
 */
public record EntityFacts(
        String name,
        LocalDate registrationDate,
        List<String> classificationCodes,
        RegisteredAddress address,
        List<Officer> officers,
        List<BeneficialOwner> owners
) {
    public EntityFacts {
        name = name != null ? name : "";
        classificationCodes = classificationCodes != null ? List.copyOf(classificationCodes) : List.of();
        address = address != null ? address : RegisteredAddress.empty();
        officers = officers != null ? List.copyOf(officers) : List.of();
        owners = owners != null ? List.copyOf(owners) : List.of();
    }

    public static EntityFacts of(CompanyProfile profile, List<Officer> officers, List<BeneficialOwner> owners) {
        return new EntityFacts(profile.name(), profile.registrationDate(), profile.classificationCodes(),
                profile.address(), officers, owners);
    }

    /**
     * Facts for an organisation known only by name, e.g. an unresolved sponsor row.
     */
    public static EntityFacts nameOnly(String name, String locality) {
        return new EntityFacts(name, null, List.of(), RegisteredAddress.ofLocality(locality), List.of(), List.of());
    }
}
