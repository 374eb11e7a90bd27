package com.expansion.leads.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Registered office address of an organisation. Missing parts are empty strings, never null.
 */
public record RegisteredAddress(
        String street,
        String postcode,
        String locality,
        String country
) {
    public RegisteredAddress {
        street = street != null ? street.trim() : "";
        postcode = postcode != null ? postcode.trim() : "";
        locality = locality != null ? locality.trim() : "";
        country = country != null ? country.trim() : "";
    }

    public static RegisteredAddress empty() {
        return new RegisteredAddress("", "", "", "");
    }

    public static RegisteredAddress ofLocality(String locality) {
        return new RegisteredAddress("", "", locality, "");
    }

    public boolean isEmpty() {
        return street.isEmpty() && postcode.isEmpty() && locality.isEmpty() && country.isEmpty();
    }

    /**
     * Number of populated parts, used to prefer the more complete of two representations.
     */
    public int completeness() {
        int n = 0;
        if (!street.isEmpty()) n++;
        if (!postcode.isEmpty()) n++;
        if (!locality.isEmpty()) n++;
        if (!country.isEmpty()) n++;
        return n;
    }

    /**
     * Single-line form: street, locality, postcode, country.
     */
    public String flattened() {
        List<String> parts = new ArrayList<>();
        for (String part : List.of(street, locality, postcode, country)) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return String.join(", ", parts);
    }
}
