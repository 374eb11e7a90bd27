package com.expansion.leads.core.model;

/**
 * An officer appointment as reported by the companies registry.
 *
 * @param name             officer name
 * @param role             appointment role, e.g. "director" or "corporate-secretary"
 * @param addressCountry   country of the officer's correspondence address
 * @param residenceCountry declared country of residence
 * @param nationality      declared nationality
 * @param resigned         whether the appointment has ended
 */
public record Officer(
        String name,
        String role,
        String addressCountry,
        String residenceCountry,
        String nationality,
        boolean resigned
) {
    public Officer {
        name = name != null ? name : "";
        role = role != null ? role : "";
        addressCountry = addressCountry != null ? addressCountry : "";
        residenceCountry = residenceCountry != null ? residenceCountry : "";
        nationality = nationality != null ? nationality : "";
    }

    public boolean isActive() {
        return !resigned;
    }

    public boolean isDirector() {
        return role.toLowerCase(java.util.Locale.ROOT).contains("director");
    }
}
