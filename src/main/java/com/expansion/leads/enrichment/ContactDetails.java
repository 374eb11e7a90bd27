package com.expansion.leads.enrichment;

import java.util.List;

/**
 * Emails and phone numbers extracted from a verified site, best first.
 */
public record ContactDetails(List<String> emails, List<String> phones) {

    public ContactDetails {
        emails = emails != null ? List.copyOf(emails) : List.of();
        phones = phones != null ? List.copyOf(phones) : List.of();
    }

    public boolean isEmpty() {
        return emails.isEmpty() && phones.isEmpty();
    }
}
