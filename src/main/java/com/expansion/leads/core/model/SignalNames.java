package com.expansion.leads.core.model;

/**
 * Names of the signals the extractor can emit.
 */
public final class SignalNames {

    public static final String FOREIGN_OFFICER_ADDRESS = "foreign_officer_address";
    public static final String FOREIGN_OFFICER_RESIDENCE = "foreign_officer_residence";
    public static final String FOREIGN_OFFICER_NATIONALITY = "foreign_officer_nationality";
    public static final String CORPORATE_BENEFICIAL_OWNER = "corporate_beneficial_owner";
    public static final String FOREIGN_BENEFICIAL_OWNER = "foreign_beneficial_owner";
    public static final String MULTIPLE_DIRECTORS = "multiple_directors";
    public static final String PRIORITY_COUNTRY = "priority_country";
    public static final String SUBSIDIARY_NAME = "subsidiary_name";
    public static final String RECENT_REGISTRATION = "recent_registration";
    public static final String MAILBOX_ADDRESS_PENALTY = "mailbox_address_penalty";
    public static final String SECTOR_BOOST = "sector_boost";
    public static final String SECTOR_PENALTY = "sector_penalty";
    public static final String FOREIGN_REGISTERED_OFFICE = "foreign_registered_office";

    private SignalNames() {
        // Constants
    }
}
