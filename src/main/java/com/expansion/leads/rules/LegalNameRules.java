package com.expansion.leads.rules;

import java.util.List;

/**
 * Built-in chain that reduces a UK organisation name to the form used for token-set comparison.
 */
public final class LegalNameRules {

    /**
     * Trailing legal or structural suffixes, stripped repeatedly ("Acme UK Holdings Ltd" -> "acme").
     */
    static final String SUFFIX_PATTERN =
            "(\\s+(ltd|limited|l t d|plc|llp|group|holdings?|international|intl|uk))+\\s*$";

    private static final List<NormalizationRule> RULES = List.of(
            NormalizationRule.regex("ampersand", 5, "&", " and "),
            NormalizationRule.regex("punctuation", 10, "[^\\p{Alnum}\\s]+", " "),
            NormalizationRule.regex("collapse-whitespace", 15, "\\s+", " "),
            NormalizationRule.regex("legal-suffix", 20, SUFFIX_PATTERN, ""),
            NormalizationRule.regex("leading-the", 25, "^\\s*the\\s+", ""));

    private LegalNameRules() {
    }

    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(RULES);
    }
}
