package com.expansion.leads.rules;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonicalizes organisation names, countries and postcodes into comparable forms.
 * All methods are pure; null input yields empty output.
 */
public class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LEADING_JUNK =
            Pattern.compile("^[\\s\"'`*@\\[\\](){}<>#!$%^&=+;:,.\\-/\\\\]+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{Alnum}]+");

    private static final Set<String> DOMESTIC_COUNTRIES = Set.of(
            "uk", "u k", "united kingdom", "great britain", "gb", "england", "scotland", "wales",
            "northern ireland");

    private static final Set<String> DOMESTIC_NATIONALITIES = Set.of(
            "british", "english", "scottish", "welsh", "northern irish", "irish");

    private static final Map<String, Set<String>> COUNTRY_VARIANTS = Map.of(
            "united states", Set.of("usa", "u s a", "united states of america", "us", "u s"),
            "united arab emirates", Set.of("uae", "u a e"),
            "south korea", Set.of("republic of korea", "korea republic of", "korea"),
            "hong kong", Set.of("hong kong sar", "hong kong china"));

    private final NormalizationEngine engine;

    public TextNormalizer() {
        this(LegalNameRules.createDefaultEngine());
    }

    public TextNormalizer(NormalizationEngine engine) {
        this.engine = engine;
    }

    /**
     * Lower-cased, trimmed, whitespace collapsed.
     */
    public String collapse(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Punctuation stripped, legal suffixes removed, lower-cased: the form used for token-set comparison.
     */
    public String entityNormalize(String name) {
        return engine.normalize(name);
    }

    /**
     * Display form: leading quotes/punctuation removed, whitespace collapsed, case preserved.
     */
    public String cleanDisplayName(String name) {
        if (name == null) {
            return "";
        }
        String n = WHITESPACE.matcher(name).replaceAll(" ").trim();
        n = LEADING_JUNK.matcher(n).replaceFirst("");
        return WHITESPACE.matcher(n).replaceAll(" ").trim();
    }

    /**
     * Share of characters that are neither alphanumeric nor a space; 1.0 for empty input.
     */
    public double nonAlnumRatio(String text) {
        if (text == null || text.isEmpty()) {
            return 1.0;
        }
        int non = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != ' ') {
                non++;
            }
        }
        return (double) non / text.length();
    }

    /**
     * Lower-cased alphanumeric words separated by single spaces.
     */
    public String alnumWords(String text) {
        if (text == null) {
            return "";
        }
        return NON_ALNUM.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Canonical country name; common variants ("USA", "U.A.E.") map to one spelling.
     */
    public String canonicalCountry(String country) {
        String c = alnumWords(country);
        if (c.isEmpty()) {
            return "";
        }
        for (Map.Entry<String, Set<String>> entry : COUNTRY_VARIANTS.entrySet()) {
            if (entry.getKey().equals(c) || entry.getValue().contains(c)) {
                return entry.getKey();
            }
        }
        return c;
    }

    /**
     * True when the country is empty or names the UK. Missing data is never treated as foreign.
     */
    public boolean isDomesticCountry(String country) {
        String c = alnumWords(country);
        return c.isEmpty() || DOMESTIC_COUNTRIES.contains(c);
    }

    /**
     * True when the nationality is empty or a UK or Irish nationality.
     */
    public boolean isDomesticNationality(String nationality) {
        String n = alnumWords(nationality);
        return n.isEmpty() || DOMESTIC_NATIONALITIES.contains(n);
    }

    /**
     * Postcode upper-cased with all whitespace removed, for literal page matching.
     */
    public String compactPostcode(String postcode) {
        if (postcode == null) {
            return "";
        }
        return WHITESPACE.matcher(postcode).replaceAll("").toUpperCase(Locale.ROOT);
    }
}
