package com.expansion.leads.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One rewrite step in the legal-name chain. Steps run in ascending {@code order}; the name
 * shows up in trace logging.
 */
public record NormalizationRule(String name, int order, Pattern pattern, String replacement) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
    }

    /**
     * Case-insensitive regex step.
     */
    public static NormalizationRule regex(String name, int order, String regex, String replacement) {
        return new NormalizationRule(name, order,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), replacement);
    }

    String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
