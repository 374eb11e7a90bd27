package com.expansion.leads.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Ordered, immutable chain of {@link NormalizationRule}s that turns a registered organisation
 * name into its comparison form. The result is always lower-case with single spaces.
 */
public final class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::order));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Null or blank input yields the empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String result = name.toLowerCase(Locale.ROOT);
        for (NormalizationRule rule : rules) {
            String next = rule.apply(result);
            if (log.isTraceEnabled() && !next.equals(result)) {
                log.trace("normalize.rule name={} '{}' -> '{}'", rule.name(), result, next);
            }
            result = next;
        }
        return SPACES.matcher(result).replaceAll(" ").trim();
    }
}
