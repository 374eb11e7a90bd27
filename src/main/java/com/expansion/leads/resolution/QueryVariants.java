package com.expansion.leads.resolution;

import com.expansion.leads.rules.TextNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds registry search queries for a free-text name, in preference order:
 * the cleaned name, the suffix-stripped name, the "&"/"and" swap, then name plus locality.
 */
public class QueryVariants {

    private final TextNormalizer normalizer;

    public QueryVariants(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public List<String> generate(String name, String locality, int max) {
        String raw = normalizer.cleanDisplayName(name);
        String stripped = normalizer.entityNormalize(raw);

        Set<String> variants = new LinkedHashSet<>();
        addIfPresent(variants, raw);
        addIfPresent(variants, stripped);
        addIfPresent(variants, swapConjunction(stripped));
        String place = normalizer.cleanDisplayName(locality);
        if (!place.isEmpty() && !raw.isEmpty()) {
            addIfPresent(variants, raw + " " + place);
        }

        List<String> out = new ArrayList<>(variants);
        return out.size() > max ? List.copyOf(out.subList(0, max)) : List.copyOf(out);
    }

    private static String swapConjunction(String text) {
        String padded = " " + text + " ";
        if (padded.contains(" and ")) {
            return padded.replace(" and ", " & ").trim();
        }
        if (padded.contains(" & ")) {
            return padded.replace(" & ", " and ").trim();
        }
        return "";
    }

    private static void addIfPresent(Set<String> variants, String candidate) {
        String v = candidate.trim().replaceAll("\\s+", " ");
        if (v.isEmpty()) {
            return;
        }
        for (String existing : variants) {
            if (existing.toLowerCase(Locale.ROOT).equals(v.toLowerCase(Locale.ROOT))) {
                return;
            }
        }
        variants.add(v);
    }
}
