package com.expansion.leads.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named fact derived from registry data.
 * Boolean signals carry 0 or 1; count signals carry the count.
 *
 * @param name     signal name, see {@link SignalNames}
 * @param value    0/1 for flags, the count for counts, days for recency
 * @param evidence human-readable supporting facts, in derivation order
 */
public record Signal(String name, int value, List<String> evidence) {

    public Signal {
        Objects.requireNonNull(name, "name is required");
        if (value < 0) {
            throw new IllegalArgumentException("Signal value must be non-negative: " + name);
        }
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public static Signal flag(String name, List<String> evidence) {
        return new Signal(name, 1, evidence);
    }

    public static Signal count(String name, int count, List<String> evidence) {
        return new Signal(name, count, evidence);
    }
}
