package com.expansion.leads.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Ordered, immutable collection of the signals that fired for one entity.
 * Order is derivation order, which is also the order the scoring engine reads them.
 */
public record SignalSet(List<Signal> signals) {

    public SignalSet {
        signals = signals != null ? List.copyOf(signals) : List.of();
    }

    public static SignalSet empty() {
        return new SignalSet(List.of());
    }

    public Optional<Signal> get(String name) {
        for (Signal signal : signals) {
            if (signal.name().equals(name)) {
                return Optional.of(signal);
            }
        }
        return Optional.empty();
    }

    /**
     * True when the signal is present with a positive value.
     */
    public boolean isFired(String name) {
        return value(name) > 0;
    }

    public int value(String name) {
        return get(name).map(Signal::value).orElse(0);
    }

    public boolean isEmpty() {
        return signals.isEmpty();
    }
}
