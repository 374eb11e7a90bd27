package com.expansion.leads.enrichment;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run cap on search calls. The only mutation is {@link #tryConsume()}, which is atomic,
 * so concurrent callers can never overspend.
 */
public class EnrichmentBudget {

    private final int cap;
    private final AtomicInteger used = new AtomicInteger();

    public EnrichmentBudget(int cap) {
        if (cap < 0) {
            throw new IllegalArgumentException("cap must be >= 0");
        }
        this.cap = cap;
    }

    /**
     * Reserves one call. Returns false, reserving nothing, once the cap is reached.
     */
    public boolean tryConsume() {
        while (true) {
            int current = used.get();
            if (current >= cap) {
                return false;
            }
            if (used.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public int used() {
        return used.get();
    }

    public int remaining() {
        return cap - used.get();
    }

    public int cap() {
        return cap;
    }
}
