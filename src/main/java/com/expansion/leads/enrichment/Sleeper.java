package com.expansion.leads.enrichment;

import java.time.Duration;

/**
 * Pause between search calls. Injected so tests run without real delays.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    static Sleeper threadSleep() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return;
            }
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }

    static Sleeper none() {
        return duration -> { };
    }
}
