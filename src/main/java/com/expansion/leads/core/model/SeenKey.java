package com.expansion.leads.core.model;

import java.util.Objects;

/**
 * Durable marker that an upstream item has been surfaced or considered.
 *
 * @param source the source the item came from
 * @param key    stable key, already prefixed by source
 */
public record SeenKey(SourceType source, String key) {

    public SeenKey {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(key, "key is required");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }

    public static SeenKey forIncorporation(String registryNumber) {
        return new SeenKey(SourceType.COMPANIES_HOUSE, SourceType.COMPANIES_HOUSE.name() + "::" + registryNumber);
    }
}
