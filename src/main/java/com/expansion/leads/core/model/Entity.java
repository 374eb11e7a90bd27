package com.expansion.leads.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Canonical organisation resolved across sources.
 *
 * <p>The identifier is the registry number when one is known, otherwise a key derived
 * from the normalized name and locality. Once a registry number is discovered it wins
 * over the name-derived key.</p>
 */
public class Entity {
    private static final String NAME_KEY_PREFIX = "NAME::";

    private final String registryNumber;
    private final String displayName;
    private final String normalizedName;
    private final LocalDate registrationDate;
    private final String status;
    private final List<String> classificationCodes;
    private final RegisteredAddress address;
    private final Instant lastSeenAt;

    private Entity(Builder builder) {
        this.registryNumber = builder.registryNumber != null ? builder.registryNumber.trim() : "";
        this.displayName = builder.displayName;
        this.normalizedName = builder.normalizedName != null ? builder.normalizedName : "";
        this.registrationDate = builder.registrationDate;
        this.status = builder.status != null ? builder.status : "";
        this.classificationCodes = builder.classificationCodes != null
                ? List.copyOf(builder.classificationCodes) : List.of();
        this.address = builder.address != null ? builder.address : RegisteredAddress.empty();
        this.lastSeenAt = builder.lastSeenAt;
    }

    /**
     * Stable identifier: registry number when known, else the name-derived key.
     */
    public String getId() {
        return hasRegistryNumber() ? registryNumber : getNameKey();
    }

    /**
     * Key derived from normalized name and locality. Always available, even once a
     * registry number is known, so earlier name-keyed records can be re-keyed.
     */
    public String getNameKey() {
        return nameKey(normalizedName, address.locality());
    }

    public static String nameKey(String normalizedName, String locality) {
        String name = normalizedName != null ? normalizedName.trim().toLowerCase(Locale.ROOT) : "";
        String place = locality != null
                ? locality.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ") : "";
        return NAME_KEY_PREFIX + name + "::" + place;
    }

    public static boolean isNameKey(String key) {
        return key != null && key.startsWith(NAME_KEY_PREFIX);
    }

    public boolean hasRegistryNumber() {
        return !registryNumber.isEmpty();
    }

    public String getRegistryNumber() {
        return registryNumber;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public LocalDate getRegistrationDate() {
        return registrationDate;
    }

    public String getStatus() {
        return status;
    }

    public List<String> getClassificationCodes() {
        return classificationCodes;
    }

    public RegisteredAddress getAddress() {
        return address;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    /**
     * Count of populated descriptive fields.
     */
    public int completeness() {
        int n = address.completeness();
        if (hasRegistryNumber()) n++;
        if (registrationDate != null) n++;
        if (!status.isEmpty()) n++;
        if (!classificationCodes.isEmpty()) n++;
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(getId(), entity.getId());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getId());
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + getId() + '\'' +
                ", displayName='" + displayName + '\'' +
                ", status='" + status + '\'' +
                ", registrationDate=" + registrationDate +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Entity entity) {
        return new Builder()
                .registryNumber(entity.registryNumber)
                .displayName(entity.displayName)
                .normalizedName(entity.normalizedName)
                .registrationDate(entity.registrationDate)
                .status(entity.status)
                .classificationCodes(entity.classificationCodes)
                .address(entity.address)
                .lastSeenAt(entity.lastSeenAt);
    }

    public static class Builder {
        private String registryNumber;
        private String displayName;
        private String normalizedName;
        private LocalDate registrationDate;
        private String status;
        private List<String> classificationCodes;
        private RegisteredAddress address;
        private Instant lastSeenAt;

        public Builder registryNumber(String registryNumber) {
            this.registryNumber = registryNumber;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder registrationDate(LocalDate registrationDate) {
            this.registrationDate = registrationDate;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder classificationCodes(List<String> classificationCodes) {
            this.classificationCodes = classificationCodes;
            return this;
        }

        public Builder address(RegisteredAddress address) {
            this.address = address;
            return this;
        }

        public Builder lastSeenAt(Instant lastSeenAt) {
            this.lastSeenAt = lastSeenAt;
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(displayName, "displayName is required");
            return new Entity(this);
        }
    }
}
