package com.expansion.leads.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Signal extraction and scoring settings: weights, tiers, thresholds and keyword lists.
 */
public class ScoringConfig {

    private final Map<String, Integer> routeBasePoints;
    private final int incorporationBasePoints;
    private final int corporateOwnerPoints;
    private final int foreignOwnerPoints;
    private final int officerResidencePoints;
    private final int officerAddressPoints;
    private final int officerNationalityPoints;
    private final int subsidiaryNamePoints;
    private final int multipleDirectorsPoints;
    private final int priorityCountryPoints;
    private final List<RecencyTier> recencyTiers;
    private final int mailboxPenaltyPerPhrase;
    private final int mailboxPenaltyCap;
    private final int sectorBoostPoints;
    private final int sectorPenaltyPoints;
    private final int verifiedSitePoints;
    private final int plausibleSitePoints;
    private final int hiringIntentPoints;
    private final int hotThreshold;
    private final int mediumThreshold;
    private final List<String> sectorBoostKeywords;
    private final List<String> sectorPenaltyKeywords;
    private final List<String> mailboxPhrases;
    private final List<String> priorityCountries;

    private ScoringConfig(Builder builder) {
        this.routeBasePoints = Collections.unmodifiableMap(new LinkedHashMap<>(builder.routeBasePoints));
        this.incorporationBasePoints = builder.incorporationBasePoints;
        this.corporateOwnerPoints = builder.corporateOwnerPoints;
        this.foreignOwnerPoints = builder.foreignOwnerPoints;
        this.officerResidencePoints = builder.officerResidencePoints;
        this.officerAddressPoints = builder.officerAddressPoints;
        this.officerNationalityPoints = builder.officerNationalityPoints;
        this.subsidiaryNamePoints = builder.subsidiaryNamePoints;
        this.multipleDirectorsPoints = builder.multipleDirectorsPoints;
        this.priorityCountryPoints = builder.priorityCountryPoints;
        List<RecencyTier> tiers = new ArrayList<>(builder.recencyTiers);
        tiers.sort(Comparator.comparingInt(RecencyTier::maxDays));
        this.recencyTiers = List.copyOf(tiers);
        this.mailboxPenaltyPerPhrase = builder.mailboxPenaltyPerPhrase;
        this.mailboxPenaltyCap = builder.mailboxPenaltyCap;
        this.sectorBoostPoints = builder.sectorBoostPoints;
        this.sectorPenaltyPoints = builder.sectorPenaltyPoints;
        this.verifiedSitePoints = builder.verifiedSitePoints;
        this.plausibleSitePoints = builder.plausibleSitePoints;
        this.hiringIntentPoints = builder.hiringIntentPoints;
        this.hotThreshold = builder.hotThreshold;
        this.mediumThreshold = builder.mediumThreshold;
        this.sectorBoostKeywords = List.copyOf(builder.sectorBoostKeywords);
        this.sectorPenaltyKeywords = List.copyOf(builder.sectorPenaltyKeywords);
        this.mailboxPhrases = List.copyOf(builder.mailboxPhrases);
        this.priorityCountries = List.copyOf(builder.priorityCountries);
    }

    public static ScoringConfig defaults() {
        return builder().build();
    }

    /**
     * Base points for a sponsor route; routes are matched by containment, first configured match wins.
     */
    public int routeBasePoints(String route) {
        if (route == null || route.isBlank()) {
            return 0;
        }
        for (Map.Entry<String, Integer> entry : routeBasePoints.entrySet()) {
            if (route.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return 0;
    }

    public Map<String, Integer> getRouteBasePoints() {
        return routeBasePoints;
    }

    public int getIncorporationBasePoints() {
        return incorporationBasePoints;
    }

    public int getCorporateOwnerPoints() {
        return corporateOwnerPoints;
    }

    public int getForeignOwnerPoints() {
        return foreignOwnerPoints;
    }

    public int getOfficerResidencePoints() {
        return officerResidencePoints;
    }

    public int getOfficerAddressPoints() {
        return officerAddressPoints;
    }

    public int getOfficerNationalityPoints() {
        return officerNationalityPoints;
    }

    public int getSubsidiaryNamePoints() {
        return subsidiaryNamePoints;
    }

    public int getMultipleDirectorsPoints() {
        return multipleDirectorsPoints;
    }

    public int getPriorityCountryPoints() {
        return priorityCountryPoints;
    }

    /**
     * Tiers sorted by ascending {@code maxDays}.
     */
    public List<RecencyTier> getRecencyTiers() {
        return recencyTiers;
    }

    /**
     * Points for a registration {@code days} old: the first tier it fits, else 0.
     */
    public int recencyPoints(int days) {
        if (days < 0) {
            return 0;
        }
        for (RecencyTier tier : recencyTiers) {
            if (days <= tier.maxDays()) {
                return tier.points();
            }
        }
        return 0;
    }

    /**
     * Oldest registration age that still earns recency points.
     */
    public int maxRecencyDays() {
        return recencyTiers.isEmpty() ? -1 : recencyTiers.get(recencyTiers.size() - 1).maxDays();
    }

    public int getMailboxPenaltyPerPhrase() {
        return mailboxPenaltyPerPhrase;
    }

    public int getMailboxPenaltyCap() {
        return mailboxPenaltyCap;
    }

    public int getSectorBoostPoints() {
        return sectorBoostPoints;
    }

    public int getSectorPenaltyPoints() {
        return sectorPenaltyPoints;
    }

    public int getVerifiedSitePoints() {
        return verifiedSitePoints;
    }

    public int getPlausibleSitePoints() {
        return plausibleSitePoints;
    }

    public int getHiringIntentPoints() {
        return hiringIntentPoints;
    }

    public int getHotThreshold() {
        return hotThreshold;
    }

    public int getMediumThreshold() {
        return mediumThreshold;
    }

    public List<String> getSectorBoostKeywords() {
        return sectorBoostKeywords;
    }

    public List<String> getSectorPenaltyKeywords() {
        return sectorPenaltyKeywords;
    }

    public List<String> getMailboxPhrases() {
        return mailboxPhrases;
    }

    public List<String> getPriorityCountries() {
        return priorityCountries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Integer> routeBasePoints = new LinkedHashMap<>();
        private int incorporationBasePoints = 0;
        private int corporateOwnerPoints = 18;
        private int foreignOwnerPoints = 20;
        private int officerResidencePoints = 15;
        private int officerAddressPoints = 8;
        private int officerNationalityPoints = 10;
        private int subsidiaryNamePoints = 5;
        private int multipleDirectorsPoints = 4;
        private int priorityCountryPoints = 3;
        private List<RecencyTier> recencyTiers = List.of(
                new RecencyTier(14, 10), new RecencyTier(30, 6),
                new RecencyTier(90, 3), new RecencyTier(365, 1));
        private int mailboxPenaltyPerPhrase = 6;
        private int mailboxPenaltyCap = 12;
        private int sectorBoostPoints = 10;
        private int sectorPenaltyPoints = 15;
        private int verifiedSitePoints = 10;
        private int plausibleSitePoints = 4;
        private int hiringIntentPoints = 4;
        private int hotThreshold = 70;
        private int mediumThreshold = 45;
        private List<String> sectorBoostKeywords = List.of(
                "62", "63", "70", "71", "72", "73", "74", "64", "65", "66",
                "software", "engineering", "pharmaceutical");
        private List<String> sectorPenaltyKeywords = List.of(
                "87", "88", "49", "56", "55", "taxi", "takeaway", "hairdressing");
        private List<String> mailboxPhrases = List.of(
                "po box", "p o box", "regus", "wework", "spaces", "virtual office",
                "mail boxes etc", "kemp house", "suite", "office");
        private List<String> priorityCountries = List.of(
                "india", "united states", "china", "united arab emirates", "australia", "japan",
                "south korea", "canada", "singapore", "hong kong", "switzerland", "germany",
                "france", "netherlands", "ireland", "luxembourg", "saudi arabia", "qatar",
                "israel", "taiwan", "new zealand");

        public Builder() {
            routeBasePoints.put("UK Expansion Worker", 25);
            routeBasePoints.put("Senior or Specialist Worker", 18);
            routeBasePoints.put("Skilled Worker", 12);
        }

        public Builder routeBasePoints(Map<String, Integer> points) {
            this.routeBasePoints.clear();
            this.routeBasePoints.putAll(points);
            return this;
        }

        public Builder incorporationBasePoints(int v) {
            this.incorporationBasePoints = v;
            return this;
        }

        public Builder corporateOwnerPoints(int v) {
            this.corporateOwnerPoints = v;
            return this;
        }

        public Builder foreignOwnerPoints(int v) {
            this.foreignOwnerPoints = v;
            return this;
        }

        public Builder officerResidencePoints(int v) {
            this.officerResidencePoints = v;
            return this;
        }

        public Builder officerAddressPoints(int v) {
            this.officerAddressPoints = v;
            return this;
        }

        public Builder officerNationalityPoints(int v) {
            this.officerNationalityPoints = v;
            return this;
        }

        public Builder subsidiaryNamePoints(int v) {
            this.subsidiaryNamePoints = v;
            return this;
        }

        public Builder multipleDirectorsPoints(int v) {
            this.multipleDirectorsPoints = v;
            return this;
        }

        public Builder priorityCountryPoints(int v) {
            this.priorityCountryPoints = v;
            return this;
        }

        public Builder recencyTiers(List<RecencyTier> tiers) {
            this.recencyTiers = tiers;
            return this;
        }

        public Builder mailboxPenaltyPerPhrase(int v) {
            this.mailboxPenaltyPerPhrase = v;
            return this;
        }

        public Builder mailboxPenaltyCap(int v) {
            this.mailboxPenaltyCap = v;
            return this;
        }

        public Builder sectorBoostPoints(int v) {
            this.sectorBoostPoints = v;
            return this;
        }

        public Builder sectorPenaltyPoints(int v) {
            this.sectorPenaltyPoints = v;
            return this;
        }

        public Builder verifiedSitePoints(int v) {
            this.verifiedSitePoints = v;
            return this;
        }

        public Builder plausibleSitePoints(int v) {
            this.plausibleSitePoints = v;
            return this;
        }

        public Builder hiringIntentPoints(int v) {
            this.hiringIntentPoints = v;
            return this;
        }

        public Builder hotThreshold(int v) {
            this.hotThreshold = v;
            return this;
        }

        public Builder mediumThreshold(int v) {
            this.mediumThreshold = v;
            return this;
        }

        public Builder sectorBoostKeywords(List<String> v) {
            this.sectorBoostKeywords = v;
            return this;
        }

        public Builder sectorPenaltyKeywords(List<String> v) {
            this.sectorPenaltyKeywords = v;
            return this;
        }

        public Builder mailboxPhrases(List<String> v) {
            this.mailboxPhrases = v;
            return this;
        }

        public Builder priorityCountries(List<String> v) {
            this.priorityCountries = v;
            return this;
        }

        public ScoringConfig build() {
            if (mediumThreshold < 0 || hotThreshold > 100 || hotThreshold <= mediumThreshold) {
                throw new IllegalArgumentException(
                        "Bucket thresholds must satisfy 0 <= medium < hot <= 100, got medium="
                                + mediumThreshold + " hot=" + hotThreshold);
            }
            int[] magnitudes = {incorporationBasePoints, corporateOwnerPoints, foreignOwnerPoints,
                    officerResidencePoints, officerAddressPoints, officerNationalityPoints,
                    subsidiaryNamePoints, multipleDirectorsPoints, priorityCountryPoints,
                    mailboxPenaltyPerPhrase, mailboxPenaltyCap, sectorBoostPoints, sectorPenaltyPoints,
                    verifiedSitePoints, plausibleSitePoints, hiringIntentPoints};
            for (int m : magnitudes) {
                if (m < 0) {
                    throw new IllegalArgumentException("Weights are magnitudes and must be >= 0");
                }
            }
            for (int v : routeBasePoints.values()) {
                if (v < 0) {
                    throw new IllegalArgumentException("Route base points must be >= 0");
                }
            }
            return new ScoringConfig(this);
        }
    }
}
